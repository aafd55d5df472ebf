package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.cfg.domain.CfgEdge;
import co.fanki.flowgraph.cfg.domain.CfgNode;
import co.fanki.flowgraph.cfg.domain.ControlFlowGraph;
import co.fanki.flowgraph.cfg.domain.DiagnosticReport;
import co.fanki.flowgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * What a renderer gets to see of a graph: nodes and edges in a stable
 * order, each with its precomputed styling hints.
 *
 * <p>Ids referenced by edges but absent from the graph appear as
 * placeholder nodes with the {@link NodeColor#MISSING} class, after the
 * real nodes, so that malformed graphs can still be drawn.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphExport {

    private final String name;

    private final List<ExportNode> nodes;

    private final List<ExportEdge> edges;

    private GraphExport(final String theName, final List<ExportNode> theNodes,
            final List<ExportEdge> theEdges) {
        this.name = theName;
        this.nodes = List.copyOf(theNodes);
        this.edges = List.copyOf(theEdges);
    }

    /**
     * Creates the export view of a graph.
     *
     * @param graph the graph, never null
     * @param diagnostics the diagnostics of that graph, never null
     * @return the export view
     */
    public static GraphExport of(final ControlFlowGraph graph,
            final DiagnosticReport diagnostics) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(diagnostics, "Diagnostics are required");

        final List<ExportNode> nodes = new ArrayList<>();
        for (final CfgNode node : graph.nodes()) {
            nodes.add(new ExportNode(node.id(), node.kind().name(),
                    node.role(), node.sourceRef(),
                    NodeColor.of(node.kind()), GraphLabels.nodeLabel(node),
                    diagnostics.isReachable(node.id())));
        }
        for (final String missing : diagnostics.missingNodeIds()) {
            nodes.add(new ExportNode(missing, null, null, null,
                    NodeColor.MISSING, missing, false));
        }

        final List<ExportEdge> edges = new ArrayList<>();
        for (final CfgEdge edge : graph.edges()) {
            edges.add(new ExportEdge(edge.src(), edge.dst(),
                    edge.constraints().conditionValue(),
                    edge.constraints().interruptionMode() == null ? null
                            : edge.constraints().interruptionMode().wireName(),
                    GraphLabels.edgeLabel(edge.constraints()),
                    !graph.contains(edge.src()) || !graph.contains(edge.dst())));
        }
        return new GraphExport(graph.name(), nodes, edges);
    }

    /** Returns the graph name. */
    public String name() {
        return name;
    }

    /** Returns the nodes, placeholders last. */
    public List<ExportNode> nodes() {
        return nodes;
    }

    /** Returns the edges in graph order. */
    public List<ExportEdge> edges() {
        return edges;
    }

    /**
     * A node as exported.
     *
     * @param id the node id
     * @param kind the kind name, null for a placeholder
     * @param role the role, or null
     * @param sourceRef the AST node id, or null
     * @param colorClass the styling class
     * @param label the display label
     * @param reachable whether the node is reachable from the entry
     */
    public record ExportNode(String id, String kind, String role,
            Long sourceRef, NodeColor colorClass, String label,
            boolean reachable) {

        /** Checks if this node stands in for an absent id. */
        public boolean isPlaceholder() {
            return colorClass == NodeColor.MISSING;
        }
    }

    /**
     * An edge as exported.
     *
     * @param src the source id
     * @param dst the destination id
     * @param conditionValue the selected branch, or null
     * @param interruptionMode the wire name of the interruption mode, or
     *        null
     * @param label the display label, empty for a sequential edge
     * @param orphan whether an endpoint is absent from the graph
     */
    public record ExportEdge(String src, String dst, Boolean conditionValue,
            String interruptionMode, String label, boolean orphan) {

        /** Checks if the edge carries a label. */
        public boolean hasLabel() {
            return !label.isEmpty();
        }
    }

}
