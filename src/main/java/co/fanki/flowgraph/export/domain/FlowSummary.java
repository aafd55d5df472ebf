package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.cfg.domain.CfgEdge;
import co.fanki.flowgraph.cfg.domain.DiagnosticReport;
import co.fanki.flowgraph.cfg.domain.DiagnosticReport.OrphanEdge;
import co.fanki.flowgraph.cfg.domain.FlowReport;
import co.fanki.flowgraph.shared.Preconditions;

import java.util.List;

/**
 * Plain text report of a diagnosed and analyzed graph.
 *
 * <p>Example:</p>
 * <pre>
 * Graph: program_entry_point
 * Nodes: 12, edges: 13
 * Basic blocks: 6
 * Reducible: yes
 * Loop headers: 1 [n5]
 * Back edges: 1
 * Loop connectedness: 1
 * Critical edges: 0
 * Orphan edges: 0
 * Disconnected nodes: 0
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowSummary {

    private FlowSummary() {
        // Utility class, not instantiable
    }

    /**
     * Renders the summary.
     *
     * @param name the graph name
     * @param diagnostics the diagnostics, never null
     * @param flow the flow analysis, never null
     * @return the text, one property per line
     */
    public static String render(final String name,
            final DiagnosticReport diagnostics, final FlowReport flow) {
        Preconditions.requireNonNull(diagnostics, "Diagnostics are required");
        Preconditions.requireNonNull(flow, "Flow report is required");

        final StringBuilder sb = new StringBuilder();
        sb.append("Graph: ").append(name).append("\n");
        sb.append("Nodes: ").append(diagnostics.nodeCount())
                .append(", edges: ").append(diagnostics.edgeCount())
                .append("\n");
        sb.append("Basic blocks: ").append(flow.basicBlockCount())
                .append("\n");
        sb.append("Reducible: ").append(flow.reducible() ? "yes" : "no")
                .append("\n");
        sb.append("Loop headers: ").append(flow.loopHeaderCount());
        if (!flow.loopHeaders().isEmpty()) {
            sb.append(" ").append(flow.loopHeaders());
        }
        sb.append("\n");
        sb.append("Back edges: ").append(flow.backEdgeCount()).append("\n");
        appendEdges(sb, flow.backEdges());
        sb.append("Loop connectedness: ").append(flow.loopConnectedness())
                .append("\n");
        sb.append("Critical edges: ").append(flow.criticalEdgeCount())
                .append("\n");
        appendEdges(sb, flow.criticalEdges());
        sb.append("Orphan edges: ").append(diagnostics.orphanEdges().size())
                .append("\n");
        for (final OrphanEdge orphan : diagnostics.orphanEdges()) {
            sb.append("  ").append(describe(orphan.edge())).append(" (")
                    .append(orphan.kind()).append(")\n");
        }
        sb.append("Disconnected nodes: ")
                .append(diagnostics.disconnectedNodes().size());
        if (!diagnostics.disconnectedNodes().isEmpty()) {
            sb.append(" ").append(diagnostics.disconnectedNodes());
        }
        sb.append("\n");
        if (!diagnostics.hasEntry()) {
            sb.append("Warning: graph has no BEGIN node\n");
        }
        if (!diagnostics.extraBeginNodeIds().isEmpty()) {
            sb.append("Warning: extra BEGIN nodes ")
                    .append(diagnostics.extraBeginNodeIds()).append("\n");
        }
        if (!diagnostics.entryIncomingEdges().isEmpty()) {
            sb.append("Warning: ")
                    .append(diagnostics.entryIncomingEdges().size())
                    .append(" edges into BEGIN\n");
        }
        if (!diagnostics.deadEndNodes().isEmpty()) {
            sb.append("Warning: nodes that never reach END ")
                    .append(diagnostics.deadEndNodes()).append("\n");
        }
        return sb.toString();
    }

    private static void appendEdges(final StringBuilder sb,
            final List<CfgEdge> edges) {
        for (final CfgEdge edge : edges) {
            sb.append("  ").append(describe(edge)).append("\n");
        }
    }

    private static String describe(final CfgEdge edge) {
        final String label = GraphLabels.edgeLabel(edge.constraints());
        final String arrow = edge.src() + " -> " + edge.dst();
        return label.isEmpty() ? arrow : arrow + " [" + label + "]";
    }

}
