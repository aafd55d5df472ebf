package co.fanki.flowgraph.cfg.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural defects found in a graph.
 *
 * <p>Produced by {@link GraphValidator}. A report is data: a malformed
 * graph yields a populated report, never an exception.</p>
 *
 * @param nodeCount number of nodes in the graph
 * @param edgeCount number of edges in the graph
 * @param orphanEdges edges referencing at least one absent node
 * @param missingNodeIds ids referenced by edges but absent, in order of
 *        first reference
 * @param reachableNodes ids reachable from the entry, in visiting order
 * @param disconnectedNodes ids not reachable from the entry, in node
 *        order
 * @param beginNodeId the entry node id, or null when the graph has none
 * @param extraBeginNodeIds ids of additional BEGIN nodes
 * @param entryIncomingEdges edges whose destination is the entry
 * @param deadEndNodes reachable non-END nodes from which no END can be
 *        reached
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DiagnosticReport(
        int nodeCount,
        int edgeCount,
        List<OrphanEdge> orphanEdges,
        List<String> missingNodeIds,
        Set<String> reachableNodes,
        List<String> disconnectedNodes,
        String beginNodeId,
        List<String> extraBeginNodeIds,
        List<CfgEdge> entryIncomingEdges,
        List<String> deadEndNodes) {

    /**
     * Creates a report, copying every collection.
     */
    public DiagnosticReport {
        orphanEdges = List.copyOf(orphanEdges);
        missingNodeIds = List.copyOf(missingNodeIds);
        reachableNodes = Collections.unmodifiableSet(
                new LinkedHashSet<>(reachableNodes));
        disconnectedNodes = List.copyOf(disconnectedNodes);
        extraBeginNodeIds = List.copyOf(extraBeginNodeIds);
        entryIncomingEdges = List.copyOf(entryIncomingEdges);
        deadEndNodes = List.copyOf(deadEndNodes);
    }

    /**
     * Returns the report of a graph without nodes nor edges.
     *
     * @return the empty report
     */
    public static DiagnosticReport empty() {
        return new DiagnosticReport(0, 0, List.of(), List.of(), Set.of(),
                List.of(), null, List.of(), List.of(), List.of());
    }

    /** Checks if the graph has an entry node. */
    public boolean hasEntry() {
        return beginNodeId != null;
    }

    /** Checks if a node was reached from the entry. */
    public boolean isReachable(final String nodeId) {
        return reachableNodes.contains(nodeId);
    }

    /**
     * Checks if the graph satisfies every structural invariant: no orphan
     * edges, every node reachable, a single entry and nothing flowing
     * into it.
     *
     * @return true if the graph is valid
     */
    public boolean isValid() {
        return orphanEdges.isEmpty()
                && disconnectedNodes.isEmpty()
                && beginNodeId != null
                && extraBeginNodeIds.isEmpty()
                && entryIncomingEdges.isEmpty();
    }

    /** Which endpoints of an orphan edge are absent. */
    public enum OrphanKind {
        MISSING_SRC, MISSING_DST, MISSING_BOTH
    }

    /**
     * An edge referencing an absent node.
     *
     * @param edge the edge
     * @param kind which endpoints are absent
     */
    public record OrphanEdge(CfgEdge edge, OrphanKind kind) {
    }

}
