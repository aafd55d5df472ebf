package co.fanki.flowgraph.cfg.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derived flow properties of the reachable part of a graph.
 *
 * @param dominatorTree dominators from the entry
 * @param postDominatorTree post-dominators from a virtual exit joining
 *        every END
 * @param edgeClasses class of every edge traversed from the entry
 * @param backEdges the back edges, in traversal order
 * @param loopHeaders distinct targets of back edges
 * @param naturalLoops the loop of every back edge whose target dominates
 *        its source
 * @param criticalEdges edges from a node with several successors to a
 *        node with several predecessors
 * @param reducible whether every back edge target dominates its source
 * @param basicBlockCount number of maximal straight-line sequences
 * @param loopConnectedness largest number of distinct back edge sources
 *        met along one path from the entry that takes no back edge
 * @param reachableNodeCount number of nodes analyzed
 * @param excludedNodes nodes left out because they are not reachable
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowReport(
        DominatorTree dominatorTree,
        DominatorTree postDominatorTree,
        Map<CfgEdge, EdgeClass> edgeClasses,
        List<CfgEdge> backEdges,
        Set<String> loopHeaders,
        List<NaturalLoop> naturalLoops,
        List<CfgEdge> criticalEdges,
        boolean reducible,
        int basicBlockCount,
        int loopConnectedness,
        int reachableNodeCount,
        List<String> excludedNodes) {

    /**
     * Creates a report, copying every collection.
     */
    public FlowReport {
        edgeClasses = Collections.unmodifiableMap(
                new LinkedHashMap<>(edgeClasses));
        backEdges = List.copyOf(backEdges);
        loopHeaders = Collections.unmodifiableSet(
                new LinkedHashSet<>(loopHeaders));
        naturalLoops = List.copyOf(naturalLoops);
        criticalEdges = List.copyOf(criticalEdges);
        excludedNodes = List.copyOf(excludedNodes);
    }

    /**
     * Returns the report for a graph that cannot be analyzed: no entry or
     * no nodes. Every count is zero and the graph is vacuously reducible.
     *
     * @param excludedNodes the nodes that could not be analyzed
     * @return the report
     */
    public static FlowReport empty(final List<String> excludedNodes) {
        return new FlowReport(DominatorTree.empty(), DominatorTree.empty(),
                Map.of(), List.of(), Set.of(), List.of(), List.of(), true,
                0, 0, 0, excludedNodes);
    }

    /**
     * Returns the report for an empty graph.
     *
     * @return the report
     */
    public static FlowReport empty() {
        return empty(List.of());
    }

    /** Returns the number of distinct loop headers. */
    public int loopHeaderCount() {
        return loopHeaders.size();
    }

    /** Returns the number of back edges. */
    public int backEdgeCount() {
        return backEdges.size();
    }

    /** Returns the number of critical edges. */
    public int criticalEdgeCount() {
        return criticalEdges.size();
    }

    /**
     * Returns the class of an edge.
     *
     * @param edge the edge
     * @return its class, or null if the traversal never took it
     */
    public EdgeClass classOf(final CfgEdge edge) {
        return edgeClasses.get(edge);
    }

}
