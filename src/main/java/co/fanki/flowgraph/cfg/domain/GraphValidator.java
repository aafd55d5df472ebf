package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.cfg.domain.DiagnosticReport.OrphanEdge;
import co.fanki.flowgraph.cfg.domain.DiagnosticReport.OrphanKind;
import co.fanki.flowgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Scans a graph for structural defects.
 *
 * <p>Reachability is a single breadth-first traversal from the entry
 * that skips edges leading to absent nodes. The validator never throws
 * on a malformed graph and never touches it: whatever it finds is
 * returned in the {@link DiagnosticReport}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphValidator {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphValidator.class);

    /**
     * Diagnoses a graph.
     *
     * @param graph the graph, never null
     * @return the report
     */
    public DiagnosticReport diagnose(final ControlFlowGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        if (graph.isEmpty() && graph.edgeCount() == 0) {
            return DiagnosticReport.empty();
        }

        final List<OrphanEdge> orphans = new ArrayList<>();
        final Set<String> missing = new LinkedHashSet<>();
        for (final CfgEdge edge : graph.edges()) {
            final boolean srcMissing = !graph.contains(edge.src());
            final boolean dstMissing = !graph.contains(edge.dst());
            if (srcMissing) {
                missing.add(edge.src());
            }
            if (dstMissing) {
                missing.add(edge.dst());
            }
            if (srcMissing && dstMissing) {
                orphans.add(new OrphanEdge(edge, OrphanKind.MISSING_BOTH));
            } else if (srcMissing) {
                orphans.add(new OrphanEdge(edge, OrphanKind.MISSING_SRC));
            } else if (dstMissing) {
                orphans.add(new OrphanEdge(edge, OrphanKind.MISSING_DST));
            }
        }

        final List<CfgNode> begins = graph.beginNodes();
        final String beginId = begins.isEmpty() ? null : begins.get(0).id();
        final List<String> extraBegins = new ArrayList<>();
        for (int i = 1; i < begins.size(); i++) {
            extraBegins.add(begins.get(i).id());
        }

        final Set<String> reachable = beginId == null
                ? Set.of() : reachableFrom(graph, beginId);

        final List<String> disconnected = new ArrayList<>();
        for (final String id : graph.nodeIds()) {
            if (!reachable.contains(id)) {
                disconnected.add(id);
            }
        }

        final List<CfgEdge> intoEntry = beginId == null
                ? List.of() : graph.incoming(beginId);

        final DiagnosticReport report = new DiagnosticReport(
                graph.nodeCount(), graph.edgeCount(), orphans,
                new ArrayList<>(missing), reachable, disconnected, beginId,
                extraBegins, intoEntry, deadEnds(graph, reachable));

        if (!report.isValid()) {
            LOG.debug("Graph {} has defects: {} orphan edges, {} disconnected"
                    + " nodes, entry {}", graph.name(), orphans.size(),
                    disconnected.size(), beginId);
        }
        return report;
    }

    private Set<String> reachableFrom(final ControlFlowGraph graph,
            final String start) {
        final Set<String> visited = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final CfgEdge edge : graph.outgoing(current)) {
                if (graph.contains(edge.dst()) && visited.add(edge.dst())) {
                    queue.add(edge.dst());
                }
            }
        }
        return visited;
    }

    /** Reverse traversal from every END, restricted to present nodes. */
    private List<String> deadEnds(final ControlFlowGraph graph,
            final Set<String> reachable) {
        final Set<String> reachesEnd = new HashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        for (final CfgNode end : graph.endNodes()) {
            reachesEnd.add(end.id());
            queue.add(end.id());
        }
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final CfgEdge edge : graph.incoming(current)) {
                if (graph.contains(edge.src()) && reachesEnd.add(edge.src())) {
                    queue.add(edge.src());
                }
            }
        }

        final List<String> result = new ArrayList<>();
        for (final String id : reachable) {
            if (!reachesEnd.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

}
