package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes dominance-based properties of a graph.
 *
 * <p>Only the part reachable from the entry is analyzed, as reported by
 * the {@link GraphValidator}; edges with an absent endpoint are ignored.
 * A graph without entry or without nodes yields
 * {@link FlowReport#empty(List)}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowAnalyzer.class);

    /** Id of the virtual node joining every END for post-dominators. */
    public static final String VIRTUAL_EXIT = "<exit>";

    private final GraphValidator validator;

    /**
     * Creates an analyzer with its own validator.
     */
    public FlowAnalyzer() {
        this(new GraphValidator());
    }

    /**
     * Creates an analyzer.
     *
     * @param theValidator the validator computing reachability
     */
    public FlowAnalyzer(final GraphValidator theValidator) {
        this.validator = Preconditions.requireNonNull(theValidator,
                "Validator is required");
    }

    /**
     * Analyzes a graph.
     *
     * @param graph the graph, never null
     * @return the report
     */
    public FlowReport analyze(final ControlFlowGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return analyze(graph, validator.diagnose(graph));
    }

    /**
     * Analyzes a graph that was already diagnosed.
     *
     * @param graph the graph, never null
     * @param diagnostics the diagnostics of that same graph
     * @return the report
     */
    public FlowReport analyze(final ControlFlowGraph graph,
            final DiagnosticReport diagnostics) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(diagnostics, "Diagnostics are required");

        if (graph.isEmpty() || !diagnostics.hasEntry()) {
            LOG.debug("Graph {} has no entry, nothing to analyze",
                    graph.name());
            return FlowReport.empty(new ArrayList<>(graph.nodeIds()));
        }

        final String entry = diagnostics.beginNodeId();
        final Set<String> reachable = diagnostics.reachableNodes();
        final Map<String, List<CfgEdge>> out = new HashMap<>();
        final Map<String, List<CfgEdge>> in = new HashMap<>();
        for (final CfgEdge edge : graph.edges()) {
            if (reachable.contains(edge.src())
                    && reachable.contains(edge.dst())) {
                out.computeIfAbsent(edge.src(), k -> new ArrayList<>())
                        .add(edge);
                in.computeIfAbsent(edge.dst(), k -> new ArrayList<>())
                        .add(edge);
            }
        }

        final DominatorTree dominators = DominatorTree.compute(entry,
                id -> targets(out.get(id)), id -> sources(in.get(id)));

        final Map<CfgEdge, EdgeClass> classes = classify(entry, out);
        final List<CfgEdge> backEdges = new ArrayList<>();
        final Set<String> loopHeaders = new LinkedHashSet<>();
        for (final Map.Entry<CfgEdge, EdgeClass> entryClass
                : classes.entrySet()) {
            if (entryClass.getValue() == EdgeClass.BACK) {
                backEdges.add(entryClass.getKey());
                loopHeaders.add(entryClass.getKey().dst());
            }
        }

        boolean reducible = true;
        final List<NaturalLoop> loops = new ArrayList<>();
        for (final CfgEdge back : backEdges) {
            if (dominators.dominates(back.dst(), back.src())) {
                loops.add(naturalLoop(back, in));
            } else {
                reducible = false;
            }
        }

        final List<CfgEdge> critical = new ArrayList<>();
        for (final CfgEdge edge : graph.edges()) {
            if (out.getOrDefault(edge.src(), List.of()).contains(edge)
                    && out.get(edge.src()).size() > 1
                    && in.get(edge.dst()).size() > 1) {
                critical.add(edge);
            }
        }

        final List<String> excluded = new ArrayList<>(
                diagnostics.disconnectedNodes());

        final FlowReport report = new FlowReport(dominators,
                postDominators(graph, reachable, out, in), classes,
                backEdges, loopHeaders, loops, critical, reducible,
                basicBlocks(entry, reachable, out, in),
                loopConnectedness(entry, reachable, out, classes),
                reachable.size(), excluded);

        LOG.debug("Analyzed graph {}: {} blocks, {} loop headers, {} back"
                + " edges, {} critical edges, reducible {}, loop"
                + " connectedness {}",
                graph.name(), report.basicBlockCount(),
                report.loopHeaderCount(), report.backEdgeCount(),
                report.criticalEdgeCount(), report.reducible(),
                report.loopConnectedness());
        return report;
    }

    /**
     * Iterative depth-first traversal from the entry following edge
     * order. An edge to a node still on the stack is a back edge; a self
     * loop is one too.
     */
    private Map<CfgEdge, EdgeClass> classify(final String entry,
            final Map<String, List<CfgEdge>> out) {
        final Map<CfgEdge, EdgeClass> classes = new LinkedHashMap<>();
        final Map<String, Integer> preOrder = new HashMap<>();
        final Set<String> onStack = new HashSet<>();
        final Deque<String> nodes = new ArrayDeque<>();
        final Deque<Integer> positions = new ArrayDeque<>();

        preOrder.put(entry, 0);
        onStack.add(entry);
        nodes.push(entry);
        positions.push(0);

        while (!nodes.isEmpty()) {
            final String node = nodes.peek();
            final int position = positions.pop();
            final List<CfgEdge> edges = out.getOrDefault(node, List.of());

            if (position >= edges.size()) {
                nodes.pop();
                onStack.remove(node);
                continue;
            }
            positions.push(position + 1);

            final CfgEdge edge = edges.get(position);
            final String target = edge.dst();
            if (!preOrder.containsKey(target)) {
                classes.put(edge, EdgeClass.TREE);
                preOrder.put(target, preOrder.size());
                onStack.add(target);
                nodes.push(target);
                positions.push(0);
            } else if (onStack.contains(target)) {
                classes.put(edge, EdgeClass.BACK);
            } else if (preOrder.get(target) > preOrder.get(node)) {
                classes.put(edge, EdgeClass.FORWARD);
            } else {
                classes.put(edge, EdgeClass.CROSS);
            }
        }
        return classes;
    }

    /**
     * Largest number of distinct back edge sources on one forward path
     * from the entry. Dropping the back edges of a depth-first traversal
     * leaves an acyclic graph, so a longest path pass over a topological
     * order finds it.
     */
    private int loopConnectedness(final String entry,
            final Set<String> reachable,
            final Map<String, List<CfgEdge>> out,
            final Map<CfgEdge, EdgeClass> classes) {
        final Set<String> latches = new HashSet<>();
        final Map<String, Integer> inDegree = new HashMap<>();
        for (final String node : reachable) {
            for (final CfgEdge edge : out.getOrDefault(node, List.of())) {
                if (classes.get(edge) == EdgeClass.BACK) {
                    latches.add(edge.src());
                } else {
                    inDegree.merge(edge.dst(), 1, Integer::sum);
                }
            }
        }
        if (latches.isEmpty()) {
            return 0;
        }

        final Map<String, Integer> best = new HashMap<>();
        best.put(entry, latches.contains(entry) ? 1 : 0);
        final Deque<String> ready = new ArrayDeque<>();
        ready.add(entry);
        int max = 0;
        while (!ready.isEmpty()) {
            final String node = ready.poll();
            final int count = best.get(node);
            max = Math.max(max, count);
            for (final CfgEdge edge : out.getOrDefault(node, List.of())) {
                if (classes.get(edge) == EdgeClass.BACK) {
                    continue;
                }
                final String target = edge.dst();
                final int candidate = count
                        + (latches.contains(target) ? 1 : 0);
                best.merge(target, candidate, Math::max);
                if (inDegree.merge(target, -1, Integer::sum) == 0) {
                    ready.add(target);
                }
            }
        }
        return max;
    }

    /** Header plus every node reaching the back edge source without it. */
    private NaturalLoop naturalLoop(final CfgEdge back,
            final Map<String, List<CfgEdge>> in) {
        final Set<String> body = new LinkedHashSet<>();
        body.add(back.dst());
        final Deque<String> pending = new ArrayDeque<>();
        if (body.add(back.src())) {
            pending.push(back.src());
        }
        while (!pending.isEmpty()) {
            final String node = pending.pop();
            for (final CfgEdge edge : in.getOrDefault(node, List.of())) {
                if (body.add(edge.src())) {
                    pending.push(edge.src());
                }
            }
        }
        return new NaturalLoop(back.dst(), back, body);
    }

    /**
     * Dominators of the reversed graph rooted at a virtual exit whose
     * successors are the reachable END nodes.
     */
    private DominatorTree postDominators(final ControlFlowGraph graph,
            final Set<String> reachable,
            final Map<String, List<CfgEdge>> out,
            final Map<String, List<CfgEdge>> in) {
        final List<String> ends = new ArrayList<>();
        for (final CfgNode end : graph.endNodes()) {
            if (reachable.contains(end.id())) {
                ends.add(end.id());
            }
        }
        if (ends.isEmpty()) {
            return DominatorTree.empty();
        }
        final Set<String> endSet = new HashSet<>(ends);
        return DominatorTree.compute(VIRTUAL_EXIT,
                id -> VIRTUAL_EXIT.equals(id) ? ends : sources(in.get(id)),
                id -> {
                    final List<String> next = new ArrayList<>(
                            targets(out.get(id)));
                    if (endSet.contains(id)) {
                        next.add(VIRTUAL_EXIT);
                    }
                    return next;
                });
    }

    /**
     * Leader rule: a node starts a block when it is the entry, has other
     * than one predecessor, or its predecessor has other than one
     * successor.
     */
    private int basicBlocks(final String entry, final Set<String> reachable,
            final Map<String, List<CfgEdge>> out,
            final Map<String, List<CfgEdge>> in) {
        int leaders = 0;
        for (final String node : reachable) {
            final List<CfgEdge> incoming = in.getOrDefault(node, List.of());
            if (node.equals(entry) || incoming.size() != 1) {
                leaders++;
                continue;
            }
            final String predecessor = incoming.get(0).src();
            if (out.getOrDefault(predecessor, List.of()).size() != 1
                    || predecessor.equals(node)) {
                leaders++;
            }
        }
        return leaders;
    }

    private static List<String> targets(final List<CfgEdge> edges) {
        if (edges == null) {
            return List.of();
        }
        final Set<String> result = new LinkedHashSet<>();
        for (final CfgEdge edge : edges) {
            result.add(edge.dst());
        }
        return new ArrayList<>(result);
    }

    private static List<String> sources(final List<CfgEdge> edges) {
        if (edges == null) {
            return List.of();
        }
        final Set<String> result = new LinkedHashSet<>();
        for (final CfgEdge edge : edges) {
            result.add(edge.src());
        }
        return new ArrayList<>(result);
    }

}
