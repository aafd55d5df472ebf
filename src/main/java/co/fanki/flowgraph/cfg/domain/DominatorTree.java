package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Dominator relation over the nodes reachable from a root.
 *
 * <p>Node {@code d} dominates {@code n} when every path from the root to
 * {@code n} goes through {@code d}. The sets are computed with the
 * iterative data-flow formulation over reverse post-order, repeated until
 * no set changes. The same computation run on the reversed graph from a
 * virtual exit gives the post-dominators.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DominatorTree {

    private static final DominatorTree EMPTY = new DominatorTree(null,
            List.of(), Map.of(), Map.of());

    private final String root;

    /** Nodes in reverse post-order from the root. */
    private final List<String> order;

    private final Map<String, Set<String>> dominators;

    private final Map<String, String> immediateDominators;

    private final Map<String, List<String>> children;

    private DominatorTree(final String theRoot, final List<String> theOrder,
            final Map<String, Set<String>> theDominators,
            final Map<String, String> theImmediateDominators) {
        this.root = theRoot;
        this.order = List.copyOf(theOrder);
        this.dominators = Collections.unmodifiableMap(theDominators);
        this.immediateDominators = Collections.unmodifiableMap(
                theImmediateDominators);

        final Map<String, List<String>> tree = new LinkedHashMap<>();
        for (final String node : order) {
            final String parent = immediateDominators.get(node);
            if (parent != null) {
                tree.computeIfAbsent(parent, k -> new ArrayList<>()).add(node);
            }
        }
        final Map<String, List<String>> frozen = new HashMap<>();
        tree.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.children = Collections.unmodifiableMap(frozen);
    }

    /**
     * Returns the tree of a graph with nothing to dominate.
     *
     * @return the empty tree
     */
    public static DominatorTree empty() {
        return EMPTY;
    }

    /**
     * Computes the dominators of every node reachable from a root.
     *
     * <p>Predecessors outside the reachable set are ignored.</p>
     *
     * @param root the root node
     * @param successors successor ids of a node, in a stable order
     * @param predecessors predecessor ids of a node
     * @return the tree
     */
    public static DominatorTree compute(final String root,
            final Function<String, List<String>> successors,
            final Function<String, List<String>> predecessors) {
        Preconditions.requireNonNull(root, "Root is required");
        Preconditions.requireNonNull(successors, "Successors are required");
        Preconditions.requireNonNull(predecessors,
                "Predecessors are required");

        final List<String> rpo = reversePostOrder(root, successors);
        final Set<String> all = new LinkedHashSet<>(rpo);

        final Map<String, Set<String>> dom = new HashMap<>();
        for (final String node : rpo) {
            dom.put(node, node.equals(root)
                    ? new LinkedHashSet<>(List.of(root))
                    : new LinkedHashSet<>(all));
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (final String node : rpo) {
                if (node.equals(root)) {
                    continue;
                }
                Set<String> meet = null;
                for (final String pred : predecessors.apply(node)) {
                    if (!all.contains(pred)) {
                        continue;
                    }
                    if (meet == null) {
                        meet = new LinkedHashSet<>(dom.get(pred));
                    } else {
                        meet.retainAll(dom.get(pred));
                    }
                }
                final Set<String> updated = new LinkedHashSet<>();
                if (meet != null) {
                    updated.addAll(meet);
                }
                updated.add(node);
                if (!updated.equals(dom.get(node))) {
                    dom.put(node, updated);
                    changed = true;
                }
            }
        }

        final Map<String, Set<String>> frozen = new LinkedHashMap<>();
        final Map<String, String> idom = new HashMap<>();
        for (final String node : rpo) {
            final Set<String> set = dom.get(node);
            frozen.put(node, Collections.unmodifiableSet(set));

            // Dominators form a chain: the closest one has the largest set.
            String closest = null;
            int closestSize = -1;
            for (final String candidate : set) {
                if (candidate.equals(node)) {
                    continue;
                }
                final int size = dom.get(candidate).size();
                if (size > closestSize) {
                    closest = candidate;
                    closestSize = size;
                }
            }
            if (closest != null) {
                idom.put(node, closest);
            }
        }
        return new DominatorTree(root, rpo, frozen, idom);
    }

    private static List<String> reversePostOrder(final String root,
            final Function<String, List<String>> successors) {
        final List<String> postOrder = new ArrayList<>();
        final Set<String> visited = new LinkedHashSet<>();
        final Deque<Map.Entry<String, Iterator<String>>> stack =
                new ArrayDeque<>();

        visited.add(root);
        stack.push(Map.entry(root, successors.apply(root).iterator()));
        while (!stack.isEmpty()) {
            final Map.Entry<String, Iterator<String>> top = stack.peek();
            if (top.getValue().hasNext()) {
                final String next = top.getValue().next();
                if (visited.add(next)) {
                    stack.push(Map.entry(next,
                            successors.apply(next).iterator()));
                }
            } else {
                postOrder.add(top.getKey());
                stack.pop();
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }

    /**
     * Returns the root, or null for the empty tree.
     *
     * @return the root id
     */
    public String root() {
        return root;
    }

    /** Checks if no node is covered. */
    public boolean isEmpty() {
        return order.isEmpty();
    }

    /**
     * Returns the covered nodes in reverse post-order.
     *
     * @return unmodifiable list of ids
     */
    public List<String> nodes() {
        return order;
    }

    /**
     * Checks if a node is covered by this tree.
     *
     * @param node the node id
     * @return true if the node was reached from the root
     */
    public boolean contains(final String node) {
        return dominators.containsKey(node);
    }

    /**
     * Returns the dominator set of a node, the node itself included.
     *
     * @param node the node id
     * @return unmodifiable set, empty if the node is not covered
     */
    public Set<String> dominators(final String node) {
        return dominators.getOrDefault(node, Set.of());
    }

    /**
     * Returns the immediate dominator of a node.
     *
     * @param node the node id
     * @return the closest strict dominator, or null for the root and for
     *         nodes not covered
     */
    public String immediateDominator(final String node) {
        return immediateDominators.get(node);
    }

    /**
     * Returns every immediate dominator, keyed by dominated node.
     *
     * @return unmodifiable map
     */
    public Map<String, String> immediateDominators() {
        return immediateDominators;
    }

    /**
     * Checks if one node dominates another.
     *
     * @param dominator the candidate dominator
     * @param node the dominated node
     * @return true if every path from the root to node goes through
     *         dominator; a node dominates itself
     */
    public boolean dominates(final String dominator, final String node) {
        return dominators(node).contains(dominator);
    }

    /**
     * Returns the nodes immediately dominated by a node.
     *
     * @param node the node id
     * @return unmodifiable list in reverse post-order
     */
    public List<String> children(final String node) {
        return children.getOrDefault(node, List.of());
    }

}
