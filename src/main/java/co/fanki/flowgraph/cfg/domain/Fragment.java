package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.shared.Preconditions;

/**
 * The entry and exit of the subgraph produced for one AST node.
 *
 * <p>A fragment whose construct never completes normally (a return, a
 * throw, a block ending in a break) has no exit: nothing that follows it
 * in a sequence is wired to it.</p>
 *
 * @param entry the node control enters through, never null
 * @param exit the node control leaves through on normal completion, or
 *        null if the construct always completes abruptly
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Fragment(CfgNode entry, CfgNode exit) {

    /**
     * Creates a fragment.
     */
    public Fragment {
        Preconditions.requireNonNull(entry, "Fragment entry is required");
    }

    /**
     * Creates a fragment that completes normally.
     *
     * @param entry the entry node
     * @param exit the exit node
     * @return the fragment
     */
    public static Fragment of(final CfgNode entry, final CfgNode exit) {
        Preconditions.requireNonNull(exit, "Fragment exit is required");
        return new Fragment(entry, exit);
    }

    /**
     * Creates a fragment made of a single node.
     *
     * @param node the node, both entry and exit
     * @return the fragment
     */
    public static Fragment single(final CfgNode node) {
        return of(node, node);
    }

    /**
     * Creates a fragment that never completes normally.
     *
     * @param entry the entry node
     * @return the fragment
     */
    public static Fragment abrupt(final CfgNode entry) {
        return new Fragment(entry, null);
    }

    /** Checks if control can leave this fragment through its exit. */
    public boolean completesNormally() {
        return exit != null;
    }

}
