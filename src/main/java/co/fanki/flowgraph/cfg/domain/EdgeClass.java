package co.fanki.flowgraph.cfg.domain;

/**
 * Classification of an edge by a depth-first traversal from the entry.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeClass {

    /** Discovers its destination. */
    TREE,

    /** Leads to an ancestor still on the traversal stack. */
    BACK,

    /** Leads to an already discovered descendant. */
    FORWARD,

    /** Leads to a node that is neither ancestor nor descendant. */
    CROSS

}
