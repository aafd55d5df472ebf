package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * A directed control transfer between two node ids.
 *
 * <p>The endpoints are ids, not nodes: an edge may reference an id the
 * graph does not contain. Such edges are orphans and are reported by
 * {@link GraphValidator}.</p>
 *
 * @param src the source node id
 * @param dst the destination node id
 * @param constraints the constraint set, {@link EdgeConstraints#NONE}
 *        for a sequential edge
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CfgEdge(String src, String dst, EdgeConstraints constraints)
        implements ValueObject {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an edge.
     */
    public CfgEdge {
        Preconditions.requireNonBlank(src, "Edge source is required");
        Preconditions.requireNonBlank(dst, "Edge destination is required");
        if (constraints == null) {
            constraints = EdgeConstraints.NONE;
        }
    }

    /**
     * Creates an unconditional edge.
     *
     * @param src the source node id
     * @param dst the destination node id
     * @return the edge
     */
    public static CfgEdge of(final String src, final String dst) {
        return new CfgEdge(src, dst, EdgeConstraints.NONE);
    }

    @Override
    public String toString() {
        if (constraints.isUnconditional()) {
            return src + " -> " + dst;
        }
        return src + " -> " + dst + " " + constraints;
    }

}
