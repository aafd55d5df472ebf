package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.shared.ValueObject;

/**
 * The constraint set of an edge.
 *
 * <p>An edge with neither a condition value nor an interruption mode is
 * an unconditional sequential edge.</p>
 *
 * @param conditionValue the branch this edge selects when leaving a
 *        condition, or null
 * @param interruptionMode when the edge is taken with respect to abrupt
 *        completion, or null for normal flow
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgeConstraints(Boolean conditionValue,
        InterruptionMode interruptionMode) implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** Unconditional sequential transfer. */
    public static final EdgeConstraints NONE = new EdgeConstraints(null, null);

    /** True branch of a condition. */
    public static final EdgeConstraints WHEN_TRUE =
            new EdgeConstraints(Boolean.TRUE, null);

    /** False branch of a condition. */
    public static final EdgeConstraints WHEN_FALSE =
            new EdgeConstraints(Boolean.FALSE, null);

    /** Exceptional exit towards a handler. */
    public static final EdgeConstraints ON_EXCEPTION =
            new EdgeConstraints(null, InterruptionMode.EXCEPTION);

    /** Entry into a region that runs however control leaves. */
    public static final EdgeConstraints ALWAYS =
            new EdgeConstraints(null, InterruptionMode.ANY);

    /**
     * Checks if this is a plain sequential edge.
     *
     * @return true if no constraint is set
     */
    public boolean isUnconditional() {
        return conditionValue == null && interruptionMode == null;
    }

}
