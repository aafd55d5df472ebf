package co.fanki.flowgraph.cfg.domain;

/**
 * The kind of a control point.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /** The unique entry of a graph. */
    BEGIN,

    /** An exit of a graph; normal and exceptional exits may differ. */
    END,

    /** A decision point whose outgoing edges carry a condition value. */
    CONDITION,

    /** Boundary of a compound region, such as an empty block. */
    COMPOUND,

    /** A straight-line control point. */
    ATOM;

    /**
     * Parses a kind name, returning ATOM if not recognized.
     *
     * @param value the kind name, case insensitive
     * @return the kind, or ATOM
     */
    public static NodeKind fromString(final String value) {
        if (value == null || value.isBlank()) {
            return ATOM;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (final IllegalArgumentException e) {
            return ATOM;
        }
    }

}
