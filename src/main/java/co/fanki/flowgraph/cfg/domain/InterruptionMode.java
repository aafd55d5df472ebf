package co.fanki.flowgraph.cfg.domain;

/**
 * When an edge is taken with respect to abrupt completion.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum InterruptionMode {

    /** Taken only when the source completes abruptly with an exception. */
    EXCEPTION("exception"),

    /** Taken however the source completes, normally or abruptly. */
    ANY("any");

    private final String wireName;

    InterruptionMode(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the lower-case name used in JSON documents.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire name.
     *
     * @param value the name, case insensitive
     * @return the mode, or null if the value is blank or unknown
     */
    public static InterruptionMode fromWireName(final String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (final InterruptionMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        return null;
    }

}
