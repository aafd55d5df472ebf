package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.cfg.domain.NodeKind;

/**
 * Styling class of an exported node, derived from its kind only.
 *
 * <p>Each class carries a suggested fill color; renderers are free to
 * map the class to their own palette.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeColor {

    BEGIN("lightgreen"),

    END("lightcoral"),

    DEFAULT("lightblue"),

    /** Placeholder for an id referenced by an edge but absent. */
    MISSING("lightgray");

    private final String fill;

    NodeColor(final String theFill) {
        this.fill = theFill;
    }

    /**
     * Returns the suggested fill color.
     *
     * @return a color name understood by Graphviz and CSS
     */
    public String fill() {
        return fill;
    }

    /**
     * Resolves the class of a node kind.
     *
     * @param kind the node kind, null for an absent node
     * @return the color class
     */
    public static NodeColor of(final NodeKind kind) {
        if (kind == null) {
            return MISSING;
        }
        return switch (kind) {
            case BEGIN -> BEGIN;
            case END -> END;
            default -> DEFAULT;
        };
    }

}
