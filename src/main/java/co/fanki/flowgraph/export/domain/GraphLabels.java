package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.cfg.domain.CfgNode;
import co.fanki.flowgraph.cfg.domain.EdgeConstraints;
import co.fanki.flowgraph.cfg.domain.InterruptionMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Label text for exported nodes and edges.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphLabels {

    private GraphLabels() {
        // Utility class, not instantiable
    }

    /**
     * Returns the label of an edge, derived from its constraints only.
     *
     * <p>{@code T} or {@code F} for a condition value, {@code exc} or
     * {@code any} for an interruption mode, both separated by a space when
     * both are set, and an empty string for a sequential edge.</p>
     *
     * @param constraints the edge constraints, null is treated as none
     * @return the label, never null
     */
    public static String edgeLabel(final EdgeConstraints constraints) {
        if (constraints == null) {
            return "";
        }
        final List<String> parts = new ArrayList<>(2);
        if (constraints.conditionValue() != null) {
            parts.add(constraints.conditionValue() ? "T" : "F");
        }
        final InterruptionMode mode = constraints.interruptionMode();
        if (mode == InterruptionMode.EXCEPTION) {
            parts.add("exc");
        } else if (mode == InterruptionMode.ANY) {
            parts.add("any");
        }
        return String.join(" ", parts);
    }

    /**
     * Returns the label of a node: its kind, then {@code AST:<id>} when it
     * points back to an AST node, then {@code role:<role>} when it has a
     * role, one per line.
     *
     * @param node the node
     * @return the label, never null
     */
    public static String nodeLabel(final CfgNode node) {
        final List<String> lines = new ArrayList<>(3);
        lines.add(node.kind().name());
        if (node.hasSourceRef()) {
            lines.add("AST:" + node.sourceRef());
        }
        if (node.hasRole()) {
            lines.add("role:" + node.role());
        }
        return String.join("\n", lines);
    }

}
