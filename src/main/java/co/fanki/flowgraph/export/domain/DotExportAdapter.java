package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.export.domain.GraphExport.ExportEdge;
import co.fanki.flowgraph.export.domain.GraphExport.ExportNode;

/**
 * Renders a Graphviz DOT digraph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DotExportAdapter implements ExportAdapter {

    @Override
    public String format() {
        return "dot";
    }

    @Override
    public String mediaType() {
        return "text/vnd.graphviz";
    }

    @Override
    public String render(final GraphExport export) {
        final StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(export.name())).append(" {\n");
        sb.append("    node [style=filled];\n");

        for (final ExportNode node : export.nodes()) {
            sb.append("    ").append(quote(node.id()))
                    .append(" [label=").append(quote(node.label()))
                    .append(", shape=").append(shape(node))
                    .append(", fillcolor=").append(node.colorClass().fill());
            if (node.isPlaceholder()) {
                sb.append(", style=\"filled,dashed\"");
            }
            sb.append("];\n");
        }

        for (final ExportEdge edge : export.edges()) {
            sb.append("    ").append(quote(edge.src())).append(" -> ")
                    .append(quote(edge.dst()));
            final StringBuilder attributes = new StringBuilder();
            if (edge.hasLabel()) {
                attributes.append("label=").append(quote(edge.label()));
            }
            if (edge.interruptionMode() != null) {
                append(attributes, "style=dotted");
            }
            if (edge.orphan()) {
                append(attributes, "color=red");
            }
            if (attributes.length() > 0) {
                sb.append(" [").append(attributes).append("]");
            }
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void append(final StringBuilder attributes,
            final String attribute) {
        if (attributes.length() > 0) {
            attributes.append(", ");
        }
        attributes.append(attribute);
    }

    private static String shape(final ExportNode node) {
        if (node.isPlaceholder()) {
            return "box";
        }
        return switch (node.kind()) {
            case "BEGIN", "END" -> "oval";
            case "CONDITION" -> "diamond";
            default -> "box";
        };
    }

    private static String quote(final String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"")
                .replace("\n", "\\n") + "\"";
    }

}
