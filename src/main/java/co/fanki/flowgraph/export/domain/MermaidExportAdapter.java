package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.export.domain.GraphExport.ExportEdge;
import co.fanki.flowgraph.export.domain.GraphExport.ExportNode;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a Mermaid flowchart.
 *
 * <p>Node ids are renamed to {@code v0}, {@code v1}, ... since graph ids
 * read from JSON may contain characters Mermaid does not accept.
 * Exceptional and finally edges are dotted, orphan edges are drawn but
 * their placeholder endpoint gets the {@code missing} class.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MermaidExportAdapter implements ExportAdapter {

    @Override
    public String format() {
        return "mermaid";
    }

    @Override
    public String mediaType() {
        return "text/plain";
    }

    @Override
    public String render(final GraphExport export) {
        final StringBuilder builder = new StringBuilder();
        builder.append("flowchart TD\n");

        final Map<String, String> ids = new HashMap<>();
        final Map<NodeColor, StringJoiner> byColor =
                new EnumMap<>(NodeColor.class);
        final List<ExportNode> nodes = export.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            final ExportNode node = nodes.get(i);
            final String id = "v" + i;
            ids.put(node.id(), id);
            builder.append("  ").append(id).append(shape(node)).append("\n");
            byColor.computeIfAbsent(node.colorClass(),
                    k -> new StringJoiner(",")).add(id);
        }

        for (final ExportEdge edge : export.edges()) {
            builder.append("  ").append(ids.get(edge.src()))
                    .append(arrow(edge))
                    .append(ids.get(edge.dst())).append("\n");
        }

        for (final Map.Entry<NodeColor, StringJoiner> entry
                : byColor.entrySet()) {
            final String className = entry.getKey().name().toLowerCase();
            builder.append("  classDef ").append(className)
                    .append(" fill:").append(entry.getKey().fill())
                    .append(";\n");
            builder.append("  class ").append(entry.getValue())
                    .append(" ").append(className).append(";\n");
        }
        return builder.toString();
    }

    private String shape(final ExportNode node) {
        final String label = escape(node.label());
        if ("BEGIN".equals(node.kind()) || "END".equals(node.kind())) {
            return "([\"" + label + "\"])";
        }
        if ("CONDITION".equals(node.kind())) {
            return "{\"" + label + "\"}";
        }
        return "[\"" + label + "\"]";
    }

    private String arrow(final ExportEdge edge) {
        final boolean dotted = edge.interruptionMode() != null;
        if (!edge.hasLabel()) {
            return dotted ? " -.-> " : " --> ";
        }
        final String label = "|" + escape(edge.label()) + "|";
        return dotted ? " -.->" + label + " " : " -->" + label + " ";
    }

    private static String escape(final String text) {
        return text.replace("\"", "#quot;").replace("\n", "<br/>");
    }

}
