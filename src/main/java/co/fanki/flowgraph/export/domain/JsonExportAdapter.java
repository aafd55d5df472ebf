package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.export.domain.GraphExport.ExportEdge;
import co.fanki.flowgraph.export.domain.GraphExport.ExportNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders the export view as JSON, styling hints included, for
 * consumers that draw the graph themselves.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JsonExportAdapter implements ExportAdapter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String mediaType() {
        return "application/json";
    }

    @Override
    public String render(final GraphExport export) {
        final ObjectNode root = MAPPER.createObjectNode();
        root.put("name", export.name());

        final ArrayNode nodes = root.putArray("nodes");
        for (final ExportNode node : export.nodes()) {
            final ObjectNode obj = nodes.addObject();
            obj.put("id", node.id());
            if (node.kind() != null) {
                obj.put("kind", node.kind());
            }
            if (node.role() != null) {
                obj.put("role", node.role());
            }
            if (node.sourceRef() != null) {
                obj.put("sourceRef", node.sourceRef());
            }
            obj.put("colorClass", node.colorClass().name());
            obj.put("color", node.colorClass().fill());
            obj.put("label", node.label());
            obj.put("reachable", node.reachable());
        }

        final ArrayNode edges = root.putArray("edges");
        for (final ExportEdge edge : export.edges()) {
            final ObjectNode obj = edges.addObject();
            obj.put("src", edge.src());
            obj.put("dst", edge.dst());
            if (edge.conditionValue() != null) {
                obj.put("conditionValue", edge.conditionValue());
            }
            if (edge.interruptionMode() != null) {
                obj.put("interruptionMode", edge.interruptionMode());
            }
            obj.put("label", edge.label());
            obj.put("orphan", edge.orphan());
        }

        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to render graph "
                    + export.name(), e);
        }
    }

}
