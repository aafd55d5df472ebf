package co.fanki.flowgraph.ast.domain;

import co.fanki.flowgraph.shared.DomainException;
import co.fanki.flowgraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Read-only view over one node of a language-agnostic AST.
 *
 * <p>The frontends hand over the tree as JSON: every node is an object
 * with a {@code type} tag, an optional numeric {@code id}, and named
 * children that are either single objects or arrays of objects. This
 * view never copies nor mutates the underlying tree; scalar properties
 * (names, literal values) are ignored by the engine.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AstNode {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonNode json;

    private AstNode(final JsonNode theJson) {
        this.json = theJson;
    }

    /**
     * Wraps an already parsed JSON object.
     *
     * @param json the JSON object, never null
     * @return the AST view
     */
    public static AstNode of(final JsonNode json) {
        Preconditions.requireNonNull(json, "AST node is required");
        Preconditions.requireDomain(json.isObject(),
                "AST node must be a JSON object, got " + json.getNodeType(),
                "INVALID_AST");
        return new AstNode(json);
    }

    /**
     * Parses an AST from its JSON text.
     *
     * @param text the JSON document
     * @return the root of the AST view
     * @throws DomainException if the document is not a JSON object
     */
    public static AstNode fromJson(final String text) {
        Preconditions.requireNonBlank(text, "AST JSON is required");
        try {
            return of(MAPPER.readTree(text));
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to parse AST: "
                    + e.getOriginalMessage(), "INVALID_AST", e);
        }
    }

    /**
     * Returns the {@code type} tag of this node.
     *
     * @return the tag, empty if the node carries none
     */
    public String type() {
        final JsonNode type = json.get("type");
        if (type == null || !type.isTextual()) {
            return "";
        }
        return type.asText();
    }

    /**
     * Returns the construct type resolved from the tag.
     *
     * @return the construct type, UNKNOWN if the tag is not recognized
     */
    public ConstructType constructType() {
        return ConstructType.fromTag(type());
    }

    /**
     * Returns the numeric id of this node.
     *
     * @return the id, or null if the node has none
     */
    public Long id() {
        final JsonNode id = json.get("id");
        if (id == null || !id.canConvertToLong()) {
            return null;
        }
        return id.asLong();
    }

    /**
     * Checks if this node has a child object or list under the field.
     *
     * @param field the field name
     * @return true if a non-null object or array is present
     */
    public boolean has(final String field) {
        final JsonNode value = json.get(field);
        return value != null && (value.isObject() || value.isArray());
    }

    /**
     * Reads a boolean property of this node.
     *
     * @param field the field name
     * @return true only if the field holds the JSON literal {@code true}
     */
    public boolean flag(final String field) {
        final JsonNode value = json.get(field);
        return value != null && value.isBoolean() && value.asBoolean();
    }

    /**
     * Returns the child object stored under a field.
     *
     * @param field the field name
     * @return the child, or null if absent or not an object
     */
    public AstNode child(final String field) {
        final JsonNode value = json.get(field);
        if (value == null || !value.isObject()) {
            return null;
        }
        return new AstNode(value);
    }

    /**
     * Returns the children stored under a field.
     *
     * <p>An array yields its object elements in order, a single object
     * yields a one-element list. Anything else yields an empty list.</p>
     *
     * @param field the field name
     * @return unmodifiable list of children, never null
     */
    public List<AstNode> children(final String field) {
        final JsonNode value = json.get(field);
        if (value == null) {
            return List.of();
        }
        if (value.isObject()) {
            return List.of(new AstNode(value));
        }
        if (!value.isArray()) {
            return List.of();
        }
        final List<AstNode> result = new ArrayList<>(value.size());
        for (final JsonNode element : value) {
            if (element.isObject()) {
                result.add(new AstNode(element));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Checks whether this node or any node below it has one of the tags.
     *
     * @param types the tags to look for
     * @return true if at least one node in the subtree matches
     */
    public boolean containsAny(final Set<String> types) {
        final Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(json);
        while (!pending.isEmpty()) {
            final JsonNode current = pending.pop();
            if (current.isObject()) {
                final JsonNode type = current.get("type");
                if (type != null && types.contains(type.asText())) {
                    return true;
                }
            }
            if (current.isContainerNode()) {
                for (final JsonNode element : current) {
                    if (element.isContainerNode()) {
                        pending.push(element);
                    }
                }
            }
        }
        return false;
    }

    /**
     * Returns a short description used in log lines.
     *
     * @return the tag and the id, e.g. {@code if_statement#12}
     */
    public String describe() {
        final Long id = id();
        final String tag = type().isEmpty() ? "<untyped>" : type();
        return id == null ? tag : tag + "#" + id;
    }

    @Override
    public String toString() {
        return describe();
    }

}
