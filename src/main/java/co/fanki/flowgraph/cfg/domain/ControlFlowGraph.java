package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.shared.DomainException;
import co.fanki.flowgraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable control-flow graph for one construction unit.
 *
 * <p>Owns its nodes, keyed by id in insertion order, and its edges in
 * the order they were added. Edge order carries no meaning; it only makes
 * iteration deterministic.</p>
 *
 * <p>The structural invariants (a single BEGIN without incoming edges,
 * no edge pointing to an unknown id, every node reachable) are not
 * enforced here. A graph may violate them and {@link GraphValidator}
 * reports the violations as data.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ControlFlowGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;

    private final Map<String, CfgNode> nodes;

    private final List<CfgEdge> edges;

    /** Outgoing edges per source id, including ids missing from nodes. */
    private final Map<String, List<CfgEdge>> outgoing;

    /** Incoming edges per destination id. */
    private final Map<String, List<CfgEdge>> incoming;

    private ControlFlowGraph(final String theName,
            final Map<String, CfgNode> theNodes,
            final List<CfgEdge> theEdges) {
        this.name = theName;
        this.nodes = Collections.unmodifiableMap(
                new LinkedHashMap<>(theNodes));
        this.edges = List.copyOf(theEdges);

        final Map<String, List<CfgEdge>> out = new HashMap<>();
        final Map<String, List<CfgEdge>> in = new HashMap<>();
        for (final CfgEdge edge : edges) {
            out.computeIfAbsent(edge.src(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.dst(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    /**
     * Starts a new graph.
     *
     * @param name the graph name, usually the root AST node type
     * @return a builder
     */
    public static Builder builder(final String name) {
        return new Builder(name);
    }

    /**
     * Returns the graph name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns all nodes in insertion order.
     *
     * @return unmodifiable collection of nodes
     */
    public Collection<CfgNode> nodes() {
        return nodes.values();
    }

    /**
     * Returns all node ids in insertion order.
     *
     * @return unmodifiable set of ids
     */
    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    /**
     * Returns the node with the given id.
     *
     * @param id the node id
     * @return the node, or null if the graph has no such node
     */
    public CfgNode node(final String id) {
        return nodes.get(id);
    }

    /**
     * Checks if the graph contains a node.
     *
     * @param id the node id
     * @return true if the node exists
     */
    public boolean contains(final String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Returns all edges in insertion order.
     *
     * @return unmodifiable list of edges
     */
    public List<CfgEdge> edges() {
        return edges;
    }

    /** Returns the number of nodes. */
    public int nodeCount() {
        return nodes.size();
    }

    /** Returns the number of edges. */
    public int edgeCount() {
        return edges.size();
    }

    /** Checks if the graph has no nodes. */
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Returns the edges leaving an id, whether or not the id is a node.
     *
     * @param id the source id
     * @return unmodifiable list of edges, empty if none
     */
    public List<CfgEdge> outgoing(final String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /**
     * Returns the edges entering an id, whether or not the id is a node.
     *
     * @param id the destination id
     * @return unmodifiable list of edges, empty if none
     */
    public List<CfgEdge> incoming(final String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Returns the distinct successor ids of a node in edge order.
     *
     * @param id the node id
     * @return unmodifiable list of successor ids
     */
    public List<String> successors(final String id) {
        final Set<String> result = new LinkedHashSet<>();
        for (final CfgEdge edge : outgoing(id)) {
            result.add(edge.dst());
        }
        return List.copyOf(result);
    }

    /**
     * Returns the distinct predecessor ids of a node in edge order.
     *
     * @param id the node id
     * @return unmodifiable list of predecessor ids
     */
    public List<String> predecessors(final String id) {
        final Set<String> result = new LinkedHashSet<>();
        for (final CfgEdge edge : incoming(id)) {
            result.add(edge.src());
        }
        return List.copyOf(result);
    }

    /**
     * Returns all BEGIN nodes in insertion order.
     *
     * <p>A well-formed graph has exactly one.</p>
     *
     * @return unmodifiable list of BEGIN nodes
     */
    public List<CfgNode> beginNodes() {
        return nodesOfKind(NodeKind.BEGIN);
    }

    /**
     * Returns the entry of the graph: the first BEGIN node.
     *
     * @return the entry, or null if the graph has no BEGIN node
     */
    public CfgNode begin() {
        for (final CfgNode node : nodes.values()) {
            if (node.kind() == NodeKind.BEGIN) {
                return node;
            }
        }
        return null;
    }

    /**
     * Returns all END nodes in insertion order.
     *
     * @return unmodifiable list of END nodes
     */
    public List<CfgNode> endNodes() {
        return nodesOfKind(NodeKind.END);
    }

    /**
     * Returns the nodes of one kind in insertion order.
     *
     * @param kind the kind to filter by
     * @return unmodifiable list of nodes
     */
    public List<CfgNode> nodesOfKind(final NodeKind kind) {
        final List<CfgNode> result = new ArrayList<>();
        for (final CfgNode node : nodes.values()) {
            if (node.kind() == kind) {
                result.add(node);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Serializes this graph to JSON.
     *
     * @return the JSON representation
     */
    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();
        root.put("name", name);

        final ArrayNode nodesArray = MAPPER.createArrayNode();
        for (final CfgNode node : nodes.values()) {
            final ObjectNode nodeObj = MAPPER.createObjectNode();
            nodeObj.put("id", node.id());
            nodeObj.put("kind", node.kind().name());
            if (node.hasRole()) {
                nodeObj.put("role", node.role());
            }
            if (node.hasSourceRef()) {
                nodeObj.put("sourceRef", node.sourceRef());
            }
            nodesArray.add(nodeObj);
        }
        root.set("nodes", nodesArray);

        final ArrayNode edgesArray = MAPPER.createArrayNode();
        for (final CfgEdge edge : edges) {
            final ObjectNode edgeObj = MAPPER.createObjectNode();
            edgeObj.put("src", edge.src());
            edgeObj.put("dst", edge.dst());
            final EdgeConstraints constraints = edge.constraints();
            if (constraints.conditionValue() != null) {
                edgeObj.put("conditionValue", constraints.conditionValue());
            }
            if (constraints.interruptionMode() != null) {
                edgeObj.put("interruptionMode",
                        constraints.interruptionMode().wireName());
            }
            edgesArray.add(edgeObj);
        }
        root.set("edges", edgesArray);

        try {
            return MAPPER.writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize ControlFlowGraph", e);
        }
    }

    /**
     * Deserializes a graph from JSON.
     *
     * <p>Edges are kept even if they reference ids absent from the node
     * list, so that malformed graphs can be diagnosed.</p>
     *
     * @param json the JSON representation
     * @return the graph
     * @throws DomainException if the document is not a graph
     */
    public static ControlFlowGraph fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");

        try {
            return fromJson(MAPPER.readTree(json));
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to parse graph: "
                    + e.getOriginalMessage(), "INVALID_GRAPH", e);
        }
    }

    /**
     * Reads a graph from an already parsed JSON document.
     *
     * @param root the JSON object
     * @return the graph
     * @throws DomainException if the document is not a graph
     */
    public static ControlFlowGraph fromJson(final JsonNode root) {
        Preconditions.requireNonNull(root, "Graph JSON is required");
        Preconditions.requireDomain(root.isObject(),
                "Graph must be a JSON object", "INVALID_GRAPH");

        final String graphName = root.hasNonNull("name")
                ? root.get("name").asText() : "cfg";
        final Builder builder = builder(graphName);

        final JsonNode nodesNode = root.get("nodes");
        if (nodesNode != null && nodesNode.isArray()) {
            for (final JsonNode nodeObj : nodesNode) {
                final String id = requireId(nodeObj, "id");
                final String role = nodeObj.hasNonNull("role")
                        ? nodeObj.get("role").asText() : null;
                final Long sourceRef = nodeObj.hasNonNull("sourceRef")
                        ? nodeObj.get("sourceRef").asLong() : null;
                builder.addNode(new CfgNode(id,
                        NodeKind.fromString(nodeObj.path("kind").asText()),
                        role, sourceRef));
            }
        }

        final JsonNode edgesNode = root.get("edges");
        if (edgesNode != null && edgesNode.isArray()) {
            for (final JsonNode edgeObj : edgesNode) {
                final String src = requireId(edgeObj, "src");
                final String dst = requireId(edgeObj, "dst");
                final Boolean conditionValue =
                        edgeObj.hasNonNull("conditionValue")
                                ? edgeObj.get("conditionValue").asBoolean()
                                : null;
                final InterruptionMode mode = InterruptionMode.fromWireName(
                        edgeObj.path("interruptionMode").asText(null));
                builder.connect(src, dst, new EdgeConstraints(conditionValue, mode));
            }
        }
        return builder.build();
    }

    /** Reads a node id field, which must be a non-blank string. */
    private static String requireId(final JsonNode obj, final String field) {
        final JsonNode value = obj.get(field);
        Preconditions.requireDomain(value != null && value.isTextual()
                && !value.asText().isBlank(),
                "Field " + field + " must be a non-blank string in " + obj,
                "INVALID_GRAPH");
        return value.asText();
    }

    private static Map<String, List<CfgEdge>> freeze(
            final Map<String, List<CfgEdge>> source) {
        final Map<String, List<CfgEdge>> copy = new HashMap<>();
        for (final Map.Entry<String, List<CfgEdge>> entry : source.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "ControlFlowGraph{" + name + ", nodes=" + nodes.size()
                + ", edges=" + edges.size() + "}";
    }

    /**
     * Mutable construction side of a graph.
     *
     * <p>Used once, then discarded: {@link #build()} takes a snapshot.
     * Edges are accepted even when an endpoint is unknown. An edge equal
     * to one already added (same endpoints and constraints) is ignored.</p>
     */
    public static final class Builder {

        private final String name;

        private final Map<String, CfgNode> nodes = new LinkedHashMap<>();

        private final List<CfgEdge> edges = new ArrayList<>();

        private final Set<CfgEdge> edgeSet = new LinkedHashSet<>();

        private int sequence;

        private Builder(final String theName) {
            this.name = Preconditions.requireNonBlank(theName,
                    "Graph name is required");
        }

        /**
         * Creates a node with a fresh id and adds it.
         *
         * @param kind the node kind
         * @param role the display role, or null
         * @param sourceRef the producing AST node id, or null
         * @return the new node
         */
        public CfgNode newNode(final NodeKind kind, final String role,
                final Long sourceRef) {
            String id;
            do {
                sequence++;
                id = "n" + sequence;
            } while (nodes.containsKey(id));
            final CfgNode node = new CfgNode(id, kind, role, sourceRef);
            nodes.put(id, node);
            return node;
        }

        /**
         * Adds a node, replacing any node with the same id.
         *
         * @param node the node
         * @return this builder
         */
        public Builder addNode(final CfgNode node) {
            Preconditions.requireNonNull(node, "Node is required");
            nodes.put(node.id(), node);
            return this;
        }

        /**
         * Adds an edge between two ids.
         *
         * @param src the source id
         * @param dst the destination id
         * @param constraints the constraint set, null for none
         * @return true if the edge was added, false if it already existed
         */
        public boolean connect(final String src, final String dst,
                final EdgeConstraints constraints) {
            final CfgEdge edge = new CfgEdge(src, dst, constraints);
            if (!edgeSet.add(edge)) {
                return false;
            }
            edges.add(edge);
            return true;
        }

        /**
         * Adds an edge between two nodes.
         *
         * @param src the source node
         * @param dst the destination node
         * @param constraints the constraint set, null for none
         * @return true if the edge was added, false if it already existed
         */
        public boolean connect(final CfgNode src, final CfgNode dst,
                final EdgeConstraints constraints) {
            return connect(src.id(), dst.id(), constraints);
        }

        /**
         * Adds an unconditional edge between two nodes.
         *
         * @param src the source node
         * @param dst the destination node
         * @return true if the edge was added, false if it already existed
         */
        public boolean connect(final CfgNode src, final CfgNode dst) {
            return connect(src.id(), dst.id(), EdgeConstraints.NONE);
        }

        /** Returns the number of nodes added so far. */
        public int nodeCount() {
            return nodes.size();
        }

        /**
         * Takes an immutable snapshot of the graph.
         *
         * @return the graph
         */
        public ControlFlowGraph build() {
            return new ControlFlowGraph(name, nodes, edges);
        }
    }

}
