package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * A control point of a graph.
 *
 * <p>The {@code role} refines the kind for labels and diagnostics only
 * ({@code loop-header}, {@code merge}, ...); nothing in the analysis
 * reads it. The {@code sourceRef} is the id of the AST node that
 * produced this point. It is a plain identifier so the graph can outlive
 * the AST; callers resolve it through their own lookup table.</p>
 *
 * @param id the identifier, unique within its graph
 * @param kind the kind
 * @param role the display role, or null
 * @param sourceRef the producing AST node id, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CfgNode(String id, NodeKind kind, String role, Long sourceRef)
        implements ValueObject {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a node, validating its identity.
     */
    public CfgNode {
        Preconditions.requireNonBlank(id, "Node id is required");
        Preconditions.requireNonNull(kind, "Node kind is required");
        if (role != null && role.isBlank()) {
            role = null;
        }
    }

    /** Checks if this node carries a display role. */
    public boolean hasRole() {
        return role != null;
    }

    /** Checks if this node points back to an AST node. */
    public boolean hasSourceRef() {
        return sourceRef != null;
    }

}
