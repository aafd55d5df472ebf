package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.ast.domain.AstNode;

/**
 * The graph under construction, as seen by a {@link ConstructTranslator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface TranslationContext {

    /**
     * Creates a node with a fresh id.
     *
     * @param kind the node kind
     * @param role the display role, or null
     * @param sourceRef the producing AST node id, or null
     * @return the node
     */
    CfgNode newNode(NodeKind kind, String role, Long sourceRef);

    /**
     * Adds an edge.
     *
     * @param src the source node
     * @param dst the destination node
     * @param constraints the constraint set
     */
    void connect(CfgNode src, CfgNode dst, EdgeConstraints constraints);

    /**
     * Translates a child AST node with the built-in rules.
     *
     * @param node the child node
     * @return its fragment
     */
    Fragment translate(AstNode node);

    /**
     * Adds the exceptional edge leaving a point of possible failure.
     *
     * <p>The edge goes to the innermost handler, through any finally
     * region in between, or to the exceptional exit of the graph.</p>
     *
     * @param failurePoint the node whose evaluation can raise
     */
    void raise(CfgNode failurePoint);

    /**
     * Checks whether evaluating a node can raise an exception.
     *
     * @param node the AST node
     * @return true if the node or its subtree contains a call
     */
    boolean mayRaise(AstNode node);

}
