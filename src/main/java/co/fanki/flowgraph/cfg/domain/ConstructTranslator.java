package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.ast.domain.AstNode;

/**
 * Translation rule for an AST node type the builder does not know.
 *
 * <p>Implementations must be pure: the same node and the same context
 * calls always produce the same nodes and edges. They create nodes and
 * edges only through the context and return the fragment they built.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface ConstructTranslator {

    /**
     * Translates one AST node.
     *
     * @param node the AST node, its type is the tag this rule is
     *        registered for
     * @param context the graph under construction
     * @return the fragment for the node, never null
     */
    Fragment translate(AstNode node, TranslationContext context);

}
