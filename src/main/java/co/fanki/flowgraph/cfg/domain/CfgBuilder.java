package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.ast.domain.AstNode;
import co.fanki.flowgraph.ast.domain.ConstructType;
import co.fanki.flowgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates an AST into a control-flow graph.
 *
 * <p>Every AST node becomes a {@link Fragment}: a pair of entry and exit
 * nodes that the parent construct wires into its own fragment. The whole
 * tree is framed by a single BEGIN (role {@code entry}) and a normal END
 * (role {@code exit}); an exceptional END (role
 * {@code exceptional-exit}) is added only when an exception can escape
 * every handler.</p>
 *
 * <p>Unknown node types never fail the build: each one becomes a single
 * ATOM, so the graph stays connected even when it is not structurally
 * complete.</p>
 *
 * <p>The builder holds no state between builds. The same AST always
 * yields the same graph, ids included, and several graphs can be built
 * concurrently from one instance.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CfgBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            CfgBuilder.class);

    /** AST node types whose evaluation can raise. */
    private static final Set<String> RAISING_TYPES = Set.of(
            "function_call", "method_call", "object_creation",
            "throw_statement");

    private final Map<String, ConstructTranslator> extensions;

    /**
     * Creates a builder with the built-in translation rules only.
     */
    public CfgBuilder() {
        this(Map.of());
    }

    /**
     * Creates a builder with additional translation rules.
     *
     * @param theExtensions rules keyed by AST type tag; tags must not be
     *        blank nor shadow a built-in construct
     * @throws IllegalArgumentException if a tag is invalid
     */
    public CfgBuilder(final Map<String, ConstructTranslator> theExtensions) {
        Preconditions.requireNonNull(theExtensions, "Extensions are required");
        final Map<String, ConstructTranslator> checked = new LinkedHashMap<>();
        for (final Map.Entry<String, ConstructTranslator> entry
                : theExtensions.entrySet()) {
            final String tag = Preconditions.requireNonBlank(entry.getKey(),
                    "Extension tag is required");
            Preconditions.require(!ConstructType.isBuiltIn(tag),
                    "Extension tag shadows a built-in construct: " + tag);
            Preconditions.requireNonNull(entry.getValue(),
                    "Translator is required for tag " + tag);
            checked.put(tag.trim(), entry.getValue());
        }
        this.extensions = Collections.unmodifiableMap(checked);
        if (!extensions.isEmpty()) {
            LOG.info("Registered construct translators for {}",
                    extensions.keySet());
        }
    }

    /**
     * Returns the tags handled by registered extensions.
     *
     * @return unmodifiable set of tags
     */
    public Set<String> extensionTags() {
        return extensions.keySet();
    }

    /**
     * Builds the graph for an AST, naming it after the root type.
     *
     * @param root the AST root, never null
     * @return the graph
     */
    public ControlFlowGraph build(final AstNode root) {
        Preconditions.requireNonNull(root, "AST root is required");
        final String name = root.type().isEmpty() ? "cfg" : root.type();
        return build(root, name);
    }

    /**
     * Builds the graph for an AST.
     *
     * @param root the AST root, never null
     * @param name the graph name
     * @return the graph
     */
    public ControlFlowGraph build(final AstNode root, final String name) {
        Preconditions.requireNonNull(root, "AST root is required");
        Preconditions.requireNonBlank(name, "Graph name is required");

        final Translation translation = new Translation(name, root);
        final ControlFlowGraph graph = translation.run(root);

        LOG.debug("Built graph {} from {}: {} nodes, {} edges", name,
                root.describe(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /** Abrupt transfers of control. */
    private enum Jump {
        BREAK, CONTINUE, RETURN, EXCEPTION
    }

    /** Enclosing construct that can intercept a jump. */
    private interface Scope {
    }

    /** Loop receiving break and continue. */
    private static final class LoopScope implements Scope {

        private final CfgNode continueTarget;

        private CfgNode breakTarget;

        private final Long sourceRef;

        private LoopScope(final CfgNode theContinueTarget,
                final CfgNode theBreakTarget, final Long theSourceRef) {
            this.continueTarget = theContinueTarget;
            this.breakTarget = theBreakTarget;
            this.sourceRef = theSourceRef;
        }
    }

    /** Try body whose exceptions go to a handler dispatch node. */
    private record HandlerScope(CfgNode dispatch) implements Scope {
    }

    /** Region every jump must go through before leaving. */
    private static final class FinallyScope implements Scope {

        private final CfgNode entry;

        /** Jumps to resume from the finally exit, in arrival order. */
        private final Set<Jump> pending = new LinkedHashSet<>();

        private FinallyScope(final CfgNode theEntry) {
            this.entry = theEntry;
        }
    }

    /**
     * State of one build: the graph under construction and the stack of
     * enclosing loops, handlers and finally regions.
     */
    private final class Translation implements TranslationContext {

        private final ControlFlowGraph.Builder graph;

        private final Deque<Scope> scopes = new ArrayDeque<>();

        private final CfgNode begin;

        private final CfgNode normalEnd;

        private CfgNode exceptionalEnd;

        private Translation(final String name, final AstNode root) {
            this.graph = ControlFlowGraph.builder(name);
            this.begin = graph.newNode(NodeKind.BEGIN, "entry", root.id());
            this.normalEnd = graph.newNode(NodeKind.END, "exit", root.id());
        }

        private ControlFlowGraph run(final AstNode root) {
            final Fragment body = translate(root);
            graph.connect(begin, body.entry());
            if (body.completesNormally()) {
                graph.connect(body.exit(), normalEnd);
            }
            return graph.build();
        }

        @Override
        public CfgNode newNode(final NodeKind kind, final String role,
                final Long sourceRef) {
            return graph.newNode(kind, role, sourceRef);
        }

        @Override
        public void connect(final CfgNode src, final CfgNode dst,
                final EdgeConstraints constraints) {
            graph.connect(src, dst, constraints);
        }

        @Override
        public boolean mayRaise(final AstNode node) {
            return node != null && node.containsAny(RAISING_TYPES);
        }

        @Override
        public void raise(final CfgNode failurePoint) {
            jump(failurePoint, Jump.EXCEPTION);
        }

        @Override
        public Fragment translate(final AstNode node) {
            final ConstructTranslator extension = extensions.get(
                    node.type().trim());
            if (extension != null) {
                return Preconditions.requireNonNull(
                        extension.translate(node, this),
                        "Translator for " + node.type()
                                + " returned no fragment");
            }
            return switch (node.constructType()) {
                case PROGRAM_ENTRY_POINT -> sequence(node,
                        node.children("body"));
                case FUNCTION_DEFINITION -> sequence(node,
                        node.children("body"));
                case COMPOUND_STATEMENT -> sequence(node,
                        node.children("statements"));
                case ASSIGNMENT_STATEMENT, EXPRESSION_STATEMENT,
                        VARIABLE_DECLARATION, FUNCTION_CALL,
                        CONDITION -> leaf(node);
                case IF_STATEMENT -> conditional(node);
                case WHILE_LOOP -> whileLoop(node);
                case DO_WHILE_LOOP -> doWhileLoop(node);
                case RANGE_FOR_LOOP -> rangeForLoop(node);
                case GENERAL_FOR_LOOP -> generalForLoop(node);
                case BREAK_STATEMENT -> abrupt(node, "break", Jump.BREAK);
                case CONTINUE_STATEMENT -> abrupt(node, "continue",
                        Jump.CONTINUE);
                case RETURN_STATEMENT -> abrupt(node, "return", Jump.RETURN);
                case THROW_STATEMENT -> abrupt(node, "throw",
                        Jump.EXCEPTION);
                case TRY_STATEMENT -> tryStatement(node);
                case UNKNOWN -> fallback(node);
            };
        }

        // -- Sequences and leaves ------------------------------------------

        private Fragment sequence(final AstNode owner,
                final List<AstNode> statements) {
            if (statements.isEmpty()) {
                return passThrough(owner);
            }

            CfgNode entry = null;
            CfgNode exit = null;
            boolean completes = true;

            for (final AstNode statement : statements) {
                final Fragment fragment = translate(statement);
                if (entry == null) {
                    entry = fragment.entry();
                } else if (exit != null) {
                    graph.connect(exit, fragment.entry());
                }
                exit = fragment.exit();
                if (!fragment.completesNormally()) {
                    completes = false;
                }
            }
            return completes ? Fragment.of(entry, exit)
                    : Fragment.abrupt(entry);
        }

        private Fragment passThrough(final AstNode owner) {
            final CfgNode enter = graph.newNode(NodeKind.COMPOUND, "enter",
                    owner.id());
            final CfgNode leave = graph.newNode(NodeKind.COMPOUND, "leave",
                    owner.id());
            graph.connect(enter, leave);
            return Fragment.of(enter, leave);
        }

        private Fragment leaf(final AstNode node) {
            final CfgNode enter = graph.newNode(NodeKind.ATOM, node.type(),
                    node.id());
            final CfgNode leave = graph.newNode(NodeKind.ATOM,
                    node.type() + "-end", node.id());
            graph.connect(enter, leave);
            if (mayRaise(node)) {
                raise(enter);
            }
            return Fragment.of(enter, leave);
        }

        private Fragment fallback(final AstNode node) {
            LOG.debug("No translation rule for {}, using an atom",
                    node.describe());
            final String role = node.type().isEmpty() ? "unknown"
                    : node.type();
            return Fragment.single(graph.newNode(NodeKind.ATOM, role,
                    node.id()));
        }

        private Fragment optionalBody(final AstNode owner,
                final AstNode body) {
            return body == null ? passThrough(owner) : translate(body);
        }

        // -- Conditionals --------------------------------------------------

        private Fragment conditional(final AstNode node) {
            final List<AstNode> branches = node.children("branches");
            final AstNode elseBranch = node.child("elseBranch");

            if (branches.isEmpty()) {
                LOG.debug("{} has no branches", node.describe());
                return optionalBody(node, elseBranch);
            }

            final List<CfgNode> toMerge = new ArrayList<>();
            final List<EdgeConstraints> mergeConstraints = new ArrayList<>();
            CfgNode entry = null;
            CfgNode previous = null;

            for (int i = 0; i < branches.size(); i++) {
                final AstNode branch = branches.get(i);
                final CfgNode condition = conditionNode(branch.child(
                        "condition"), node,
                        i == 0 ? "if-condition" : "else-if-condition");

                if (previous == null) {
                    entry = condition;
                } else {
                    graph.connect(previous, condition,
                            EdgeConstraints.WHEN_FALSE);
                }

                final AstNode body = branch.child("body");
                if (body == null) {
                    toMerge.add(condition);
                    mergeConstraints.add(EdgeConstraints.WHEN_TRUE);
                } else {
                    final Fragment fragment = translate(body);
                    graph.connect(condition, fragment.entry(),
                            EdgeConstraints.WHEN_TRUE);
                    if (fragment.completesNormally()) {
                        toMerge.add(fragment.exit());
                        mergeConstraints.add(EdgeConstraints.NONE);
                    }
                }
                previous = condition;
            }

            if (elseBranch != null) {
                final Fragment fragment = translate(elseBranch);
                graph.connect(previous, fragment.entry(),
                        EdgeConstraints.WHEN_FALSE);
                if (fragment.completesNormally()) {
                    toMerge.add(fragment.exit());
                    mergeConstraints.add(EdgeConstraints.NONE);
                }
            } else {
                toMerge.add(previous);
                mergeConstraints.add(EdgeConstraints.WHEN_FALSE);
            }

            if (toMerge.isEmpty()) {
                return Fragment.abrupt(entry);
            }

            final CfgNode merge = graph.newNode(NodeKind.ATOM, "merge",
                    node.id());
            for (int i = 0; i < toMerge.size(); i++) {
                graph.connect(toMerge.get(i), merge, mergeConstraints.get(i));
            }
            return Fragment.of(entry, merge);
        }

        private CfgNode conditionNode(final AstNode condition,
                final AstNode owner, final String role) {
            final Long sourceRef = condition != null && condition.id() != null
                    ? condition.id() : owner.id();
            final CfgNode node = graph.newNode(NodeKind.CONDITION, role,
                    sourceRef);
            if (mayRaise(condition)) {
                raise(node);
            }
            return node;
        }

        // -- Loops ---------------------------------------------------------

        private Fragment whileLoop(final AstNode node) {
            final CfgNode header = conditionNode(node.child("condition"),
                    node, "loop-header");
            final CfgNode exit = graph.newNode(NodeKind.ATOM, "loop-exit",
                    node.id());

            scopes.push(new LoopScope(header, exit, node.id()));
            final AstNode body = node.child("body");
            if (body == null) {
                graph.connect(header, header, EdgeConstraints.WHEN_TRUE);
            } else {
                final Fragment fragment = translate(body);
                graph.connect(header, fragment.entry(),
                        EdgeConstraints.WHEN_TRUE);
                if (fragment.completesNormally()) {
                    graph.connect(fragment.exit(), header);
                }
            }
            scopes.pop();

            graph.connect(header, exit, EdgeConstraints.WHEN_FALSE);
            return Fragment.of(header, exit);
        }

        private Fragment doWhileLoop(final AstNode node) {
            final CfgNode condition = conditionNode(node.child("condition"),
                    node, "loop-header");
            final CfgNode exit = graph.newNode(NodeKind.ATOM, "loop-exit",
                    node.id());

            scopes.push(new LoopScope(condition, exit, node.id()));
            final Fragment body = optionalBody(node, node.child("body"));
            scopes.pop();

            if (body.completesNormally()) {
                graph.connect(body.exit(), condition);
            }
            graph.connect(condition, body.entry(), EdgeConstraints.WHEN_TRUE);
            graph.connect(condition, exit, EdgeConstraints.WHEN_FALSE);
            return Fragment.of(body.entry(), exit);
        }

        private Fragment rangeForLoop(final AstNode node) {
            final CfgNode init = graph.newNode(NodeKind.ATOM, "loop-init",
                    node.id());
            if (mayRaise(node.child("iterable"))) {
                raise(init);
            }
            final CfgNode header = graph.newNode(NodeKind.CONDITION,
                    "loop-header", node.id());
            final CfgNode exit = graph.newNode(NodeKind.ATOM, "loop-exit",
                    node.id());
            graph.connect(init, header);

            scopes.push(new LoopScope(header, exit, node.id()));
            final Fragment body = optionalBody(node, node.child("body"));
            scopes.pop();

            graph.connect(header, body.entry(), EdgeConstraints.WHEN_TRUE);
            if (body.completesNormally()) {
                graph.connect(body.exit(), header);
            }
            graph.connect(header, exit, EdgeConstraints.WHEN_FALSE);
            return Fragment.of(init, exit);
        }

        private Fragment generalForLoop(final AstNode node) {
            final AstNode initializer = node.child("initializer");
            final AstNode conditionAst = node.child("condition");
            final AstNode updateAst = node.child("update");

            final Fragment init = initializer == null ? null
                    : translate(initializer);
            final CfgNode header = conditionNode(conditionAst, node,
                    "loop-header");
            final Fragment update = updateAst == null ? null
                    : translate(updateAst);

            if (init != null && init.completesNormally()) {
                graph.connect(init.exit(), header);
            }
            if (update != null && update.completesNormally()) {
                graph.connect(update.exit(), header);
            }

            // Without a condition the loop is left only through a break.
            final CfgNode exit = conditionAst == null ? null
                    : graph.newNode(NodeKind.ATOM, "loop-exit", node.id());
            final LoopScope loop = new LoopScope(
                    update == null ? header : update.entry(), exit,
                    node.id());

            scopes.push(loop);
            final Fragment body = optionalBody(node, node.child("body"));
            scopes.pop();

            graph.connect(header, body.entry(), EdgeConstraints.WHEN_TRUE);
            if (body.completesNormally()) {
                graph.connect(body.exit(), loop.continueTarget);
            }
            if (conditionAst != null) {
                graph.connect(header, exit, EdgeConstraints.WHEN_FALSE);
            }

            final CfgNode entry = init == null ? header : init.entry();
            return loop.breakTarget == null ? Fragment.abrupt(entry)
                    : Fragment.of(entry, loop.breakTarget);
        }

        // -- Jumps and handlers --------------------------------------------

        private Fragment abrupt(final AstNode node, final String role,
                final Jump jump) {
            final CfgNode point = graph.newNode(NodeKind.ATOM, role,
                    node.id());
            if (jump != Jump.EXCEPTION && mayRaise(node)) {
                raise(point);
            }
            jump(point, jump);
            return Fragment.abrupt(point);
        }

        private void jump(final CfgNode from, final Jump jump) {
            for (final Scope scope : scopes) {
                if (scope instanceof FinallyScope finallyScope) {
                    graph.connect(from, finallyScope.entry,
                            EdgeConstraints.ALWAYS);
                    finallyScope.pending.add(jump);
                    return;
                }
                if (jump == Jump.EXCEPTION
                        && scope instanceof HandlerScope handler) {
                    graph.connect(from, handler.dispatch(),
                            EdgeConstraints.ON_EXCEPTION);
                    return;
                }
                if ((jump == Jump.BREAK || jump == Jump.CONTINUE)
                        && scope instanceof LoopScope loop) {
                    graph.connect(from, jump == Jump.BREAK
                            ? breakTarget(loop) : loop.continueTarget);
                    return;
                }
            }

            switch (jump) {
                case RETURN -> graph.connect(from, normalEnd);
                case EXCEPTION -> graph.connect(from, exceptionalEnd(),
                        EdgeConstraints.ON_EXCEPTION);
                default -> LOG.warn("{} outside of any loop at node {},"
                        + " leaving it without successor",
                        jump.name().toLowerCase(), from.id());
            }
        }

        private CfgNode breakTarget(final LoopScope loop) {
            if (loop.breakTarget == null) {
                loop.breakTarget = graph.newNode(NodeKind.ATOM, "loop-exit",
                        loop.sourceRef);
            }
            return loop.breakTarget;
        }

        private CfgNode exceptionalEnd() {
            if (exceptionalEnd == null) {
                exceptionalEnd = graph.newNode(NodeKind.END,
                        "exceptional-exit", begin.sourceRef());
            }
            return exceptionalEnd;
        }

        private Fragment tryStatement(final AstNode node) {
            final List<AstNode> catches = node.children("catches");
            final AstNode finallyAst = node.child("finallyBlock");

            final CfgNode tryEnter = graph.newNode(NodeKind.ATOM, "try",
                    node.id());

            FinallyScope finallyScope = null;
            if (finallyAst != null) {
                finallyScope = new FinallyScope(graph.newNode(
                        NodeKind.COMPOUND, "finally", finallyAst.id()));
                scopes.push(finallyScope);
            }

            HandlerScope handler = null;
            if (!catches.isEmpty()) {
                handler = new HandlerScope(graph.newNode(NodeKind.ATOM,
                        "catch-dispatch", node.id()));
                scopes.push(handler);
            }

            final Fragment body = optionalBody(node, node.child("body"));
            graph.connect(tryEnter, body.entry());
            if (handler != null) {
                scopes.pop();
            }

            final List<CfgNode> normalExits = new ArrayList<>();
            if (body.completesNormally()) {
                normalExits.add(body.exit());
            }

            if (handler != null) {
                boolean catchAll = false;
                for (final AstNode clause : catches) {
                    final Fragment fragment = optionalBody(clause,
                            clause.child("body"));
                    graph.connect(handler.dispatch(), fragment.entry());
                    if (fragment.completesNormally()) {
                        normalExits.add(fragment.exit());
                    }
                    catchAll = catchAll || clause.flag("catchAll");
                }
                if (!catchAll) {
                    // No clause is known to match every exception.
                    raise(handler.dispatch());
                }
            }

            if (finallyScope == null) {
                if (normalExits.isEmpty()) {
                    return Fragment.abrupt(tryEnter);
                }
                final CfgNode after = graph.newNode(NodeKind.ATOM,
                        "try-exit", node.id());
                for (final CfgNode exit : normalExits) {
                    graph.connect(exit, after);
                }
                return Fragment.of(tryEnter, after);
            }

            scopes.pop();
            for (final CfgNode exit : normalExits) {
                graph.connect(exit, finallyScope.entry,
                        EdgeConstraints.ALWAYS);
            }

            final Fragment region = translate(finallyAst);
            graph.connect(finallyScope.entry, region.entry());
            if (!region.completesNormally()) {
                return Fragment.abrupt(tryEnter);
            }

            for (final Jump pending : finallyScope.pending) {
                jump(region.exit(), pending);
            }
            if (normalExits.isEmpty()) {
                return Fragment.abrupt(tryEnter);
            }
            final CfgNode after = graph.newNode(NodeKind.ATOM, "try-exit",
                    node.id());
            graph.connect(region.exit(), after);
            return Fragment.of(tryEnter, after);
        }
    }

}
