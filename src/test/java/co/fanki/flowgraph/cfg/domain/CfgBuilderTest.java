package co.fanki.flowgraph.cfg.domain;

import co.fanki.flowgraph.ast.domain.AstNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CfgBuilder}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CfgBuilderTest {

    private static final String IF_ELSE = """
            {"type": "program_entry_point", "id": 1, "body": [
              {"type": "if_statement", "id": 2,
               "branches": [{
                 "condition": {"type": "condition", "id": 3},
                 "body": {"type": "compound_statement", "id": 4,
                          "statements": [
                            {"type": "assignment_statement", "id": 5}]}}],
               "elseBranch": {"type": "compound_statement", "id": 6,
                              "statements": [
                                {"type": "assignment_statement", "id": 7}]}}
            ]}
            """;

    private static final String WHILE_WITH_BREAK = """
            {"type": "program_entry_point", "id": 1, "body": [
              {"type": "while_loop", "id": 2,
               "condition": {"type": "condition", "id": 3},
               "body": {"type": "compound_statement", "id": 4, "statements": [
                 {"type": "if_statement", "id": 5, "branches": [{
                   "condition": {"type": "condition", "id": 6},
                   "body": {"type": "break_statement", "id": 7}}]},
                 {"type": "assignment_statement", "id": 8}]}}
            ]}
            """;

    private static final String FOR_WITH_CONTINUE = """
            {"type": "program_entry_point", "id": 1, "body": [
              {"type": "general_for_loop", "id": 2,
               "initializer": {"type": "variable_declaration", "id": 3},
               "condition": {"type": "condition", "id": 4},
               "update": {"type": "expression_statement", "id": 5},
               "body": {"type": "compound_statement", "id": 6, "statements": [
                 {"type": "continue_statement", "id": 7}]}}
            ]}
            """;

    private static final String TRY_CATCH = """
            {"type": "program_entry_point", "id": 1, "body": [
              {"type": "try_statement", "id": 2,
               "body": {"type": "compound_statement", "id": 3, "statements": [
                 {"type": "expression_statement", "id": 4,
                  "value": {"type": "function_call", "id": 5}}]},
               "catches": [{"type": "catch_clause", "id": 6,
                 "body": {"type": "compound_statement", "id": 7,
                          "statements": [
                            {"type": "assignment_statement", "id": 8}]}}]}
            ]}
            """;

    private static final String RETURN_THROUGH_FINALLY = """
            {"type": "function_definition", "id": 1,
             "body": {"type": "compound_statement", "id": 2, "statements": [
               {"type": "try_statement", "id": 3,
                "body": {"type": "compound_statement", "id": 4,
                         "statements": [
                           {"type": "return_statement", "id": 5}]},
                "finallyBlock": {"type": "compound_statement", "id": 6,
                                 "statements": [
                                   {"type": "assignment_statement",
                                    "id": 7}]}},
               {"type": "assignment_statement", "id": 8}]}}
            """;

    private final CfgBuilder builder = new CfgBuilder();

    private final GraphValidator validator = new GraphValidator();

    @Test
    void whenBuilding_givenNullRoot_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(null));
    }

    @Test
    void whenBuilding_givenAnyAst_shouldHaveSingleEntryWithoutIncomingEdges() {
        for (final String ast : List.of(IF_ELSE, WHILE_WITH_BREAK,
                FOR_WITH_CONTINUE, TRY_CATCH, RETURN_THROUGH_FINALLY,
                "{\"type\": \"program_entry_point\", \"body\": []}",
                "{\"type\": \"mystery\"}")) {
            final ControlFlowGraph graph = build(ast);

            assertEquals(1, graph.beginNodes().size(), ast);
            assertTrue(graph.incoming(graph.begin().id()).isEmpty(), ast);
            assertFalse(graph.endNodes().isEmpty(), ast);
        }
    }

    @Test
    void whenBuilding_givenIfElse_shouldBranchAndMerge() {
        final ControlFlowGraph graph = build(IF_ELSE);

        final List<CfgNode> conditions = graph.nodesOfKind(
                NodeKind.CONDITION);
        assertEquals(1, conditions.size());
        final CfgNode condition = conditions.get(0);
        assertEquals("if-condition", condition.role());
        assertEquals(3L, condition.sourceRef());

        final List<CfgEdge> out = graph.outgoing(condition.id());
        assertEquals(2, out.size());
        final CfgEdge whenTrue = edgeWith(out, Boolean.TRUE);
        final CfgEdge whenFalse = edgeWith(out, Boolean.FALSE);
        assertNotEquals(whenTrue.dst(), whenFalse.dst());
        assertEquals(5L, graph.node(whenTrue.dst()).sourceRef());
        assertEquals(7L, graph.node(whenFalse.dst()).sourceRef());

        final CfgNode merge = byRole(graph, "merge");
        assertEquals(2, graph.incoming(merge.id()).size());
        assertEquals(List.of("n2"), graph.successors(merge.id()));

        final DiagnosticReport report = validator.diagnose(graph);
        assertTrue(report.isValid());
        assertTrue(report.orphanEdges().isEmpty());
        assertTrue(report.disconnectedNodes().isEmpty());
    }

    @Test
    void whenBuilding_givenLeaf_shouldEmitAtomPairWithSourceRef() {
        final ControlFlowGraph graph = build(IF_ELSE);

        final CfgNode enter = byRole(graph, "assignment_statement");
        assertEquals(NodeKind.ATOM, enter.kind());
        assertEquals(List.of(enter.id()), graph.predecessors(
                graph.successors(enter.id()).get(0)));
        final CfgNode leave = graph.node(graph.successors(enter.id()).get(0));
        assertEquals("assignment_statement-end", leave.role());
        assertEquals(enter.sourceRef(), leave.sourceRef());
    }

    @Test
    void whenBuilding_givenIfWithoutElse_shouldWireFalseEdgeToMerge() {
        final ControlFlowGraph graph = build("""
                {"type": "if_statement", "id": 1, "branches": [
                  {"condition": {"type": "condition", "id": 2},
                   "body": {"type": "assignment_statement", "id": 3}}]}
                """);

        final CfgNode condition = graph.nodesOfKind(NodeKind.CONDITION)
                .get(0);
        final CfgNode merge = byRole(graph, "merge");

        assertTrue(graph.edges().contains(new CfgEdge(condition.id(),
                merge.id(), EdgeConstraints.WHEN_FALSE)));
    }

    @Test
    void whenBuilding_givenElseIfChain_shouldChainConditionsOnFalse() {
        final ControlFlowGraph graph = build("""
                {"type": "if_statement", "id": 1, "branches": [
                  {"condition": {"type": "condition", "id": 2},
                   "body": {"type": "assignment_statement", "id": 3}},
                  {"condition": {"type": "condition", "id": 4},
                   "body": {"type": "assignment_statement", "id": 5}}]}
                """);

        final CfgNode first = byRole(graph, "if-condition");
        final CfgNode second = byRole(graph, "else-if-condition");

        assertTrue(graph.edges().contains(new CfgEdge(first.id(),
                second.id(), EdgeConstraints.WHEN_FALSE)));
        assertEquals(3, graph.incoming(byRole(graph, "merge").id()).size());
    }

    @Test
    void whenBuilding_givenWhileLoop_shouldCreateBackEdgeToHeader() {
        final ControlFlowGraph graph = build(WHILE_WITH_BREAK);

        final CfgNode header = byRole(graph, "loop-header");
        final CfgNode exit = byRole(graph, "loop-exit");
        final CfgNode breakNode = byRole(graph, "break");

        assertEquals(NodeKind.CONDITION, header.kind());
        assertTrue(graph.edges().contains(new CfgEdge(header.id(), exit.id(),
                EdgeConstraints.WHEN_FALSE)));
        assertEquals(List.of(exit.id()), graph.successors(breakNode.id()));

        final CfgNode lastStatement = byRole(graph,
                "assignment_statement-end");
        assertEquals(List.of(header.id()),
                graph.successors(lastStatement.id()));

        assertTrue(validator.diagnose(graph).isValid());
    }

    @Test
    void whenBuilding_givenForLoop_shouldSendContinueToUpdate() {
        final ControlFlowGraph graph = build(FOR_WITH_CONTINUE);

        final CfgNode continueNode = byRole(graph, "continue");
        final CfgNode update = byRole(graph, "expression_statement");
        final CfgNode header = byRole(graph, "loop-header");

        assertEquals(List.of(update.id()),
                graph.successors(continueNode.id()));
        assertTrue(graph.successors(
                byRole(graph, "expression_statement-end").id())
                .contains(header.id()));
        assertTrue(graph.successors(
                byRole(graph, "variable_declaration-end").id())
                .contains(header.id()));

        final FlowReport flow = new FlowAnalyzer().analyze(graph);
        assertEquals(Set.of(header.id()), flow.loopHeaders());
        assertTrue(flow.reducible());
    }

    @Test
    void whenBuilding_givenDoWhile_shouldEnterBodyFirst() {
        final ControlFlowGraph graph = build("""
                {"type": "do_while_loop", "id": 1,
                 "body": {"type": "assignment_statement", "id": 2},
                 "condition": {"type": "condition", "id": 3}}
                """);

        final CfgNode body = byRole(graph, "assignment_statement");
        final CfgNode condition = byRole(graph, "loop-header");

        assertEquals(List.of(body.id()), graph.successors(graph.begin().id()));
        assertTrue(graph.edges().contains(new CfgEdge(condition.id(),
                body.id(), EdgeConstraints.WHEN_TRUE)));
    }

    @Test
    void whenBuilding_givenRangeFor_shouldInitializeBeforeHeader() {
        final ControlFlowGraph graph = build("""
                {"type": "range_for_loop", "id": 1,
                 "identifier": {"type": "identifier", "id": 2},
                 "iterable": {"type": "function_call", "id": 3},
                 "body": {"type": "assignment_statement", "id": 4}}
                """);

        final CfgNode init = byRole(graph, "loop-init");
        final CfgNode header = byRole(graph, "loop-header");

        assertEquals(List.of(init.id()), graph.successors(graph.begin().id()));
        assertTrue(graph.successors(init.id()).contains(header.id()));
        // The iterable is a call, so initializing the loop can raise.
        assertNotNull(byRole(graph, "exceptional-exit"));
    }

    @Test
    void whenBuilding_givenTryCatch_shouldRouteExceptionsToHandler() {
        final ControlFlowGraph graph = build(TRY_CATCH);

        final CfgNode call = byRole(graph, "expression_statement");
        final CfgNode dispatch = byRole(graph, "catch-dispatch");
        final CfgNode exceptionalExit = byRole(graph, "exceptional-exit");

        assertTrue(graph.edges().contains(new CfgEdge(call.id(),
                dispatch.id(), EdgeConstraints.ON_EXCEPTION)));
        assertTrue(graph.edges().contains(new CfgEdge(dispatch.id(),
                exceptionalExit.id(), EdgeConstraints.ON_EXCEPTION)));
        assertEquals(NodeKind.END, exceptionalExit.kind());
        assertEquals(2, graph.endNodes().size());
        assertEquals(2, graph.incoming(byRole(graph, "try-exit").id())
                .size());
        assertTrue(validator.diagnose(graph).isValid());
    }

    @Test
    void whenBuilding_givenCatchAll_shouldNotPropagateFromDispatch() {
        final ControlFlowGraph graph = build(TRY_CATCH.replace(
                "\"type\": \"catch_clause\",",
                "\"type\": \"catch_clause\", \"catchAll\": true,"));

        assertNull(findByRole(graph, "exceptional-exit"));
        assertEquals(1, graph.endNodes().size());
    }

    @Test
    void whenBuilding_givenReturnInsideFinally_shouldRunFinallyBeforeExit() {
        final ControlFlowGraph graph = build(RETURN_THROUGH_FINALLY);

        final CfgNode returnNode = byRole(graph, "return");
        final CfgNode finallyEntry = byRole(graph, "finally");
        final CfgNode finallyEnd = byRole(graph, "assignment_statement-end");

        assertTrue(graph.edges().contains(new CfgEdge(returnNode.id(),
                finallyEntry.id(), EdgeConstraints.ALWAYS)));
        assertTrue(graph.successors(finallyEnd.id()).contains("n2"));

        // The statement after the try is dead code: built but never wired.
        final DiagnosticReport report = validator.diagnose(graph);
        assertEquals(2, report.disconnectedNodes().size());
        assertTrue(report.orphanEdges().isEmpty());
    }

    @Test
    void whenBuilding_givenThrowOutsideHandler_shouldReachExceptionalExit() {
        final ControlFlowGraph graph = build("""
                {"type": "program_entry_point", "id": 1, "body": [
                  {"type": "throw_statement", "id": 2}]}
                """);

        final CfgNode throwNode = byRole(graph, "throw");
        final CfgNode exceptionalExit = byRole(graph, "exceptional-exit");

        assertEquals(List.of(new CfgEdge(throwNode.id(), exceptionalExit.id(),
                EdgeConstraints.ON_EXCEPTION)), graph.outgoing(throwNode.id()));
    }

    @Test
    void whenBuilding_givenBreakOutsideLoop_shouldLeaveItWithoutSuccessor() {
        final ControlFlowGraph graph = build("""
                {"type": "program_entry_point", "id": 1, "body": [
                  {"type": "break_statement", "id": 2}]}
                """);

        assertTrue(graph.outgoing(byRole(graph, "break").id()).isEmpty());
        assertEquals(1, graph.beginNodes().size());
    }

    @Test
    void whenBuilding_givenEmptyProgram_shouldEmitPassThroughPair() {
        final ControlFlowGraph graph = build(
                "{\"type\": \"program_entry_point\", \"id\": 9, \"body\": []}");

        final List<CfgNode> compounds = graph.nodesOfKind(NodeKind.COMPOUND);
        assertEquals(2, compounds.size());
        assertEquals(4, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        assertTrue(validator.diagnose(graph).isValid());
    }

    @Test
    void whenBuilding_givenUnknownConstruct_shouldFallBackToSingleAtom() {
        final ControlFlowGraph graph = build("""
                {"type": "program_entry_point", "id": 1, "body": [
                  {"type": "goto_statement", "id": 2},
                  {"id": 3}]}
                """);

        final CfgNode unknown = byRole(graph, "goto_statement");
        final CfgNode untyped = byRole(graph, "unknown");

        assertEquals(NodeKind.ATOM, unknown.kind());
        assertEquals(List.of(untyped.id()), graph.successors(unknown.id()));
        assertTrue(validator.diagnose(graph).isValid());
    }

    @Test
    void whenBuilding_givenSameAstTwice_shouldProduceIdenticalGraphs() {
        final ControlFlowGraph first = build(TRY_CATCH);
        final ControlFlowGraph second = build(TRY_CATCH);

        assertEquals(first.nodes().stream().toList(),
                second.nodes().stream().toList());
        assertEquals(first.edges(), second.edges());
    }

    @Test
    void whenBuilding_givenExtension_shouldUseItForItsTag() {
        final ConstructTranslator switchTranslator = (node, context) -> {
            final CfgNode selector = context.newNode(NodeKind.CONDITION,
                    "switch", node.id());
            final CfgNode merge = context.newNode(NodeKind.ATOM,
                    "switch-end", node.id());
            for (final AstNode arm : node.children("cases")) {
                final Fragment fragment = context.translate(arm);
                context.connect(selector, fragment.entry(),
                        EdgeConstraints.NONE);
                context.connect(fragment.exit(), merge, EdgeConstraints.NONE);
            }
            return Fragment.of(selector, merge);
        };
        final CfgBuilder extended = new CfgBuilder(
                Map.of("switch_statement", switchTranslator));

        final ControlFlowGraph graph = extended.build(AstNode.fromJson("""
                {"type": "switch_statement", "id": 1, "cases": [
                  {"type": "assignment_statement", "id": 2},
                  {"type": "assignment_statement", "id": 3}]}
                """));

        final CfgNode selector = byRole(graph, "switch");
        assertEquals(2, graph.successors(selector.id()).size());
        assertEquals(Set.of("switch_statement"),
                extended.extensionTags());
        assertTrue(validator.diagnose(graph).isValid());
    }

    @Test
    void whenBuilding_givenPaddedExtensionTag_shouldStillUseExtension() {
        final ConstructTranslator gotoTranslator = (node, context) ->
                Fragment.single(context.newNode(NodeKind.CONDITION, "goto",
                        node.id()));
        final CfgBuilder extended = new CfgBuilder(
                Map.of(" goto_statement ", gotoTranslator));

        final ControlFlowGraph graph = extended.build(AstNode.fromJson("""
                {"type": "program_entry_point", "body": [
                  {"type": " goto_statement", "id": 2},
                  {"type": "goto_statement ", "id": 3}]}
                """));

        assertEquals(Set.of("goto_statement"), extended.extensionTags());
        assertEquals(2, graph.nodesOfKind(NodeKind.CONDITION).size());
        assertNull(findByRole(graph, " goto_statement"));
    }

    @Test
    void whenCreatingBuilder_givenExtensionShadowingBuiltIn_shouldThrow() {
        final ConstructTranslator translator = (node, context) ->
                Fragment.single(context.newNode(NodeKind.ATOM, null, null));

        assertThrows(IllegalArgumentException.class,
                () -> new CfgBuilder(Map.of("if_statement", translator)));
        assertThrows(IllegalArgumentException.class,
                () -> new CfgBuilder(Map.of(" ", translator)));
    }

    private ControlFlowGraph build(final String json) {
        return builder.build(AstNode.fromJson(json));
    }

    private static CfgEdge edgeWith(final List<CfgEdge> edges,
            final Boolean value) {
        return edges.stream()
                .filter(e -> value.equals(e.constraints().conditionValue()))
                .findFirst()
                .orElseThrow();
    }

    private static CfgNode findByRole(final ControlFlowGraph graph,
            final String role) {
        return graph.nodes().stream()
                .filter(n -> role.equals(n.role()))
                .findFirst()
                .orElse(null);
    }

    private static CfgNode byRole(final ControlFlowGraph graph,
            final String role) {
        final CfgNode node = findByRole(graph, role);
        assertNotNull(node, "No node with role " + role);
        return node;
    }

}
