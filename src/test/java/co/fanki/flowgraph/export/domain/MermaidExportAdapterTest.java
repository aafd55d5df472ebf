package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.cfg.domain.ControlFlowGraph;
import co.fanki.flowgraph.cfg.domain.GraphValidator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link MermaidExportAdapter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MermaidExportAdapterTest {

    private final MermaidExportAdapter adapter = new MermaidExportAdapter();

    @Test
    void whenRendering_shouldDrawShapesByKind() {
        final String text = adapter.render(
                ExportFixtures.branchWithOrphanExport());

        assertTrue(text.startsWith("flowchart TD\n"));
        assertTrue(text.contains(
                "  v0([\"BEGIN<br/>AST:1<br/>role:entry\"])\n"));
        assertTrue(text.contains(
                "  v1{\"CONDITION<br/>AST:2<br/>role:if-condition\"}\n"));
        assertTrue(text.contains("  v2[\"ATOM\"]\n"));
        assertTrue(text.contains("  v3([\"END<br/>role:exit\"])\n"));
        assertTrue(text.contains("  v4[\"ghost\"]\n"));
    }

    @Test
    void whenRendering_shouldLabelAndDotEdges() {
        final String text = adapter.render(
                ExportFixtures.branchWithOrphanExport());

        assertTrue(text.contains("  v0 --> v1\n"));
        assertTrue(text.contains("  v1 -->|T| v2\n"));
        assertTrue(text.contains("  v1 -->|F| v3\n"));
        assertTrue(text.contains("  v2 -.->|exc| v4\n"));
    }

    @Test
    void whenRendering_shouldAssignColorClasses() {
        final String text = adapter.render(
                ExportFixtures.branchWithOrphanExport());

        assertTrue(text.contains("  classDef begin fill:lightgreen;\n"));
        assertTrue(text.contains("  class v0 begin;\n"));
        assertTrue(text.contains("  class v1,v2 default;\n"));
        assertTrue(text.contains("  class v4 missing;\n"));
    }

    @Test
    void whenRendering_givenEmptyGraph_shouldRenderHeaderOnly() {
        final ControlFlowGraph graph = ControlFlowGraph.builder("none")
                .build();

        assertEquals("flowchart TD\n", adapter.render(GraphExport.of(graph,
                new GraphValidator().diagnose(graph))));
    }

}
