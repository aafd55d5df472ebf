package co.fanki.flowgraph.export.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DotExportAdapter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DotExportAdapterTest {

    private final DotExportAdapter adapter = new DotExportAdapter();

    @Test
    void whenRendering_shouldWriteDigraph() {
        final String text = adapter.render(
                ExportFixtures.branchWithOrphanExport());

        assertTrue(text.startsWith("digraph \"sample\" {\n"));
        assertTrue(text.endsWith("}\n"));
        assertTrue(text.contains("    \"n1\" [label=\"BEGIN\\nAST:1\\nrole:entry\","
                + " shape=oval, fillcolor=lightgreen];\n"));
        assertTrue(text.contains("    \"n2\" [label=\"CONDITION\\nAST:2"
                + "\\nrole:if-condition\", shape=diamond,"
                + " fillcolor=lightblue];\n"));
    }

    @Test
    void whenRendering_shouldStyleEdgesAndPlaceholders() {
        final String text = adapter.render(
                ExportFixtures.branchWithOrphanExport());

        assertTrue(text.contains("    \"n1\" -> \"n2\";\n"));
        assertTrue(text.contains("    \"n2\" -> \"n3\" [label=\"T\"];\n"));
        assertTrue(text.contains("    \"n3\" -> \"ghost\" [label=\"exc\","
                + " style=dotted, color=red];\n"));
        assertTrue(text.contains("    \"ghost\" [label=\"ghost\", shape=box,"
                + " fillcolor=lightgray, style=\"filled,dashed\"];\n"));
    }

    @Test
    void whenDescribing_shouldExposeFormatAndMediaType() {
        assertEquals("dot", adapter.format());
        assertEquals("text/vnd.graphviz", adapter.mediaType());
    }

}
