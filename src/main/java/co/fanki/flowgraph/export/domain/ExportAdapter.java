package co.fanki.flowgraph.export.domain;

/**
 * Renders the export view of a graph into a textual format.
 *
 * <p>Adapters only see the {@link GraphExport}: they never reach into
 * the graph, the diagnostics or the flow analysis.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ExportAdapter {

    /**
     * Returns the format name this adapter is registered under.
     *
     * @return the format name, e.g. "mermaid"
     */
    String format();

    /**
     * Returns the media type of the rendered document.
     *
     * @return the media type, e.g. "text/plain"
     */
    String mediaType();

    /**
     * Renders a graph.
     *
     * @param export the export view, never null
     * @return the document
     */
    String render(GraphExport export);

}
