package co.fanki.flowgraph.analysis.application;

import co.fanki.flowgraph.cfg.domain.ControlFlowGraph;
import co.fanki.flowgraph.cfg.domain.DiagnosticReport;
import co.fanki.flowgraph.cfg.domain.FlowReport;
import co.fanki.flowgraph.export.domain.FlowSummary;
import co.fanki.flowgraph.export.domain.GraphExport;

/**
 * A graph together with the results derived from it.
 *
 * @param graph the graph
 * @param diagnostics its structural diagnostics
 * @param flow its flow analysis
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphAnalysis(ControlFlowGraph graph,
        DiagnosticReport diagnostics, FlowReport flow) {

    /**
     * Returns the text summary.
     *
     * @return the summary
     */
    public String summary() {
        return FlowSummary.render(graph.name(), diagnostics, flow);
    }

    /**
     * Returns the export view.
     *
     * @return the view adapters render from
     */
    public GraphExport export() {
        return GraphExport.of(graph, diagnostics);
    }

}
