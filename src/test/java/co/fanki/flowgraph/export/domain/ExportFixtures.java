package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.cfg.domain.CfgNode;
import co.fanki.flowgraph.cfg.domain.ControlFlowGraph;
import co.fanki.flowgraph.cfg.domain.EdgeConstraints;
import co.fanki.flowgraph.cfg.domain.GraphValidator;
import co.fanki.flowgraph.cfg.domain.NodeKind;

/**
 * Graphs shared by the export tests.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class ExportFixtures {

    private ExportFixtures() {
    }

    /**
     * A branch whose true side may throw to an id that is not in the
     * graph.
     *
     * @return the graph
     */
    static ControlFlowGraph branchWithOrphan() {
        final ControlFlowGraph.Builder builder = ControlFlowGraph.builder(
                "sample");
        builder.addNode(new CfgNode("n1", NodeKind.BEGIN, "entry", 1L));
        builder.addNode(new CfgNode("n2", NodeKind.CONDITION, "if-condition",
                2L));
        builder.addNode(new CfgNode("n3", NodeKind.ATOM, null, null));
        builder.addNode(new CfgNode("n4", NodeKind.END, "exit", null));
        builder.connect("n1", "n2", null);
        builder.connect("n2", "n3", EdgeConstraints.WHEN_TRUE);
        builder.connect("n2", "n4", EdgeConstraints.WHEN_FALSE);
        builder.connect("n3", "ghost", EdgeConstraints.ON_EXCEPTION);
        builder.connect("n3", "n4", null);
        return builder.build();
    }

    /**
     * The export view of {@link #branchWithOrphan()}.
     *
     * @return the export view
     */
    static GraphExport branchWithOrphanExport() {
        final ControlFlowGraph graph = branchWithOrphan();
        return GraphExport.of(graph, new GraphValidator().diagnose(graph));
    }

}
