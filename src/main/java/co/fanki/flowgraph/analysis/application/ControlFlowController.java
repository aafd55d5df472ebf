package co.fanki.flowgraph.analysis.application;

import co.fanki.flowgraph.analysis.application.ControlFlowService.BatchItem;
import co.fanki.flowgraph.analysis.application.ControlFlowService.BatchResult;
import co.fanki.flowgraph.cfg.domain.CfgEdge;
import co.fanki.flowgraph.cfg.domain.ControlFlowGraph;
import co.fanki.flowgraph.cfg.domain.DiagnosticReport;
import co.fanki.flowgraph.cfg.domain.FlowReport;
import co.fanki.flowgraph.cfg.domain.NaturalLoop;
import co.fanki.flowgraph.export.domain.ExportAdapter;
import co.fanki.flowgraph.export.domain.GraphLabels;
import co.fanki.flowgraph.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for building and analyzing control-flow graphs.
 *
 * <p>An AST posted to {@code /sessions} is turned into a graph, diagnosed
 * and analyzed; the result stays in memory under a session id for later
 * summaries and exports. Raw graphs can be checked with
 * {@code /diagnose} without creating a session.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/cfg")
@Tag(name = "Control Flow",
        description = "Build, validate, analyze and export control-flow graphs")
public class ControlFlowController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ControlFlowController.class);

    private final ControlFlowService controlFlowService;

    /**
     * Creates a new ControlFlowController.
     *
     * @param theControlFlowService the control flow service
     */
    public ControlFlowController(
            final ControlFlowService theControlFlowService) {
        this.controlFlowService = theControlFlowService;
    }

    /**
     * Analyzes an AST and opens a session for it.
     *
     * @param request the AST and its name
     * @return the session with its diagnostics and flow properties
     */
    @PostMapping("/sessions")
    @Operation(summary = "Analyze an AST",
            description = "Builds the control-flow graph of a"
                    + " language-agnostic AST, diagnoses it and computes"
                    + " its dominance-based properties")
    public ResponseEntity<?> analyze(
            @RequestBody final AnalyzeRequest request) {

        LOG.info("Analyze request for {}", request.name());

        try {
            final AnalysisSession session = controlFlowService.analyze(
                    request.name(), request.ast());
            return ResponseEntity.ok(SessionResponse.from(session));
        } catch (final DomainException e) {
            return error("Analysis", e);
        }
    }

    /**
     * Analyzes several ASTs concurrently.
     *
     * @param request the ASTs
     * @return one result per AST, in request order
     */
    @PostMapping("/sessions/batch")
    @Operation(summary = "Analyze a batch of ASTs",
            description = "Analyzes each AST independently; a failing item"
                    + " is reported without affecting the others")
    public ResponseEntity<BatchResponse> analyzeBatch(
            @RequestBody final BatchRequest request) {

        final List<AnalyzeRequest> items = request.items() == null
                ? List.of() : request.items();
        LOG.info("Batch request with {} items", items.size());

        final List<BatchResult> results = controlFlowService.analyzeBatch(
                items.stream()
                        .map(item -> new BatchItem(item.name(), item.ast()))
                        .toList());

        return ResponseEntity.ok(new BatchResponse(results.stream()
                .map(BatchItemResponse::from)
                .toList()));
    }

    /**
     * Diagnoses and analyzes a raw graph.
     *
     * @param graph the graph as {@code {name, nodes, edges}}
     * @return the diagnostics and flow properties
     */
    @PostMapping("/diagnose")
    @Operation(summary = "Diagnose a raw graph",
            description = "Reports orphan edges, disconnected nodes and the"
                    + " flow properties of a graph given as JSON")
    public ResponseEntity<?> diagnose(@RequestBody final JsonNode graph) {
        try {
            final GraphAnalysis analysis = controlFlowService.inspect(
                    ControlFlowGraph.fromJson(graph));
            return ResponseEntity.ok(AnalysisResponse.from(analysis));
        } catch (final DomainException e) {
            return error("Diagnose", e);
        }
    }

    /**
     * Returns the text summary of a session.
     *
     * @param sessionId the session id
     * @return the summary as plain text
     */
    @GetMapping(value = "/sessions/{sessionId}/summary")
    @Operation(summary = "Summarize a session",
            description = "Basic blocks, reducibility, loop headers, back"
                    + " edges, critical edges and diagnostics as text")
    public ResponseEntity<?> summary(
            @PathVariable final String sessionId) {
        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(controlFlowService.summary(sessionId));
        } catch (final DomainException e) {
            return error("Summary", e);
        }
    }

    /**
     * Renders the graph of a session.
     *
     * @param sessionId the session id
     * @param format mermaid, dot or json; the configured default if absent
     * @return the rendered document
     */
    @GetMapping("/sessions/{sessionId}/export")
    @Operation(summary = "Export a session graph",
            description = "Renders the graph with its styling hints as"
                    + " Mermaid, Graphviz DOT or JSON")
    public ResponseEntity<?> export(
            @PathVariable final String sessionId,
            @RequestParam(required = false) final String format) {
        try {
            final ExportAdapter adapter = controlFlowService.adapter(format);
            final String document = controlFlowService.export(sessionId,
                    adapter.format());
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(adapter.mediaType()))
                    .body(document);
        } catch (final DomainException e) {
            return error("Export", e);
        }
    }

    /**
     * Drops a session.
     *
     * @param sessionId the session id
     * @return 204 when dropped
     */
    @DeleteMapping("/sessions/{sessionId}")
    @Operation(summary = "Close a session")
    public ResponseEntity<?> close(@PathVariable final String sessionId) {
        try {
            controlFlowService.close(sessionId);
            return ResponseEntity.noContent().build();
        } catch (final DomainException e) {
            return error("Close", e);
        }
    }

    private ResponseEntity<Map<String, String>> error(final String operation,
            final DomainException e) {
        LOG.warn("{} failed: {}", operation, e.getMessage());
        final HttpStatus status = "SESSION_NOT_FOUND".equals(e.getErrorCode())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(
                Map.of("error", e.getMessage(),
                        "errorCode", e.getErrorCode()));
    }

    /**
     * Request body for analyzing an AST.
     *
     * @param name the name of the AST, optional
     * @param ast the AST root object
     */
    public record AnalyzeRequest(String name, JsonNode ast) {}

    /**
     * Request body for a batch.
     *
     * @param items the ASTs to analyze
     */
    public record BatchRequest(List<AnalyzeRequest> items) {}

    /**
     * Response for a batch.
     */
    public record BatchResponse(List<BatchItemResponse> results) {}

    /**
     * Response for one item of a batch.
     */
    public record BatchItemResponse(
            String name,
            SessionResponse session,
            String error,
            String errorCode
    ) {
        static BatchItemResponse from(final BatchResult result) {
            return new BatchItemResponse(result.name(),
                    result.succeeded()
                            ? SessionResponse.from(result.session()) : null,
                    result.error(), result.errorCode());
        }
    }

    /**
     * Response for a session.
     */
    public record SessionResponse(
            String id,
            String name,
            Instant createdAt,
            DiagnosticsResponse diagnostics,
            FlowResponse flow
    ) {
        static SessionResponse from(final AnalysisSession session) {
            return new SessionResponse(session.id(), session.name(),
                    session.createdAt(),
                    DiagnosticsResponse.from(session.analysis().diagnostics()),
                    FlowResponse.from(session.analysis().flow()));
        }
    }

    /**
     * Response for a raw graph analysis.
     */
    public record AnalysisResponse(
            String name,
            DiagnosticsResponse diagnostics,
            FlowResponse flow,
            String summary
    ) {
        static AnalysisResponse from(final GraphAnalysis analysis) {
            return new AnalysisResponse(analysis.graph().name(),
                    DiagnosticsResponse.from(analysis.diagnostics()),
                    FlowResponse.from(analysis.flow()),
                    analysis.summary());
        }
    }

    /**
     * An edge with its display label.
     */
    public record EdgeResponse(String src, String dst, String label) {
        static EdgeResponse from(final CfgEdge edge) {
            return new EdgeResponse(edge.src(), edge.dst(),
                    GraphLabels.edgeLabel(edge.constraints()));
        }

        static List<EdgeResponse> fromAll(final List<CfgEdge> edges) {
            return edges.stream().map(EdgeResponse::from).toList();
        }
    }

    /**
     * An orphan edge and which of its endpoints are absent.
     */
    public record OrphanEdgeResponse(String src, String dst, String kind) {}

    /**
     * Structural diagnostics.
     */
    public record DiagnosticsResponse(
            boolean valid,
            int nodeCount,
            int edgeCount,
            int reachableNodeCount,
            String beginNodeId,
            List<String> extraBeginNodeIds,
            List<EdgeResponse> entryIncomingEdges,
            List<OrphanEdgeResponse> orphanEdges,
            List<String> missingNodeIds,
            List<String> disconnectedNodes,
            List<String> deadEndNodes
    ) {
        static DiagnosticsResponse from(final DiagnosticReport report) {
            return new DiagnosticsResponse(report.isValid(),
                    report.nodeCount(), report.edgeCount(),
                    report.reachableNodes().size(), report.beginNodeId(),
                    report.extraBeginNodeIds(),
                    EdgeResponse.fromAll(report.entryIncomingEdges()),
                    report.orphanEdges().stream()
                            .map(o -> new OrphanEdgeResponse(o.edge().src(),
                                    o.edge().dst(), o.kind().name()))
                            .toList(),
                    report.missingNodeIds(), report.disconnectedNodes(),
                    report.deadEndNodes());
        }
    }

    /**
     * A natural loop.
     */
    public record LoopResponse(String header, Set<String> body) {}

    /**
     * Flow properties.
     */
    public record FlowResponse(
            boolean reducible,
            int basicBlockCount,
            int reachableNodeCount,
            int loopHeaderCount,
            int loopConnectedness,
            Set<String> loopHeaders,
            List<EdgeResponse> backEdges,
            List<EdgeResponse> criticalEdges,
            List<LoopResponse> naturalLoops,
            Map<String, String> immediateDominators,
            Map<String, String> immediatePostDominators,
            List<String> excludedNodes
    ) {
        static FlowResponse from(final FlowReport report) {
            final List<LoopResponse> loops = report.naturalLoops().stream()
                    .map((NaturalLoop l) -> new LoopResponse(l.header(),
                            l.body()))
                    .toList();
            return new FlowResponse(report.reducible(),
                    report.basicBlockCount(), report.reachableNodeCount(),
                    report.loopHeaderCount(), report.loopConnectedness(),
                    report.loopHeaders(),
                    EdgeResponse.fromAll(report.backEdges()),
                    EdgeResponse.fromAll(report.criticalEdges()), loops,
                    report.dominatorTree().immediateDominators(),
                    report.postDominatorTree().immediateDominators(),
                    report.excludedNodes());
        }
    }

}
