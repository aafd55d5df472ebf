package co.fanki.flowgraph.analysis.application;

import co.fanki.flowgraph.analysis.application.ControlFlowController.AnalysisResponse;
import co.fanki.flowgraph.analysis.application.ControlFlowController.AnalyzeRequest;
import co.fanki.flowgraph.analysis.application.ControlFlowController.BatchRequest;
import co.fanki.flowgraph.analysis.application.ControlFlowController.BatchResponse;
import co.fanki.flowgraph.analysis.application.ControlFlowController.SessionResponse;
import co.fanki.flowgraph.cfg.domain.CfgBuilder;
import co.fanki.flowgraph.cfg.domain.FlowAnalyzer;
import co.fanki.flowgraph.cfg.domain.GraphValidator;
import co.fanki.flowgraph.export.domain.DotExportAdapter;
import co.fanki.flowgraph.export.domain.ExportAdapters;
import co.fanki.flowgraph.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ControlFlowController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ControlFlowControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ControlFlowService service;

    private ControlFlowController controller;

    @BeforeEach
    void setUp() {
        service = mock(ControlFlowService.class);
        controller = new ControlFlowController(service);
    }

    private static ControlFlowService realService() {
        final GraphValidator validator = new GraphValidator();
        return new ControlFlowService(new CfgBuilder(), validator,
                new FlowAnalyzer(validator), ExportAdapters.defaults(), 8, 2,
                "mermaid");
    }

    @Test
    void whenAnalyzing_givenValidAst_shouldReturnSession() throws Exception {
        controller = new ControlFlowController(realService());
        final JsonNode ast = MAPPER.readTree("""
                {"type": "program_entry_point", "body": [
                  {"type": "while_loop",
                   "condition": {"type": "condition"},
                   "body": {"type": "assignment_statement"}}]}
                """);

        final ResponseEntity<?> response = controller.analyze(
                new AnalyzeRequest("loop", ast));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        final SessionResponse body = assertInstanceOf(SessionResponse.class,
                response.getBody());
        assertEquals("loop", body.name());
        assertTrue(body.diagnostics().valid());
        assertEquals(1, body.flow().loopHeaderCount());
        assertEquals(1, body.flow().loopConnectedness());
        assertEquals(1, body.flow().backEdges().size());
        assertEquals(1, body.flow().naturalLoops().size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void whenAnalyzing_givenInvalidAst_shouldReturnBadRequest() {
        when(service.analyze(any(), (JsonNode) any())).thenThrow(
                new DomainException("An AST object is required",
                        "INVALID_AST"));

        final ResponseEntity<?> response = controller.analyze(
                new AnalyzeRequest("x", null));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        final Map<String, String> body =
                (Map<String, String>) response.getBody();
        assertEquals("INVALID_AST", body.get("errorCode"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void whenSummarizing_givenUnknownSession_shouldReturnNotFound() {
        when(service.summary("nope")).thenThrow(new DomainException(
                "Session not found: nope", "SESSION_NOT_FOUND"));

        final ResponseEntity<?> response = controller.summary("nope");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        final Map<String, String> body =
                (Map<String, String>) response.getBody();
        assertEquals("SESSION_NOT_FOUND", body.get("errorCode"));
    }

    @Test
    void whenSummarizing_shouldReturnPlainText() {
        when(service.summary("s1")).thenReturn("Graph: g\n");

        final ResponseEntity<?> response = controller.summary("s1");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(MediaType.TEXT_PLAIN,
                response.getHeaders().getContentType());
        assertEquals("Graph: g\n", response.getBody());
    }

    @Test
    void whenExporting_shouldUseAdapterMediaType() {
        when(service.adapter("dot")).thenReturn(new DotExportAdapter());
        when(service.export("s1", "dot")).thenReturn("digraph \"g\" {\n}\n");

        final ResponseEntity<?> response = controller.export("s1", "dot");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(MediaType.parseMediaType("text/vnd.graphviz"),
                response.getHeaders().getContentType());
    }

    @Test
    void whenExporting_givenUnknownFormat_shouldReturnBadRequest() {
        when(service.adapter("png")).thenThrow(new DomainException(
                "Unknown export format: png", "UNKNOWN_FORMAT"));

        final ResponseEntity<?> response = controller.export("s1", "png");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void whenClosing_shouldReturnNoContent() {
        final ResponseEntity<?> response = controller.close("s1");

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        verify(service).close("s1");
    }

    @Test
    void whenClosing_givenUnknownSession_shouldReturnNotFound() {
        doThrow(new DomainException("Session not found: s1",
                "SESSION_NOT_FOUND")).when(service).close("s1");

        final ResponseEntity<?> response = controller.close("s1");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void whenDiagnosing_givenOrphanEdge_shouldReportIt() throws Exception {
        controller = new ControlFlowController(realService());
        final JsonNode graph = MAPPER.readTree("""
                {"name": "raw",
                 "nodes": [{"id": "A", "kind": "BEGIN"}],
                 "edges": [{"src": "A", "dst": "B"}]}
                """);

        final ResponseEntity<?> response = controller.diagnose(graph);

        final AnalysisResponse body = assertInstanceOf(AnalysisResponse.class,
                response.getBody());
        assertEquals("raw", body.name());
        assertFalse(body.diagnostics().valid());
        assertEquals(1, body.diagnostics().orphanEdges().size());
        assertEquals("MISSING_DST",
                body.diagnostics().orphanEdges().get(0).kind());
        assertEquals(List.of("B"), body.diagnostics().missingNodeIds());
        assertTrue(body.summary().contains("Orphan edges: 1"));
    }

    @Test
    void whenDiagnosing_givenMalformedGraph_shouldReturnBadRequest()
            throws Exception {
        controller = new ControlFlowController(realService());

        final ResponseEntity<?> response = controller.diagnose(
                MAPPER.readTree("{\"edges\": [{\"src\": \"a\"}]}"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void whenDiagnosing_givenBlankIds_shouldReturnBadRequest()
            throws Exception {
        controller = new ControlFlowController(realService());

        final ResponseEntity<?> blankNode = controller.diagnose(MAPPER.readTree(
                "{\"nodes\": [{\"id\": \"\", \"kind\": \"BEGIN\"}],"
                        + " \"edges\": []}"));
        final ResponseEntity<?> blankEdge = controller.diagnose(MAPPER.readTree(
                "{\"edges\": [{\"src\": \"a\", \"dst\": \"\"}]}"));

        assertEquals(HttpStatus.BAD_REQUEST, blankNode.getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, blankEdge.getStatusCode());
        assertEquals("INVALID_GRAPH",
                ((Map<?, ?>) blankEdge.getBody()).get("errorCode"));
    }

    @Test
    void whenAnalyzingBatch_shouldKeepRequestOrder() throws Exception {
        controller = new ControlFlowController(realService());
        final JsonNode ast = MAPPER.readTree(
                "{\"type\": \"program_entry_point\", \"body\": []}");

        final ResponseEntity<BatchResponse> response = controller.analyzeBatch(
                new BatchRequest(List.of(new AnalyzeRequest("one", ast),
                        new AnalyzeRequest("two", null))));

        final BatchResponse body = response.getBody();
        assertEquals(2, body.results().size());
        assertEquals("one", body.results().get(0).session().name());
        assertNull(body.results().get(1).session());
        assertEquals("INVALID_AST", body.results().get(1).errorCode());
    }

}
