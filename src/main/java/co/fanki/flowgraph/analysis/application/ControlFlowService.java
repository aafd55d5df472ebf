package co.fanki.flowgraph.analysis.application;

import co.fanki.flowgraph.ast.domain.AstNode;
import co.fanki.flowgraph.cfg.domain.CfgBuilder;
import co.fanki.flowgraph.cfg.domain.ControlFlowGraph;
import co.fanki.flowgraph.cfg.domain.DiagnosticReport;
import co.fanki.flowgraph.cfg.domain.FlowAnalyzer;
import co.fanki.flowgraph.cfg.domain.FlowReport;
import co.fanki.flowgraph.cfg.domain.GraphValidator;
import co.fanki.flowgraph.export.domain.ExportAdapter;
import co.fanki.flowgraph.export.domain.ExportAdapters;
import co.fanki.flowgraph.shared.DomainException;
import co.fanki.flowgraph.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the pipeline from AST to exported graph.
 *
 * <p>Each analysis builds the graph, diagnoses it and analyzes its flow,
 * then keeps the result in an in-memory session so it can be summarized
 * or exported afterwards. Once more than the configured number of
 * sessions are cached, the oldest ones are dropped.</p>
 *
 * <p>Batches are analyzed concurrently, one task per AST. A failing item
 * is reported in its own result and does not affect the others.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ControlFlowService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ControlFlowService.class);

    private final CfgBuilder builder;

    private final GraphValidator validator;

    private final FlowAnalyzer analyzer;

    private final ExportAdapters adapters;

    private final int maxCachedSessions;

    private final int batchThreads;

    private final String defaultFormat;

    private final Map<String, AnalysisSession> sessions =
            new ConcurrentHashMap<>();

    /** Session ids in creation order, for eviction. */
    private final Queue<String> creationOrder = new ConcurrentLinkedQueue<>();

    /**
     * Creates a new ControlFlowService.
     *
     * @param theBuilder the graph builder
     * @param theValidator the graph validator
     * @param theAnalyzer the flow analyzer
     * @param theAdapters the export adapters
     * @param theMaxCachedSessions the number of sessions kept in memory
     * @param theBatchThreads the threads used to analyze a batch
     * @param theDefaultFormat the export format used when none is given
     */
    public ControlFlowService(
            final CfgBuilder theBuilder,
            final GraphValidator theValidator,
            final FlowAnalyzer theAnalyzer,
            final ExportAdapters theAdapters,
            @Value("${flowgraph.sessions.max-cached:256}")
            final int theMaxCachedSessions,
            @Value("${flowgraph.batch.threads:4}") final int theBatchThreads,
            @Value("${flowgraph.export.default-format:mermaid}")
            final String theDefaultFormat) {
        this.builder = Preconditions.requireNonNull(theBuilder,
                "Builder is required");
        this.validator = Preconditions.requireNonNull(theValidator,
                "Validator is required");
        this.analyzer = Preconditions.requireNonNull(theAnalyzer,
                "Analyzer is required");
        this.adapters = Preconditions.requireNonNull(theAdapters,
                "Export adapters are required");
        this.maxCachedSessions = Preconditions.requirePositive(
                theMaxCachedSessions, "Max cached sessions must be positive");
        this.batchThreads = Preconditions.requirePositive(theBatchThreads,
                "Batch threads must be positive");
        Preconditions.require(theAdapters.supports(theDefaultFormat),
                "Default export format not available: " + theDefaultFormat);
        this.defaultFormat = theDefaultFormat;
    }

    /**
     * Builds, diagnoses and analyzes an AST, and caches the result.
     *
     * @param name the name of the AST, null to use the root type
     * @param ast the AST as JSON
     * @return the new session
     * @throws DomainException with code INVALID_AST if the AST is not a
     *         JSON object
     */
    public AnalysisSession analyze(final String name, final JsonNode ast) {
        Preconditions.requireDomain(ast != null && ast.isObject(),
                "An AST object is required", "INVALID_AST");
        return analyze(name, AstNode.of(ast));
    }

    /**
     * Builds, diagnoses and analyzes an AST, and caches the result.
     *
     * @param name the name of the AST, null to use the root type
     * @param root the AST root
     * @return the new session
     */
    public AnalysisSession analyze(final String name, final AstNode root) {
        Preconditions.requireNonNull(root, "AST root is required");

        final ControlFlowGraph graph = name == null || name.isBlank()
                ? builder.build(root) : builder.build(root, name);
        final GraphAnalysis analysis = inspect(graph);

        final AnalysisSession session = new AnalysisSession(
                UUID.randomUUID().toString(), graph.name(), Instant.now(),
                analysis);
        store(session);

        LOG.info("Analyzed {} as session {}: {} nodes, {} edges, valid {}",
                graph.name(), session.id(), graph.nodeCount(),
                graph.edgeCount(), analysis.diagnostics().isValid());
        return session;
    }

    /**
     * Diagnoses and analyzes a graph that was not built from an AST.
     *
     * <p>The result is not cached.</p>
     *
     * @param graph the graph
     * @return the graph and its reports
     */
    public GraphAnalysis inspect(final ControlFlowGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        final DiagnosticReport diagnostics = validator.diagnose(graph);
        final FlowReport flow = analyzer.analyze(graph, diagnostics);
        return new GraphAnalysis(graph, diagnostics, flow);
    }

    /**
     * Analyzes several ASTs concurrently.
     *
     * @param items the ASTs to analyze
     * @return one result per item, in the same order
     */
    public List<BatchResult> analyzeBatch(final List<BatchItem> items) {
        Preconditions.requireNonNull(items, "Items are required");

        if (items.isEmpty()) {
            return List.of();
        }

        LOG.info("Analyzing batch of {} ASTs on {} threads", items.size(),
                batchThreads);

        final List<BatchResult> results = new ArrayList<>(items.size());
        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(batchThreads, items.size()));
        try {
            final List<Future<AnalysisSession>> futures = new ArrayList<>(
                    items.size());
            for (final BatchItem item : items) {
                futures.add(executor.submit(
                        () -> analyze(item.name(), item.ast())));
            }

            for (int i = 0; i < futures.size(); i++) {
                final String name = items.get(i).name();
                try {
                    results.add(BatchResult.success(name,
                            futures.get(i).get()));
                } catch (final ExecutionException e) {
                    results.add(failure(name, e.getCause()));
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.add(failure(name, e));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private BatchResult failure(final String name, final Throwable cause) {
        LOG.warn("Batch item {} failed: {}", name, cause.getMessage());
        final String errorCode = cause instanceof DomainException domain
                ? domain.getErrorCode() : DomainException.DEFAULT_ERROR_CODE;
        return BatchResult.failure(name, cause.getMessage(), errorCode);
    }

    /**
     * Returns a cached session.
     *
     * @param sessionId the session id
     * @return the session
     * @throws DomainException with code SESSION_NOT_FOUND if not cached
     */
    public AnalysisSession session(final String sessionId) {
        final AnalysisSession session = sessionId == null ? null
                : sessions.get(sessionId);
        if (session == null) {
            throw new DomainException("Session not found: " + sessionId,
                    "SESSION_NOT_FOUND");
        }
        return session;
    }

    /**
     * Returns the text summary of a session.
     *
     * @param sessionId the session id
     * @return the summary
     */
    public String summary(final String sessionId) {
        return session(sessionId).analysis().summary();
    }

    /**
     * Resolves the adapter of an export format.
     *
     * @param format the format, null or blank for the default one
     * @return the adapter
     * @throws DomainException with code UNKNOWN_FORMAT if not available
     */
    public ExportAdapter adapter(final String format) {
        return adapters.get(format == null || format.isBlank()
                ? defaultFormat : format);
    }

    /**
     * Renders the graph of a session.
     *
     * @param sessionId the session id
     * @param format the format, null or blank for the default one
     * @return the rendered document
     */
    public String export(final String sessionId, final String format) {
        final AnalysisSession session = session(sessionId);
        return adapter(format).render(session.analysis().export());
    }

    /**
     * Drops a session.
     *
     * @param sessionId the session id
     * @throws DomainException with code SESSION_NOT_FOUND if not cached
     */
    public void close(final String sessionId) {
        if (sessionId == null || sessions.remove(sessionId) == null) {
            throw new DomainException("Session not found: " + sessionId,
                    "SESSION_NOT_FOUND");
        }
        creationOrder.remove(sessionId);
        LOG.debug("Closed session {}", sessionId);
    }

    /** Returns the number of cached sessions. */
    public int sessionCount() {
        return sessions.size();
    }

    private void store(final AnalysisSession session) {
        sessions.put(session.id(), session);
        creationOrder.add(session.id());
        while (sessions.size() > maxCachedSessions) {
            final String oldest = creationOrder.poll();
            if (oldest == null) {
                break;
            }
            if (sessions.remove(oldest) != null) {
                LOG.debug("Evicted session {}", oldest);
            }
        }
    }

    /**
     * One AST of a batch.
     *
     * @param name the name of the AST, may be null
     * @param ast the AST as JSON
     */
    public record BatchItem(String name, JsonNode ast) {}

    /**
     * Outcome of one batch item: a session or an error.
     *
     * @param name the name of the item
     * @param session the session, null on failure
     * @param error the failure message, null on success
     * @param errorCode the failure code, null on success
     */
    public record BatchResult(String name, AnalysisSession session,
            String error, String errorCode) {

        static BatchResult success(final String name,
                final AnalysisSession session) {
            return new BatchResult(name, session, null, null);
        }

        static BatchResult failure(final String name, final String error,
                final String errorCode) {
            return new BatchResult(name, null, error, errorCode);
        }

        /** Checks if the item was analyzed. */
        public boolean succeeded() {
            return session != null;
        }
    }

}
