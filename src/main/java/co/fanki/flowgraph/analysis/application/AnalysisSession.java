package co.fanki.flowgraph.analysis.application;

import java.time.Instant;

/**
 * An analyzed AST kept in memory so that it can be exported later.
 *
 * @param id the session id
 * @param name the name the caller gave to the AST
 * @param createdAt when the analysis finished
 * @param analysis the graph and its reports
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisSession(String id, String name, Instant createdAt,
        GraphAnalysis analysis) {
}
