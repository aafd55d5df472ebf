package co.fanki.flowgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Flow Graph Engine Application.
 *
 * <p>Turns language-agnostic ASTs into control-flow graphs, checks their
 * structural integrity and computes their dominance-based properties
 * (loop headers, back edges, critical edges, reducibility). Results are
 * served over HTTP as JSON, text summaries and Mermaid or DOT
 * drawings.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class FlowGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(FlowGraphApplication.class, args);
    }

}
