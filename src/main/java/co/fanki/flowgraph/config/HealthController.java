package co.fanki.flowgraph.config;

import co.fanki.flowgraph.analysis.application.ControlFlowService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Simple health check endpoint.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final ControlFlowService controlFlowService;

    /**
     * Creates a new HealthController.
     *
     * @param theControlFlowService the service whose sessions are counted
     */
    public HealthController(final ControlFlowService theControlFlowService) {
        this.controlFlowService = theControlFlowService;
    }

    /**
     * Returns health status.
     *
     * @return "up" and the number of cached sessions
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "up",
                "sessions", controlFlowService.sessionCount());
    }

}
