package co.fanki.zombies.config;

import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.graph.domain.GraphGenerations;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Liveness and readiness checks.
 *
 * <p>The service is ready once a graph generation has been published,
 * either built from facts or loaded from a snapshot.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private final GraphGenerations generations;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theGenerations the published graph generations
     */
    public HealthCheckController(final GraphGenerations theGenerations) {
        this.generations = theGenerations;
    }

    /**
     * Liveness check endpoint.
     *
     * @return "ok" string
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness check endpoint.
     *
     * @return status map with the published generation, 503 if none
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final Optional<DependencyGraph> graph = generations.current();

        final Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", graph.isPresent() ? "ready" : "not_ready");
        graph.ifPresent(g -> {
            status.put("generation", g.generation());
            status.put("nodes", g.nodeCount());
        });

        if (graph.isPresent()) {
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

}
