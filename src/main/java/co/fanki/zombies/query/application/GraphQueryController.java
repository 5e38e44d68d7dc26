package co.fanki.zombies.query.application;

import co.fanki.zombies.analysis.domain.ZombieClassification;
import co.fanki.zombies.analysis.domain.ZombieFilter;
import co.fanki.zombies.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read-only REST access to the dependency graph.
 *
 * <p>Symbol ids contain {@code ::} and path separators, so they travel as
 * the {@code id} query parameter rather than as a path segment.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/graph")
@Tag(name = "Graph Query",
        description = "Query the dependency graph and the zombie report")
public class GraphQueryController {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphQueryController.class);

    private final GraphQueryService graphQueryService;

    /**
     * Creates a new GraphQueryController.
     *
     * @param theGraphQueryService the graph query service
     */
    public GraphQueryController(
            final GraphQueryService theGraphQueryService) {
        this.graphQueryService = theGraphQueryService;
    }

    @GetMapping("/symbol")
    @Operation(summary = "Look up a symbol",
            description = "Returns the node of the current generation."
                    + " Example id: billing::src/Invoice.java::Invoice.total")
    public ResponseEntity<?> symbol(@RequestParam("id") final String id) {
        return respond(() -> graphQueryService.symbol(id));
    }

    @GetMapping("/dependencies")
    @Operation(summary = "What a symbol depends on",
            description = "Follows outgoing edges breadth-first up to"
                    + " maxDepth, or the configured cap when absent")
    public ResponseEntity<?> dependencies(
            @RequestParam("id") final String id,
            @RequestParam(value = "maxDepth", required = false)
            final Integer maxDepth) {
        return respond(() -> graphQueryService.dependencies(id, maxDepth));
    }

    @GetMapping("/dependents")
    @Operation(summary = "What depends on a symbol",
            description = "Follows incoming edges breadth-first up to"
                    + " maxDepth, or the configured cap when absent")
    public ResponseEntity<?> dependents(
            @RequestParam("id") final String id,
            @RequestParam(value = "maxDepth", required = false)
            final Integer maxDepth) {
        return respond(() -> graphQueryService.dependents(id, maxDepth));
    }

    @GetMapping("/root-path")
    @Operation(summary = "Shortest path from an active root",
            description = "Edges ordered from the root to the symbol;"
                    + " hops is -1 when no root reaches the symbol")
    public ResponseEntity<?> rootPath(@RequestParam("id") final String id) {
        return respond(() -> graphQueryService.pathToNearestRoot(id));
    }

    @GetMapping("/reachable")
    @Operation(summary = "Whether an active root reaches a symbol",
            description = "Answered from the latest analysis run")
    public ResponseEntity<?> reachable(@RequestParam("id") final String id) {
        return respond(() -> graphQueryService.isReachable(id));
    }

    @GetMapping("/zombies")
    @Operation(summary = "Zombie report",
            description = "Every symbol the latest analysis run did not"
                    + " reach, with classification and confidence."
                    + " Items can be narrowed by classification, minimum"
                    + " confidence and repository")
    public ResponseEntity<?> zombies(
            @RequestParam(value = "classification", required = false)
            final Set<ZombieClassification> classifications,
            @RequestParam(value = "minConfidence", required = false)
            final Double minConfidence,
            @RequestParam(value = "repository", required = false)
            final String repository) {
        return respond(() -> graphQueryService.zombies(new ZombieFilter(
                classifications, minConfidence, repository)));
    }

    @GetMapping("/metrics")
    @Operation(summary = "Graph metrics of the current generation")
    public ResponseEntity<?> metrics() {
        return respond(graphQueryService::metrics);
    }

    @GetMapping("/dangling")
    @Operation(summary = "Unresolved references of the current generation")
    public ResponseEntity<?> dangling() {
        return respond(graphQueryService::danglingReferences);
    }

    @GetMapping("/diagnostics")
    @Operation(summary = "Build diagnostics of the current generation")
    public ResponseEntity<?> diagnostics() {
        return respond(graphQueryService::diagnostics);
    }

    private ResponseEntity<?> respond(final Supplier<?> query) {
        try {
            return ResponseEntity.ok(query.get());
        } catch (final DomainException e) {
            LOG.warn("Graph query failed: {}", e.getMessage());
            final HttpStatus status = "SYMBOL_NOT_FOUND".equals(
                    e.getErrorCode())
                    ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
            return ResponseEntity.status(status).body(
                    Map.of("error", String.valueOf(e.getMessage()),
                            "errorCode", e.getErrorCode()));
        } catch (final IllegalArgumentException e) {
            LOG.warn("Invalid graph query: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", String.valueOf(e.getMessage()),
                            "errorCode", "INVALID_ARGUMENT"));
        }
    }

}
