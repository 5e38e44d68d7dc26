package co.fanki.zombies.analysis.application;

import co.fanki.zombies.analysis.application.ReachabilityService.AnalysisRun;
import co.fanki.zombies.analysis.domain.ReachabilityResult;
import co.fanki.zombies.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts, cancels and reports on background reachability analysis.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Analysis", description = "Run reachability analysis")
public class AnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisController.class);

    private final ReachabilityService reachabilityService;

    /**
     * Creates a new AnalysisController.
     *
     * @param theReachabilityService the analysis service
     */
    public AnalysisController(
            final ReachabilityService theReachabilityService) {
        this.reachabilityService = theReachabilityService;
    }

    /**
     * Starts an analysis of the current generation.
     *
     * @return 202 when started
     */
    @PostMapping
    @Operation(summary = "Start an analysis",
            description = "Runs in the background from the active roots of"
                    + " the current graph generation")
    public ResponseEntity<?> start() {
        try {
            reachabilityService.start();
            return ResponseEntity.accepted().body(Map.of("running", true));
        } catch (final DomainException e) {
            LOG.warn("Cannot start analysis: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Cancels the running analysis.
     *
     * @return whether a run was signalled
     */
    @DeleteMapping
    @Operation(summary = "Cancel the running analysis")
    public ResponseEntity<Map<String, Object>> cancel() {
        return ResponseEntity.ok(Map.of("cancelled",
                reachabilityService.cancel()));
    }

    /**
     * Summary of the latest run.
     *
     * @return the status map
     */
    @GetMapping
    @Operation(summary = "Status of the latest analysis")
    public ResponseEntity<Map<String, Object>> status() {
        final Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", reachabilityService.isRunning());
        reachabilityService.latest().map(AnalysisRun::result)
                .ifPresent(result -> describe(result, status));
        return ResponseEntity.ok(status);
    }

    private static void describe(final ReachabilityResult result,
            final Map<String, Object> status) {
        status.put("generation", result.generation());
        status.put("status", result.status());
        status.put("reachable", result.reachableCount());
        status.put("zombies", result.zombieCount());
        status.put("layers", result.layers());
        status.put("durationMillis", result.duration().toMillis());
    }

}
