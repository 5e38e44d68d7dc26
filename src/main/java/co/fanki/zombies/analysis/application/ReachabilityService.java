package co.fanki.zombies.analysis.application;

import co.fanki.zombies.analysis.domain.ReachabilityAnalyzer;
import co.fanki.zombies.analysis.domain.ReachabilityResult;
import co.fanki.zombies.analysis.domain.ZombieReport;
import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.graph.domain.GraphGenerations;
import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs reachability analysis in the background and keeps the latest
 * result.
 *
 * <p>A run pins the generation that was current when it started. Its
 * result is kept together with that graph, so node indices of the overlay
 * always refer to the graph they were computed on, even after a newer
 * generation is published.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ReachabilityService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReachabilityService.class);

    private final GraphGenerations generations;
    private final ReachabilityAnalyzer analyzer;
    private final ExecutorService analysisExecutor;

    private final AtomicReference<AnalysisRun> latest =
            new AtomicReference<>();
    private final AtomicReference<AtomicBoolean> running =
            new AtomicReference<>();

    /**
     * Creates a new ReachabilityService.
     *
     * @param theGenerations the published generations
     * @param theAnalyzer the analyzer
     * @param theAnalysisExecutor the background executor
     */
    public ReachabilityService(final GraphGenerations theGenerations,
            final ReachabilityAnalyzer theAnalyzer,
            @Qualifier("analysisExecutor")
            final ExecutorService theAnalysisExecutor) {
        this.generations = Preconditions.requireNonNull(theGenerations,
                "Generations are required");
        this.analyzer = Preconditions.requireNonNull(theAnalyzer,
                "Analyzer is required");
        this.analysisExecutor = Preconditions.requireNonNull(
                theAnalysisExecutor, "Executor is required");
    }

    /**
     * Starts an analysis of the current generation in the background.
     *
     * <p>Cancelling the returned future, or calling {@link #cancel()},
     * stops the run at its next layer boundary; the run then completes
     * with a {@code CANCELLED} result.</p>
     *
     * @return the pending run
     * @throws DomainException with code {@code GRAPH_NOT_BUILT}
     */
    public CompletableFuture<AnalysisRun> start() {
        final DependencyGraph graph = generations.require();
        final AtomicBoolean cancelled = new AtomicBoolean();
        running.set(cancelled);
        LOG.info("Starting analysis of generation {}", graph.generation());

        final CompletableFuture<AnalysisRun> future =
                CompletableFuture.supplyAsync(() -> {
                    try {
                        return record(graph, analyzer.analyze(graph,
                                graph.activeRoots(), cancelled::get));
                    } finally {
                        running.compareAndSet(cancelled, null);
                    }
                }, analysisExecutor);
        future.whenComplete((run, error) -> {
            if (error != null && !future.isCancelled()) {
                LOG.error("Analysis of generation {} failed",
                        graph.generation(), error);
            }
            if (future.isCancelled()) {
                cancelled.set(true);
            }
        });
        return future;
    }

    /**
     * Analyses the current generation on the calling thread.
     *
     * @return the run
     * @throws DomainException with code {@code GRAPH_NOT_BUILT}
     */
    public AnalysisRun analyze() {
        final DependencyGraph graph = generations.require();
        return record(graph, analyzer.analyze(graph));
    }

    /**
     * Analyses the current generation from an alternative root set.
     *
     * <p>What-if runs are returned only; they do not replace the latest
     * result.</p>
     *
     * @param rootIds the root symbol ids
     * @return the run
     */
    public AnalysisRun whatIf(final Collection<String> rootIds) {
        final DependencyGraph graph = generations.require();
        return new AnalysisRun(graph,
                analyzer.analyze(graph, rootIds, () -> false));
    }

    /**
     * Requests cancellation of the background run, if any.
     *
     * @return true if a run was signalled
     */
    public boolean cancel() {
        final AtomicBoolean flag = running.get();
        if (flag == null) {
            return false;
        }
        flag.set(true);
        LOG.info("Cancellation requested");
        return true;
    }

    /** @return true while a background run is in progress */
    public boolean isRunning() {
        return running.get() != null;
    }

    /** @return the latest completed run, if any */
    public Optional<AnalysisRun> latest() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * Returns the latest completed run.
     *
     * @return the run
     * @throws DomainException with code {@code ANALYSIS_NOT_RUN}
     */
    public AnalysisRun requireLatest() {
        final AnalysisRun run = latest.get();
        if (run == null) {
            throw new DomainException("No reachability analysis has run",
                    "ANALYSIS_NOT_RUN");
        }
        return run;
    }

    /**
     * Builds the zombie report of the latest run.
     *
     * @return the report
     * @throws DomainException with code {@code ANALYSIS_NOT_RUN}
     */
    public ZombieReport report() {
        final AnalysisRun run = requireLatest();
        return ZombieReport.of(run.graph(), run.result());
    }

    private AnalysisRun record(final DependencyGraph graph,
            final ReachabilityResult result) {
        final AnalysisRun run = new AnalysisRun(graph, result);
        latest.accumulateAndGet(run, (current, candidate) ->
                current == null || candidate.graph().generation()
                        >= current.graph().generation() ? candidate : current);
        return run;
    }

    /**
     * A result together with the generation it was computed on.
     *
     * @param graph the analysed graph
     * @param result the reachability overlay
     */
    public record AnalysisRun(DependencyGraph graph,
            ReachabilityResult result) {}

}
