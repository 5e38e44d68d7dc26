package co.fanki.zombies.query.application;

import co.fanki.zombies.analysis.application.ReachabilityService;
import co.fanki.zombies.analysis.application.ReachabilityService.AnalysisRun;
import co.fanki.zombies.analysis.domain.ZombieFilter;
import co.fanki.zombies.analysis.domain.ZombieReport;
import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DanglingReference;
import co.fanki.zombies.graph.domain.Diagnostic;
import co.fanki.zombies.graph.domain.GraphGenerations;
import co.fanki.zombies.graph.domain.GraphMetrics;
import co.fanki.zombies.query.domain.GraphQueryEngine;
import co.fanki.zombies.query.domain.RootPath;
import co.fanki.zombies.query.domain.TraversalResult;
import co.fanki.zombies.shared.DomainException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only queries over the published graph generation.
 *
 * <p>Each call pins the generation current when it starts.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class GraphQueryService {

    private final GraphGenerations generations;
    private final GraphQueryEngine engine;
    private final ReachabilityService reachabilityService;

    /**
     * Creates a new GraphQueryService.
     *
     * @param theGenerations the published generations
     * @param theEngine the traversal engine
     * @param theReachabilityService the analysis results
     */
    public GraphQueryService(final GraphGenerations theGenerations,
            final GraphQueryEngine theEngine,
            final ReachabilityService theReachabilityService) {
        this.generations = theGenerations;
        this.engine = theEngine;
        this.reachabilityService = theReachabilityService;
    }

    /**
     * Looks up a symbol.
     *
     * @param symbolId the symbol id
     * @return the symbol
     * @throws DomainException with code {@code SYMBOL_NOT_FOUND}
     */
    public CodeSymbol symbol(final String symbolId) {
        return engine.symbol(generations.require(), symbolId);
    }

    /**
     * Returns what a symbol depends on.
     *
     * @param symbolId the symbol id
     * @param maxDepth the depth limit, null for the configured cap
     * @return the traversal
     */
    public TraversalResult dependencies(final String symbolId,
            final Integer maxDepth) {
        return engine.dependencies(generations.require(), symbolId,
                maxDepth);
    }

    /**
     * Returns what depends on a symbol.
     *
     * @param symbolId the symbol id
     * @param maxDepth the depth limit, null for the configured cap
     * @return the traversal
     */
    public TraversalResult dependents(final String symbolId,
            final Integer maxDepth) {
        return engine.dependents(generations.require(), symbolId, maxDepth);
    }

    /**
     * Returns the shortest path from an active root to a symbol.
     *
     * @param symbolId the symbol id
     * @return the path, isolated if no root reaches the symbol
     */
    public RootPath pathToNearestRoot(final String symbolId) {
        return engine.pathToNearestRoot(generations.require(), symbolId);
    }

    /**
     * Checks reachability against the latest analysis run.
     *
     * @param symbolId the symbol id
     * @return the answer with the generation and status it comes from
     * @throws DomainException with code {@code ANALYSIS_NOT_RUN} or
     *         {@code SYMBOL_NOT_FOUND}
     */
    public Reachability isReachable(final String symbolId) {
        final AnalysisRun run = reachabilityService.requireLatest();
        final int index = run.graph().indexOf(symbolId);
        if (index < 0) {
            throw new DomainException("Symbol not found: " + symbolId,
                    "SYMBOL_NOT_FOUND");
        }
        return new Reachability(symbolId, run.result().isReachable(index),
                run.graph().generation(), run.result().status().name());
    }

    /** @return the zombie report of the latest analysis run */
    public ZombieReport zombies() {
        return reachabilityService.report();
    }

    /**
     * Returns the zombie report of the latest analysis run, narrowed.
     *
     * @param filter the item filter
     * @return the filtered report
     */
    public ZombieReport zombies(final ZombieFilter filter) {
        return reachabilityService.report().filter(filter);
    }

    /** @return the metrics of the current generation */
    public GraphMetrics metrics() {
        return generations.require().metrics();
    }

    /** @return the unresolved references of the current generation */
    public List<DanglingReference> danglingReferences() {
        return generations.require().danglingReferences();
    }

    /** @return the build diagnostics of the current generation */
    public List<Diagnostic> diagnostics() {
        return generations.require().diagnostics();
    }

    /**
     * Reachability of one symbol.
     *
     * @param symbolId the symbol id
     * @param reachable true if an active root reaches it
     * @param generation the analysed generation
     * @param status the status of the run, the answer is authoritative
     *        only when COMPLETE
     */
    public record Reachability(String symbolId, boolean reachable,
            long generation, String status) {}

}
