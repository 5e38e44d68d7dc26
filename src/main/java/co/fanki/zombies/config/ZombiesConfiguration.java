package co.fanki.zombies.config;

import co.fanki.zombies.analysis.domain.ReachabilityAnalyzer;
import co.fanki.zombies.graph.domain.GraphGenerations;
import co.fanki.zombies.graph.domain.link.SemanticLinkConfig;
import co.fanki.zombies.query.domain.GraphQueryEngine;
import co.fanki.zombies.store.domain.GraphSnapshotStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the graph core components from {@code zombies.*} properties.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ZombiesConfiguration {

    /**
     * The published graph generation, shared by builders and readers.
     *
     * @return the generation holder
     */
    @Bean
    public GraphGenerations graphGenerations() {
        return new GraphGenerations();
    }

    /**
     * Worker pool for parallel ingestion.
     *
     * @param workers the number of ingestion threads
     * @return the executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ingestExecutor(
            @Value("${zombies.ingest.workers:4}") final int workers) {
        return Executors.newFixedThreadPool(Math.max(1, workers),
                named("zombies-ingest-"));
    }

    /**
     * Single background thread running reachability analyses.
     *
     * @return the executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor() {
        return Executors.newSingleThreadExecutor(named("zombies-analysis-"));
    }

    /**
     * The semantic link detector families to run during builds.
     *
     * @param ormMapping whether mapper XML statements are linked
     * @param storedProcedures whether procedure calls are linked
     * @param schedulerScripts whether scheduler scripts are linked
     * @param sqlTableAccess whether SQL table access is linked
     * @return the link configuration
     */
    @Bean
    public SemanticLinkConfig semanticLinkConfig(
            @Value("${zombies.links.orm-mapping:true}")
            final boolean ormMapping,
            @Value("${zombies.links.stored-procedures:true}")
            final boolean storedProcedures,
            @Value("${zombies.links.scheduler-scripts:true}")
            final boolean schedulerScripts,
            @Value("${zombies.links.sql-table-access:true}")
            final boolean sqlTableAccess) {
        return new SemanticLinkConfig(ormMapping, storedProcedures,
                schedulerScripts, sqlTableAccess);
    }

    /**
     * Reachability analyzer with the configured budgets.
     *
     * @param stepBudget the maximum number of expanded nodes per run
     * @param timeBudgetSeconds the maximum run time
     * @return the analyzer
     */
    @Bean
    public ReachabilityAnalyzer reachabilityAnalyzer(
            @Value("${zombies.analysis.step-budget:50000000}")
            final long stepBudget,
            @Value("${zombies.analysis.time-budget-seconds:120}")
            final long timeBudgetSeconds) {
        return new ReachabilityAnalyzer(stepBudget,
                Duration.ofSeconds(timeBudgetSeconds));
    }

    /**
     * Query engine with the configured depth cap.
     *
     * @param maxDepth the hard traversal depth limit
     * @return the engine
     */
    @Bean
    public GraphQueryEngine graphQueryEngine(
            @Value("${zombies.query.max-depth:64}") final int maxDepth) {
        return new GraphQueryEngine(maxDepth);
    }

    /**
     * Snapshot store.
     *
     * @param snapshotPath the snapshot file
     * @return the store
     */
    @Bean
    public GraphSnapshotStore graphSnapshotStore(
            @Value("${zombies.store.snapshot-path:"
                    + "${java.io.tmpdir}/zombies/graph.smile}")
            final String snapshotPath) {
        return new GraphSnapshotStore(Path.of(snapshotPath));
    }

    private static ThreadFactory named(final String prefix) {
        final AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            final Thread thread = new Thread(runnable,
                    prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

}
