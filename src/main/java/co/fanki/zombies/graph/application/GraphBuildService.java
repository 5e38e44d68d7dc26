package co.fanki.zombies.graph.application;

import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.GraphBuilder;
import co.fanki.zombies.graph.domain.GraphGenerations;
import co.fanki.zombies.graph.domain.RootDesignation;
import co.fanki.zombies.graph.domain.SymbolQualifiers;
import co.fanki.zombies.graph.domain.SymbolTable;
import co.fanki.zombies.graph.domain.link.SemanticLinkConfig;
import co.fanki.zombies.graph.domain.link.SemanticLinker;
import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;
import co.fanki.zombies.store.domain.GraphSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Builds graph generations from parser facts and publishes them.
 *
 * <p>One writer at a time: full builds, incremental merges and snapshot
 * loads are serialised on this service. Generation numbers keep growing
 * across full rebuilds. Every published generation is also written to the
 * snapshot store; a failed write is logged and does not undo the
 * publish.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class GraphBuildService {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphBuildService.class);

    private final GraphGenerations generations;
    private final GraphSnapshotStore store;
    private final ExecutorService ingestExecutor;
    private final int shards;
    private final SemanticLinkConfig linkConfig;

    private GraphBuilder builder;

    /**
     * Creates a new GraphBuildService.
     *
     * @param theGenerations the published generations
     * @param theStore the snapshot store
     * @param theIngestExecutor the ingestion worker pool
     * @param theShards the symbol table shard count
     * @param theLinkConfig the enabled detector families
     */
    public GraphBuildService(final GraphGenerations theGenerations,
            final GraphSnapshotStore theStore,
            @Qualifier("ingestExecutor")
            final ExecutorService theIngestExecutor,
            @Value("${zombies.symbols.shards:64}") final int theShards,
            final SemanticLinkConfig theLinkConfig) {
        this.generations = Preconditions.requireNonNull(theGenerations,
                "Generations are required");
        this.store = Preconditions.requireNonNull(theStore,
                "Snapshot store is required");
        this.ingestExecutor = theIngestExecutor;
        this.shards = Preconditions.requirePositive(theShards,
                "Shard count must be positive");
        this.linkConfig = Preconditions.requireNonNull(theLinkConfig,
                "Link config is required");
    }

    /**
     * Builds a new generation from scratch.
     *
     * <p>The new generation is numbered after the published one, so runs
     * recorded against older generations never win over it.</p>
     *
     * @param files the facts of every file
     * @param roots the active root designations
     * @return the published graph
     */
    public synchronized DependencyGraph build(
            final Collection<FileFacts> files,
            final Collection<RootDesignation> roots) {
        Preconditions.requireNonNull(files, "Files are required");
        Preconditions.requireNonNull(roots, "Roots are required");

        final long published = generations.current()
                .map(DependencyGraph::generation).orElse(0L);
        final GraphBuilder fresh = new GraphBuilder(
                new SymbolTable(shards, SymbolQualifiers.defaults()),
                SemanticLinker.of(linkConfig), published);
        fresh.ingestAll(files, ingestExecutor);
        final List<RootDesignation> unmatched = fresh.designateRoots(roots);
        if (!unmatched.isEmpty()) {
            LOG.warn("{} of {} root designations matched no symbol",
                    unmatched.size(), roots.size());
        }

        builder = fresh;
        return publish(fresh.freeze());
    }

    /**
     * Merges the new facts of one file into the current generation.
     *
     * <p>When the current generation was loaded from a snapshot, the
     * builder is first restored from it.</p>
     *
     * @param file the new facts of the file
     * @return the published graph
     * @throws DomainException with code {@code GRAPH_NOT_BUILT} if there
     *         is nothing to merge into
     */
    public synchronized DependencyGraph reingest(final FileFacts file) {
        Preconditions.requireNonNull(file, "File facts are required");
        if (builder == null) {
            builder = GraphBuilder.restore(generations.require(),
                    new SymbolTable(shards, SymbolQualifiers.defaults()),
                    SemanticLinker.of(linkConfig));
        }
        builder.reingest(file);
        return publish(builder.freeze());
    }

    /**
     * Publishes the snapshot if it can be read, otherwise rebuilds.
     *
     * @param facts supplies the facts of every file for a rebuild
     * @param roots the active root designations for a rebuild
     * @return the published graph
     */
    public synchronized DependencyGraph loadOrRebuild(
            final Supplier<Collection<FileFacts>> facts,
            final Collection<RootDesignation> roots) {
        Preconditions.requireNonNull(facts, "Facts supplier is required");
        final Optional<DependencyGraph> loaded = loadSnapshot();
        final Optional<DependencyGraph> current = generations.current();
        if (loaded.isPresent() && current.isPresent()
                && loaded.get().generation() <= current.get().generation()) {
            LOG.info("Snapshot generation {} is not newer than published"
                    + " generation {}, keeping it", loaded.get().generation(),
                    current.get().generation());
            return current.get();
        }
        if (loaded.isPresent()) {
            builder = null;
            generations.publish(loaded.get());
            return loaded.get();
        }
        LOG.info("Rebuilding graph from source facts");
        return build(facts.get(), roots);
    }

    private Optional<DependencyGraph> loadSnapshot() {
        try {
            return store.load();
        } catch (DomainException e) {
            LOG.warn("Discarding snapshot {} ({}): {}", store.path(),
                    e.getErrorCode(), e.getMessage());
            return Optional.empty();
        }
    }

    private DependencyGraph publish(final DependencyGraph graph) {
        generations.publish(graph);
        try {
            store.save(graph);
        } catch (DomainException e) {
            LOG.error("Generation {} published but not persisted: {}",
                    graph.generation(), e.getMessage(), e);
        }
        return graph;
    }

}
