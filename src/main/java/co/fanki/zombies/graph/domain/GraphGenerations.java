package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the published graph generation.
 *
 * <p>Readers pin the generation returned by {@link #require()} for the
 * whole of one query; a concurrent publish never changes a graph a reader
 * already holds.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphGenerations {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphGenerations.class);

    private final AtomicReference<DependencyGraph> current =
            new AtomicReference<>();

    /**
     * Publishes a generation, replacing the current one.
     *
     * @param graph the frozen graph
     * @return the previous generation, or null
     */
    public DependencyGraph publish(final DependencyGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        final DependencyGraph previous = current.getAndSet(graph);
        LOG.info("Published graph generation {} ({} nodes, {} edges)",
                graph.generation(), graph.nodeCount(), graph.edgeCount());
        return previous;
    }

    /** @return the current generation, if any was published */
    public Optional<DependencyGraph> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Returns the current generation.
     *
     * @return the graph
     * @throws DomainException with code {@code GRAPH_NOT_BUILT} if nothing
     *         was published yet
     */
    public DependencyGraph require() {
        final DependencyGraph graph = current.get();
        if (graph == null) {
            throw new DomainException("No graph generation has been built",
                    "GRAPH_NOT_BUILT");
        }
        return graph;
    }

}
