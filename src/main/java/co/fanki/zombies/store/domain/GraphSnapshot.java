package co.fanki.zombies.store.domain;

import co.fanki.zombies.graph.domain.Adjacency;
import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DanglingReference;
import co.fanki.zombies.graph.domain.DependencyEdge;
import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.graph.domain.Diagnostic;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of a graph generation.
 *
 * <p>Written as two consecutive values: the {@link Header}, read and
 * checked on its own before anything else, then this body.</p>
 *
 * @param nodes the nodes, in index order
 * @param edges the edges, in index order
 * @param forwardOffsets the forward adjacency offsets
 * @param forwardEdges the forward adjacency edge indices
 * @param reverseOffsets the reverse adjacency offsets
 * @param reverseEdges the reverse adjacency edge indices
 * @param dangling the unresolved references
 * @param diagnostics the build diagnostics
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
record GraphSnapshot(
        List<CodeSymbol> nodes,
        List<DependencyEdge> edges,
        int[] forwardOffsets,
        int[] forwardEdges,
        int[] reverseOffsets,
        int[] reverseEdges,
        List<DanglingReference> dangling,
        List<Diagnostic> diagnostics) {

    /**
     * Snapshot header.
     *
     * @param format the format tag
     * @param schemaVersion the schema version
     * @param generation the graph generation
     * @param createdAtMillis the graph creation instant, epoch millis
     * @param nodeCount the number of nodes in the body
     * @param edgeCount the number of edges in the body
     */
    record Header(String format, int schemaVersion, long generation,
            long createdAtMillis, int nodeCount, int edgeCount) {}

    static Header headerOf(final DependencyGraph graph, final String format,
            final int schemaVersion) {
        return new Header(format, schemaVersion, graph.generation(),
                graph.createdAt().toEpochMilli(), graph.nodeCount(),
                graph.edgeCount());
    }

    static GraphSnapshot of(final DependencyGraph graph) {
        return new GraphSnapshot(graph.symbols(), graph.edges(),
                graph.forward().offsets(), graph.forward().edges(),
                graph.reverse().offsets(), graph.reverse().edges(),
                graph.danglingReferences(), graph.diagnostics());
    }

    DependencyGraph toGraph(final Header header) {
        final int nodeCount = nodes.size();
        final int edgeCount = edges.size();
        return DependencyGraph.restore(header.generation(),
                Instant.ofEpochMilli(header.createdAtMillis()), nodes, edges,
                Adjacency.restore(nodeCount, edgeCount, forwardOffsets,
                        forwardEdges),
                Adjacency.restore(nodeCount, edgeCount, reverseOffsets,
                        reverseEdges),
                dangling == null ? List.of() : dangling,
                diagnostics == null ? List.of() : diagnostics);
    }

}
