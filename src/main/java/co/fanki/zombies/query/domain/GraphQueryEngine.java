package co.fanki.zombies.query.domain;

import co.fanki.zombies.graph.domain.Adjacency;
import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DependencyEdge;
import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Traversal queries over one pinned graph generation.
 *
 * <p>Every traversal keeps an explicit visited set over compact node
 * indices and an explicit work queue or stack, so cycles never cause
 * repeated visits or deep recursion.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphQueryEngine {

    private final int depthCap;

    /**
     * Creates an engine.
     *
     * @param theDepthCap the hard depth limit applied to every traversal
     */
    public GraphQueryEngine(final int theDepthCap) {
        this.depthCap = Preconditions.requirePositive(theDepthCap,
                "Depth cap must be positive");
    }

    /**
     * Returns a symbol.
     *
     * @param graph the graph
     * @param symbolId the symbol id
     * @return the symbol
     * @throws DomainException with code {@code SYMBOL_NOT_FOUND}
     */
    public CodeSymbol symbol(final DependencyGraph graph,
            final String symbolId) {
        return graph.symbol(require(graph, symbolId));
    }

    /**
     * Returns what a symbol depends on, following outgoing edges.
     *
     * @param graph the graph
     * @param symbolId the start symbol
     * @param maxDepth the depth limit, null for the configured cap
     * @return the traversal result
     */
    public TraversalResult dependencies(final DependencyGraph graph,
            final String symbolId, final Integer maxDepth) {
        return traverse(graph, symbolId, maxDepth, true);
    }

    /**
     * Returns what depends on a symbol, following incoming edges.
     *
     * @param graph the graph
     * @param symbolId the start symbol
     * @param maxDepth the depth limit, null for the configured cap
     * @return the traversal result
     */
    public TraversalResult dependents(final DependencyGraph graph,
            final String symbolId, final Integer maxDepth) {
        return traverse(graph, symbolId, maxDepth, false);
    }

    /**
     * Finds the shortest chain of edges from an active root to a symbol.
     *
     * <p>Breadth-first search backwards along incoming edges. Among
     * equally near roots the first one met in canonical edge order
     * wins.</p>
     *
     * @param graph the graph
     * @param symbolId the symbol
     * @return the path, or an isolated result when no root reaches it
     */
    public RootPath pathToNearestRoot(final DependencyGraph graph,
            final String symbolId) {
        final int start = require(graph, symbolId);
        if (graph.symbol(start).activeRoot()) {
            return new RootPath(symbolId, symbolId, List.of(), 0);
        }

        final Adjacency reverse = graph.reverse();
        final Map<Integer, Integer> reachedBy = new HashMap<>();
        final BitSet visited = new BitSet(graph.nodeCount());
        visited.set(start);
        int[] queue = new int[16];
        int head = 0;
        int tail = 0;
        queue[tail++] = start;

        while (head < tail) {
            final int node = queue[head++];
            for (int p = reverse.start(node); p < reverse.end(node); p++) {
                final int edge = reverse.edgeAt(p);
                final int source = graph.edgeSource(edge);
                if (visited.get(source)) {
                    continue;
                }
                visited.set(source);
                reachedBy.put(source, edge);
                if (graph.symbol(source).activeRoot()) {
                    return pathFrom(graph, symbolId, source, start,
                            reachedBy);
                }
                if (tail == queue.length) {
                    queue = Arrays.copyOf(queue, queue.length * 2);
                }
                queue[tail++] = source;
            }
        }
        return RootPath.isolated(symbolId);
    }

    private RootPath pathFrom(final DependencyGraph graph,
            final String symbolId, final int root, final int start,
            final Map<Integer, Integer> reachedBy) {
        final List<DependencyEdge> edges = new ArrayList<>();
        int node = root;
        while (node != start) {
            final int edge = reachedBy.get(node);
            edges.add(graph.edge(edge));
            node = graph.edgeTarget(edge);
        }
        return new RootPath(symbolId, graph.symbol(root).id(),
                List.copyOf(edges), edges.size());
    }

    private TraversalResult traverse(final DependencyGraph graph,
            final String symbolId, final Integer maxDepth,
            final boolean outgoing) {
        final int start = require(graph, symbolId);
        final int limit = maxDepth == null ? depthCap
                : Math.min(Preconditions.requireNonNegative(maxDepth,
                        "Max depth must not be negative"), depthCap);
        final Adjacency adjacency = outgoing ? graph.forward()
                : graph.reverse();

        final BitSet explored = new BitSet(graph.nodeCount());
        explored.set(start);
        final List<TraversalHit> hits = new ArrayList<>();
        int[] frontier = {start};
        int depth = 0;
        boolean truncated = false;

        while (frontier.length > 0) {
            if (depth == limit) {
                truncated = hasUnexplored(graph, adjacency, frontier,
                        explored, outgoing);
                break;
            }
            depth++;
            int[] next = new int[Math.max(4, frontier.length)];
            int size = 0;
            for (final int node : frontier) {
                for (int p = adjacency.start(node); p < adjacency.end(node);
                        p++) {
                    final int edge = adjacency.edgeAt(p);
                    final int other = other(graph, edge, outgoing);
                    if (explored.get(other)) {
                        continue;
                    }
                    explored.set(other);
                    hits.add(new TraversalHit(graph.symbol(other), depth,
                            graph.edge(edge)));
                    if (size == next.length) {
                        next = Arrays.copyOf(next, size * 2);
                    }
                    next[size++] = other;
                }
            }
            frontier = Arrays.copyOf(next, size);
        }

        return new TraversalResult(symbolId, graph.generation(), limit,
                List.copyOf(hits), truncated,
                cycleEdges(graph, adjacency, start, explored, outgoing));
    }

    private static boolean hasUnexplored(final DependencyGraph graph,
            final Adjacency adjacency, final int[] frontier,
            final BitSet explored, final boolean outgoing) {
        for (final int node : frontier) {
            for (int p = adjacency.start(node); p < adjacency.end(node);
                    p++) {
                if (!explored.get(other(graph, adjacency.edgeAt(p),
                        outgoing))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Back edges of an iterative colour DFS restricted to the explored
     * region. Each one closes a cycle.
     */
    private static List<DependencyEdge> cycleEdges(
            final DependencyGraph graph, final Adjacency adjacency,
            final int start, final BitSet explored, final boolean outgoing) {
        final List<DependencyEdge> cycles = new ArrayList<>();
        final BitSet gray = new BitSet(graph.nodeCount());
        final BitSet black = new BitSet(graph.nodeCount());
        int[] stackNode = new int[16];
        int[] stackPos = new int[16];

        int root = start;
        while (root >= 0) {
            int top = 0;
            stackNode[0] = root;
            stackPos[0] = adjacency.start(root);
            gray.set(root);

            while (top >= 0) {
                final int node = stackNode[top];
                final int position = stackPos[top];
                if (position < adjacency.end(node)) {
                    stackPos[top]++;
                    final int edge = adjacency.edgeAt(position);
                    final int next = other(graph, edge, outgoing);
                    if (!explored.get(next) || black.get(next)) {
                        continue;
                    }
                    if (gray.get(next)) {
                        cycles.add(graph.edge(edge));
                        continue;
                    }
                    if (++top == stackNode.length) {
                        stackNode = Arrays.copyOf(stackNode, top * 2);
                        stackPos = Arrays.copyOf(stackPos, top * 2);
                    }
                    stackNode[top] = next;
                    stackPos[top] = adjacency.start(next);
                    gray.set(next);
                } else {
                    gray.clear(node);
                    black.set(node);
                    top--;
                }
            }
            root = nextUnfinished(explored, black);
        }
        return List.copyOf(cycles);
    }

    private static int nextUnfinished(final BitSet explored,
            final BitSet black) {
        for (int n = explored.nextSetBit(0); n >= 0;
                n = explored.nextSetBit(n + 1)) {
            if (!black.get(n)) {
                return n;
            }
        }
        return -1;
    }

    private static int other(final DependencyGraph graph, final int edge,
            final boolean outgoing) {
        return outgoing ? graph.edgeTarget(edge) : graph.edgeSource(edge);
    }

    private static int require(final DependencyGraph graph,
            final String symbolId) {
        final int index = graph.indexOf(symbolId);
        if (index < 0) {
            throw new DomainException("Symbol not found: " + symbolId,
                    "SYMBOL_NOT_FOUND");
        }
        return index;
    }

}
