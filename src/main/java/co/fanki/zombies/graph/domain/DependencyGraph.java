package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable, frozen generation of the dependency graph.
 *
 * <p>Nodes are sorted by id and addressed by compact {@code int} indices;
 * edges are sorted by {@link DependencyEdge#ORDER}. Both orders depend only
 * on the graph content, never on the order facts were ingested in, which
 * keeps every traversal deterministic.</p>
 *
 * <p>Forward and reverse adjacency are {@link Adjacency} indices over the
 * edge array. Every edge endpoint is guaranteed to be a node of this
 * graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    private final long generation;
    private final Instant createdAt;
    private final List<CodeSymbol> symbols;
    private final Map<String, Integer> indexById;
    private final List<DependencyEdge> edges;
    private final int[] edgeSources;
    private final int[] edgeTargets;
    private final Adjacency forward;
    private final Adjacency reverse;
    private final int[] roots;
    private final List<DanglingReference> danglingReferences;
    private final List<Diagnostic> diagnostics;

    private DependencyGraph(final long theGeneration,
            final Instant theCreatedAt,
            final List<CodeSymbol> theSymbols,
            final List<DependencyEdge> theEdges,
            final Adjacency theForward,
            final Adjacency theReverse,
            final List<DanglingReference> theDanglingReferences,
            final List<Diagnostic> theDiagnostics) {

        this.generation = theGeneration;
        this.createdAt = theCreatedAt;
        this.symbols = Collections.unmodifiableList(theSymbols);
        this.edges = Collections.unmodifiableList(theEdges);
        this.danglingReferences = List.copyOf(theDanglingReferences);
        this.diagnostics = List.copyOf(theDiagnostics);

        this.indexById = new HashMap<>(theSymbols.size() * 2);
        final List<Integer> rootList = new ArrayList<>();
        for (int i = 0; i < theSymbols.size(); i++) {
            final CodeSymbol symbol = theSymbols.get(i);
            if (indexById.put(symbol.id(), i) != null) {
                throw new DomainException("Duplicate node " + symbol.id(),
                        "INVALID_GRAPH");
            }
            if (symbol.activeRoot()) {
                rootList.add(i);
            }
        }
        this.roots = rootList.stream().mapToInt(Integer::intValue).toArray();

        this.edgeSources = new int[theEdges.size()];
        this.edgeTargets = new int[theEdges.size()];
        for (int e = 0; e < theEdges.size(); e++) {
            final DependencyEdge edge = theEdges.get(e);
            edgeSources[e] = requireNode(edge.sourceId(), edge);
            edgeTargets[e] = requireNode(edge.targetId(), edge);
        }

        this.forward = theForward != null ? theForward
                : Adjacency.build(theSymbols.size(), edgeSources);
        this.reverse = theReverse != null ? theReverse
                : Adjacency.build(theSymbols.size(), edgeTargets);
    }

    /**
     * Freezes a set of symbols and edges into a new generation.
     *
     * @param generation the generation number
     * @param symbols the nodes, in any order
     * @param edges the edges, in any order, already deduplicated
     * @param danglingReferences unresolved references
     * @param diagnostics build diagnostics
     * @return the frozen graph
     * @throws DomainException with code {@code INVALID_EDGE} if an edge
     *         points to a node that is not part of the graph
     */
    public static DependencyGraph freeze(final long generation,
            final Collection<CodeSymbol> symbols,
            final Collection<DependencyEdge> edges,
            final Collection<DanglingReference> danglingReferences,
            final Collection<Diagnostic> diagnostics) {

        Preconditions.requireNonNull(symbols, "Symbols are required");
        Preconditions.requireNonNull(edges, "Edges are required");

        final List<CodeSymbol> sortedSymbols = new ArrayList<>(symbols);
        sortedSymbols.sort(Comparator.comparing(CodeSymbol::id));
        final List<DependencyEdge> sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(DependencyEdge.ORDER);

        final List<DanglingReference> dangling =
                new ArrayList<>(danglingReferences);
        dangling.sort(Comparator.comparing(DanglingReference::fileKey)
                .thenComparingInt(DanglingReference::line)
                .thenComparing(DanglingReference::target)
                .thenComparing(DanglingReference::sourceId));

        final List<Diagnostic> sortedDiagnostics = new ArrayList<>(diagnostics);
        sortedDiagnostics.sort(Comparator.comparing(Diagnostic::kind)
                .thenComparing(Diagnostic::subject)
                .thenComparing(Diagnostic::message)
                .thenComparing(Diagnostic::fileKey,
                        Comparator.nullsFirst(Comparator.naturalOrder())));

        return new DependencyGraph(generation, Instant.now(), sortedSymbols,
                sortedEdges, null, null, dangling, sortedDiagnostics);
    }

    /**
     * Rebuilds a generation from persisted state.
     *
     * <p>Symbols and edges must be in canonical order, as written by the
     * snapshot store; the persisted adjacency indices are checked against
     * the node and edge counts.</p>
     *
     * @param generation the generation number
     * @param createdAt the original creation instant
     * @param symbols the nodes, sorted by id
     * @param edges the edges, sorted canonically
     * @param forward the persisted forward index
     * @param reverse the persisted reverse index
     * @param danglingReferences unresolved references
     * @param diagnostics build diagnostics
     * @return the graph
     */
    public static DependencyGraph restore(final long generation,
            final Instant createdAt, final List<CodeSymbol> symbols,
            final List<DependencyEdge> edges, final Adjacency forward,
            final Adjacency reverse,
            final List<DanglingReference> danglingReferences,
            final List<Diagnostic> diagnostics) {
        return new DependencyGraph(generation, createdAt,
                new ArrayList<>(symbols), new ArrayList<>(edges), forward,
                reverse, danglingReferences, diagnostics);
    }

    private int requireNode(final String id, final DependencyEdge edge) {
        final Integer index = indexById.get(id);
        if (index == null) {
            throw new DomainException("Edge " + edge.sourceId() + " -> "
                    + edge.targetId() + " points to unknown node " + id,
                    "INVALID_EDGE");
        }
        return index;
    }

    /** @return the generation number */
    public long generation() {
        return generation;
    }

    /** @return when this generation was frozen */
    public Instant createdAt() {
        return createdAt;
    }

    /** @return the node count */
    public int nodeCount() {
        return symbols.size();
    }

    /** @return the edge count */
    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns the compact index of a node.
     *
     * @param id the symbol id
     * @return the index, or -1 if the node is unknown
     */
    public int indexOf(final String id) {
        if (id == null) {
            return -1;
        }
        final Integer index = indexById.get(id);
        return index == null ? -1 : index;
    }

    /**
     * Checks if the graph contains a node.
     *
     * @param id the symbol id
     * @return true if present
     */
    public boolean contains(final String id) {
        return indexOf(id) >= 0;
    }

    /**
     * Returns the symbol at an index.
     *
     * @param index the node index
     * @return the symbol
     */
    public CodeSymbol symbol(final int index) {
        return symbols.get(index);
    }

    /**
     * Returns the symbol with an id.
     *
     * @param id the symbol id
     * @return the symbol, empty if unknown
     */
    public Optional<CodeSymbol> symbol(final String id) {
        final int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(symbols.get(index));
    }

    /** @return all symbols sorted by id */
    public List<CodeSymbol> symbols() {
        return symbols;
    }

    /** @return all edges in canonical order */
    public List<DependencyEdge> edges() {
        return edges;
    }

    /**
     * Returns the edge at an index.
     *
     * @param edgeIndex the edge index
     * @return the edge
     */
    public DependencyEdge edge(final int edgeIndex) {
        return edges.get(edgeIndex);
    }

    /**
     * Returns the source node index of an edge.
     *
     * @param edgeIndex the edge index
     * @return the source node index
     */
    public int edgeSource(final int edgeIndex) {
        return edgeSources[edgeIndex];
    }

    /**
     * Returns the target node index of an edge.
     *
     * @param edgeIndex the edge index
     * @return the target node index
     */
    public int edgeTarget(final int edgeIndex) {
        return edgeTargets[edgeIndex];
    }

    /** @return the outgoing-edge index */
    public Adjacency forward() {
        return forward;
    }

    /** @return the incoming-edge index */
    public Adjacency reverse() {
        return reverse;
    }

    /** @return the active root indices, ascending */
    public int[] activeRoots() {
        return roots.clone();
    }

    /** @return the unresolved references */
    public List<DanglingReference> danglingReferences() {
        return danglingReferences;
    }

    /** @return the build diagnostics */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * Computes size and shape figures.
     *
     * @return the metrics
     */
    public GraphMetrics metrics() {
        int isolated = 0;
        int phantoms = 0;
        for (int n = 0; n < symbols.size(); n++) {
            if (forward.degree(n) == 0 && reverse.degree(n) == 0) {
                isolated++;
            }
            if (symbols.get(n).phantom()) {
                phantoms++;
            }
        }

        final Map<EdgeType, Integer> byType = new EnumMap<>(EdgeType.class);
        int lowConfidence = 0;
        for (final DependencyEdge edge : edges) {
            byType.merge(edge.type(), 1, Integer::sum);
            if (edge.lowConfidence()) {
                lowConfidence++;
            }
        }

        final double averageOutDegree = symbols.isEmpty()
                ? 0.0 : (double) edges.size() / symbols.size();

        return new GraphMetrics(symbols.size(), edges.size(), isolated,
                phantoms, roots.length, danglingReferences.size(),
                lowConfidence, averageOutDegree,
                Collections.unmodifiableMap(byType));
    }

}
