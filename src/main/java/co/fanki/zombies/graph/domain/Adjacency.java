package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.DomainException;

import java.util.Arrays;

/**
 * Compressed adjacency index over compact node indices.
 *
 * <p>The edges of node {@code n} are the edge indices stored in
 * {@code edges[offsets[n] .. offsets[n + 1])}, in ascending edge order.
 * Two int arrays for the whole graph, no per-node objects.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Adjacency {

    private final int[] offsets;
    private final int[] edges;

    private Adjacency(final int[] theOffsets, final int[] theEdges) {
        this.offsets = theOffsets;
        this.edges = theEdges;
    }

    /**
     * Builds the index grouping edges by one of their endpoints.
     *
     * <p>Counting sort, stable in edge index.</p>
     *
     * @param nodeCount the number of nodes
     * @param endpoint for each edge index, the node it is grouped under
     * @return the adjacency index
     */
    public static Adjacency build(final int nodeCount, final int[] endpoint) {
        final int[] offsets = new int[nodeCount + 1];
        for (final int node : endpoint) {
            offsets[node + 1]++;
        }
        for (int i = 0; i < nodeCount; i++) {
            offsets[i + 1] += offsets[i];
        }
        final int[] cursor = Arrays.copyOf(offsets, nodeCount);
        final int[] edges = new int[endpoint.length];
        for (int e = 0; e < endpoint.length; e++) {
            edges[cursor[endpoint[e]]++] = e;
        }
        return new Adjacency(offsets, edges);
    }

    /**
     * Restores a persisted index, checking it fits the graph.
     *
     * @param nodeCount the number of nodes
     * @param edgeCount the number of edges
     * @param offsets the persisted offsets
     * @param edges the persisted edge indices
     * @return the adjacency index
     * @throws DomainException if the arrays do not fit the graph
     */
    public static Adjacency restore(final int nodeCount, final int edgeCount,
            final int[] offsets, final int[] edges) {
        if (offsets == null || edges == null
                || offsets.length != nodeCount + 1
                || edges.length != edgeCount
                || offsets[0] != 0
                || offsets[nodeCount] != edgeCount) {
            throw new DomainException("Adjacency index does not match graph",
                    "SNAPSHOT_CORRUPT");
        }
        for (int n = 0; n < nodeCount; n++) {
            if (offsets[n] > offsets[n + 1]) {
                throw new DomainException("Adjacency offsets decrease at node "
                        + n, "SNAPSHOT_CORRUPT");
            }
        }
        for (int p = 0; p < edgeCount; p++) {
            if (edges[p] < 0 || edges[p] >= edgeCount) {
                throw new DomainException("Adjacency edge index out of range: "
                        + edges[p], "SNAPSHOT_CORRUPT");
            }
        }
        return new Adjacency(offsets.clone(), edges.clone());
    }

    /**
     * First position of a node's edges.
     *
     * @param node the node index
     * @return the inclusive start position
     */
    public int start(final int node) {
        return offsets[node];
    }

    /**
     * End position of a node's edges.
     *
     * @param node the node index
     * @return the exclusive end position
     */
    public int end(final int node) {
        return offsets[node + 1];
    }

    /**
     * Edge index stored at a position.
     *
     * @param position a position between {@link #start} and {@link #end}
     * @return the edge index
     */
    public int edgeAt(final int position) {
        return edges[position];
    }

    /**
     * Number of edges of a node.
     *
     * @param node the node index
     * @return the degree
     */
    public int degree(final int node) {
        return offsets[node + 1] - offsets[node];
    }

    /** @return a copy of the offsets array, for persistence */
    public int[] offsets() {
        return offsets.clone();
    }

    /** @return a copy of the edge index array, for persistence */
    public int[] edges() {
        return edges.clone();
    }

}
