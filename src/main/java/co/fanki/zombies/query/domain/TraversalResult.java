package co.fanki.zombies.query.domain;

import co.fanki.zombies.graph.domain.DependencyEdge;

import java.util.List;

/**
 * Result of a dependencies or dependents query.
 *
 * @param symbolId the start symbol
 * @param generation the graph generation the query ran on
 * @param maxDepth the depth limit applied
 * @param hits the symbols found, in breadth-first order
 * @param truncated true if the depth limit stopped the traversal while
 *        symbols were still unexplored
 * @param cycleEdges edges closing a cycle within the explored region
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TraversalResult(
        String symbolId,
        long generation,
        int maxDepth,
        List<TraversalHit> hits,
        boolean truncated,
        List<DependencyEdge> cycleEdges) {

    /**
     * Checks if the explored region contains a cycle.
     *
     * @return true if at least one cycle edge was found
     */
    public boolean hasCycles() {
        return !cycleEdges.isEmpty();
    }
}
