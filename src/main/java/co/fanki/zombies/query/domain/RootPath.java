package co.fanki.zombies.query.domain;

import co.fanki.zombies.graph.domain.DependencyEdge;

import java.util.List;

/**
 * Shortest chain of edges from an active root down to a symbol.
 *
 * @param symbolId the symbol
 * @param rootId the nearest root, null when isolated
 * @param edges the edges in order, from the root to the symbol
 * @param hops the number of edges, -1 when isolated
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RootPath(
        String symbolId,
        String rootId,
        List<DependencyEdge> edges,
        int hops) {

    /**
     * Creates the result for a symbol no root reaches.
     *
     * @param symbolId the symbol
     * @return the isolated result
     */
    public static RootPath isolated(final String symbolId) {
        return new RootPath(symbolId, null, List.of(), -1);
    }

    /**
     * Checks if a root reaches the symbol.
     *
     * @return true if a path was found
     */
    public boolean found() {
        return rootId != null;
    }
}
