package co.fanki.zombies.query.domain;

import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DependencyEdge;

/**
 * A symbol found by a traversal.
 *
 * @param symbol the symbol
 * @param depth the hops from the start symbol, at least 1
 * @param via the edge that first reached the symbol
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TraversalHit(CodeSymbol symbol, int depth, DependencyEdge via) {}
