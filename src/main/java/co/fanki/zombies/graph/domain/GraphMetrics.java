package co.fanki.zombies.graph.domain;

import java.util.Map;

/**
 * Size and shape figures of a frozen graph generation.
 *
 * @param totalNodes the node count
 * @param totalEdges the edge count
 * @param isolatedNodes nodes with neither incoming nor outgoing edges
 * @param phantomNodes placeholder nodes for undeclared entities
 * @param activeRoots designated entry points
 * @param danglingReferences unresolved references
 * @param lowConfidenceEdges edges linked by tie-break
 * @param averageOutDegree edges per node
 * @param edgesByType edge count per type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphMetrics(
        int totalNodes,
        int totalEdges,
        int isolatedNodes,
        int phantomNodes,
        int activeRoots,
        int danglingReferences,
        int lowConfidenceEdges,
        double averageOutDegree,
        Map<EdgeType, Integer> edgesByType) {}
