package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.GraphNode;

import java.util.List;

/**
 * Finds pairs of nodes whose vectors are closer than a threshold.
 *
 * <p>The default implementation compares every pair. An approximate
 * nearest-neighbour index can replace it without changing callers.
 */
public interface SimilarityIndex {

    /**
     * @param nodes nodes with semantic vectors, in graph order
     * @param threshold pairs with similarity strictly above this are returned
     * @param cancellationToken checked between rows
     * @return each unordered pair once, first node earlier in {@code nodes}
     */
    List<SimilarPair> findSimilarPairs(List<GraphNode> nodes, double threshold, CancellationToken cancellationToken);

    record SimilarPair(String firstNodeId, String secondNodeId, double similarity) {
    }
}
