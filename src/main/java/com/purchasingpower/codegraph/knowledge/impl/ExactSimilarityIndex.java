package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.knowledge.CancellationToken;
import com.purchasingpower.codegraph.knowledge.SimilarityIndex;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares every unordered pair of nodes. O(n^2) in node count, which caps
 * the practical tree size; swap in an approximate index for large trees.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ExactSimilarityIndex implements SimilarityIndex {

    @Override
    public List<SimilarPair> findSimilarPairs(List<GraphNode> nodes, double threshold,
                                              CancellationToken cancellationToken) {
        List<SimilarPair> pairs = new ArrayList<>();

        for (int i = 0; i < nodes.size(); i++) {
            cancellationToken.throwIfCancellationRequested("similarity discovery");
            GraphNode first = nodes.get(i);
            if (first.getSemanticVector() == null) {
                continue;
            }
            for (int j = i + 1; j < nodes.size(); j++) {
                GraphNode second = nodes.get(j);
                double similarity = VectorMath.cosineSimilarity(first.getSemanticVector(), second.getSemanticVector());
                if (similarity > threshold) {
                    pairs.add(new SimilarPair(first.getId(), second.getId(), similarity));
                }
            }
        }

        log.debug("Compared {} nodes pairwise, {} pairs above {}", nodes.size(), pairs.size(), threshold);
        return pairs;
    }
}
