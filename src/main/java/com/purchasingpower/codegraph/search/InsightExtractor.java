package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import com.purchasingpower.codegraph.model.query.GraphInsight;

import java.util.List;

/**
 * Derives insights from a query's result subgraph.
 *
 * @since 1.0.0
 */
public interface InsightExtractor {

    /**
     * @param nodes result nodes, in rank order
     * @param relationships relationships touching the result nodes
     * @return hub insights in node order, then cycle insights, then one isolation insight if any
     */
    List<GraphInsight> extract(List<GraphNode> nodes, List<GraphRelationship> relationships);
}
