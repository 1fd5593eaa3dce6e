package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.GraphNode;

/**
 * Builds the text a node is vectorized and indexed from.
 */
public interface NodeDescriptionGenerator {

    String describe(GraphNode node);
}
