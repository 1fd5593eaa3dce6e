package com.purchasingpower.codegraph.knowledge;

/**
 * Holder of the published knowledge graph.
 *
 * <p>Builds publish a complete snapshot in one step; readers always see
 * either the previous or the new graph, never one in progress.
 */
public interface GraphStore {

    /**
     * The currently published graph, an empty graph before the first build.
     */
    KnowledgeGraph current();

    /**
     * Replace the published graph.
     */
    void publish(KnowledgeGraph graph);
}
