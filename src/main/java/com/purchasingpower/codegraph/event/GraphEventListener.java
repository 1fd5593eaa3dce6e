package com.purchasingpower.codegraph.event;

/**
 * Observer for build and query completion.
 *
 * <p>Spring beans implementing this interface are registered automatically;
 * other listeners can be added through {@code KnowledgeGraphService#addListener}.
 * Callbacks run on the build or query thread, so they should return quickly.
 */
public interface GraphEventListener {

    default void onGraphBuilt(GraphBuiltEvent event) {
    }

    default void onQueryExecuted(QueryExecutedEvent event) {
    }
}
