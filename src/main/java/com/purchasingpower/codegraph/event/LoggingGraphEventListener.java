package com.purchasingpower.codegraph.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes build and query telemetry to the application log.
 */
@Slf4j
@Component
public class LoggingGraphEventListener implements GraphEventListener {

    @Override
    public void onGraphBuilt(GraphBuiltEvent event) {
        log.info("Knowledge graph built for {}: {} nodes, {} relationships, {} concepts in {}ms",
            event.rootPath(), event.nodeCount(), event.relationshipCount(),
            event.conceptCount(), event.durationMs());
    }

    @Override
    public void onQueryExecuted(QueryExecutedEvent event) {
        log.info("Query '{}' returned {} nodes in {}ms (relevance {})",
            event.queryText(), event.resultCount(), event.durationMs(),
            String.format("%.3f", event.relevanceScore()));
    }
}
