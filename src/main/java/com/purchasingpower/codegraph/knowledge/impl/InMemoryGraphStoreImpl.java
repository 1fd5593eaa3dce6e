package com.purchasingpower.codegraph.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.KnowledgeGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the published graph in memory. Publishing is a single reference swap.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class InMemoryGraphStoreImpl implements GraphStore {

    private final AtomicReference<KnowledgeGraph> published = new AtomicReference<>(KnowledgeGraph.empty());

    @Override
    public KnowledgeGraph current() {
        return published.get();
    }

    @Override
    public void publish(KnowledgeGraph graph) {
        Preconditions.checkNotNull(graph, "Graph cannot be null");
        KnowledgeGraph previous = published.getAndSet(graph);
        log.debug("Published graph with {} nodes (replaced {} nodes)", graph.nodeCount(), previous.nodeCount());
    }
}
