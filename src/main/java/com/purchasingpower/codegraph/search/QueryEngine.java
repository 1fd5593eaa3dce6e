package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.knowledge.KnowledgeGraph;
import com.purchasingpower.codegraph.model.query.QueryResult;
import com.purchasingpower.codegraph.model.query.SemanticQuery;

/**
 * Semantic query over a graph snapshot.
 *
 * @since 1.0.0
 */
public interface QueryEngine {

    /**
     * Rank the graph's nodes against the query text.
     *
     * <p>Never throws for malformed input: a blank query or unknown filter
     * yields an empty or unfiltered result with a diagnostic suggestion.
     *
     * @param graph published snapshot, not modified
     * @param query text, intent and filters
     * @return ranked nodes with touching relationships, suggestions and insights
     */
    QueryResult query(KnowledgeGraph graph, SemanticQuery query);
}
