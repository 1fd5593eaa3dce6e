package com.purchasingpower.codegraph.model.query;

/**
 * What the caller wants out of a query.
 */
public enum QueryIntent {

    /**
     * Ranked lookup of matching entities.
     */
    SEARCH,

    /**
     * Lookup plus pattern insights for the matched entities.
     */
    ANALYSIS,

    /**
     * Lookup mainly for follow-up suggestions.
     */
    SUGGESTION,

    /**
     * Lookup plus pattern insights for the matched entities.
     */
    PATTERN_RECOGNITION
}
