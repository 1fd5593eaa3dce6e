package com.purchasingpower.codegraph.event;

public record QueryExecutedEvent(String queryText, int resultCount, long durationMs, double relevanceScore) {
}
