package com.purchasingpower.codegraph.knowledge;

/**
 * Detects architectural patterns, design patterns, anti-patterns and domain
 * terms in an assembled graph and records them as concepts.
 *
 * <p>Detection is additive and idempotent: running it twice on the same
 * graph yields the same concept set.
 */
public interface PatternRecognizer {

    /**
     * @return number of concepts in the graph after recognition
     */
    int recognize(WorkingGraph graph);
}
