package com.purchasingpower.codegraph.knowledge;

/**
 * Build phases, in execution order, plus terminal states.
 */
public enum BuildState {
    NOT_STARTED,
    DISCOVERING,
    EXTRACTING,
    LINKING,
    VECTORIZING,
    DISCOVERING_SIMILARITY,
    RECOGNIZING_PATTERNS,
    INDEXING,
    COMPLETED,
    FAILED,
    CANCELLED
}
