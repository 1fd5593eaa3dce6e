package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Edge types in the code knowledge graph.
 */
public enum RelationshipType {
    IMPORTS,
    EXPORTS,
    CALLS,
    EXTENDS,
    IMPLEMENTS,
    USES,
    DEPENDS_ON,
    SIMILAR_TO,
    PART_OF;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
