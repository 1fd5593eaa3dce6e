package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Node types in the code knowledge graph.
 */
public enum NodeType {
    FILE,
    FUNCTION,
    CLASS,
    INTERFACE,
    VARIABLE,
    MODULE,
    CONCEPT;

    /**
     * Lower-case name used in ids, exports and visualization payloads.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
