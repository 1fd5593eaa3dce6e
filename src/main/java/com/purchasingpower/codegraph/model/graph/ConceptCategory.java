package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConceptCategory {
    DESIGN_PATTERN,
    ARCHITECTURE,
    ALGORITHM,
    DATA_STRUCTURE,
    BUSINESS_LOGIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
