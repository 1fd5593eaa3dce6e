package com.purchasingpower.codegraph.model.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InsightType {
    PATTERN,
    ANOMALY,
    OPTIMIZATION,
    VULNERABILITY,
    ARCHITECTURE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
