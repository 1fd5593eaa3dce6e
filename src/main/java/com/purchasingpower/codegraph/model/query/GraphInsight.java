package com.purchasingpower.codegraph.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A derived observation over a query's result subgraph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphInsight {

    private InsightType type;
    private String title;
    private String description;
    private double confidence;
    private boolean actionable;
    private String suggestion;

    @Builder.Default
    private List<String> affectedNodes = new ArrayList<>();
}
