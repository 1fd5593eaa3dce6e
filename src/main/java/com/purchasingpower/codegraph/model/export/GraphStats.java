package com.purchasingpower.codegraph.model.export;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStats {

    private int nodeCount;
    private int relationshipCount;
    private int conceptCount;

    /**
     * Node count per type wire name, only types that occur.
     */
    @Builder.Default
    private Map<String, Integer> nodeTypeDistribution = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> relationshipTypeDistribution = new LinkedHashMap<>();
}
