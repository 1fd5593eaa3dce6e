package com.purchasingpower.codegraph.model.query;

import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    /**
     * Matched nodes, best match first.
     */
    @Builder.Default
    private List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<GraphRelationship> relationships = new ArrayList<>();

    private double relevanceScore;

    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

    @Builder.Default
    private List<GraphInsight> insights = new ArrayList<>();

    /**
     * Cosine similarity of each matched node to the query, keyed by node id.
     */
    @Builder.Default
    private Map<String, Double> similarityScores = new LinkedHashMap<>();

    public static QueryResult empty(List<String> suggestions) {
        return QueryResult.builder()
            .suggestions(new ArrayList<>(suggestions))
            .build();
    }
}
