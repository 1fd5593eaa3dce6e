package com.purchasingpower.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named pattern or domain term detected across the graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Concept {

    private String id;
    private String name;
    private String description;
    private ConceptCategory category;

    @Builder.Default
    private Set<String> keywords = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> relatedConcepts = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> codePatterns = new LinkedHashSet<>();

    private double confidence;

    /**
     * Nodes the detector matched, empty for graph-wide concepts.
     */
    @Builder.Default
    private List<String> affectedNodeIds = new ArrayList<>();

    public Concept copy() {
        return toBuilder()
            .keywords(new LinkedHashSet<>(keywords))
            .relatedConcepts(new LinkedHashSet<>(relatedConcepts))
            .codePatterns(new LinkedHashSet<>(codePatterns))
            .affectedNodeIds(new ArrayList<>(affectedNodeIds))
            .build();
    }
}
