package com.purchasingpower.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A typed entity in the code knowledge graph.
 *
 * <p>The id is content-addressed from the type and an identifier string
 * (see {@code GraphIds}), so re-inserting the same entity is idempotent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;
    private NodeType type;
    private String name;

    /**
     * Declaring file, relative to the build root. Absent for modules.
     */
    private String sourceLocation;

    @Builder.Default
    private Map<String, AttributeValue> metadata = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, AttributeValue> attributes = new LinkedHashMap<>();

    private double[] semanticVector;

    @Builder.Default
    private double importance = 0.5;

    private Instant lastUpdated;

    /**
     * Detached copy with its own maps and vector, safe to hand to callers.
     */
    public GraphNode copy() {
        return toBuilder()
            .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
            .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
            .semanticVector(semanticVector != null ? semanticVector.clone() : null)
            .build();
    }

    public Optional<AttributeValue> metadataValue(String key) {
        return Optional.ofNullable(metadata != null ? metadata.get(key) : null);
    }

    public Optional<AttributeValue> attributeValue(String key) {
        return Optional.ofNullable(attributes != null ? attributes.get(key) : null);
    }
}
