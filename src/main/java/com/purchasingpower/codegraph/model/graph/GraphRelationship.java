package com.purchasingpower.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A typed, weighted edge between two nodes.
 *
 * <p>The id is the composite key {@code <from>_<type>_<to>}; a second insert
 * with the same key is ignored by the graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GraphRelationship {

    public static final double DEFAULT_CONFIDENCE = 0.8;

    private String id;
    private String fromNodeId;
    private String toNodeId;
    private RelationshipType type;

    @Builder.Default
    private double weight = 0.5;

    @Builder.Default
    private double confidence = DEFAULT_CONFIDENCE;

    private boolean bidirectional;

    public GraphRelationship copy() {
        return toBuilder().build();
    }

    public boolean touches(String nodeId) {
        return nodeId.equals(fromNodeId) || nodeId.equals(toNodeId);
    }
}
