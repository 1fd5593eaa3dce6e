package com.purchasingpower.codegraph.model.extraction;

import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declaration found by a lexical rule, before it is turned into a graph node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedEntity {

    private NodeType type;
    private String name;
    private int line;

    /**
     * Character offset of the declared name in the file content. Call-site
     * scanning skips identifiers starting at a declaration offset.
     */
    private int nameOffset;

    @Builder.Default
    private double importance = 0.5;

    @Builder.Default
    private Map<String, AttributeValue> metadata = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, AttributeValue> attributes = new LinkedHashMap<>();
}
