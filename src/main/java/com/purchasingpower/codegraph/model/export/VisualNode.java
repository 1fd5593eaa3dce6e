package com.purchasingpower.codegraph.model.export;

import com.purchasingpower.codegraph.model.graph.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualNode {

    private String id;
    private String label;
    private NodeType type;
    private double size;
    private String color;
}
