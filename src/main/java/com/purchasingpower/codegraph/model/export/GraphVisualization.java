package com.purchasingpower.codegraph.model.export;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Node/edge lists in the shape graph rendering libraries expect.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphVisualization {

    @Builder.Default
    private List<VisualNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<VisualEdge> edges = new ArrayList<>();
}
