package com.purchasingpower.codegraph.model.export;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualEdge {

    private String id;
    private String source;
    private String target;
    private String label;
    private double weight;
}
