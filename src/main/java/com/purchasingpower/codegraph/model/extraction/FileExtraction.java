package com.purchasingpower.codegraph.model.extraction;

import com.purchasingpower.codegraph.model.graph.GraphNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything extracted from a single source file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileExtraction {

    private String relativePath;
    private GraphNode fileNode;

    @Builder.Default
    private List<GraphNode> entityNodes = new ArrayList<>();

    @Builder.Default
    private List<DependencyReference> dependencies = new ArrayList<>();

    @Builder.Default
    private List<CallSite> callSites = new ArrayList<>();
}
