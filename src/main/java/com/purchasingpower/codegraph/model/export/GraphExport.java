package com.purchasingpower.codegraph.model.export;

import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON-serializable snapshot of the published graph, for persistence
 * collaborators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphExport {

    @Builder.Default
    private List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<GraphRelationship> relationships = new ArrayList<>();

    @Builder.Default
    private List<Concept> concepts = new ArrayList<>();

    private ExportMetadata metadata;
}
