package com.purchasingpower.codegraph.model.query;

import com.purchasingpower.codegraph.model.graph.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Hard excludes applied before ranking. Empty collections mean "no filter".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryFilters {

    @Builder.Default
    private Set<NodeType> nodeTypes = EnumSet.noneOf(NodeType.class);

    /**
     * Substrings matched against a node's source location.
     */
    @Builder.Default
    private List<String> filePaths = new ArrayList<>();

    /**
     * Concept ids or names; a node passes if its name contains a keyword of
     * one of them.
     */
    @Builder.Default
    private List<String> concepts = new ArrayList<>();

    public static QueryFilters none() {
        return QueryFilters.builder().build();
    }
}
