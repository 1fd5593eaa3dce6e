package com.purchasingpower.codegraph.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticQuery {

    private String text;

    @Builder.Default
    private QueryIntent intent = QueryIntent.SEARCH;

    @Builder.Default
    private QueryFilters filters = QueryFilters.none();

    public static SemanticQuery search(String text) {
        return SemanticQuery.builder().text(text).build();
    }
}
