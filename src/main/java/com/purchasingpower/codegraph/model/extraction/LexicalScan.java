package com.purchasingpower.codegraph.model.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one language extractor over one file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LexicalScan {

    @Builder.Default
    private List<ExtractedEntity> entities = new ArrayList<>();

    /**
     * Dependencies with the raw specifier only; path resolution happens in the
     * entity extractor, which knows the file system.
     */
    @Builder.Default
    private List<DependencyReference> dependencies = new ArrayList<>();

    public static LexicalScan empty() {
        return LexicalScan.builder().build();
    }
}
