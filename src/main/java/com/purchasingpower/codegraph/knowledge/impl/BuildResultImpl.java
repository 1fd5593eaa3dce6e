package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.knowledge.BuildResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of BuildResult.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildResultImpl implements BuildResult {

    private boolean success;
    private String rootPath;
    private int nodeCount;
    private int relationshipCount;
    private int conceptCount;
    private int filesProcessed;
    private int filesSkipped;
    private long durationMs;

    /**
     * Per-file problems for a successful build, the fatal cause for a failed one.
     */
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static BuildResultImpl failure(String rootPath, String error, long durationMs) {
        return BuildResultImpl.builder()
            .success(false)
            .rootPath(rootPath)
            .errors(List.of(error))
            .durationMs(durationMs)
            .build();
    }
}
