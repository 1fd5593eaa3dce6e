package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.knowledge.BuildState;
import com.purchasingpower.codegraph.knowledge.BuildStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Default implementation of BuildStatus.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildStatusImpl implements BuildStatus {

    private String rootPath;

    @Builder.Default
    private BuildState state = BuildState.NOT_STARTED;

    private int progress;
    private String currentStep;
    private long startedAt;

    public static BuildStatusImpl notStarted() {
        return BuildStatusImpl.builder()
            .state(BuildState.NOT_STARTED)
            .progress(0)
            .currentStep("Not started")
            .build();
    }

    public static BuildStatusImpl inProgress(String rootPath, BuildState state, int progress,
                                             String step, long startedAt) {
        return BuildStatusImpl.builder()
            .rootPath(rootPath)
            .state(state)
            .progress(progress)
            .currentStep(step)
            .startedAt(startedAt)
            .build();
    }

    public static BuildStatusImpl completed(String rootPath, long startedAt) {
        return BuildStatusImpl.builder()
            .rootPath(rootPath)
            .state(BuildState.COMPLETED)
            .progress(100)
            .currentStep("Completed")
            .startedAt(startedAt)
            .build();
    }

    public static BuildStatusImpl failed(String rootPath, String reason, long startedAt) {
        return BuildStatusImpl.builder()
            .rootPath(rootPath)
            .state(BuildState.FAILED)
            .currentStep("Failed: " + reason)
            .startedAt(startedAt)
            .build();
    }

    public static BuildStatusImpl cancelled(String rootPath, long startedAt) {
        return BuildStatusImpl.builder()
            .rootPath(rootPath)
            .state(BuildState.CANCELLED)
            .currentStep("Cancelled")
            .startedAt(startedAt)
            .build();
    }
}
