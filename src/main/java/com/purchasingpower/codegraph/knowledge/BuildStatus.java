package com.purchasingpower.codegraph.knowledge;

/**
 * Progress of the current or last build.
 */
public interface BuildStatus {
    String getRootPath();
    BuildState getState();
    int getProgress();
    String getCurrentStep();
    long getStartedAt();
}
