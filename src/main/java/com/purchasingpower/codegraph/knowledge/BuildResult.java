package com.purchasingpower.codegraph.knowledge;

import java.util.List;

/**
 * Outcome of a graph build.
 */
public interface BuildResult {
    boolean isSuccess();
    String getRootPath();
    int getNodeCount();
    int getRelationshipCount();
    int getConceptCount();
    int getFilesProcessed();
    int getFilesSkipped();
    long getDurationMs();
    List<String> getErrors();
}
