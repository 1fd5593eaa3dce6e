package com.purchasingpower.codegraph.event;

import java.nio.file.Path;

public record GraphBuiltEvent(Path rootPath, int nodeCount, int relationshipCount, int conceptCount, long durationMs) {
}
