package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * A build could not run at all, e.g. the root is not a readable directory.
 *
 * <p>Per-file problems never raise this; they are logged and counted.
 */
@Getter
public class GraphBuildException extends RuntimeException {

    private final String rootPath;

    public GraphBuildException(String message, String rootPath) {
        super(message);
        this.rootPath = rootPath;
    }

    public GraphBuildException(String message, String rootPath, Throwable cause) {
        super(message, cause);
        this.rootPath = rootPath;
    }
}
