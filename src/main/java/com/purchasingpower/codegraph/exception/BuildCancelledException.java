package com.purchasingpower.codegraph.exception;

public class BuildCancelledException extends GraphBuildException {

    public BuildCancelledException(String phase) {
        super("Graph build cancelled during " + phase, null);
    }
}
