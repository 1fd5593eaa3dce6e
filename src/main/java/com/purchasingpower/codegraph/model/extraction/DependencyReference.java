package com.purchasingpower.codegraph.model.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An import-like statement found in a file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyReference {

    /**
     * The module specifier as written, e.g. {@code ./util} or {@code react}.
     */
    private String specifier;

    /**
     * Syntax that produced the reference: import, require, from or export.
     */
    private String importType;

    private int line;

    /**
     * Root-relative path of the target file for local references, null for
     * external modules.
     */
    private String resolvedPath;

    public boolean isLocal() {
        return resolvedPath != null;
    }
}
