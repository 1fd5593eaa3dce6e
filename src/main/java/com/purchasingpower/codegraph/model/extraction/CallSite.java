package com.purchasingpower.codegraph.model.extraction;

/**
 * An {@code identifier(} occurrence that may be a function call.
 */
public record CallSite(String name, int line) {
}
