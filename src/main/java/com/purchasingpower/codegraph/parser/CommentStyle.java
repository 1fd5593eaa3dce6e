package com.purchasingpower.codegraph.parser;

/**
 * Comment syntax of a source language, used to blank out comments before
 * lexical rules run.
 */
public enum CommentStyle {

    /**
     * {@code //} line and {@code /* ... *&#47;} block comments.
     */
    C_STYLE,

    /**
     * {@code #} line comments.
     */
    HASH
}
