package com.purchasingpower.codegraph.parser;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Languages recognized from file extensions.
 */
public enum SourceLanguage {
    TYPESCRIPT("typescript", CommentStyle.C_STYLE),
    JAVASCRIPT("javascript", CommentStyle.C_STYLE),
    PYTHON("python", CommentStyle.HASH),
    JAVA("java", CommentStyle.C_STYLE),
    CPP("cpp", CommentStyle.C_STYLE),
    C("c", CommentStyle.C_STYLE),
    CSHARP("csharp", CommentStyle.C_STYLE),
    GO("go", CommentStyle.C_STYLE),
    RUST("rust", CommentStyle.C_STYLE),
    UNKNOWN("unknown", CommentStyle.C_STYLE);

    private final String wireName;
    private final CommentStyle commentStyle;

    SourceLanguage(String wireName, CommentStyle commentStyle) {
        this.wireName = wireName;
        this.commentStyle = commentStyle;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public CommentStyle commentStyle() {
        return commentStyle;
    }

    /**
     * @param extension extension including the dot, e.g. {@code .tsx}
     */
    public static SourceLanguage fromExtension(String extension) {
        if (extension == null) {
            return UNKNOWN;
        }
        return switch (extension.toLowerCase(Locale.ROOT)) {
            case ".ts", ".tsx" -> TYPESCRIPT;
            case ".js", ".jsx" -> JAVASCRIPT;
            case ".py" -> PYTHON;
            case ".java" -> JAVA;
            case ".cpp" -> CPP;
            case ".c" -> C;
            case ".cs" -> CSHARP;
            case ".go" -> GO;
            case ".rs" -> RUST;
            default -> UNKNOWN;
        };
    }
}
