package com.purchasingpower.codegraph.model.graph;

/**
 * Well-known keys of {@link GraphNode#getMetadata()} and {@link GraphNode#getAttributes()}.
 */
public final class NodeMetadataKeys {

    // metadata
    public static final String SIZE = "size";
    public static final String EXTENSION = "extension";
    public static final String LAST_MODIFIED = "lastModified";
    public static final String LINE_COUNT = "lineCount";
    public static final String LINE = "line";
    public static final String IS_ASYNC = "isAsync";
    public static final String EXTENDS = "extends";
    public static final String IMPLEMENTS = "implements";
    public static final String HAS_PRIVATE_CONSTRUCTOR = "hasPrivateConstructor";
    public static final String DECLARATION_TYPE = "declarationType";
    public static final String IS_EXTERNAL = "isExternal";
    public static final String IMPORT_TYPE = "importType";

    // attributes
    public static final String LANGUAGE = "language";
    public static final String COMPLEXITY = "complexity";
    public static final String IS_ABSTRACT = "isAbstract";

    private NodeMetadataKeys() {
    }
}
