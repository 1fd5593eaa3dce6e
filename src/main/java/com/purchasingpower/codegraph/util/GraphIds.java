package com.purchasingpower.codegraph.util;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.model.graph.RelationshipType;

import java.nio.charset.StandardCharsets;

/**
 * Content-addressed ids for graph entities.
 *
 * Format: node {@code <type>_<16 hex chars of sha256(identifier)>},
 * relationship {@code <from>_<type>_<to>}.
 */
public final class GraphIds {

    private static final int NODE_HASH_LENGTH = 16;

    private GraphIds() {
    }

    public static String nodeId(NodeType type, String identifier) {
        Preconditions.checkNotNull(type, "Node type cannot be null");
        Preconditions.checkNotNull(identifier, "Node identifier cannot be null");
        return type.wireName() + "_" + contentHash(identifier).substring(0, NODE_HASH_LENGTH);
    }

    /**
     * Id of an entity declared inside a file.
     */
    public static String entityId(NodeType type, String relativePath, String name) {
        return nodeId(type, relativePath + ":" + name);
    }

    public static String relationshipId(String fromNodeId, RelationshipType type, String toNodeId) {
        return fromNodeId + "_" + type.wireName() + "_" + toNodeId;
    }

    /**
     * Full SHA-256 hex digest of the text.
     */
    public static String contentHash(String text) {
        return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
    }
}
