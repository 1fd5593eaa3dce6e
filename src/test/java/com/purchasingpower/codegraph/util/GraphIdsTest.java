package com.purchasingpower.codegraph.util;

import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.model.graph.RelationshipType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Id Tests")
class GraphIdsTest {

    @Test
    @DisplayName("Same type and identifier always give the same node id")
    void testNodeId_IsDeterministic() {
        String first = GraphIds.nodeId(NodeType.FILE, "src/app.js");
        String second = GraphIds.nodeId(NodeType.FILE, "src/app.js");

        assertEquals(first, second);
        assertTrue(first.startsWith("file_"));
        assertEquals("file_".length() + 16, first.length());
    }

    @Test
    @DisplayName("Type is part of the id")
    void testNodeId_DiffersByType() {
        assertNotEquals(
            GraphIds.nodeId(NodeType.FUNCTION, "src/app.js:run"),
            GraphIds.nodeId(NodeType.CLASS, "src/app.js:run"));
    }

    @Test
    @DisplayName("Entity ids hash the path and name together")
    void testEntityId_UsesPathColonName() {
        assertEquals(
            GraphIds.nodeId(NodeType.FUNCTION, "lib/math.py:add"),
            GraphIds.entityId(NodeType.FUNCTION, "lib/math.py", "add"));
    }

    @Test
    @DisplayName("Relationship id is the composite key")
    void testRelationshipId_Format() {
        assertEquals("file_1_depends_on_file_2",
            GraphIds.relationshipId("file_1", RelationshipType.DEPENDS_ON, "file_2"));
    }

    @Test
    @DisplayName("Content hash is full SHA-256 hex")
    void testContentHash_EmptyString() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
            GraphIds.contentHash(""));
    }
}
