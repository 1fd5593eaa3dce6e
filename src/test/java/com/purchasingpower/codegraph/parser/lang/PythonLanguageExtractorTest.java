package com.purchasingpower.codegraph.parser.lang;

import com.purchasingpower.codegraph.model.extraction.DependencyReference;
import com.purchasingpower.codegraph.model.extraction.ExtractedEntity;
import com.purchasingpower.codegraph.model.extraction.LexicalScan;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.parser.CommentStyle;
import com.purchasingpower.codegraph.parser.LexicalSupport;
import com.purchasingpower.codegraph.parser.SourceLanguage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Python Extractor Tests")
class PythonLanguageExtractorTest {

    private static final String SOURCE = """
        import os, sys as system
        from .models import User
        from ..core.db import session
        from typing import List


        class UserService(BaseService, Mixin):
            def __init__(self):
                self.users = []

            async def load(self, user_id):
                return await fetch(user_id)


        def helper():
            # def commented_out():
            pass
        """;

    private PythonLanguageExtractor extractor;
    private LexicalScan scan;

    @BeforeEach
    void setUp() {
        extractor = new PythonLanguageExtractor();
        scan = extractor.scan(LexicalSupport.maskComments(SOURCE, CommentStyle.HASH));
    }

    @Test
    @DisplayName("Should support Python only")
    void testSupports() {
        assertTrue(extractor.supports(SourceLanguage.PYTHON));
        assertFalse(extractor.supports(SourceLanguage.JAVA));
    }

    @Test
    @DisplayName("Should find classes and functions, ignoring comments")
    void testScan_Entities() {
        assertThat(scan.getEntities())
            .extracting(ExtractedEntity::getName, ExtractedEntity::getType, ExtractedEntity::getLine)
            .containsExactly(
                tuple("UserService", NodeType.CLASS, 7),
                tuple("__init__", NodeType.FUNCTION, 8),
                tuple("load", NodeType.FUNCTION, 11),
                tuple("helper", NodeType.FUNCTION, 15));
    }

    @Test
    @DisplayName("Class bases become extends, body size from indentation")
    void testScan_ClassMetadata() {
        ExtractedEntity userService = scan.getEntities().get(0);

        assertEquals("BaseService, Mixin", userService.getMetadata().get(NodeMetadataKeys.EXTENDS).asString());
        assertEquals(6.0, userService.getMetadata().get(NodeMetadataKeys.LINE_COUNT).asDouble());
    }

    @Test
    @DisplayName("Async def is flagged")
    void testScan_AsyncFunction() {
        assertTrue(scan.getEntities().get(2).getMetadata().get(NodeMetadataKeys.IS_ASYNC).asBoolean());
        assertFalse(scan.getEntities().get(3).getMetadata().get(NodeMetadataKeys.IS_ASYNC).asBoolean());
    }

    @Test
    @DisplayName("Should find both import forms in line order")
    void testScan_Dependencies() {
        assertThat(scan.getDependencies())
            .extracting(DependencyReference::getSpecifier, DependencyReference::getImportType)
            .containsExactly(
                tuple("os", "import"),
                tuple("sys", "import"),
                tuple("./models", "from"),
                tuple("../core/db", "from"),
                tuple("typing", "from"));
    }

    @Test
    @DisplayName("Relative modules are rewritten to slash paths")
    void testToSpecifier() {
        assertEquals("./models", PythonLanguageExtractor.toSpecifier(".models"));
        assertEquals("../core/db", PythonLanguageExtractor.toSpecifier("..core.db"));
        assertEquals("./", PythonLanguageExtractor.toSpecifier("."));
        assertEquals("os.path", PythonLanguageExtractor.toSpecifier("os.path"));
    }
}
