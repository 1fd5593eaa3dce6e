package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.model.extraction.CallSite;
import com.purchasingpower.codegraph.model.extraction.ExtractedEntity;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.parser.LexicalSupport.LineIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Lexical Support Tests")
class LexicalSupportTest {

    @Test
    @DisplayName("C-style comments are blanked, line breaks kept")
    void testMaskComments_CStyle() {
        String content = "a // x\nb /* y\n z */ c";

        String masked = LexicalSupport.maskComments(content, CommentStyle.C_STYLE);

        assertEquals("a     \nb     \n      c", masked);
    }

    @Test
    @DisplayName("Comment markers inside string literals are kept")
    void testMaskComments_KeepsStrings() {
        String content = "const url = 'http://example.com'; // trailing\nconst t = `/* not a comment */`;";

        String masked = LexicalSupport.maskComments(content, CommentStyle.C_STYLE);

        assertTrue(masked.contains("'http://example.com'"));
        assertTrue(masked.contains("`/* not a comment */`"));
        assertFalse(masked.contains("trailing"));
        assertEquals(content.length(), masked.length());
    }

    @Test
    @DisplayName("Hash comments are blanked outside strings and docstrings")
    void testMaskComments_Hash() {
        String content = "x = 1  # note\ns = '#keep'\n\"\"\"# doc\"\"\"";

        String masked = LexicalSupport.maskComments(content, CommentStyle.HASH);

        assertEquals("x = 1        \ns = '#keep'\n\"\"\"# doc\"\"\"", masked);
    }

    @Test
    @DisplayName("String bodies are blanked with quotes and escapes handled")
    void testMaskCommentsAndStrings_CStyle() {
        String content = "log(\"foo(\") // c\nx = 'a\\'b';";

        String masked = LexicalSupport.maskCommentsAndStrings(content, CommentStyle.C_STYLE);

        assertEquals("log(\"    \")     \nx = '    ';", masked);
    }

    @Test
    @DisplayName("Triple-quoted bodies are blanked, line breaks kept")
    void testMaskCommentsAndStrings_TripleQuoted() {
        String content = "s = \"\"\"def f(\n  x\"\"\"";

        String masked = LexicalSupport.maskCommentsAndStrings(content, CommentStyle.HASH);

        assertEquals("s = \"\"\"      \n   \"\"\"", masked);
    }

    @Test
    @DisplayName("Calls written inside string literals are not call sites")
    void testFindCallSites_IgnoresStrings() {
        String content = "log(\"foo(\");\nrender(`bar()`);";
        String masked = LexicalSupport.maskCommentsAndStrings(content, CommentStyle.C_STYLE);

        List<CallSite> callSites = LexicalSupport.findCallSites(masked, Set.of(), new LineIndex(masked));

        assertEquals(List.of(new CallSite("log", 1), new CallSite("render", 2)), callSites);
    }

    @Test
    @DisplayName("Matching brace skips nested blocks")
    void testMatchingBrace() {
        assertEquals(14, LexicalSupport.matchingBrace("a { b { c } d } e", 2));
        assertEquals(2, LexicalSupport.matchingBrace("{ {", 0));
    }

    @Test
    @DisplayName("Indented block ends at the first line back at header indentation")
    void testIndentedBlockLineCount() {
        String content = "class A:\n    def f(self):\n        pass\n\nx = 1\n";

        assertEquals(3, LexicalSupport.indentedBlockLineCount(content, 6));
    }

    @Test
    @DisplayName("Call sites skip declarations, member calls and keywords")
    void testFindCallSites() {
        String content = "function foo() {}\nfoo();\nobj.bar();\nif (x) {}";

        List<CallSite> callSites = LexicalSupport.findCallSites(content, Set.of(9), new LineIndex(content));

        assertEquals(List.of(new CallSite("foo", 2)), callSites);
    }

    @Test
    @DisplayName("Line index is 1-based and counts the final line")
    void testLineIndex() {
        LineIndex index = new LineIndex("a\nbc\n");

        assertEquals(1, index.lineOf(0));
        assertEquals(1, index.lineOf(1));
        assertEquals(2, index.lineOf(2));
        assertEquals(3, index.lineOf(5));
        assertEquals(3, index.lineCount());
    }

    @Test
    @DisplayName("Entity helper rejects blank names and records the line")
    void testEntity() {
        LineIndex index = new LineIndex("\n\nclass Foo {}");

        assertNull(LexicalSupport.entity(NodeType.CLASS, " ", 0, index));

        ExtractedEntity entity = LexicalSupport.entity(NodeType.CLASS, "Foo", 8, index);
        assertNotNull(entity);
        assertEquals(3, entity.getLine());
        assertEquals(0.8, entity.getImportance());
        assertEquals(3.0, entity.getMetadata().get(NodeMetadataKeys.LINE).asDouble());
    }
}
