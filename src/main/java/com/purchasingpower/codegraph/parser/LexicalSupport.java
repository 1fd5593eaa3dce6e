package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.model.extraction.CallSite;
import com.purchasingpower.codegraph.model.extraction.ExtractedEntity;
import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the language extractors.
 */
@Slf4j
public final class LexicalSupport {

    private static final Pattern CALL_SITE = Pattern.compile("(?<![\\w$.])([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Set<String> CONTROL_KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "function", "elif", "with", "typeof", "synchronized");

    private LexicalSupport() {
    }

    /**
     * Replace comments with spaces, keeping line breaks so offsets and line
     * numbers are unchanged. String literals are left alone, including any
     * comment markers inside them.
     */
    public static String maskComments(String content, CommentStyle style) {
        return mask(content, style, false);
    }

    /**
     * Like {@link #maskComments} but also blanks the body of every string
     * literal. Quote characters stay in place. Declarations and call sites
     * are matched on this text; import specifiers need {@link #maskComments}.
     */
    public static String maskCommentsAndStrings(String content, CommentStyle style) {
        return mask(content, style, true);
    }

    private static String mask(String content, CommentStyle style, boolean blankStrings) {
        char[] chars = content.toCharArray();
        int i = 0;
        while (i < chars.length) {
            char c = chars[i];
            if (style == CommentStyle.HASH && startsWithTripleQuote(chars, i)) {
                i = skipTripleQuoted(chars, i, blankStrings);
            } else if (c == '"' || c == '\'' || (c == '`' && style == CommentStyle.C_STYLE)) {
                i = skipQuoted(chars, i, c, blankStrings);
            } else if (style == CommentStyle.HASH && c == '#') {
                i = blankToLineEnd(chars, i);
            } else if (style == CommentStyle.C_STYLE && c == '/' && i + 1 < chars.length && chars[i + 1] == '/') {
                i = blankToLineEnd(chars, i);
            } else if (style == CommentStyle.C_STYLE && c == '/' && i + 1 < chars.length && chars[i + 1] == '*') {
                i = blankBlockComment(chars, i);
            } else {
                i++;
            }
        }
        return new String(chars);
    }

    /**
     * Offset of the matching close brace, or the last offset of the content
     * when braces are unbalanced.
     */
    public static int matchingBrace(String content, int openBraceOffset) {
        int depth = 0;
        for (int i = openBraceOffset; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return Math.max(openBraceOffset, content.length() - 1);
    }

    /**
     * Number of lines of an indentation-delimited block, counting the header
     * line. Blank lines inside the block are included, trailing blank lines
     * are not.
     */
    public static int indentedBlockLineCount(String content, int headerOffset) {
        String[] lines = content.split("\n", -1);
        LineIndex lineIndex = new LineIndex(content);
        int headerLine = lineIndex.lineOf(headerOffset) - 1;
        int headerIndent = indentation(lines[headerLine]);

        int lastBodyLine = headerLine;
        for (int i = headerLine + 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            if (indentation(lines[i]) <= headerIndent) {
                break;
            }
            lastBodyLine = i;
        }
        return lastBodyLine - headerLine + 1;
    }

    /**
     * Every {@code identifier(} occurrence whose identifier does not start at
     * one of the declaration offsets. Member calls ({@code a.b()}) are
     * skipped: only the receiver-less name can be matched to a function.
     */
    public static List<CallSite> findCallSites(String maskedContent, Set<Integer> declarationOffsets, LineIndex lineIndex) {
        List<CallSite> callSites = new ArrayList<>();
        Matcher matcher = CALL_SITE.matcher(maskedContent);
        while (matcher.find()) {
            if (declarationOffsets.contains(matcher.start(1)) || CONTROL_KEYWORDS.contains(matcher.group(1))) {
                continue;
            }
            callSites.add(new CallSite(matcher.group(1), lineIndex.lineOf(matcher.start(1))));
        }
        return callSites;
    }

    /**
     * Entity with the default importance of its type, or null when the rule
     * matched without a usable name.
     */
    public static ExtractedEntity entity(NodeType type, String name, int nameOffset, LineIndex lineIndex) {
        if (name == null || name.isBlank()) {
            log.debug("Skipping {} match at offset {} without a name", type.wireName(), nameOffset);
            return null;
        }
        ExtractedEntity entity = ExtractedEntity.builder()
            .type(type)
            .name(name)
            .nameOffset(nameOffset)
            .line(lineIndex.lineOf(nameOffset))
            .importance(defaultImportance(type))
            .build();
        entity.getMetadata().put(NodeMetadataKeys.LINE, AttributeValue.of((long) entity.getLine()));
        return entity;
    }

    public static double defaultImportance(NodeType type) {
        return switch (type) {
            case FUNCTION -> 0.7;
            case CLASS -> 0.8;
            case INTERFACE -> 0.6;
            case VARIABLE -> 0.3;
            case MODULE -> 0.4;
            default -> 0.5;
        };
    }

    private static int indentation(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }

    private static boolean startsWithTripleQuote(char[] chars, int i) {
        if (i + 2 >= chars.length) {
            return false;
        }
        char c = chars[i];
        return (c == '"' || c == '\'') && chars[i + 1] == c && chars[i + 2] == c;
    }

    private static int skipTripleQuoted(char[] chars, int start, boolean blank) {
        char quote = chars[start];
        int i = start + 3;
        while (i < chars.length) {
            if (chars[i] == '\\') {
                blankAt(chars, i, blank);
                blankAt(chars, i + 1, blank);
                i += 2;
            } else if (startsWithTripleQuote(chars, i) && chars[i] == quote) {
                return i + 3;
            } else {
                blankAt(chars, i, blank);
                i++;
            }
        }
        return chars.length;
    }

    private static int skipQuoted(char[] chars, int start, char quote, boolean blank) {
        int i = start + 1;
        while (i < chars.length) {
            char c = chars[i];
            if (c == '\\') {
                blankAt(chars, i, blank);
                blankAt(chars, i + 1, blank);
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n' && quote != '`') {
                // unterminated literal ends at the line break
                return i;
            } else {
                blankAt(chars, i, blank);
                i++;
            }
        }
        return chars.length;
    }

    private static void blankAt(char[] chars, int i, boolean blank) {
        if (blank && i < chars.length && chars[i] != '\n') {
            chars[i] = ' ';
        }
    }

    private static int blankToLineEnd(char[] chars, int start) {
        int i = start;
        while (i < chars.length && chars[i] != '\n') {
            chars[i] = ' ';
            i++;
        }
        return i;
    }

    private static int blankBlockComment(char[] chars, int start) {
        int i = start;
        while (i < chars.length) {
            if (chars[i] == '*' && i + 1 < chars.length && chars[i + 1] == '/') {
                chars[i] = ' ';
                chars[i + 1] = ' ';
                return i + 2;
            }
            if (chars[i] != '\n') {
                chars[i] = ' ';
            }
            i++;
        }
        return i;
    }

    /**
     * Offset to 1-based line number lookup.
     */
    public static final class LineIndex {

        private final int[] lineStarts;

        public LineIndex(String content) {
            int[] starts = new int[16];
            int count = 0;
            starts[count++] = 0;
            for (int i = 0; i < content.length(); i++) {
                if (content.charAt(i) == '\n') {
                    if (count == starts.length) {
                        starts = Arrays.copyOf(starts, starts.length * 2);
                    }
                    starts[count++] = i + 1;
                }
            }
            this.lineStarts = Arrays.copyOf(starts, count);
        }

        public int lineOf(int offset) {
            int index = Arrays.binarySearch(lineStarts, offset);
            return index >= 0 ? index + 1 : -index - 1;
        }

        public int lineCount() {
            return lineStarts.length;
        }
    }
}
