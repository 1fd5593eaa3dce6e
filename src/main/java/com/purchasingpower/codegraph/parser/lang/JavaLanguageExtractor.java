package com.purchasingpower.codegraph.parser.lang;

import com.purchasingpower.codegraph.model.extraction.DependencyReference;
import com.purchasingpower.codegraph.model.extraction.ExtractedEntity;
import com.purchasingpower.codegraph.model.extraction.LexicalScan;
import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.parser.CommentStyle;
import com.purchasingpower.codegraph.parser.LanguageExtractor;
import com.purchasingpower.codegraph.parser.LexicalSupport;
import com.purchasingpower.codegraph.parser.LexicalSupport.LineIndex;
import com.purchasingpower.codegraph.parser.SourceLanguage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical rules for Java sources.
 *
 * <p>Methods are lines shaped like {@code [modifiers] Type name(}; control
 * statements, constructors and expressions such as {@code return foo(} are
 * filtered out by keyword. Fields need at least one modifier so local
 * variables are not taken for fields.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class JavaLanguageExtractor implements LanguageExtractor {

    private static final String MODIFIERS = "public|protected|private|static|final|abstract|synchronized|native|default|strictfp|sealed|transient|volatile";
    private static final String TYPE = "[\\w$.]+(?:<[^;{}()]*>)?(?:\\[\\])*";
    private static final String ANNOTATIONS = "(?:@[\\w.]+(?:\\([^)]*\\))?\\s+)*";

    private static final Pattern CLASS_DECLARATION = Pattern.compile(
        "\\b((?:(?:" + MODIFIERS + ")\\s+)*)class\\s+(\\w+)([^{;]*)\\{");
    private static final Pattern INTERFACE_DECLARATION = Pattern.compile(
        "(?<!@)\\binterface\\s+(\\w+)");
    private static final Pattern METHOD_DECLARATION = Pattern.compile(
        "^[ \\t]*" + ANNOTATIONS + "((?:(?:" + MODIFIERS + ")\\s+)*)(?:<[^>]+>\\s+)?(" + TYPE + ")\\s+(\\w+)\\s*\\(", Pattern.MULTILINE);
    private static final Pattern FIELD_DECLARATION = Pattern.compile(
        "^[ \\t]*" + ANNOTATIONS + "((?:(?:" + MODIFIERS + ")\\s+)+)(" + TYPE + ")\\s+(\\w+)\\s*[=;]", Pattern.MULTILINE);
    private static final Pattern IMPORT_DECLARATION = Pattern.compile(
        "^[ \\t]*import\\s+(?:static\\s+)?([\\w.]+(?:\\.\\*)?)\\s*;", Pattern.MULTILINE);

    private static final Pattern EXTENDS_CLAUSE = Pattern.compile("\\bextends\\s+([\\w.]+)");
    private static final Pattern IMPLEMENTS_CLAUSE = Pattern.compile("\\bimplements\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern GENERIC_ARGUMENTS = Pattern.compile("<[^<>]*>");

    private static final Set<String> NON_METHOD_WORDS = Set.of(
        "return", "new", "else", "throw", "if", "for", "while", "switch", "catch", "case",
        "synchronized", "try", "do", "assert", "yield", "class", "interface", "enum", "record",
        "public", "protected", "private", "static", "final", "abstract");

    @Override
    public boolean supports(SourceLanguage language) {
        return language == SourceLanguage.JAVA;
    }

    @Override
    public LexicalScan scan(String maskedContent) {
        LineIndex lineIndex = new LineIndex(maskedContent);
        String code = LexicalSupport.maskCommentsAndStrings(maskedContent, CommentStyle.C_STYLE);
        List<ExtractedEntity> entities = new ArrayList<>();

        Matcher matcher = CLASS_DECLARATION.matcher(code);
        while (matcher.find()) {
            ExtractedEntity entity = LexicalSupport.entity(NodeType.CLASS, matcher.group(2), matcher.start(2), lineIndex);
            if (entity != null) {
                describeClass(entity, code, matcher, lineIndex);
                entities.add(entity);
            }
        }

        matcher = INTERFACE_DECLARATION.matcher(code);
        while (matcher.find()) {
            ExtractedEntity entity = LexicalSupport.entity(NodeType.INTERFACE, matcher.group(1), matcher.start(1), lineIndex);
            if (entity != null) {
                entities.add(entity);
            }
        }

        matcher = METHOD_DECLARATION.matcher(code);
        while (matcher.find()) {
            String type = matcher.group(2);
            String name = matcher.group(3);
            if (NON_METHOD_WORDS.contains(type) || NON_METHOD_WORDS.contains(name)) {
                continue;
            }
            ExtractedEntity entity = LexicalSupport.entity(NodeType.FUNCTION, name, matcher.start(3), lineIndex);
            if (entity != null) {
                entity.getMetadata().put(NodeMetadataKeys.IS_ASYNC, AttributeValue.of(false));
                entity.getAttributes().put(NodeMetadataKeys.IS_ABSTRACT, AttributeValue.of(matcher.group(1).contains("abstract")));
                entities.add(entity);
            }
        }

        matcher = FIELD_DECLARATION.matcher(code);
        while (matcher.find()) {
            if (NON_METHOD_WORDS.contains(matcher.group(2))) {
                continue;
            }
            ExtractedEntity entity = LexicalSupport.entity(NodeType.VARIABLE, matcher.group(3), matcher.start(3), lineIndex);
            if (entity != null) {
                entity.getMetadata().put(NodeMetadataKeys.DECLARATION_TYPE, AttributeValue.of("field"));
                entities.add(entity);
            }
        }

        entities.sort(Comparator.comparingInt(ExtractedEntity::getNameOffset));
        return LexicalScan.builder()
            .entities(entities)
            .dependencies(findImports(maskedContent, lineIndex))
            .build();
    }

    private void describeClass(ExtractedEntity entity, String content, Matcher matcher, LineIndex lineIndex) {
        String header = stripGenerics(matcher.group(3));

        Matcher extendsMatcher = EXTENDS_CLAUSE.matcher(header);
        if (extendsMatcher.find()) {
            entity.getMetadata().put(NodeMetadataKeys.EXTENDS, AttributeValue.of(extendsMatcher.group(1)));
        }
        Matcher implementsMatcher = IMPLEMENTS_CLAUSE.matcher(header);
        if (implementsMatcher.find()) {
            String interfaces = String.join(", ", implementsMatcher.group(1).trim().split("\\s*,\\s*"));
            entity.getMetadata().put(NodeMetadataKeys.IMPLEMENTS, AttributeValue.of(interfaces));
        }

        int open = matcher.end() - 1;
        int close = LexicalSupport.matchingBrace(content, open);
        String body = content.substring(open, close + 1);
        int lineCount = lineIndex.lineOf(close) - lineIndex.lineOf(matcher.start(2)) + 1;
        Pattern privateConstructor = Pattern.compile("\\bprivate\\s+" + Pattern.quote(entity.getName()) + "\\s*\\(");

        entity.getMetadata().put(NodeMetadataKeys.LINE_COUNT, AttributeValue.of((long) lineCount));
        entity.getMetadata().put(NodeMetadataKeys.HAS_PRIVATE_CONSTRUCTOR,
            AttributeValue.of(privateConstructor.matcher(body).find()));
        entity.getAttributes().put(NodeMetadataKeys.IS_ABSTRACT,
            AttributeValue.of(matcher.group(1).contains("abstract")));
    }

    private List<DependencyReference> findImports(String content, LineIndex lineIndex) {
        List<DependencyReference> imports = new ArrayList<>();
        Matcher matcher = IMPORT_DECLARATION.matcher(content);
        while (matcher.find()) {
            imports.add(DependencyReference.builder()
                .specifier(matcher.group(1))
                .importType("import")
                .line(lineIndex.lineOf(matcher.start()))
                .build());
        }
        return imports;
    }

    private static String stripGenerics(String text) {
        String previous;
        String current = text;
        do {
            previous = current;
            current = GENERIC_ARGUMENTS.matcher(previous).replaceAll("");
        } while (!current.equals(previous));
        return current;
    }
}
