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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical rules for JavaScript and TypeScript.
 *
 * <p>Recognizes function declarations, function-valued constants, classes,
 * interfaces and other variable declarations; and {@code import},
 * {@code export ... from} and {@code require} dependencies.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class JavaScriptLanguageExtractor implements LanguageExtractor {

    private static final String IDENT = "[A-Za-z_$][\\w$]*";

    private static final Pattern FUNCTION_DECLARATION = Pattern.compile(
        "\\b(async\\s+)?function\\b\\s*\\*?\\s*(" + IDENT + ")\\s*(?:<[^>]*>)?\\s*\\(");
    private static final Pattern FUNCTION_EXPRESSION = Pattern.compile(
        "\\b(?:const|let|var)\\s+(" + IDENT + ")\\s*(?::[^=;]+)?=\\s*(async\\s+)?"
            + "(?:function\\b|\\([^()]*\\)\\s*(?::[^=;{]+)?=>|" + IDENT + "\\s*=>)");
    private static final Pattern CLASS_DECLARATION = Pattern.compile(
        "\\b(abstract\\s+)?class\\s+(" + IDENT + ")([^{;]*)\\{");
    private static final Pattern INTERFACE_DECLARATION = Pattern.compile(
        "\\binterface\\s+(" + IDENT + ")");
    private static final Pattern VARIABLE_DECLARATION = Pattern.compile(
        "\\b(const|let|var)\\s+(" + IDENT + ")\\s*(?::[^=;]+)?=");

    private static final Pattern EXTENDS_CLAUSE = Pattern.compile("\\bextends\\s+([\\w$.]+)");
    private static final Pattern IMPLEMENTS_CLAUSE = Pattern.compile("\\bimplements\\s+([^{]+)");
    private static final Pattern PRIVATE_CONSTRUCTOR = Pattern.compile("\\bprivate\\s+constructor\\s*\\(");

    private static final Pattern IMPORT_FROM = Pattern.compile(
        "\\bimport\\s+(?:type\\s+)?[\\w$*{}\\s,]+?\\s+from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern IMPORT_SIDE_EFFECT = Pattern.compile(
        "\\bimport\\s*\\(?\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern EXPORT_FROM = Pattern.compile(
        "\\bexport\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+" + IDENT + ")?|\\{[^}]*\\})\\s+from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern REQUIRE_CALL = Pattern.compile(
        "\\brequire\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    @Override
    public boolean supports(SourceLanguage language) {
        return language == SourceLanguage.JAVASCRIPT || language == SourceLanguage.TYPESCRIPT;
    }

    @Override
    public LexicalScan scan(String maskedContent) {
        LineIndex lineIndex = new LineIndex(maskedContent);
        String code = LexicalSupport.maskCommentsAndStrings(maskedContent, CommentStyle.C_STYLE);
        List<ExtractedEntity> entities = new ArrayList<>();
        Set<Integer> functionOffsets = new HashSet<>();

        Matcher matcher = FUNCTION_DECLARATION.matcher(code);
        while (matcher.find()) {
            addFunction(entities, functionOffsets, matcher.group(2), matcher.start(2), matcher.group(1) != null, lineIndex);
        }

        matcher = FUNCTION_EXPRESSION.matcher(code);
        while (matcher.find()) {
            addFunction(entities, functionOffsets, matcher.group(1), matcher.start(1), matcher.group(2) != null, lineIndex);
        }

        matcher = CLASS_DECLARATION.matcher(code);
        while (matcher.find()) {
            ExtractedEntity entity = LexicalSupport.entity(NodeType.CLASS, matcher.group(2), matcher.start(2), lineIndex);
            if (entity == null) {
                continue;
            }
            describeClass(entity, code, matcher, lineIndex);
            entities.add(entity);
        }

        matcher = INTERFACE_DECLARATION.matcher(code);
        while (matcher.find()) {
            ExtractedEntity entity = LexicalSupport.entity(NodeType.INTERFACE, matcher.group(1), matcher.start(1), lineIndex);
            if (entity != null) {
                entities.add(entity);
            }
        }

        matcher = VARIABLE_DECLARATION.matcher(code);
        while (matcher.find()) {
            if (functionOffsets.contains(matcher.start(2))) {
                continue;
            }
            ExtractedEntity entity = LexicalSupport.entity(NodeType.VARIABLE, matcher.group(2), matcher.start(2), lineIndex);
            if (entity != null) {
                entity.getMetadata().put(NodeMetadataKeys.DECLARATION_TYPE, AttributeValue.of(matcher.group(1)));
                entities.add(entity);
            }
        }

        entities.sort(Comparator.comparingInt(ExtractedEntity::getNameOffset));
        return LexicalScan.builder()
            .entities(entities)
            .dependencies(findDependencies(maskedContent, lineIndex))
            .build();
    }

    private void addFunction(List<ExtractedEntity> entities, Set<Integer> functionOffsets,
                             String name, int offset, boolean async, LineIndex lineIndex) {
        if (!functionOffsets.add(offset)) {
            return;
        }
        ExtractedEntity entity = LexicalSupport.entity(NodeType.FUNCTION, name, offset, lineIndex);
        if (entity != null) {
            entity.getMetadata().put(NodeMetadataKeys.IS_ASYNC, AttributeValue.of(async));
            entities.add(entity);
        }
    }

    private void describeClass(ExtractedEntity entity, String content, Matcher matcher, LineIndex lineIndex) {
        String header = matcher.group(3);

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
        int lineCount = lineIndex.lineOf(close) - lineIndex.lineOf(matcher.start()) + 1;

        entity.getMetadata().put(NodeMetadataKeys.LINE_COUNT, AttributeValue.of((long) lineCount));
        entity.getMetadata().put(NodeMetadataKeys.HAS_PRIVATE_CONSTRUCTOR,
            AttributeValue.of(PRIVATE_CONSTRUCTOR.matcher(body).find()));
        entity.getAttributes().put(NodeMetadataKeys.IS_ABSTRACT, AttributeValue.of(matcher.group(1) != null));
    }

    private List<DependencyReference> findDependencies(String content, LineIndex lineIndex) {
        Map<Integer, DependencyReference> byOffset = new TreeMap<>();
        collect(byOffset, IMPORT_FROM.matcher(content), "import", lineIndex);
        collect(byOffset, IMPORT_SIDE_EFFECT.matcher(content), "import", lineIndex);
        collect(byOffset, EXPORT_FROM.matcher(content), "export", lineIndex);
        collect(byOffset, REQUIRE_CALL.matcher(content), "require", lineIndex);
        return new ArrayList<>(byOffset.values());
    }

    private void collect(Map<Integer, DependencyReference> byOffset, Matcher matcher, String importType, LineIndex lineIndex) {
        while (matcher.find()) {
            byOffset.putIfAbsent(matcher.start(1), DependencyReference.builder()
                .specifier(matcher.group(1))
                .importType(importType)
                .line(lineIndex.lineOf(matcher.start()))
                .build());
        }
    }
}
