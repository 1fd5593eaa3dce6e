package com.purchasingpower.codegraph.parser.lang;

import com.google.common.base.Strings;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical rules for Python: {@code def}, {@code class} and both import forms.
 *
 * <p>Relative module paths are rewritten to slash form ({@code .models}
 * becomes {@code ./models}, {@code ..core.db} becomes {@code ../core/db}) so
 * they resolve like JavaScript relative imports.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class PythonLanguageExtractor implements LanguageExtractor {

    private static final Pattern FUNCTION_DEFINITION = Pattern.compile(
        "^[ \\t]*(async\\s+)?def\\s+(\\w+)\\s*\\(", Pattern.MULTILINE);
    private static final Pattern CLASS_DEFINITION = Pattern.compile(
        "^[ \\t]*class\\s+(\\w+)\\s*(?:\\(([^)]*)\\))?\\s*:", Pattern.MULTILINE);
    private static final Pattern FROM_IMPORT = Pattern.compile(
        "^[ \\t]*from\\s+(\\.*[\\w.]*)\\s+import\\b", Pattern.MULTILINE);
    private static final Pattern PLAIN_IMPORT = Pattern.compile(
        "^[ \\t]*import\\s+([\\w.]+(?:\\s+as\\s+\\w+)?(?:\\s*,\\s*[\\w.]+(?:\\s+as\\s+\\w+)?)*)", Pattern.MULTILINE);

    @Override
    public boolean supports(SourceLanguage language) {
        return language == SourceLanguage.PYTHON;
    }

    @Override
    public LexicalScan scan(String maskedContent) {
        LineIndex lineIndex = new LineIndex(maskedContent);
        String code = LexicalSupport.maskCommentsAndStrings(maskedContent, CommentStyle.HASH);
        List<ExtractedEntity> entities = new ArrayList<>();

        Matcher matcher = FUNCTION_DEFINITION.matcher(code);
        while (matcher.find()) {
            ExtractedEntity entity = LexicalSupport.entity(NodeType.FUNCTION, matcher.group(2), matcher.start(2), lineIndex);
            if (entity != null) {
                entity.getMetadata().put(NodeMetadataKeys.IS_ASYNC, AttributeValue.of(matcher.group(1) != null));
                entities.add(entity);
            }
        }

        matcher = CLASS_DEFINITION.matcher(code);
        while (matcher.find()) {
            ExtractedEntity entity = LexicalSupport.entity(NodeType.CLASS, matcher.group(1), matcher.start(1), lineIndex);
            if (entity == null) {
                continue;
            }
            String bases = Strings.nullToEmpty(matcher.group(2)).trim();
            if (!bases.isEmpty()) {
                entity.getMetadata().put(NodeMetadataKeys.EXTENDS, AttributeValue.of(bases));
            }
            int lineCount = LexicalSupport.indentedBlockLineCount(code, matcher.start(1));
            entity.getMetadata().put(NodeMetadataKeys.LINE_COUNT, AttributeValue.of((long) lineCount));
            entities.add(entity);
        }

        entities.sort(Comparator.comparingInt(ExtractedEntity::getNameOffset));
        return LexicalScan.builder()
            .entities(entities)
            .dependencies(findDependencies(maskedContent, lineIndex))
            .build();
    }

    private List<DependencyReference> findDependencies(String content, LineIndex lineIndex) {
        List<DependencyReference> dependencies = new ArrayList<>();

        Matcher matcher = FROM_IMPORT.matcher(content);
        while (matcher.find()) {
            String module = matcher.group(1);
            if (module.isEmpty()) {
                log.debug("Skipping 'from' import without a module at line {}", lineIndex.lineOf(matcher.start()));
                continue;
            }
            dependencies.add(reference(toSpecifier(module), "from", lineIndex.lineOf(matcher.start())));
        }

        matcher = PLAIN_IMPORT.matcher(content);
        while (matcher.find()) {
            for (String clause : matcher.group(1).split("\\s*,\\s*")) {
                String module = clause.trim().split("\\s+")[0];
                dependencies.add(reference(module, "import", lineIndex.lineOf(matcher.start())));
            }
        }

        dependencies.sort(Comparator.comparingInt(DependencyReference::getLine));
        return dependencies;
    }

    /**
     * Relative dotted module to a slash path; absolute modules unchanged.
     */
    static String toSpecifier(String module) {
        int dots = 0;
        while (dots < module.length() && module.charAt(dots) == '.') {
            dots++;
        }
        if (dots == 0) {
            return module;
        }
        String prefix = dots == 1 ? "./" : Strings.repeat("../", dots - 1);
        return prefix + module.substring(dots).replace('.', '/');
    }

    private static DependencyReference reference(String specifier, String importType, int line) {
        return DependencyReference.builder()
            .specifier(specifier)
            .importType(importType)
            .line(line)
            .build();
    }
}
