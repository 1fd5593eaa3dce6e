package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.model.extraction.LexicalScan;

/**
 * Per-language lexical extraction rules.
 *
 * <p>Implementations are pattern-based approximations, not parsers: they
 * find import statements with regular expressions over comment-masked text,
 * and declarations over text whose string bodies are masked as well. A real parser can replace one without touching the
 * graph or query layers.
 *
 * @since 1.0.0
 */
public interface LanguageExtractor {

    boolean supports(SourceLanguage language);

    /**
     * Find declarations and raw dependency specifiers.
     *
     * @param maskedContent file content with comments replaced by spaces;
     *                      offsets and line breaks match the original file
     * @return entities with name offsets, dependencies without resolved paths
     */
    LexicalScan scan(String maskedContent);
}
