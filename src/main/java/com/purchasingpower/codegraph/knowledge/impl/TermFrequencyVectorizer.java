package com.purchasingpower.codegraph.knowledge.impl;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.knowledge.SemanticVectorizer;
import com.purchasingpower.codegraph.util.GraphIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Term-frequency projection of text into a fixed number of slots.
 *
 * <p>Tokens are lower-cased alphanumeric runs of at least three characters.
 * The most frequent terms (ties by term) each add {@code count / totalTokens}
 * to slot {@code murmur3(term) mod D}. There is no IDF and no learned model,
 * so similarity is purely lexical.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class TermFrequencyVectorizer implements SemanticVectorizer {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^A-Za-z0-9]+");
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final HashFunction SLOT_HASH = Hashing.murmur3_32_fixed();

    private final int dimension;
    private final Cache<String, double[]> cache;

    public TermFrequencyVectorizer(CodeGraphProperties properties) {
        this.dimension = properties.getVectorDimension();
        this.cache = CacheBuilder.newBuilder()
            .maximumSize(properties.getVectorCacheSize())
            .build();
    }

    @Override
    public double[] vectorize(String text) {
        String content = text == null ? "" : text;
        String key = GraphIds.contentHash(content);

        double[] cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached.clone();
        }

        double[] vector = project(tokenize(content));
        cache.put(key, vector);
        return vector.clone();
    }

    @Override
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        for (String raw : TOKEN_SEPARATOR.split(text)) {
            if (raw.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(raw.toLowerCase(Locale.ROOT));
            }
        }
        return tokens;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public long cacheSize() {
        return cache.size();
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    private double[] project(List<String> tokens) {
        double[] vector = new double[dimension];
        if (tokens.isEmpty()) {
            return vector;
        }

        Map<String, Integer> frequencies = new HashMap<>();
        for (String token : tokens) {
            frequencies.merge(token, 1, Integer::sum);
        }

        List<Map.Entry<String, Integer>> topTerms = new ArrayList<>(frequencies.entrySet());
        topTerms.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));

        double total = tokens.size();
        int limit = Math.min(dimension, topTerms.size());
        for (int i = 0; i < limit; i++) {
            Map.Entry<String, Integer> term = topTerms.get(i);
            vector[slot(term.getKey())] += term.getValue() / total;
        }

        log.trace("Projected {} tokens ({} distinct) into {} slots", tokens.size(), frequencies.size(), dimension);
        return vector;
    }

    private int slot(String term) {
        return Math.floorMod(SLOT_HASH.hashString(term, StandardCharsets.UTF_8).asInt(), dimension);
    }
}
