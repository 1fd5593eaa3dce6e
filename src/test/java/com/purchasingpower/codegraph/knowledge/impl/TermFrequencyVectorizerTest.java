package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.util.VectorMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Term Frequency Vectorizer Tests")
class TermFrequencyVectorizerTest {

    private TermFrequencyVectorizer vectorizer;

    @BeforeEach
    void setUp() {
        vectorizer = new TermFrequencyVectorizer(new CodeGraphProperties());
    }

    @Test
    @DisplayName("Should keep alphanumeric tokens of three or more characters, lower-cased")
    void testTokenize_FiltersShortTokens() {
        assertThat(vectorizer.tokenize("getUserName of ab-cd XYZ"))
            .containsExactly("getusername", "xyz");
        assertTrue(vectorizer.tokenize(null).isEmpty());
    }

    @Test
    @DisplayName("Should produce equal vectors for equal text")
    void testVectorize_IsDeterministic() {
        double[] first = vectorizer.vectorize("invoice total function billing");
        double[] second = vectorizer.vectorize("invoice total function billing");

        assertArrayEquals(first, second);
        assertEquals(100, first.length);
        assertEquals(1, vectorizer.cacheSize());
    }

    @Test
    @DisplayName("Should hand out copies so callers cannot corrupt the cache")
    void testVectorize_ReturnsCopies() {
        double[] first = vectorizer.vectorize("alpha beta");
        Arrays.fill(first, 9.0);

        double[] second = vectorizer.vectorize("alpha beta");

        assertEquals(1.0, Arrays.stream(second).sum(), 1e-9);
    }

    @Test
    @DisplayName("Should return the zero vector for text without tokens")
    void testVectorize_EmptyText() {
        double[] vector = vectorizer.vectorize("a b .. 42");

        assertEquals(100, vector.length);
        assertTrue(Arrays.stream(vector).allMatch(v -> v == 0.0));
        assertEquals(0.0, VectorMath.cosineSimilarity(vector, vectorizer.vectorize("anything")));
    }

    @Test
    @DisplayName("Slot values sum to the share of counted tokens")
    void testVectorize_TermFrequencyWeights() {
        double[] vector = vectorizer.vectorize("alpha alpha beta");

        assertEquals(1.0, Arrays.stream(vector).sum(), 1e-9);
        assertTrue(Arrays.stream(vector).anyMatch(v -> v >= 2.0 / 3.0 - 1e-9));
    }

    @Test
    @DisplayName("Word order does not change the vector")
    void testVectorize_OrderIndependent() {
        assertArrayEquals(vectorizer.vectorize("alpha beta gamma"), vectorizer.vectorize("gamma alpha beta"));
    }

    @Test
    @DisplayName("Only the top D terms are projected")
    void testVectorize_LimitsToDimension() {
        // Given
        CodeGraphProperties properties = new CodeGraphProperties();
        properties.setVectorDimension(8);
        TermFrequencyVectorizer small = new TermFrequencyVectorizer(properties);

        // When
        double[] vector = small.vectorize("one1 two2 three four five six seven eight nine ten");

        // Then
        assertEquals(8, vector.length);
        assertEquals(0.8, Arrays.stream(vector).sum(), 1e-9);
    }

    @Test
    @DisplayName("Clearing the cache empties it")
    void testClearCache() {
        vectorizer.vectorize("alpha");
        vectorizer.vectorize("beta");

        vectorizer.clearCache();

        assertEquals(0, vectorizer.cacheSize());
    }
}
