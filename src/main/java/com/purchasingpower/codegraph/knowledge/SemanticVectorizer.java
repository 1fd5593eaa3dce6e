package com.purchasingpower.codegraph.knowledge;

import java.util.List;

/**
 * Turns text into fixed-dimension vectors for similarity comparison.
 */
public interface SemanticVectorizer {

    /**
     * Vectorize text. Same text always gives an equal vector.
     *
     * @param text any text, null is treated as empty
     * @return vector of length {@link #getDimension()}, all zeros when the text has no tokens
     */
    double[] vectorize(String text);

    /**
     * The tokens {@link #vectorize(String)} counts, in text order.
     */
    List<String> tokenize(String text);

    int getDimension();

    long cacheSize();

    void clearCache();
}
