package com.purchasingpower.codegraph.knowledge;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Inverted index from vectorizer tokens to the ids of nodes whose description
 * contains them.
 */
public final class TermIndex {

    private static final TermIndex EMPTY = new TermIndex(Map.of());

    private final Map<String, Set<String>> postings;

    private TermIndex(Map<String, Set<String>> postings) {
        this.postings = postings;
    }

    public static TermIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> nodeIds(String term) {
        return postings.getOrDefault(term, Set.of());
    }

    /**
     * Union of the postings of all given terms, in first-seen order.
     */
    public Set<String> nodeIdsForAny(Collection<String> terms) {
        Set<String> ids = new LinkedHashSet<>();
        for (String term : terms) {
            ids.addAll(nodeIds(term));
        }
        return ids;
    }

    public int termCount() {
        return postings.size();
    }

    public static final class Builder {

        private final Map<String, Set<String>> postings = new LinkedHashMap<>();

        public Builder add(String nodeId, Collection<String> terms) {
            for (String term : terms) {
                postings.computeIfAbsent(term, k -> new LinkedHashSet<>()).add(nodeId);
            }
            return this;
        }

        public TermIndex build() {
            Map<String, Set<String>> frozen = new LinkedHashMap<>();
            postings.forEach((term, ids) -> frozen.put(term, Collections.unmodifiableSet(new LinkedHashSet<>(ids))));
            return new TermIndex(Collections.unmodifiableMap(frozen));
        }
    }
}
