package com.purchasingpower.codegraph.search.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.knowledge.KnowledgeGraph;
import com.purchasingpower.codegraph.knowledge.SemanticVectorizer;
import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.model.query.GraphInsight;
import com.purchasingpower.codegraph.model.query.InsightType;
import com.purchasingpower.codegraph.model.query.QueryFilters;
import com.purchasingpower.codegraph.model.query.QueryIntent;
import com.purchasingpower.codegraph.model.query.QueryResult;
import com.purchasingpower.codegraph.model.query.SemanticQuery;
import com.purchasingpower.codegraph.search.InsightExtractor;
import com.purchasingpower.codegraph.search.QueryEngine;
import com.purchasingpower.codegraph.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks nodes by cosine similarity between the query vector and each node's
 * vector.
 *
 * <p>Only nodes sharing at least one term with the query are scored. Vector
 * slots are hashed, so two unrelated terms can land in the same slot; the
 * term check keeps such collisions out of the results.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryEngineImpl implements QueryEngine {

    static final String BLANK_QUERY_SUGGESTION = "Provide a non-empty query text";

    private final SemanticVectorizer vectorizer;
    private final InsightExtractor insightExtractor;
    private final CodeGraphProperties properties;

    @Override
    public QueryResult query(KnowledgeGraph graph, SemanticQuery query) {
        if (query == null || query.getText() == null || query.getText().isBlank()) {
            return QueryResult.empty(List.of(BLANK_QUERY_SUGGESTION));
        }

        String text = query.getText();
        QueryIntent intent = query.getIntent() != null ? query.getIntent() : QueryIntent.SEARCH;
        QueryFilters filters = query.getFilters() != null ? query.getFilters() : QueryFilters.none();
        List<String> diagnostics = new ArrayList<>();

        Set<String> conceptKeywords = resolveConceptKeywords(graph, filters, diagnostics);
        List<String> queryTerms = new ArrayList<>(new LinkedHashSet<>(vectorizer.tokenize(text)));
        double[] queryVector = vectorizer.vectorize(text);

        List<ScoredNode> scored = new ArrayList<>();
        for (String nodeId : graph.getTermIndex().nodeIdsForAny(queryTerms)) {
            GraphNode node = graph.getNode(nodeId).orElse(null);
            if (node == null || !passesFilters(node, filters, conceptKeywords)) {
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(queryVector, node.getSemanticVector());
            if (similarity > properties.getQuerySimilarityFloor()) {
                scored.add(new ScoredNode(node, similarity));
            }
        }

        scored.sort(Comparator.comparingDouble(ScoredNode::similarity).reversed()
            .thenComparing(scoredNode -> scoredNode.node().getId()));
        if (scored.size() > properties.getMaxQueryResults()) {
            scored = new ArrayList<>(scored.subList(0, properties.getMaxQueryResults()));
        }

        // results are detached copies; the published snapshot is shared by every query
        List<GraphNode> nodes = new ArrayList<>();
        Map<String, Double> similarityScores = new LinkedHashMap<>();
        for (ScoredNode scoredNode : scored) {
            nodes.add(scoredNode.node().copy());
            similarityScores.put(scoredNode.node().getId(), scoredNode.similarity());
        }

        Set<String> resultIds = new LinkedHashSet<>(similarityScores.keySet());
        List<GraphRelationship> relationships = graph.relationshipsTouching(resultIds).stream()
            .map(GraphRelationship::copy)
            .collect(Collectors.toList());

        List<GraphInsight> insights = new ArrayList<>(insightExtractor.extract(nodes, relationships));
        if (intent == QueryIntent.ANALYSIS || intent == QueryIntent.PATTERN_RECOGNITION) {
            insights.addAll(patternInsights(graph, nodes));
        }

        log.debug("Query '{}' ({} terms) matched {} nodes", text, queryTerms.size(), nodes.size());

        return QueryResult.builder()
            .nodes(nodes)
            .relationships(relationships)
            .relevanceScore(relevance(nodes))
            .suggestions(suggestions(graph, text, nodes, diagnostics))
            .insights(insights)
            .similarityScores(similarityScores)
            .build();
    }

    private Set<String> resolveConceptKeywords(KnowledgeGraph graph, QueryFilters filters, List<String> diagnostics) {
        Set<String> keywords = new LinkedHashSet<>();
        if (filters.getConcepts() == null) {
            return keywords;
        }
        for (String requested : filters.getConcepts()) {
            boolean found = false;
            for (Concept concept : graph.getConcepts()) {
                if (concept.getId().equalsIgnoreCase(requested) || concept.getName().equalsIgnoreCase(requested)) {
                    concept.getKeywords().forEach(keyword -> keywords.add(keyword.toLowerCase(Locale.ROOT)));
                    found = true;
                }
            }
            if (!found) {
                diagnostics.add("Unknown concept filter ignored: " + requested);
            }
        }
        return keywords;
    }

    private boolean passesFilters(GraphNode node, QueryFilters filters, Set<String> conceptKeywords) {
        Set<NodeType> nodeTypes = filters.getNodeTypes();
        if (nodeTypes != null && !nodeTypes.isEmpty() && !nodeTypes.contains(node.getType())) {
            return false;
        }

        List<String> filePaths = filters.getFilePaths();
        if (filePaths != null && !filePaths.isEmpty()) {
            String location = node.getSourceLocation();
            if (location == null || filePaths.stream().noneMatch(location::contains)) {
                return false;
            }
        }

        return conceptKeywords.isEmpty() || nameContainsAny(node, conceptKeywords);
    }

    static double relevance(List<GraphNode> nodes) {
        if (nodes.isEmpty()) {
            return 0.0;
        }
        double meanImportance = nodes.stream().mapToDouble(GraphNode::getImportance).average().orElse(0.0);
        long distinctTypes = nodes.stream().map(GraphNode::getType).distinct().count();
        return (meanImportance + (double) distinctTypes / nodes.size()) / 2;
    }

    private List<String> suggestions(KnowledgeGraph graph, String text, List<GraphNode> nodes, List<String> diagnostics) {
        Set<String> suggestions = new LinkedHashSet<>(diagnostics);

        if (nodes.isEmpty()) {
            suggestions.add("Try a broader search term");
            suggestions.add("Check spelling and try synonyms");
        }

        Set<String> words = new LinkedHashSet<>(Arrays.asList(text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")));
        if (words.contains("function") || words.contains("method")) {
            suggestions.add("Search for related functions");
        }
        if (words.contains("class") || words.contains("component")) {
            suggestions.add("Find similar classes");
        }
        if (words.contains("pattern")) {
            suggestions.add("Explore design patterns");
        }

        for (Concept concept : graph.getConcepts()) {
            if (matchesAny(concept, nodes)) {
                concept.getRelatedConcepts().forEach(related -> suggestions.add("Search for: " + related));
            }
        }

        return suggestions.stream()
            .limit(properties.getMaxSuggestions())
            .collect(Collectors.toList());
    }

    private List<GraphInsight> patternInsights(KnowledgeGraph graph, List<GraphNode> nodes) {
        List<GraphInsight> insights = new ArrayList<>();
        for (Concept concept : graph.getConcepts()) {
            List<String> matched = new ArrayList<>();
            for (GraphNode node : nodes) {
                if (nameContainsAny(node, concept.getKeywords())) {
                    matched.add(node.getId());
                }
            }
            if (matched.isEmpty()) {
                continue;
            }
            insights.add(GraphInsight.builder()
                .type(InsightType.PATTERN)
                .title(concept.getName())
                .description(concept.getDescription() + " (" + matched.size() + " matching results)")
                .confidence(concept.getConfidence())
                .actionable(false)
                .affectedNodes(matched)
                .build());
        }
        return insights;
    }

    private static boolean matchesAny(Concept concept, List<GraphNode> nodes) {
        for (GraphNode node : nodes) {
            if (nameContainsAny(node, concept.getKeywords())) {
                return true;
            }
        }
        return false;
    }

    private static boolean nameContainsAny(GraphNode node, Set<String> keywords) {
        if (node.getName() == null) {
            return false;
        }
        String name = node.getName().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (name.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private record ScoredNode(GraphNode node, double similarity) {
    }
}
