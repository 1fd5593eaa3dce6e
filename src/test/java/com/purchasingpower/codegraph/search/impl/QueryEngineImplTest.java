package com.purchasingpower.codegraph.search.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.knowledge.KnowledgeGraph;
import com.purchasingpower.codegraph.knowledge.TermIndex;
import com.purchasingpower.codegraph.knowledge.WorkingGraph;
import com.purchasingpower.codegraph.knowledge.impl.NodeDescriptionGeneratorImpl;
import com.purchasingpower.codegraph.knowledge.impl.TermFrequencyVectorizer;
import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.ConceptCategory;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.model.graph.RelationshipType;
import com.purchasingpower.codegraph.model.query.InsightType;
import com.purchasingpower.codegraph.model.query.QueryFilters;
import com.purchasingpower.codegraph.model.query.QueryIntent;
import com.purchasingpower.codegraph.model.query.QueryResult;
import com.purchasingpower.codegraph.model.query.SemanticQuery;
import com.purchasingpower.codegraph.util.GraphIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Query Engine Tests")
class QueryEngineImplTest {

    private static final String INVOICE_FILE = GraphIds.nodeId(NodeType.FILE, "billing/invoice.js");
    private static final String INVOICE_TOTAL = GraphIds.entityId(NodeType.FUNCTION, "billing/invoice.js", "invoice_total");
    private static final String CUSTOMER = GraphIds.entityId(NodeType.CLASS, "crm/customer.js", "Customer");
    private static final String CUSTOMER_FILE = GraphIds.nodeId(NodeType.FILE, "crm/customer.js");

    private CodeGraphProperties properties;
    private TermFrequencyVectorizer vectorizer;
    private QueryEngineImpl queryEngine;
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        properties = new CodeGraphProperties();
        vectorizer = new TermFrequencyVectorizer(properties);
        queryEngine = new QueryEngineImpl(vectorizer, new InsightExtractorImpl(properties), properties);
        graph = billingGraph();
    }

    @Test
    @DisplayName("Should rank nodes sharing query terms, best first")
    void testQuery_RanksMatches() {
        // When
        QueryResult result = queryEngine.query(graph, SemanticQuery.search("invoice"));

        // Then
        assertThat(result.getNodes()).extracting(GraphNode::getId)
            .containsExactlyInAnyOrder(INVOICE_FILE, INVOICE_TOTAL);
        List<Double> scores = new ArrayList<>(result.getSimilarityScores().values());
        for (int i = 1; i < scores.size(); i++) {
            assertTrue(scores.get(i - 1) >= scores.get(i));
        }
        assertTrue(scores.stream().allMatch(score -> score > properties.getQuerySimilarityFloor()));
        assertThat(result.getRelationships()).extracting(GraphRelationship::getType)
            .containsExactly(RelationshipType.PART_OF);
        assertTrue(result.getRelevanceScore() > 0.0);
    }

    @Test
    @DisplayName("Blank text returns a hint and no nodes")
    void testQuery_BlankText() {
        QueryResult result = queryEngine.query(graph, SemanticQuery.search("   "));

        assertTrue(result.getNodes().isEmpty());
        assertEquals(List.of(QueryEngineImpl.BLANK_QUERY_SUGGESTION), result.getSuggestions());
        assertEquals(0.0, result.getRelevanceScore());
    }

    @Test
    @DisplayName("No match gives broadening suggestions")
    void testQuery_NoMatches() {
        QueryResult result = queryEngine.query(graph, SemanticQuery.search("zzz_no_such_token"));

        assertTrue(result.getNodes().isEmpty());
        assertThat(result.getSuggestions())
            .contains("Try a broader search term", "Check spelling and try synonyms");
    }

    @Test
    @DisplayName("Node type filter is a hard exclude")
    void testQuery_NodeTypeFilter() {
        SemanticQuery query = SemanticQuery.builder()
            .text("invoice")
            .filters(QueryFilters.builder().nodeTypes(EnumSet.of(NodeType.FUNCTION)).build())
            .build();

        QueryResult result = queryEngine.query(graph, query);

        assertThat(result.getNodes()).extracting(GraphNode::getId).containsExactly(INVOICE_TOTAL);
    }

    @Test
    @DisplayName("File path filter matches on source location")
    void testQuery_FilePathFilter() {
        SemanticQuery query = SemanticQuery.builder()
            .text("invoice customer")
            .filters(QueryFilters.builder().filePaths(List.of("crm/")).build())
            .build();

        QueryResult result = queryEngine.query(graph, query);

        assertThat(result.getNodes()).extracting(GraphNode::getId)
            .containsExactlyInAnyOrder(CUSTOMER, CUSTOMER_FILE);
    }

    @Test
    @DisplayName("Unknown concept filters are reported and ignored")
    void testQuery_UnknownConceptFilter() {
        SemanticQuery query = SemanticQuery.builder()
            .text("invoice")
            .filters(QueryFilters.builder().concepts(List.of("nonexistent")).build())
            .build();

        QueryResult result = queryEngine.query(graph, query);

        assertEquals(2, result.getNodes().size());
        assertEquals("Unknown concept filter ignored: nonexistent", result.getSuggestions().get(0));
    }

    @Test
    @DisplayName("Known concept filter keeps nodes named after its keywords")
    void testQuery_ConceptFilter() {
        SemanticQuery query = SemanticQuery.builder()
            .text("invoice customer")
            .filters(QueryFilters.builder().concepts(List.of("domain_invoice")).build())
            .build();

        QueryResult result = queryEngine.query(graph, query);

        assertThat(result.getNodes()).extracting(GraphNode::getId)
            .containsExactlyInAnyOrder(INVOICE_FILE, INVOICE_TOTAL);
    }

    @Test
    @DisplayName("Suggestions include trigger words and related concepts")
    void testQuery_Suggestions() {
        QueryResult result = queryEngine.query(graph, SemanticQuery.search("invoice function"));

        assertThat(result.getSuggestions())
            .contains("Search for related functions", "Search for: billing_domain")
            .doesNotHaveDuplicates()
            .hasSizeLessThanOrEqualTo(properties.getMaxSuggestions());
    }

    @Test
    @DisplayName("Analysis intent adds pattern insights")
    void testQuery_AnalysisIntent() {
        SemanticQuery analysis = SemanticQuery.builder().text("invoice").intent(QueryIntent.ANALYSIS).build();

        QueryResult search = queryEngine.query(graph, SemanticQuery.search("invoice"));
        QueryResult analyzed = queryEngine.query(graph, analysis);

        assertTrue(search.getInsights().stream().noneMatch(insight -> insight.getType() == InsightType.PATTERN));
        assertTrue(analyzed.getInsights().stream()
            .anyMatch(insight -> insight.getType() == InsightType.PATTERN && insight.getTitle().equals("invoice")));
    }

    @Test
    @DisplayName("Result count is capped")
    void testQuery_MaxResults() {
        properties.setMaxQueryResults(1);

        QueryResult result = queryEngine.query(graph, SemanticQuery.search("invoice"));

        assertEquals(1, result.getNodes().size());
        assertEquals(1, result.getSimilarityScores().size());
    }

    @Test
    @DisplayName("Empty graph yields an empty result")
    void testQuery_EmptyGraph() {
        QueryResult result = queryEngine.query(KnowledgeGraph.empty(), SemanticQuery.search("invoice"));

        assertTrue(result.getNodes().isEmpty());
        assertFalse(result.getSuggestions().isEmpty());
    }

    @Test
    @DisplayName("Relevance averages importance and type diversity")
    void testRelevance() {
        GraphNode service = GraphNode.builder().id("c").type(NodeType.CLASS).importance(0.8).build();
        GraphNode function = GraphNode.builder().id("f").type(NodeType.FUNCTION).importance(0.7).build();

        assertEquals(0.875, QueryEngineImpl.relevance(List.of(service, function)), 1e-9);
        assertEquals(0.0, QueryEngineImpl.relevance(List.of()));
    }

    private KnowledgeGraph billingGraph() {
        WorkingGraph working = new WorkingGraph();
        working.addNode(file("billing/invoice.js"));
        working.addNode(entity(NodeType.FUNCTION, "billing/invoice.js", "invoice_total", 0.7));
        working.addNode(file("crm/customer.js"));
        working.addNode(entity(NodeType.CLASS, "crm/customer.js", "Customer", 0.8));
        working.addRelationship(INVOICE_TOTAL, INVOICE_FILE, RelationshipType.PART_OF, 0.9, false);
        working.putConcept(Concept.builder()
            .id("domain_invoice")
            .name("invoice")
            .description("Domain concept: invoice")
            .category(ConceptCategory.BUSINESS_LOGIC)
            .keywords(new LinkedHashSet<>(List.of("invoice")))
            .relatedConcepts(new LinkedHashSet<>(List.of("billing_domain")))
            .confidence(0.3)
            .build());

        NodeDescriptionGeneratorImpl descriptions = new NodeDescriptionGeneratorImpl();
        TermIndex.Builder termIndex = TermIndex.builder();
        for (GraphNode node : working.getNodes()) {
            String description = descriptions.describe(node);
            node.setSemanticVector(vectorizer.vectorize(description));
            termIndex.add(node.getId(), vectorizer.tokenize(description));
        }
        return working.freeze(termIndex.build(), null, null);
    }

    private static GraphNode file(String path) {
        GraphNode node = GraphNode.builder()
            .id(GraphIds.nodeId(NodeType.FILE, path))
            .type(NodeType.FILE)
            .name(path.substring(path.lastIndexOf('/') + 1))
            .sourceLocation(path)
            .build();
        node.getAttributes().put(NodeMetadataKeys.LANGUAGE, AttributeValue.of("javascript"));
        return node;
    }

    private static GraphNode entity(NodeType type, String path, String name, double importance) {
        return GraphNode.builder()
            .id(GraphIds.entityId(type, path, name))
            .type(type)
            .name(name)
            .sourceLocation(path)
            .importance(importance)
            .build();
    }
}
