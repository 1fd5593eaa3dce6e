package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.knowledge.WorkingGraph;
import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.util.GraphIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pattern Recognizer Tests")
class PatternRecognizerImplTest {

    private PatternRecognizerImpl recognizer;
    private WorkingGraph graph;

    @BeforeEach
    void setUp() {
        recognizer = new PatternRecognizerImpl(new CodeGraphProperties());
        graph = new WorkingGraph();
    }

    @Test
    @DisplayName("Reference concepts are seeded even in an empty graph")
    void testRecognize_SeedsReferenceConcepts() {
        int count = recognizer.recognize(graph);

        assertEquals(2, count);
        assertThat(conceptIds()).containsExactlyInAnyOrder("concept_mvc", "concept_solid");
    }

    @Test
    @DisplayName("Should detect MVC when controllers, models and views are present")
    void testRecognize_Mvc() {
        GraphNode controller = add(NodeType.CLASS, "UserController");
        GraphNode model = add(NodeType.CLASS, "UserModel");
        GraphNode view = add(NodeType.CLASS, "UserView");

        recognizer.recognize(graph);

        Concept mvc = concept("pattern_mvc").orElseThrow();
        assertEquals(0.8, mvc.getConfidence());
        assertThat(mvc.getAffectedNodeIds()).containsExactly(controller.getId(), model.getId(), view.getId());
    }

    @Test
    @DisplayName("MVC needs all three roles")
    void testRecognize_NoMvcWithoutViews() {
        add(NodeType.CLASS, "UserController");
        add(NodeType.CLASS, "UserModel");

        recognizer.recognize(graph);

        assertTrue(concept("pattern_mvc").isEmpty());
    }

    @Test
    @DisplayName("Microservices fires above the service count threshold")
    void testRecognize_Microservices() {
        add(NodeType.CLASS, "OrderService");
        add(NodeType.CLASS, "PaymentService");
        add(NodeType.CLASS, "ShippingService");

        recognizer.recognize(graph);
        assertTrue(concept("pattern_microservices").isEmpty());

        add(NodeType.CLASS, "BillingService");
        recognizer.recognize(graph);
        assertEquals(4, concept("pattern_microservices").orElseThrow().getAffectedNodeIds().size());
    }

    @Test
    @DisplayName("Singleton by name or by private constructor, classes only")
    void testRecognize_Singleton() {
        GraphNode named = add(NodeType.CLASS, "ConfigSingleton");
        GraphNode privateCtor = node(NodeType.CLASS, "Registry");
        privateCtor.getMetadata().put(NodeMetadataKeys.HAS_PRIVATE_CONSTRUCTOR, AttributeValue.of(true));
        graph.addNode(privateCtor);
        GraphNode function = add(NodeType.FUNCTION, "singleton");

        recognizer.recognize(graph);

        assertTrue(concept("pattern_singleton_" + named.getId()).isPresent());
        assertTrue(concept("pattern_singleton_" + privateCtor.getId()).isPresent());
        assertTrue(concept("pattern_singleton_" + function.getId()).isEmpty());
    }

    @Test
    @DisplayName("Factory detected from the name")
    void testRecognize_Factory() {
        GraphNode factory = add(NodeType.CLASS, "WidgetFactory");

        recognizer.recognize(graph);

        Concept concept = concept("pattern_factory_" + factory.getId()).orElseThrow();
        assertEquals(0.7, concept.getConfidence());
        assertThat(concept.getAffectedNodeIds()).containsExactly(factory.getId());
    }

    @Test
    @DisplayName("God object needs more lines than the threshold")
    void testRecognize_GodObject() {
        GraphNode huge = node(NodeType.CLASS, "Everything");
        huge.getMetadata().put(NodeMetadataKeys.LINE_COUNT, AttributeValue.of(501L));
        graph.addNode(huge);
        GraphNode borderline = node(NodeType.CLASS, "Borderline");
        borderline.getMetadata().put(NodeMetadataKeys.LINE_COUNT, AttributeValue.of(500L));
        graph.addNode(borderline);

        recognizer.recognize(graph);

        assertTrue(concept("antipattern_god_object_" + huge.getId()).isPresent());
        assertTrue(concept("antipattern_god_object_" + borderline.getId()).isEmpty());
    }

    @Test
    @DisplayName("Domain terms need the minimum frequency")
    void testRecognize_DomainConcepts() {
        GraphNode service = add(NodeType.CLASS, "OrderService");
        GraphNode repository = add(NodeType.CLASS, "OrderRepository");
        GraphNode utils = add(NodeType.FILE, "order_utils");

        recognizer.recognize(graph);

        Concept order = concept("domain_order").orElseThrow();
        assertEquals(0.3, order.getConfidence(), 1e-9);
        assertThat(order.getAffectedNodeIds()).containsExactly(service.getId(), repository.getId(), utils.getId());
        assertTrue(concept("domain_service").isEmpty());
    }

    @Test
    @DisplayName("Domain terms split camel case and separators")
    void testDomainTerms() {
        assertThat(PatternRecognizerImpl.domainTerms("OrderService")).containsExactly("order", "service");
        assertThat(PatternRecognizerImpl.domainTerms("load_user_id")).containsExactly("load", "user");
        assertTrue(PatternRecognizerImpl.domainTerms(null).isEmpty());
    }

    @Test
    @DisplayName("Running twice yields the same concept set")
    void testRecognize_IsIdempotent() {
        add(NodeType.CLASS, "UserController");
        add(NodeType.CLASS, "UserModel");
        add(NodeType.CLASS, "UserView");
        add(NodeType.CLASS, "WidgetFactory");

        int first = recognizer.recognize(graph);
        Set<String> firstIds = conceptIds();
        int second = recognizer.recognize(graph);

        assertEquals(first, second);
        assertEquals(firstIds, conceptIds());
    }

    private GraphNode add(NodeType type, String name) {
        GraphNode node = node(type, name);
        graph.addNode(node);
        return node;
    }

    private static GraphNode node(NodeType type, String name) {
        return GraphNode.builder()
            .id(GraphIds.entityId(type, "src/app.ts", name))
            .type(type)
            .name(name)
            .sourceLocation("src/app.ts")
            .build();
    }

    private Optional<Concept> concept(String id) {
        return graph.getConcepts().stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    private Set<String> conceptIds() {
        return graph.getConcepts().stream().map(Concept::getId).collect(Collectors.toSet());
    }
}
