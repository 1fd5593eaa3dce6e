package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.knowledge.PatternRecognizer;
import com.purchasingpower.codegraph.knowledge.WorkingGraph;
import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.ConceptCategory;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Name- and metadata-driven pattern detection.
 *
 * <p>Every concept id is derived from what was matched (a fixed id for
 * graph-wide patterns, the node id or term otherwise), so a second run
 * overwrites the first run's concepts instead of duplicating them.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternRecognizerImpl implements PatternRecognizer {

    private static final Pattern TERM_SPLITTER = Pattern.compile("(?=[A-Z])|[^A-Za-z0-9]+");
    private static final int MIN_TERM_LENGTH = 3;
    private static final double MAX_DOMAIN_CONFIDENCE = 0.9;

    private final CodeGraphProperties properties;

    @Override
    public int recognize(WorkingGraph graph) {
        List<GraphNode> nodes = new ArrayList<>(graph.getNodes());

        seedReferenceConcepts(graph);
        recognizeArchitecturalPatterns(graph, nodes);
        recognizeDesignPatterns(graph, nodes);
        recognizeAntiPatterns(graph, nodes);
        extractDomainConcepts(graph, nodes);

        log.info("Pattern recognition over {} nodes: {} concepts", nodes.size(), graph.conceptCount());
        return graph.conceptCount();
    }

    /**
     * Well-known concepts present in every graph, so queries can relate
     * matches to them even when no detector fires.
     */
    private void seedReferenceConcepts(WorkingGraph graph) {
        graph.putConcept(Concept.builder()
            .id("concept_mvc")
            .name("Model-View-Controller")
            .description("Architectural pattern separating concerns")
            .category(ConceptCategory.ARCHITECTURE)
            .keywords(orderedSet("mvc", "model", "view", "controller"))
            .relatedConcepts(orderedSet("separation_of_concerns"))
            .codePatterns(orderedSet("*Controller", "*Model", "*View"))
            .confidence(1.0)
            .build());

        graph.putConcept(Concept.builder()
            .id("concept_solid")
            .name("SOLID Principles")
            .description("Five design principles for maintainable software")
            .category(ConceptCategory.DESIGN_PATTERN)
            .keywords(orderedSet("solid", "srp", "ocp", "lsp", "isp", "dip"))
            .relatedConcepts(orderedSet("design_principles"))
            .codePatterns(orderedSet("interface", "abstract"))
            .confidence(1.0)
            .build());
    }

    private void recognizeArchitecturalPatterns(WorkingGraph graph, List<GraphNode> nodes) {
        List<String> controllers = idsWhere(nodes, node -> nameContains(node, "controller"));
        List<String> models = idsWhere(nodes, node -> nameContains(node, "model"));
        List<String> views = idsWhere(nodes, node -> nameContains(node, "view") || nameContains(node, "component"));

        if (!controllers.isEmpty() && !models.isEmpty() && !views.isEmpty()) {
            List<String> affected = new ArrayList<>(controllers);
            affected.addAll(models);
            affected.addAll(views);

            graph.putConcept(Concept.builder()
                .id("pattern_mvc")
                .name("Model-View-Controller")
                .description("MVC architectural pattern detected")
                .category(ConceptCategory.ARCHITECTURE)
                .keywords(orderedSet("mvc", "controller", "model", "view"))
                .relatedConcepts(orderedSet("separation_of_concerns"))
                .codePatterns(orderedSet("*Controller.ts", "*Model.ts", "*View.*"))
                .confidence(0.8)
                .affectedNodeIds(distinct(affected))
                .build());
            log.debug("MVC detected: {} controllers, {} models, {} views", controllers.size(), models.size(), views.size());
        }

        List<String> services = idsWhere(nodes, node -> nameContains(node, "service"));
        if (services.size() > properties.getServiceCountThreshold()) {
            graph.putConcept(Concept.builder()
                .id("pattern_microservices")
                .name("Microservices Architecture")
                .description("Microservices pattern detected based on service count")
                .category(ConceptCategory.ARCHITECTURE)
                .keywords(orderedSet("microservices", "service", "api"))
                .relatedConcepts(orderedSet("distributed_systems"))
                .codePatterns(orderedSet("*Service.ts", "services/*"))
                .confidence(0.7)
                .affectedNodeIds(services)
                .build());
            log.debug("Microservices detected: {} service nodes", services.size());
        }
    }

    private void recognizeDesignPatterns(WorkingGraph graph, List<GraphNode> nodes) {
        for (GraphNode node : nodes) {
            boolean singleton = node.getType() == NodeType.CLASS
                && (nameContains(node, "singleton")
                    || node.metadataValue(NodeMetadataKeys.HAS_PRIVATE_CONSTRUCTOR).map(AttributeValue::asBoolean).orElse(false));
            if (singleton) {
                graph.putConcept(Concept.builder()
                    .id("pattern_singleton_" + node.getId())
                    .name("Singleton Pattern")
                    .description("Singleton pattern detected in " + node.getName())
                    .category(ConceptCategory.DESIGN_PATTERN)
                    .keywords(orderedSet("singleton", "instance", "private"))
                    .relatedConcepts(orderedSet("creational_patterns"))
                    .codePatterns(orderedSet("private constructor", "static instance"))
                    .confidence(0.8)
                    .affectedNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
            }

            if (nameContains(node, "factory")) {
                graph.putConcept(Concept.builder()
                    .id("pattern_factory_" + node.getId())
                    .name("Factory Pattern")
                    .description("Factory pattern detected in " + node.getName())
                    .category(ConceptCategory.DESIGN_PATTERN)
                    .keywords(orderedSet("factory", "create", "instance"))
                    .relatedConcepts(orderedSet("creational_patterns"))
                    .codePatterns(orderedSet("*Factory.ts", "create*"))
                    .confidence(0.7)
                    .affectedNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
            }
        }
    }

    private void recognizeAntiPatterns(WorkingGraph graph, List<GraphNode> nodes) {
        int threshold = properties.getGodObjectLineThreshold();
        for (GraphNode node : nodes) {
            if (node.getType() != NodeType.CLASS) {
                continue;
            }
            double lineCount = node.metadataValue(NodeMetadataKeys.LINE_COUNT).map(AttributeValue::asDouble).orElse(0.0);
            if (lineCount > threshold) {
                graph.putConcept(Concept.builder()
                    .id("antipattern_god_object_" + node.getId())
                    .name("God Object Anti-pattern")
                    .description("Potential God Object detected in " + node.getName())
                    .category(ConceptCategory.DESIGN_PATTERN)
                    .keywords(orderedSet("god object", "large class", "complexity"))
                    .relatedConcepts(orderedSet("code_smells"))
                    .codePatterns(orderedSet("large classes", "high complexity"))
                    .confidence(0.6)
                    .affectedNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
                log.debug("God object candidate {} ({} lines)", node.getName(), (long) lineCount);
            }
        }
    }

    private void extractDomainConcepts(WorkingGraph graph, List<GraphNode> nodes) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        Map<String, LinkedHashSet<String>> nodesByTerm = new LinkedHashMap<>();

        for (GraphNode node : nodes) {
            for (String term : domainTerms(node.getName())) {
                frequencies.merge(term, 1, Integer::sum);
                nodesByTerm.computeIfAbsent(term, k -> new LinkedHashSet<>()).add(node.getId());
            }
        }

        int promoted = 0;
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            String term = entry.getKey();
            int frequency = entry.getValue();
            if (frequency < properties.getDomainTermMinFrequency()) {
                continue;
            }
            graph.putConcept(Concept.builder()
                .id("domain_" + term)
                .name(term)
                .description("Domain concept: " + term)
                .category(ConceptCategory.BUSINESS_LOGIC)
                .keywords(orderedSet(term))
                .codePatterns(orderedSet("*" + term + "*"))
                .confidence(Math.min(MAX_DOMAIN_CONFIDENCE, frequency / 10.0))
                .affectedNodeIds(new ArrayList<>(nodesByTerm.get(term)))
                .build());
            promoted++;
        }
        log.debug("Promoted {} of {} domain terms", promoted, frequencies.size());
    }

    /**
     * Lower-cased camel-case and separator-delimited parts of a name, three
     * characters or longer.
     */
    static List<String> domainTerms(String name) {
        List<String> terms = new ArrayList<>();
        if (name == null) {
            return terms;
        }
        for (String part : TERM_SPLITTER.split(name)) {
            if (part.length() >= MIN_TERM_LENGTH) {
                terms.add(part.toLowerCase(Locale.ROOT));
            }
        }
        return terms;
    }

    private static boolean nameContains(GraphNode node, String fragment) {
        return node.getName() != null && node.getName().toLowerCase(Locale.ROOT).contains(fragment);
    }

    private static List<String> idsWhere(List<GraphNode> nodes, Predicate<GraphNode> predicate) {
        List<String> ids = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (predicate.test(node)) {
                ids.add(node.getId());
            }
        }
        return ids;
    }

    private static List<String> distinct(List<String> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }

    private static LinkedHashSet<String> orderedSet(String... values) {
        return new LinkedHashSet<>(List.of(values));
    }
}
