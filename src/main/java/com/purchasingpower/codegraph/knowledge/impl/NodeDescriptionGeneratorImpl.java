package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.knowledge.NodeDescriptionGenerator;
import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Synthesizes the text a node is vectorized from: its name plus the context
 * that makes structurally similar entities lexically close.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class NodeDescriptionGeneratorImpl implements NodeDescriptionGenerator {

    @Override
    public String describe(GraphNode node) {
        StringBuilder description = new StringBuilder(nullToEmpty(node.getName()));

        switch (node.getType()) {
            case FILE -> append(description, node.attributeValue(NodeMetadataKeys.LANGUAGE)
                .map(AttributeValue::asString).orElse(null));
            case FUNCTION -> {
                append(description, "function");
                append(description, node.getSourceLocation());
            }
            case CLASS -> {
                append(description, "class");
                append(description, node.metadataValue(NodeMetadataKeys.EXTENDS)
                    .map(AttributeValue::asString).orElse(null));
                append(description, node.getSourceLocation());
            }
            case INTERFACE -> {
                append(description, "interface");
                append(description, node.getSourceLocation());
            }
            case VARIABLE -> append(description, "variable");
            case MODULE -> append(description, "module");
            default -> {
                // name only
            }
        }

        log.trace("Description for {}: {}", node.getId(), description);
        return description.toString();
    }

    private static void append(StringBuilder description, String part) {
        if (part != null && !part.isBlank()) {
            description.append(' ').append(part);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
