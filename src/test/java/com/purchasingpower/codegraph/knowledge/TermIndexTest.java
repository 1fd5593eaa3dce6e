package com.purchasingpower.codegraph.knowledge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Term Index Tests")
class TermIndexTest {

    @Test
    @DisplayName("Union of postings keeps first-seen order")
    void testNodeIdsForAny() {
        TermIndex index = TermIndex.builder()
            .add("n1", List.of("invoice", "total"))
            .add("n2", List.of("customer"))
            .add("n3", List.of("invoice"))
            .build();

        assertThat(index.nodeIdsForAny(List.of("invoice", "customer"))).containsExactly("n1", "n3", "n2");
        assertTrue(index.nodeIds("missing").isEmpty());
        assertEquals(3, index.termCount());
    }
}
