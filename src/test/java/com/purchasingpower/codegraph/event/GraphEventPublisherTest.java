package com.purchasingpower.codegraph.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Event Publisher Tests")
class GraphEventPublisherTest {

    private GraphEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new GraphEventPublisher();
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void testPublish_IsolatesFailures() {
        // Given
        List<String> received = new ArrayList<>();
        publisher.addListener(new GraphEventListener() {
            @Override
            public void onGraphBuilt(GraphBuiltEvent event) {
                throw new IllegalStateException("boom");
            }
        });
        publisher.addListener(new GraphEventListener() {
            @Override
            public void onGraphBuilt(GraphBuiltEvent event) {
                received.add(event.rootPath().toString());
            }
        });

        // When
        assertDoesNotThrow(() -> publisher.publishGraphBuilt(
            new GraphBuiltEvent(Path.of("/repo"), 3, 2, 2, 15)));

        // Then
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Removed listeners are not called")
    void testRemoveListener() {
        List<QueryExecutedEvent> received = new ArrayList<>();
        GraphEventListener listener = new GraphEventListener() {
            @Override
            public void onQueryExecuted(QueryExecutedEvent event) {
                received.add(event);
            }
        };
        publisher.addListener(listener);

        publisher.publishQueryExecuted(new QueryExecutedEvent("first", 1, 2, 0.5));
        publisher.removeListener(listener);
        publisher.publishQueryExecuted(new QueryExecutedEvent("second", 1, 2, 0.5));

        assertEquals(1, received.size());
        assertEquals("first", received.get(0).queryText());
    }

    @Test
    @DisplayName("Null listeners are rejected")
    void testAddListener_Null() {
        assertThrows(NullPointerException.class, () -> publisher.addListener(null));
    }
}
