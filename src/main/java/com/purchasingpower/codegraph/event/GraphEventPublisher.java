package com.purchasingpower.codegraph.event;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Explicit listener registry for graph events.
 *
 * A failing listener is logged and skipped; it never breaks the build or
 * query that emitted the event.
 */
@Slf4j
@Component
public class GraphEventPublisher {

    private final List<GraphEventListener> listeners = new CopyOnWriteArrayList<>();

    public GraphEventPublisher() {
    }

    @Autowired
    public GraphEventPublisher(ObjectProvider<GraphEventListener> listenerBeans) {
        listenerBeans.orderedStream().forEach(listeners::add);
        log.debug("Registered {} graph event listeners", listeners.size());
    }

    public void addListener(GraphEventListener listener) {
        Preconditions.checkNotNull(listener, "Listener cannot be null");
        listeners.add(listener);
    }

    public void removeListener(GraphEventListener listener) {
        listeners.remove(listener);
    }

    public void publishGraphBuilt(GraphBuiltEvent event) {
        dispatch(listener -> listener.onGraphBuilt(event), "graph built");
    }

    public void publishQueryExecuted(QueryExecutedEvent event) {
        dispatch(listener -> listener.onQueryExecuted(event), "query executed");
    }

    private void dispatch(Consumer<GraphEventListener> callback, String eventName) {
        for (GraphEventListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} event: {}",
                    listener.getClass().getSimpleName(), eventName, e.getMessage(), e);
            }
        }
    }
}
