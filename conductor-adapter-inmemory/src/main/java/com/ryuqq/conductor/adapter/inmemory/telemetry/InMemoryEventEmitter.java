package com.ryuqq.conductor.adapter.inmemory.telemetry;

import com.ryuqq.conductor.core.spi.event.EventEmitter;
import com.ryuqq.conductor.core.spi.event.OrchestraEvent;
import com.ryuqq.conductor.core.spi.event.OrchestraEventType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory event emitter.
 *
 * <p>Keeps every published event and forwards it synchronously to registered listeners.
 * A failing listener does not prevent delivery to the others.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventEmitter implements EventEmitter {

    private final List<OrchestraEvent> published = new CopyOnWriteArrayList<>();
    private final List<Consumer<OrchestraEvent>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void publish(OrchestraEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        published.add(event);
        RuntimeException failure = null;
        for (Consumer<OrchestraEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Registers a synchronous listener.
     *
     * @param listener the listener
     */
    public void subscribe(Consumer<OrchestraEvent> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public List<OrchestraEvent> events() {
        return List.copyOf(published);
    }

    public List<OrchestraEvent> eventsOf(OrchestraEventType type) {
        return published.stream().filter(event -> event.type() == type).toList();
    }

    public void clear() {
        published.clear();
    }
}
