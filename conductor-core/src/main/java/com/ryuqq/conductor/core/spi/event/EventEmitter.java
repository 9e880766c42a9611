package com.ryuqq.conductor.core.spi.event;

/**
 * Event transport SPI.
 *
 * <p>Delivery semantics belong to the implementation. Publishing is fire-and-forget from the
 * conductor's point of view.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventEmitter {

    /**
     * Publishes an event.
     *
     * @param event the event
     */
    void publish(OrchestraEvent event);

    /**
     * Emitter that drops every event.
     *
     * @return a no-op emitter
     */
    static EventEmitter noop() {
        return event -> { };
    }
}
