package com.ryuqq.conductor.adapter.inmemory.telemetry;

import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.spi.event.OrchestraEvent;
import com.ryuqq.conductor.core.spi.event.OrchestraEventType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryEventEmitter}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryEventEmitterTest {

    @Test
    void publish_DeliversToSubscribersAndRecords() {
        // Given
        InMemoryEventEmitter emitter = new InMemoryEventEmitter();
        List<OrchestraEvent> received = new ArrayList<>();
        emitter.subscribe(received::add);

        // When
        emitter.publish(OrchestraEvent.of(OrchestraEventType.ACTION_COMPLETED, Domain.DATABASE, "t", "o", Map.of()));

        // Then
        assertEquals(1, received.size());
        assertEquals(1, emitter.eventsOf(OrchestraEventType.ACTION_COMPLETED).size());
        assertTrue(emitter.eventsOf(OrchestraEventType.ACTION_FAILED).isEmpty());
    }

    @Test
    void publish_FailingSubscriber_StillDeliversToOthersThenRethrows() {
        // Given
        InMemoryEventEmitter emitter = new InMemoryEventEmitter();
        List<OrchestraEvent> received = new ArrayList<>();
        emitter.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        emitter.subscribe(received::add);

        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> emitter.publish(
            OrchestraEvent.of(OrchestraEventType.ACTION_FAILED, Domain.FINANCE, "t", null, Map.of())));

        // Then
        assertEquals("listener bug", exception.getMessage());
        assertEquals(1, received.size());
        assertEquals(1, emitter.events().size());
    }

    @Test
    void clear_RemovesRecordedEvents() {
        // Given
        InMemoryEventEmitter emitter = new InMemoryEventEmitter();
        emitter.publish(OrchestraEvent.of(OrchestraEventType.ACTION_FAILED, Domain.FINANCE, "t", null, Map.of()));

        // When
        emitter.clear();

        // Then
        assertTrue(emitter.events().isEmpty());
    }
}
