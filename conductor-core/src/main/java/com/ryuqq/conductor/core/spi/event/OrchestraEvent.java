package com.ryuqq.conductor.core.spi.event;

import com.ryuqq.conductor.core.model.Domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event published through the {@link EventEmitter}.
 *
 * @param type event type
 * @param domain domain the event concerns
 * @param tenantId tenant (nullable for registry events)
 * @param orchestrationId orchestration id (nullable outside coordinations)
 * @param attributes event payload, insertion ordered
 * @param timestamp when the event happened
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestraEvent(
    OrchestraEventType type,
    Domain domain,
    String tenantId,
    String orchestrationId,
    Map<String, Object> attributes,
    Instant timestamp
) {

    public OrchestraEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static OrchestraEvent of(OrchestraEventType type, Domain domain, String tenantId,
                                    String orchestrationId, Map<String, Object> attributes) {
        return new OrchestraEvent(type, domain, tenantId, orchestrationId, attributes, Instant.now());
    }
}
