package com.example.widgetstate.shared.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * An event travelling between workers over the event bus.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public class EventMessage {
    private final String eventType;
    private final String widgetId;
    @Builder.Default
    private final Map<String, Object> data = Map.of();
    private final String sourceWorkerId;
    private final String targetWorkerId;
    private final Instant timestamp;
    private final String messageId;

    public Optional<String> getTargetWorkerId() {
        return Optional.ofNullable(targetWorkerId);
    }

    public boolean isAddressedTo(String workerId) {
        return targetWorkerId == null || targetWorkerId.equals(workerId);
    }

    /**
     * Builds a message stamped with the given publish time and a fresh message id.
     */
    public static EventMessage create(String eventType, String widgetId, Map<String, Object> data,
                                      String sourceWorkerId, String targetWorkerId, Instant timestamp) {
        return EventMessage.builder()
                .eventType(eventType)
                .widgetId(widgetId)
                .data(data != null ? data : Map.of())
                .sourceWorkerId(sourceWorkerId)
                .targetWorkerId(targetWorkerId)
                .timestamp(timestamp)
                .messageId(UUID.randomUUID().toString())
                .build();
    }
}
