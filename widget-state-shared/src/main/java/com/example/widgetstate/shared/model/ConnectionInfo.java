package com.example.widgetstate.shared.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.time.Instant;
import java.util.Optional;

/**
 * Which worker currently holds the live connection of a widget.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public class ConnectionInfo {
    private final String widgetId;
    private final String workerId;
    private final Instant connectedAt;
    @With
    private final Instant lastHeartbeat;
    private final String userId;
    private final String sessionId;

    public Optional<String> getUserId() {
        return Optional.ofNullable(userId);
    }

    public Optional<String> getSessionId() {
        return Optional.ofNullable(sessionId);
    }
}
