package com.example.widgetstate.shared.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An authenticated user session with its roles. A session whose expiry lies in the past is
 * treated as absent everywhere, whether or not the backend has purged it yet.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public class UserSession {
    private final String sessionId;
    private final String userId;
    @Builder.Default
    private final Set<String> roles = Set.of();
    private final Instant createdAt;
    @With
    private final Instant expiresAt;
    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /**
     * Time between creation and the current expiry; empty for sessions that never expire.
     */
    public Optional<Duration> originalTtl() {
        if (expiresAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(createdAt, expiresAt));
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
