package com.example.widgetstate.shared.store;

import com.example.widgetstate.shared.model.UserSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Authenticated sessions and role based permission checks.
 * <p>
 * A session whose expiry has passed is absent on every read path, even if the backend still holds it.
 */
public interface SessionStore {

    /**
     * @param ttl lifetime of the session; {@code null} applies the configured default and zero
     *            means the session never expires. A negative value fails with {@link IllegalArgumentException}.
     */
    Mono<UserSession> createSession(String sessionId, String userId, Set<String> roles,
                                    Duration ttl, Map<String, Object> metadata);

    Mono<UserSession> getSession(String sessionId);

    Mono<Boolean> validateSession(String sessionId);

    Mono<Boolean> deleteSession(String sessionId);

    /**
     * Pushes the expiry forward. Without {@code extendTtl} the session keeps the lifetime it was
     * created with. Expired sessions cannot be refreshed.
     */
    Mono<Boolean> refreshSession(String sessionId, Duration extendTtl);

    Flux<UserSession> listUserSessions(String userId);

    Mono<Boolean> checkPermission(String sessionId, String resourceType, String resourceId, String permission);

    Mono<Void> setRolePermissions(String role, Set<String> permissions);

    Mono<Set<String>> getRolePermissions(String role);
}
