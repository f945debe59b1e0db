package com.example.widgetstate.shared.store.memory;

import com.example.widgetstate.shared.model.UserSession;
import com.example.widgetstate.shared.store.PermissionResolver;
import com.example.widgetstate.shared.store.SessionStore;
import com.example.widgetstate.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-process session store. Expired sessions are purged when a read path runs into them.
 */
@Slf4j
public class MemorySessionStore implements SessionStore {

    private final Object lock = new Object();
    private final Map<String, StoredSession> sessions = new HashMap<>();
    private final Map<String, Set<String>> userSessions = new HashMap<>();
    private final Map<String, Set<String>> rolePermissions = new HashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;
    private final PermissionResolver permissionResolver;

    public MemorySessionStore(Clock clock, Duration defaultTtl,
                              Map<String, Set<String>> rolePermissions,
                              PermissionResolver permissionResolver) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.permissionResolver = permissionResolver;
        rolePermissions.forEach((role, perms) -> this.rolePermissions.put(role, Set.copyOf(perms)));
    }

    @Override
    public Mono<UserSession> createSession(String sessionId, String userId, Set<String> roles,
                                           Duration ttl, Map<String, Object> metadata) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            Duration lifetime = ttl != null ? ttl : defaultTtl;
            if (lifetime != null && lifetime.isNegative()) {
                throw new IllegalArgumentException("Session TTL must not be negative: " + lifetime);
            }
            boolean expires = lifetime != null && !lifetime.isZero();
            UserSession session = UserSession.builder()
                    .sessionId(sessionId)
                    .userId(userId)
                    .roles(roles == null ? Set.of() : Set.copyOf(roles))
                    .createdAt(now)
                    .expiresAt(expires ? now.plus(lifetime) : null)
                    .metadata(JsonUtils.copyOf(metadata))
                    .build();
            synchronized (lock) {
                StoredSession replaced = sessions.put(sessionId, new StoredSession(session, expires ? lifetime : null));
                if (replaced != null && !replaced.session.getUserId().equals(userId)) {
                    removeFromUser(replaced.session.getUserId(), sessionId);
                }
                userSessions.computeIfAbsent(userId, k -> new LinkedHashSet<>()).add(sessionId);
            }
            log.debug("Created session {} for user: {}", sessionId, userId);
            return session;
        });
    }

    @Override
    public Mono<UserSession> getSession(String sessionId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return liveSession(sessionId, clock.instant());
            }
        });
    }

    @Override
    public Mono<Boolean> validateSession(String sessionId) {
        return getSession(sessionId).hasElement();
    }

    @Override
    public Mono<Boolean> deleteSession(String sessionId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                StoredSession removed = sessions.remove(sessionId);
                if (removed == null) {
                    return false;
                }
                removeFromUser(removed.session.getUserId(), sessionId);
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> refreshSession(String sessionId, Duration extendTtl) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                Instant now = clock.instant();
                UserSession session = liveSession(sessionId, now);
                if (session == null) {
                    return false;
                }
                StoredSession stored = sessions.get(sessionId);
                Duration lifetime = extendTtl != null ? extendTtl : stored.lifetime;
                if (lifetime != null) {
                    sessions.put(sessionId, new StoredSession(session.withExpiresAt(now.plus(lifetime)), stored.lifetime));
                }
                return true;
            }
        });
    }

    @Override
    public Flux<UserSession> listUserSessions(String userId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                Set<String> ids = userSessions.get(userId);
                List<UserSession> result = new ArrayList<>();
                if (ids == null) {
                    return result;
                }
                Instant now = clock.instant();
                for (Iterator<String> it = ids.iterator(); it.hasNext(); ) {
                    String id = it.next();
                    StoredSession stored = sessions.get(id);
                    if (stored == null) {
                        it.remove();
                    } else if (stored.session.isExpired(now)) {
                        sessions.remove(id);
                        it.remove();
                    } else {
                        result.add(stored.session);
                    }
                }
                if (ids.isEmpty()) {
                    userSessions.remove(userId);
                }
                return result;
            }
        }).flatMapIterable(sessions -> sessions);
    }

    @Override
    public Mono<Boolean> checkPermission(String sessionId, String resourceType, String resourceId, String permission) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                UserSession session = liveSession(sessionId, clock.instant());
                if (session == null) {
                    return false;
                }
                return permissionResolver.isGranted(session, rolePermissions, resourceType, resourceId, permission);
            }
        });
    }

    @Override
    public Mono<Void> setRolePermissions(String role, Set<String> permissions) {
        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                rolePermissions.put(role, Set.copyOf(permissions));
            }
        });
    }

    @Override
    public Mono<Set<String>> getRolePermissions(String role) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return rolePermissions.getOrDefault(role, Set.of());
            }
        });
    }

    private UserSession liveSession(String sessionId, Instant now) {
        StoredSession stored = sessions.get(sessionId);
        if (stored == null) {
            return null;
        }
        if (stored.session.isExpired(now)) {
            sessions.remove(sessionId);
            removeFromUser(stored.session.getUserId(), sessionId);
            log.debug("Purged expired session: {}", sessionId);
            return null;
        }
        return stored.session;
    }

    private void removeFromUser(String userId, String sessionId) {
        Set<String> ids = userSessions.get(userId);
        if (ids != null) {
            ids.remove(sessionId);
            if (ids.isEmpty()) {
                userSessions.remove(userId);
            }
        }
    }

    private static final class StoredSession {
        private final UserSession session;
        private final Duration lifetime;

        private StoredSession(UserSession session, Duration lifetime) {
            this.session = session;
            this.lifetime = lifetime;
        }
    }
}
