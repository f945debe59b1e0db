package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.model.UserSession;
import com.example.widgetstate.shared.store.PermissionResolver;
import com.example.widgetstate.shared.store.SessionStore;
import com.example.widgetstate.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sessions as Redis hashes under {@code {prefix}:session:{id}} with a native TTL, indexed per
 * user in {@code {prefix}:user:{userId}:sessions}. The stored {@code expires_at} is checked on
 * every read, since Redis may serve a key briefly past its TTL.
 * <p>
 * Role permissions set at runtime live in the {@code {prefix}:role_permissions} hash as JSON
 * lists; roles without an entry there fall back to the configured defaults.
 */
@Slf4j
public class RedisSessionStore extends AbstractRedisStore implements SessionStore {

    static final String FIELD_USER = "user_id";
    static final String FIELD_ROLES = "roles";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_EXPIRES_AT = "expires_at";
    static final String FIELD_TTL = "ttl";
    static final String FIELD_METADATA = "metadata";

    private final Clock clock;
    private final Duration defaultTtl;
    private final Map<String, Set<String>> defaultRolePermissions;
    private final PermissionResolver permissionResolver;

    public RedisSessionStore(StringRedisTemplate redisTemplate, RedisKeys keys, Scheduler ioScheduler,
                             Clock clock, Duration defaultTtl, Map<String, Set<String>> defaultRolePermissions,
                             PermissionResolver permissionResolver) {
        super(redisTemplate, keys, ioScheduler);
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.permissionResolver = permissionResolver;
        Map<String, Set<String>> defaults = new HashMap<>();
        defaultRolePermissions.forEach((role, perms) -> defaults.put(role, Set.copyOf(perms)));
        this.defaultRolePermissions = defaults;
    }

    @Override
    public Mono<UserSession> createSession(String sessionId, String userId, Set<String> roles,
                                           Duration ttl, Map<String, Object> metadata) {
        return call("session.create", () -> {
            Instant now = clock.instant();
            Duration lifetime = ttl != null ? ttl : defaultTtl;
            if (lifetime != null && lifetime.isNegative()) {
                throw new IllegalArgumentException("Session TTL must not be negative: " + lifetime);
            }
            boolean expires = lifetime != null && !lifetime.isZero();
            Set<String> roleSet = roles == null ? Set.of() : Set.copyOf(roles);
            Map<String, Object> metadataCopy = JsonUtils.copyOf(metadata);
            Instant expiresAt = expires ? now.plus(lifetime) : null;

            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(FIELD_USER, userId);
            fields.put(FIELD_ROLES, JsonUtils.toJsonArray(roleSet));
            fields.put(FIELD_CREATED_AT, epochMillis(now));
            fields.put(FIELD_EXPIRES_AT, expires ? epochMillis(expiresAt) : "0");
            fields.put(FIELD_TTL, expires ? Long.toString(lifetime.toMillis()) : "0");
            fields.put(FIELD_METADATA, JsonUtils.toJson(metadataCopy));

            String key = keys.session(sessionId);
            Object previousUser = redisTemplate.opsForHash().get(key, FIELD_USER);
            transaction(ops -> {
                if (previousUser != null && !previousUser.toString().equals(userId)) {
                    ops.opsForSet().remove(keys.userSessions(previousUser.toString()), sessionId);
                }
                ops.delete(key);
                ops.opsForHash().putAll(key, fields);
                if (expires) {
                    ops.expire(key, lifetime);
                }
                ops.opsForSet().add(keys.userSessions(userId), sessionId);
            });
            log.debug("Created session {} for user: {}", sessionId, userId);
            return UserSession.builder()
                    .sessionId(sessionId)
                    .userId(userId)
                    .roles(roleSet)
                    .createdAt(now)
                    .expiresAt(expiresAt)
                    .metadata(metadataCopy)
                    .build();
        });
    }

    @Override
    public Mono<UserSession> getSession(String sessionId) {
        return call("session.get", () -> readSession(sessionId, clock.instant()));
    }

    @Override
    public Mono<Boolean> validateSession(String sessionId) {
        return getSession(sessionId).hasElement();
    }

    @Override
    public Mono<Boolean> deleteSession(String sessionId) {
        return call("session.delete", () -> {
            String key = keys.session(sessionId);
            Object userId = redisTemplate.opsForHash().get(key, FIELD_USER);
            if (userId == null) {
                return false;
            }
            transaction(ops -> {
                ops.delete(key);
                ops.opsForSet().remove(keys.userSessions(userId.toString()), sessionId);
            });
            return true;
        });
    }

    @Override
    public Mono<Boolean> refreshSession(String sessionId, Duration extendTtl) {
        return call("session.refresh", () -> {
            Instant now = clock.instant();
            String key = keys.session(sessionId);
            Map<Object, Object> fields = redisTemplate.opsForHash().entries(key);
            if (fields.isEmpty()) {
                return false;
            }
            Instant expiresAt = parseInstant(fields.get(FIELD_EXPIRES_AT));
            if (expiresAt != null && expiresAt.isBefore(now)) {
                return false;
            }
            Duration lifetime = extendTtl != null ? extendTtl : storedLifetime(fields);
            if (lifetime == null) {
                return true;
            }
            transaction(ops -> {
                ops.opsForHash().put(key, FIELD_EXPIRES_AT, epochMillis(now.plus(lifetime)));
                ops.expire(key, lifetime);
            });
            return true;
        });
    }

    @Override
    public Flux<UserSession> listUserSessions(String userId) {
        return call("session.listUser", () -> {
            String indexKey = keys.userSessions(userId);
            Set<String> ids = redisTemplate.opsForSet().members(indexKey);
            if (ids == null || ids.isEmpty()) {
                return List.<UserSession>of();
            }
            Instant now = clock.instant();
            List<UserSession> live = new ArrayList<>();
            List<String> stale = new ArrayList<>();
            for (String id : ids) {
                UserSession session = readSession(id, now);
                if (session != null && userId.equals(session.getUserId())) {
                    live.add(session);
                } else {
                    stale.add(id);
                }
            }
            if (!stale.isEmpty()) {
                redisTemplate.opsForSet().remove(indexKey, stale.toArray());
                log.debug("Dropped {} expired or reassigned session(s) from user {}", stale.size(), userId);
            }
            return live;
        }).flatMapIterable(sessions -> sessions);
    }

    @Override
    public Mono<Boolean> checkPermission(String sessionId, String resourceType, String resourceId, String permission) {
        return call("session.checkPermission", () -> {
            UserSession session = readSession(sessionId, clock.instant());
            if (session == null) {
                return false;
            }
            Map<String, Set<String>> rolePermissions = new HashMap<>();
            List<String> roles = new ArrayList<>(session.getRoles());
            if (!roles.isEmpty()) {
                List<Object> stored = redisTemplate.opsForHash().multiGet(keys.rolePermissions(), new ArrayList<>(roles));
                for (int i = 0; i < roles.size(); i++) {
                    Object json = stored != null && i < stored.size() ? stored.get(i) : null;
                    rolePermissions.put(roles.get(i), resolveRole(roles.get(i), json));
                }
            }
            return permissionResolver.isGranted(session, rolePermissions, resourceType, resourceId, permission);
        });
    }

    @Override
    public Mono<Void> setRolePermissions(String role, Set<String> permissions) {
        return call("session.setRolePermissions", () -> {
            redisTemplate.opsForHash().put(keys.rolePermissions(), role, JsonUtils.toJsonArray(permissions));
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Set<String>> getRolePermissions(String role) {
        return call("session.getRolePermissions",
                () -> resolveRole(role, redisTemplate.opsForHash().get(keys.rolePermissions(), role)));
    }

    private Set<String> resolveRole(String role, Object storedJson) {
        if (storedJson != null) {
            return JsonUtils.parseStringSet(storedJson.toString());
        }
        return defaultRolePermissions.getOrDefault(role, Set.of());
    }

    private UserSession readSession(String sessionId, Instant now) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(keys.session(sessionId));
        if (fields.isEmpty() || fields.get(FIELD_USER) == null) {
            return null;
        }
        Instant expiresAt = parseInstant(fields.get(FIELD_EXPIRES_AT));
        if (expiresAt != null && expiresAt.isBefore(now)) {
            return null;
        }
        return UserSession.builder()
                .sessionId(sessionId)
                .userId(fields.get(FIELD_USER).toString())
                .roles(JsonUtils.parseStringSet((String) fields.get(FIELD_ROLES)))
                .createdAt(parseInstant(fields.get(FIELD_CREATED_AT)))
                .expiresAt(expiresAt)
                .metadata(JsonUtils.parseMap((String) fields.get(FIELD_METADATA)))
                .build();
    }

    private Duration storedLifetime(Map<Object, Object> fields) {
        Object ttl = fields.get(FIELD_TTL);
        if (ttl != null) {
            try {
                long millis = Long.parseLong(ttl.toString());
                return millis > 0 ? Duration.ofMillis(millis) : null;
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed session ttl field: {}", ttl);
            }
        }
        Instant created = parseInstant(fields.get(FIELD_CREATED_AT));
        Instant expires = parseInstant(fields.get(FIELD_EXPIRES_AT));
        return created != null && expires != null ? Duration.between(created, expires) : null;
    }
}
