package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.model.ConnectionInfo;
import com.example.widgetstate.shared.store.ConnectionRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connection ownership as Redis hashes under {@code {prefix}:conn:{widgetId}}, expiring unless a
 * heartbeat refreshes them, plus one {@code {prefix}:worker:{workerId}:connections} set per worker.
 */
@Slf4j
public class RedisConnectionRouter extends AbstractRedisStore implements ConnectionRouter {

    static final String FIELD_WORKER = "worker_id";
    static final String FIELD_CONNECTED_AT = "connected_at";
    static final String FIELD_LAST_HEARTBEAT = "last_heartbeat";
    static final String FIELD_USER = "user_id";
    static final String FIELD_SESSION = "session_id";

    private final Duration connectionTtl;
    private final Clock clock;

    public RedisConnectionRouter(StringRedisTemplate redisTemplate, RedisKeys keys, Scheduler ioScheduler,
                                 Duration connectionTtl, Clock clock) {
        super(redisTemplate, keys, ioScheduler);
        this.connectionTtl = connectionTtl;
        this.clock = clock;
    }

    @Override
    public Mono<ConnectionInfo> registerConnection(String widgetId, String workerId, String userId, String sessionId) {
        return call("connection.register", () -> {
            Instant now = clock.instant();
            String key = keys.connection(widgetId);
            Object previousOwner = redisTemplate.opsForHash().get(key, FIELD_WORKER);

            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(FIELD_WORKER, workerId);
            fields.put(FIELD_CONNECTED_AT, epochMillis(now));
            fields.put(FIELD_LAST_HEARTBEAT, epochMillis(now));
            if (userId != null) {
                fields.put(FIELD_USER, userId);
            }
            if (sessionId != null) {
                fields.put(FIELD_SESSION, sessionId);
            }

            transaction(ops -> {
                ops.delete(key);
                ops.opsForHash().putAll(key, fields);
                ops.expire(key, connectionTtl);
                ops.opsForSet().add(keys.workerConnections(workerId), widgetId);
                if (previousOwner != null && !workerId.equals(previousOwner.toString())) {
                    ops.opsForSet().remove(keys.workerConnections(previousOwner.toString()), widgetId);
                }
            });
            if (previousOwner != null && !workerId.equals(previousOwner.toString())) {
                log.info("Connection for widget: {} moved from worker {} to {}", widgetId, previousOwner, workerId);
            }
            return ConnectionInfo.builder()
                    .widgetId(widgetId)
                    .workerId(workerId)
                    .connectedAt(now)
                    .lastHeartbeat(now)
                    .userId(userId)
                    .sessionId(sessionId)
                    .build();
        });
    }

    @Override
    public Mono<ConnectionInfo> getConnectionInfo(String widgetId) {
        return call("connection.get", () -> {
            Map<Object, Object> fields = redisTemplate.opsForHash().entries(keys.connection(widgetId));
            if (fields.isEmpty() || fields.get(FIELD_WORKER) == null) {
                return null;
            }
            return ConnectionInfo.builder()
                    .widgetId(widgetId)
                    .workerId(fields.get(FIELD_WORKER).toString())
                    .connectedAt(parseInstant(fields.get(FIELD_CONNECTED_AT)))
                    .lastHeartbeat(parseInstant(fields.get(FIELD_LAST_HEARTBEAT)))
                    .userId((String) fields.get(FIELD_USER))
                    .sessionId((String) fields.get(FIELD_SESSION))
                    .build();
        });
    }

    @Override
    public Mono<String> getOwner(String widgetId) {
        return call("connection.getOwner", () -> {
            Object owner = redisTemplate.opsForHash().get(keys.connection(widgetId), FIELD_WORKER);
            return owner != null ? owner.toString() : null;
        });
    }

    @Override
    public Mono<Boolean> refreshHeartbeat(String widgetId) {
        return call("connection.refreshHeartbeat", () -> {
            String key = keys.connection(widgetId);
            if (!Boolean.TRUE.equals(redisTemplate.expire(key, connectionTtl))) {
                return false;
            }
            redisTemplate.opsForHash().put(key, FIELD_LAST_HEARTBEAT, epochMillis(clock.instant()));
            return true;
        });
    }

    @Override
    public Mono<Boolean> unregisterConnection(String widgetId) {
        return call("connection.unregister", () -> {
            String key = keys.connection(widgetId);
            Object owner = redisTemplate.opsForHash().get(key, FIELD_WORKER);
            if (owner == null) {
                return false;
            }
            transaction(ops -> {
                ops.delete(key);
                ops.opsForSet().remove(keys.workerConnections(owner.toString()), widgetId);
            });
            return true;
        });
    }

    /**
     * Members are checked against their connection hash; entries that expired or now belong to
     * another worker are removed from the set.
     */
    @Override
    public Flux<String> listWorkerConnections(String workerId) {
        return call("connection.listWorker", () -> {
            String setKey = keys.workerConnections(workerId);
            Set<String> members = redisTemplate.opsForSet().members(setKey);
            if (members == null || members.isEmpty()) {
                return List.<String>of();
            }
            List<String> owned = new ArrayList<>();
            List<String> stale = new ArrayList<>();
            for (String widgetId : members) {
                Object owner = redisTemplate.opsForHash().get(keys.connection(widgetId), FIELD_WORKER);
                if (owner != null && workerId.equals(owner.toString())) {
                    owned.add(widgetId);
                } else {
                    stale.add(widgetId);
                }
            }
            if (!stale.isEmpty()) {
                redisTemplate.opsForSet().remove(setKey, stale.toArray());
                log.debug("Dropped {} stale connection(s) from worker {}", stale.size(), workerId);
            }
            return owned;
        }).flatMapIterable(ids -> ids);
    }
}
