package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.config.WidgetStateProperties;
import com.example.widgetstate.shared.model.StateBackend;
import com.example.widgetstate.shared.store.PermissionResolver;
import com.example.widgetstate.shared.store.StateBackendFactory;
import com.example.widgetstate.shared.store.StateStores;
import com.example.widgetstate.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;

/**
 * Builds the Redis stores over one shared template and listener container. All blocking Redis
 * calls of the stores run on {@code ioScheduler}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisStateBackendFactory implements StateBackendFactory {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final Scheduler ioScheduler;

    @Override
    public StateBackend backend() {
        return StateBackend.REDIS;
    }

    @Override
    public StateStores create(WidgetStateProperties properties, Clock clock) {
        RedisKeys keys = new RedisKeys(properties.getRedis().getPrefix());
        WidgetStateProperties.Ttl ttl = properties.getTtl();
        WidgetStateProperties.Session session = properties.getSession();
        log.info("Using Redis state backend with key prefix '{}'", properties.getRedis().getPrefix());
        return new StateStores(
                new RedisWidgetStore(redisTemplate, keys, ioScheduler, ttl.getWidget(), clock),
                new RedisEventBus(redisTemplate, keys, ioScheduler, listenerContainer,
                        new EventMessageCodec(JsonUtils.mapper())),
                new RedisConnectionRouter(redisTemplate, keys, ioScheduler, ttl.getConnection(), clock),
                new RedisSessionStore(redisTemplate, keys, ioScheduler, clock, ttl.getSession(),
                        session.getRolePermissions(),
                        new PermissionResolver(session.getPermissionPolicy(), session.getSuperuserRoles())));
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
