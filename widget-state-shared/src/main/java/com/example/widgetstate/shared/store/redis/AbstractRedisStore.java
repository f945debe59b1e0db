package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.exception.StateBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Shared plumbing of the Redis stores: blocking template calls run on the I/O scheduler, and
 * Spring's data access errors surface as {@link StateBackendException}.
 */
@Slf4j
abstract class AbstractRedisStore {

    protected final StringRedisTemplate redisTemplate;
    protected final RedisKeys keys;
    private final Scheduler ioScheduler;

    protected AbstractRedisStore(StringRedisTemplate redisTemplate, RedisKeys keys, Scheduler ioScheduler) {
        this.redisTemplate = redisTemplate;
        this.keys = keys;
        this.ioScheduler = ioScheduler;
    }

    protected <T> Mono<T> call(String operation, Callable<T> callable) {
        return Mono.fromCallable(callable)
                .subscribeOn(ioScheduler)
                .onErrorMap(DataAccessException.class,
                        e -> new StateBackendException("Redis operation '" + operation + "' failed: " + e.getMessage(), e));
    }

    /**
     * Queues the given commands inside MULTI and runs them with EXEC on one connection.
     */
    protected List<Object> transaction(Consumer<RedisOperations<String, String>> commands) {
        return redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                commands.accept(ops);
                return ops.exec();
            }
        });
    }

    /**
     * Reads a reply from an EXEC result list; depending on the command it is a count or a flag.
     */
    protected static boolean isAffirmative(Object reply) {
        if (reply instanceof Number number) {
            return number.longValue() > 0;
        }
        return Boolean.TRUE.equals(reply);
    }

    protected static String epochMillis(Instant instant) {
        return Long.toString(instant.toEpochMilli());
    }

    protected static Instant parseInstant(Object value) {
        if (value == null) {
            return null;
        }
        try {
            long millis = Long.parseLong(value.toString());
            return millis <= 0 ? null : Instant.ofEpochMilli(millis);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed timestamp field: {}", value);
            return null;
        }
    }
}
