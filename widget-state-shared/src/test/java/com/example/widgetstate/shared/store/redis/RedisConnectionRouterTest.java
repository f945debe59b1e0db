package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.model.ConnectionInfo;
import com.example.widgetstate.shared.support.MutableClock;
import com.example.widgetstate.shared.support.RedisTestServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class RedisConnectionRouterTest {

    private static RedisTestServer redis;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private RedisConnectionRouter router;

    @BeforeAll
    static void startRedis() {
        redis = RedisTestServer.start();
    }

    @AfterAll
    static void stopRedis() {
        redis.close();
    }

    @BeforeEach
    void setUp() {
        redis.flushAll();
        router = new RedisConnectionRouter(redis.redisTemplate(), new RedisKeys("test"),
                Schedulers.boundedElastic(), Duration.ofMinutes(5), clock);
    }

    @Test
    void registerStoresOwnerUserAndSession() {
        router.registerConnection("abc", "worker-1", "alice", "s1").block();

        ConnectionInfo info = router.getConnectionInfo("abc").block();
        assertEquals("worker-1", info.getWorkerId());
        assertEquals("alice", info.getUserId().orElseThrow());
        assertEquals("s1", info.getSessionId().orElseThrow());
        assertEquals(clock.instant(), info.getConnectedAt());
        assertEquals(List.of("abc"), router.listWorkerConnections("worker-1").collectList().block());
        Long ttl = redis.redisTemplate().getExpire("test:conn:abc");
        assertTrue(ttl != null && ttl > 0 && ttl <= 300);
    }

    @Test
    void secondWorkerTakesOverConnection() {
        router.registerConnection("abc", "worker-1", null, null).block();
        router.registerConnection("abc", "worker-2", null, null).block();

        assertEquals("worker-2", router.getOwner("abc").block());
        assertTrue(router.listWorkerConnections("worker-1").collectList().block().isEmpty());
        assertEquals(List.of("abc"), router.listWorkerConnections("worker-2").collectList().block());
    }

    @Test
    void heartbeatUpdatesTimestampOnlyForLiveEntries() {
        assertFalse(router.refreshHeartbeat("abc").block());
        assertFalse(redis.redisTemplate().hasKey("test:conn:abc"));

        router.registerConnection("abc", "worker-1", null, null).block();
        clock.advance(Duration.ofSeconds(30));

        assertTrue(router.refreshHeartbeat("abc").block());
        assertEquals(clock.instant(), router.getConnectionInfo("abc").block().getLastHeartbeat());
    }

    @Test
    void unregisterRemovesEntry() {
        router.registerConnection("abc", "worker-1", null, null).block();

        assertTrue(router.unregisterConnection("abc").block());
        assertFalse(router.unregisterConnection("abc").block());

        assertNull(router.getOwner("abc").block());
        assertTrue(router.listWorkerConnections("worker-1").collectList().block().isEmpty());
    }

    @Test
    void staleWorkerSetMembersAreDropped() {
        router.registerConnection("abc", "worker-1", null, null).block();
        redis.redisTemplate().delete("test:conn:abc");

        assertTrue(router.listWorkerConnections("worker-1").collectList().block().isEmpty());
        assertFalse(redis.redisTemplate().opsForSet().isMember("test:worker:worker-1:connections", "abc"));
    }
}
