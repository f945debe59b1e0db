package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.model.WidgetRecord;
import com.example.widgetstate.shared.support.RedisTestServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class RedisWidgetStoreTest {

    private static RedisTestServer redis;
    private final RedisKeys keys = new RedisKeys("test");

    @BeforeAll
    static void startRedis() {
        redis = RedisTestServer.start();
    }

    @AfterAll
    static void stopRedis() {
        redis.close();
    }

    @BeforeEach
    void flush() {
        redis.flushAll();
    }

    private RedisWidgetStore store(Duration ttl) {
        return new RedisWidgetStore(redis.redisTemplate(), keys, Schedulers.boundedElastic(), ttl, Clock.systemUTC());
    }

    @Test
    void registerWritesHashWithTtlAndIndexesWidget() {
        RedisWidgetStore store = store(Duration.ofHours(1));

        store.register("abc", "<p>hi</p>", "tok", "worker-1", Map.of("kind", "chart")).block();

        Map<Object, Object> hash = redis.redisTemplate().opsForHash().entries("test:widget:abc");
        assertEquals("<p>hi</p>", hash.get("html"));
        assertEquals("tok", hash.get("token"));
        assertEquals("worker-1", hash.get("owner_worker_id"));
        Long ttl = redis.redisTemplate().getExpire("test:widget:abc");
        assertTrue(ttl != null && ttl > 0 && ttl <= 3600);
        assertTrue(redis.redisTemplate().opsForSet().isMember("test:widgets:active", "abc"));
    }

    @Test
    void readsBackRecord() {
        RedisWidgetStore store = store(Duration.ofHours(1));
        store.register("abc", "<p>hi</p>", null, "worker-1", Map.of("kind", "chart")).block();

        WidgetRecord record = store.get("abc").block();

        assertEquals("<p>hi</p>", record.getHtml());
        assertTrue(record.getToken().isEmpty());
        assertEquals("worker-1", record.getOwnerWorkerId().orElseThrow());
        assertEquals("chart", record.getMetadata().get("kind"));
        assertTrue(record.getCreatedAt() != null);
        assertEquals("<p>hi</p>", store.getHtml("abc").block());
        assertNull(store.getToken("abc").block());
    }

    @Test
    void updatesRequireExistingWidget() {
        RedisWidgetStore store = store(Duration.ofHours(1));

        assertFalse(store.updateHtml("abc", "<p>x</p>").block());
        assertFalse(redis.redisTemplate().hasKey("test:widget:abc"));

        store.register("abc", "<p>hi</p>", null, "worker-1", null).block();
        assertTrue(store.updateHtml("abc", "<p>bye</p>").block());
        assertTrue(store.updateToken("abc", "t2").block());

        assertEquals("<p>bye</p>", store.getHtml("abc").block());
        assertEquals("t2", store.getToken("abc").block());
    }

    @Test
    void deleteRemovesHashAndIndexEntry() {
        RedisWidgetStore store = store(Duration.ofHours(1));
        store.register("abc", "<p>hi</p>", null, "worker-1", null).block();

        assertTrue(store.delete("abc").block());
        assertFalse(store.delete("abc").block());

        assertFalse(store.exists("abc").block());
        assertFalse(redis.redisTemplate().opsForSet().isMember("test:widgets:active", "abc"));
    }

    @Test
    void expiredWidgetsDropOutOfActiveList() throws InterruptedException {
        RedisWidgetStore shortLived = store(Duration.ofMillis(200));
        RedisWidgetStore longLived = store(Duration.ofHours(1));
        shortLived.register("gone", "<p>a</p>", null, "worker-1", null).block();
        longLived.register("kept", "<p>b</p>", null, "worker-1", null).block();

        Thread.sleep(500);

        assertEquals(List.of("kept"), longLived.listActive().collectList().block());
        assertEquals(1L, longLived.count().block());
        assertFalse(redis.redisTemplate().opsForSet().isMember("test:widgets:active", "gone"));
    }
}
