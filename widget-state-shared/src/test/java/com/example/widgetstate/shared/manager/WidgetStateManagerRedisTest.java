package com.example.widgetstate.shared.manager;

import com.example.widgetstate.shared.callback.CallbackRegistry;
import com.example.widgetstate.shared.config.WidgetStateProperties;
import com.example.widgetstate.shared.model.StateBackend;
import com.example.widgetstate.shared.model.WidgetEvent;
import com.example.widgetstate.shared.store.redis.RedisStateBackendFactory;
import com.example.widgetstate.shared.support.RedisTestServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Two workers sharing one Redis server.
 */
@Testcontainers(disabledWithoutDocker = true)
class WidgetStateManagerRedisTest {

    private static RedisTestServer redis;

    private WidgetStateManager workerA;
    private WidgetStateManager workerB;

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
        workerA = worker("worker-a");
        workerB = worker("worker-b");
    }

    @AfterEach
    void tearDown() {
        workerA.shutdown();
        workerB.shutdown();
    }

    private WidgetStateManager worker(String workerId) {
        WidgetStateProperties properties = new WidgetStateProperties();
        properties.setStateBackend(StateBackend.REDIS);
        properties.setWorkerId(workerId);
        RedisStateBackendFactory factory = new RedisStateBackendFactory(redis.redisTemplate(),
                redis.listenerContainer(), Schedulers.boundedElastic());
        return new WidgetStateManager(properties, factory,
                new CallbackRegistry(Schedulers.boundedElastic(), Clock.systemUTC()), Clock.systemUTC());
    }

    @Test
    void redisBackendImpliesDeployMode() {
        assertTrue(workerA.isDeployMode());
        assertEquals(StateBackend.REDIS, workerA.getBackend());
        assertTrue(workerA.isBackendAvailable());
    }

    @Test
    void widgetWrittenByOneWorkerIsReadByAnother() {
        workerA.registerWidget("abc", "<p>hi</p>", null, null).block();

        assertEquals("<p>hi</p>", workerB.getWidgetHtml("abc").block());

        workerA.removeWidget("abc").block();
        assertFalse(workerB.widgetExists("abc").block());
    }

    @Test
    void blockingViewWorksFromPlainThreads() {
        workerA.blocking().registerWidget("abc", "<p>sync</p>", null, null);

        assertEquals("<p>sync</p>", workerB.blocking().getWidgetHtml("abc").orElseThrow());
        assertTrue(workerB.blocking().widgetExists("abc"));
    }

    @Test
    void broadcastCrossesWorkers() throws InterruptedException {
        BlockingQueue<WidgetEvent> received = new LinkedBlockingQueue<>();
        workerA.registerConnection("abc", "alice", null).block().subscribe(received::add);
        assertEquals("worker-a", workerB.getConnectionOwner("abc").block());

        WidgetEvent got = null;
        long deadline = System.currentTimeMillis() + 5000;
        while (got == null && System.currentTimeMillis() < deadline) {
            workerB.broadcastEvent("abc", "update", Map.of("v", 1)).block();
            got = received.poll(100, TimeUnit.MILLISECONDS);
        }

        assertNotNull(got);
        assertEquals(WidgetEvent.of("update", Map.of("v", 1)), got);
    }
}
