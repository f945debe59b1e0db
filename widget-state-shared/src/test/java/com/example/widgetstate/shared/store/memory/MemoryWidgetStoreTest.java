package com.example.widgetstate.shared.store.memory;

import com.example.widgetstate.shared.model.WidgetRecord;
import com.example.widgetstate.shared.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryWidgetStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private MemoryWidgetStore store;

    @BeforeEach
    void setUp() {
        store = new MemoryWidgetStore(clock);
    }

    @Test
    void registerStoresHtmlTokenAndOwner() {
        WidgetRecord record = store.register("abc", "<p>hi</p>", "tok", "worker-1", Map.of("kind", "chart")).block();

        assertEquals("abc", record.getWidgetId());
        assertEquals(clock.instant(), record.getCreatedAt());
        assertEquals("<p>hi</p>", store.getHtml("abc").block());
        assertEquals("tok", store.getToken("abc").block());
        assertEquals("worker-1", store.get("abc").block().getOwnerWorkerId().orElseThrow());
        assertEquals("chart", store.get("abc").block().getMetadata().get("kind"));
    }

    @Test
    void registerTwiceReplacesRecord() {
        store.register("abc", "<p>one</p>", "tok", "worker-1", null).block();
        store.register("abc", "<p>two</p>", null, "worker-2", null).block();

        assertEquals("<p>two</p>", store.getHtml("abc").block());
        assertNull(store.getToken("abc").block());
        assertEquals(1L, store.count().block());
    }

    @Test
    void missingWidgetIsEmpty() {
        assertNull(store.get("nope").block());
        assertNull(store.getHtml("nope").block());
        assertFalse(store.exists("nope").block());
    }

    @Test
    void updatesOnlyApplyToExistingWidgets() {
        assertFalse(store.updateHtml("abc", "<p>x</p>").block());
        assertFalse(store.updateToken("abc", "t").block());

        store.register("abc", "<p>hi</p>", null, "worker-1", null).block();

        assertTrue(store.updateHtml("abc", "<p>bye</p>").block());
        assertTrue(store.updateToken("abc", "t2").block());
        assertEquals("<p>bye</p>", store.getHtml("abc").block());
        assertEquals("t2", store.getToken("abc").block());
    }

    @Test
    void deleteRemovesFromActiveList() {
        store.register("a", "<p>a</p>", null, "w", null).block();
        store.register("b", "<p>b</p>", null, "w", null).block();

        assertTrue(store.delete("a").block());
        assertFalse(store.delete("a").block());

        List<String> active = store.listActive().collectList().block();
        assertEquals(List.of("b"), active);
        assertEquals(1L, store.count().block());
        assertFalse(store.exists("a").block());
    }
}
