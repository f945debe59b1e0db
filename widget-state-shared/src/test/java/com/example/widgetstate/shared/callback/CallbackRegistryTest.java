package com.example.widgetstate.shared.callback;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallbackRegistryTest {

    private final CallbackRegistry registry = new CallbackRegistry(Schedulers.boundedElastic(), Clock.systemUTC());

    @Test
    void syncHandlerReceivesPayloadAndCountsInvocations() {
        AtomicReference<Object> seen = new AtomicReference<>();
        registry.register("abc", "click", (data, widgetId, eventType) -> {
            seen.set(data.get("x"));
            return widgetId + ":" + eventType;
        });

        CallbackResult result = registry.invoke("abc", "click", Map.of("x", 3)).block();

        assertTrue(result.isHandled());
        assertEquals("abc:click", result.getResult().orElseThrow());
        assertEquals(3, seen.get());
        CallbackRegistration registration = registry.get("abc", "click").orElseThrow();
        assertEquals(1, registration.getInvokeCount());
        assertTrue(registration.getLastInvoked().isPresent());
        assertFalse(registration.isAsync());
    }

    @Test
    void asyncHandlerWithoutValueIsHandled() {
        registry.registerAsync("abc", "save", (data, widgetId, eventType) -> Mono.empty());

        CallbackResult result = registry.invoke("abc", "save", null).block();

        assertTrue(result.isHandled());
        assertTrue(result.getResult().isEmpty());
        assertTrue(registry.get("abc", "save").orElseThrow().isAsync());
    }

    @Test
    void handlerOnlyRunsForItsOwnWidget() {
        AtomicReference<String> invokedFor = new AtomicReference<>();
        registry.register("w1", "click", (data, widgetId, eventType) -> {
            invokedFor.set(widgetId);
            return null;
        });

        assertFalse(registry.invoke("w2", "click", Map.of()).block().isHandled());
        assertNull(invokedFor.get());
        assertTrue(registry.hasCallback("w1", "click"));
        assertFalse(registry.hasCallback("w2", "click"));
    }

    @Test
    void missingHandlerIsNotHandled() {
        assertFalse(registry.invoke("abc", "click", Map.of()).block().isHandled());
    }

    @Test
    void failingHandlersAreReportedNotHandled() {
        registry.register("abc", "boom", (data, widgetId, eventType) -> {
            throw new IllegalStateException("boom");
        });
        registry.registerAsync("abc", "async-boom",
                (data, widgetId, eventType) -> Mono.error(new IllegalStateException("boom")));

        assertFalse(registry.invoke("abc", "boom", Map.of()).block().isHandled());
        assertFalse(registry.invoke("abc", "async-boom", Map.of()).block().isHandled());
    }

    @Test
    void reRegisteringReplacesHandler() {
        registry.register("abc", "click", (data, widgetId, eventType) -> "first");
        registry.register("abc", "click", (data, widgetId, eventType) -> "second");

        assertEquals("second", registry.invoke("abc", "click", Map.of()).block().getResult().orElseThrow());
        assertEquals(List.of("click"), registry.listWidgetEvents("abc"));
    }

    @Test
    void unregisterAndStats() {
        registry.register("abc", "click", (data, widgetId, eventType) -> null);
        registry.register("abc", "hover", (data, widgetId, eventType) -> null);
        registry.register("xyz", "click", (data, widgetId, eventType) -> null);
        registry.invoke("abc", "click", Map.of()).block();

        CallbackRegistryStats stats = registry.getStats();
        assertEquals(2, stats.getWidgetCount());
        assertEquals(3, stats.getTotalCallbacks());
        assertEquals(1, stats.getTotalInvocations());
        assertEquals(List.of("click", "hover"), stats.getWidgets().get("abc"));

        assertTrue(registry.unregister("xyz", "click"));
        assertFalse(registry.unregister("xyz", "click"));
        assertFalse(registry.hasWidget("xyz"));
        assertEquals(2, registry.unregisterWidget("abc"));
        assertEquals(List.of(), registry.listWidgets());
    }
}
