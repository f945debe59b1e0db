package com.example.widgetstate.shared.store;

import com.example.widgetstate.shared.model.WidgetRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Registry of rendered widgets. Lookups of unknown ids complete empty (or with {@code false}),
 * they never signal an error. Errors are reserved for an unreachable backend.
 */
public interface WidgetStore {

    /**
     * Upserts a widget. Re-registering an id replaces the whole record.
     */
    Mono<WidgetRecord> register(String widgetId, String html, String token,
                                String ownerWorkerId, Map<String, Object> metadata);

    Mono<WidgetRecord> get(String widgetId);

    Mono<String> getHtml(String widgetId);

    Mono<String> getToken(String widgetId);

    Mono<Boolean> exists(String widgetId);

    /**
     * @return {@code true} if the widget existed. Backends with expiry slide the TTL forward.
     */
    Mono<Boolean> updateHtml(String widgetId, String html);

    Mono<Boolean> updateToken(String widgetId, String token);

    Mono<Boolean> delete(String widgetId);

    Flux<String> listActive();

    Mono<Long> count();
}
