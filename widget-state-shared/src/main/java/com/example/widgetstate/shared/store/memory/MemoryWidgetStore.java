package com.example.widgetstate.shared.store.memory;

import com.example.widgetstate.shared.model.WidgetRecord;
import com.example.widgetstate.shared.store.WidgetStore;
import com.example.widgetstate.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-process widget store. Widgets live until they are deleted.
 */
@Slf4j
@RequiredArgsConstructor
public class MemoryWidgetStore implements WidgetStore {

    private final Object lock = new Object();
    private final Map<String, WidgetRecord> widgets = new LinkedHashMap<>();
    private final Clock clock;

    @Override
    public Mono<WidgetRecord> register(String widgetId, String html, String token,
                                       String ownerWorkerId, Map<String, Object> metadata) {
        return Mono.fromCallable(() -> {
            WidgetRecord record = WidgetRecord.builder()
                    .widgetId(widgetId)
                    .html(html)
                    .token(token)
                    .createdAt(clock.instant())
                    .ownerWorkerId(ownerWorkerId)
                    .metadata(JsonUtils.copyOf(metadata))
                    .build();
            synchronized (lock) {
                widgets.put(widgetId, record);
            }
            log.debug("Registered widget: {}", widgetId);
            return record;
        });
    }

    @Override
    public Mono<WidgetRecord> get(String widgetId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return widgets.get(widgetId);
            }
        });
    }

    @Override
    public Mono<String> getHtml(String widgetId) {
        return get(widgetId).map(WidgetRecord::getHtml);
    }

    @Override
    public Mono<String> getToken(String widgetId) {
        return get(widgetId).flatMap(record -> Mono.justOrEmpty(record.getToken()));
    }

    @Override
    public Mono<Boolean> exists(String widgetId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return widgets.containsKey(widgetId);
            }
        });
    }

    @Override
    public Mono<Boolean> updateHtml(String widgetId, String html) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                WidgetRecord current = widgets.get(widgetId);
                if (current == null) {
                    return false;
                }
                widgets.put(widgetId, current.withHtml(html));
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> updateToken(String widgetId, String token) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                WidgetRecord current = widgets.get(widgetId);
                if (current == null) {
                    return false;
                }
                widgets.put(widgetId, current.withToken(token));
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> delete(String widgetId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return widgets.remove(widgetId) != null;
            }
        });
    }

    @Override
    public Flux<String> listActive() {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return new ArrayList<>(widgets.keySet());
            }
        }).flatMapIterable(ids -> ids);
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return (long) widgets.size();
            }
        });
    }
}
