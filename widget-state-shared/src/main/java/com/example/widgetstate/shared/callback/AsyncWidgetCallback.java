package com.example.widgetstate.shared.callback;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A non-blocking event handler. The returned {@link Mono} is subscribed by the registry; an
 * empty Mono counts as handled without a result.
 */
@FunctionalInterface
public interface AsyncWidgetCallback {

    Mono<?> handle(Map<String, Object> data, String widgetId, String eventType);
}
