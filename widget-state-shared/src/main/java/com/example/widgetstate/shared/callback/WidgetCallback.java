package com.example.widgetstate.shared.callback;

import java.util.Map;

/**
 * A synchronous event handler. It runs on the callback scheduler, so it may block.
 */
@FunctionalInterface
public interface WidgetCallback {

    /**
     * @return a result for the caller, or {@code null}
     */
    Object handle(Map<String, Object> data, String widgetId, String eventType) throws Exception;
}
