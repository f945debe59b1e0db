package com.example.widgetstate.shared.callback;

import lombok.Getter;

import java.time.Instant;
import java.util.Optional;

/**
 * A handler bound to one widget event, with its invocation counters. Exists only in the process
 * that registered it. Counters are written by {@link CallbackRegistry} under its lock.
 */
@Getter
public class CallbackRegistration {

    private final String widgetId;
    private final String eventType;
    private final WidgetCallback callback;
    private final AsyncWidgetCallback asyncCallback;
    private final Instant createdAt;
    private volatile long invokeCount;
    private volatile Instant lastInvoked;

    CallbackRegistration(String widgetId, String eventType, WidgetCallback callback,
                         AsyncWidgetCallback asyncCallback, Instant createdAt) {
        this.widgetId = widgetId;
        this.eventType = eventType;
        this.callback = callback;
        this.asyncCallback = asyncCallback;
        this.createdAt = createdAt;
    }

    public boolean isAsync() {
        return asyncCallback != null;
    }

    public Optional<Instant> getLastInvoked() {
        return Optional.ofNullable(lastInvoked);
    }

    void recordInvocation(Instant at) {
        invokeCount++;
        lastInvoked = at;
    }
}
