package com.example.widgetstate.shared.callback;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local table of (widget, event type) handlers.
 * <p>
 * Handlers are plain Java objects and are never written to a backend. An event for a widget
 * whose handler lives on another worker is routed there over the event bus by the state manager.
 * Synchronous handlers run on {@code callbackScheduler} so {@link #invoke} never blocks the
 * subscribing thread.
 */
@Slf4j
public class CallbackRegistry {

    private final Object lock = new Object();
    private final Map<String, Map<String, CallbackRegistration>> callbacks = new LinkedHashMap<>();
    private final Scheduler callbackScheduler;
    private final Clock clock;

    public CallbackRegistry(Scheduler callbackScheduler, Clock clock) {
        this.callbackScheduler = callbackScheduler;
        this.clock = clock;
    }

    /**
     * Registers a blocking handler, replacing any handler already bound to the same event.
     */
    public CallbackRegistration register(String widgetId, String eventType, WidgetCallback callback) {
        return store(new CallbackRegistration(widgetId, eventType, callback, null, clock.instant()));
    }

    public CallbackRegistration registerAsync(String widgetId, String eventType, AsyncWidgetCallback callback) {
        return store(new CallbackRegistration(widgetId, eventType, null, callback, clock.instant()));
    }

    public Optional<CallbackRegistration> get(String widgetId, String eventType) {
        synchronized (lock) {
            return Optional.ofNullable(find(widgetId, eventType));
        }
    }

    public boolean hasWidget(String widgetId) {
        synchronized (lock) {
            return callbacks.containsKey(widgetId);
        }
    }

    public boolean hasCallback(String widgetId, String eventType) {
        synchronized (lock) {
            return find(widgetId, eventType) != null;
        }
    }

    /**
     * Runs the handler bound to the event, if any. Handler failures are logged and reported as
     * not handled; the returned Mono never errors.
     */
    public Mono<CallbackResult> invoke(String widgetId, String eventType, Map<String, Object> data) {
        return Mono.defer(() -> {
            CallbackRegistration registration;
            synchronized (lock) {
                registration = find(widgetId, eventType);
                if (registration == null) {
                    return Mono.just(CallbackResult.notHandled());
                }
                registration.recordInvocation(clock.instant());
            }
            Map<String, Object> payload = data != null ? data : Map.of();
            Mono<?> execution = registration.isAsync()
                    ? Mono.defer(() -> registration.getAsyncCallback().handle(payload, widgetId, eventType))
                    : Mono.fromCallable(() -> registration.getCallback().handle(payload, widgetId, eventType))
                            .subscribeOn(callbackScheduler);
            return execution
                    .map(CallbackResult::handled)
                    .defaultIfEmpty(CallbackResult.handled(null))
                    .doOnNext(result -> log.debug("Invoked callback {}:{} (count: {})",
                            widgetId, eventType, registration.getInvokeCount()))
                    .onErrorResume(e -> {
                        log.error("Error invoking callback {}:{}", widgetId, eventType, e);
                        return Mono.just(CallbackResult.notHandled());
                    });
        });
    }

    public boolean unregister(String widgetId, String eventType) {
        synchronized (lock) {
            Map<String, CallbackRegistration> events = callbacks.get(widgetId);
            if (events == null || events.remove(eventType) == null) {
                return false;
            }
            if (events.isEmpty()) {
                callbacks.remove(widgetId);
            }
            return true;
        }
    }

    /**
     * @return the number of handlers removed
     */
    public int unregisterWidget(String widgetId) {
        synchronized (lock) {
            Map<String, CallbackRegistration> events = callbacks.remove(widgetId);
            if (events == null) {
                return 0;
            }
            log.debug("Unregistered {} callbacks for widget: {}", events.size(), widgetId);
            return events.size();
        }
    }

    public List<String> listWidgetEvents(String widgetId) {
        synchronized (lock) {
            Map<String, CallbackRegistration> events = callbacks.get(widgetId);
            return events == null ? List.of() : List.copyOf(events.keySet());
        }
    }

    public List<String> listWidgets() {
        synchronized (lock) {
            return List.copyOf(callbacks.keySet());
        }
    }

    public CallbackRegistryStats getStats() {
        synchronized (lock) {
            Map<String, List<String>> widgets = new LinkedHashMap<>();
            int total = 0;
            long invocations = 0;
            for (Map.Entry<String, Map<String, CallbackRegistration>> entry : callbacks.entrySet()) {
                widgets.put(entry.getKey(), new ArrayList<>(entry.getValue().keySet()));
                total += entry.getValue().size();
                for (CallbackRegistration registration : entry.getValue().values()) {
                    invocations += registration.getInvokeCount();
                }
            }
            return CallbackRegistryStats.builder()
                    .widgetCount(callbacks.size())
                    .totalCallbacks(total)
                    .totalInvocations(invocations)
                    .widgets(widgets)
                    .build();
        }
    }

    private CallbackRegistration store(CallbackRegistration registration) {
        synchronized (lock) {
            callbacks.computeIfAbsent(registration.getWidgetId(), k -> new LinkedHashMap<>())
                    .put(registration.getEventType(), registration);
        }
        log.debug("Registered {} callback for {}:{}", registration.isAsync() ? "async" : "sync",
                registration.getWidgetId(), registration.getEventType());
        return registration;
    }

    private CallbackRegistration find(String widgetId, String eventType) {
        Map<String, CallbackRegistration> events = callbacks.get(widgetId);
        return events == null ? null : events.get(eventType);
    }
}
