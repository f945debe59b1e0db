package com.example.widgetstate.shared.store;

/**
 * Channel naming for the event bus.
 */
public final class EventChannels {

    public static final String WIDGET_PREFIX = "widget:";
    public static final String WORKER_PREFIX = "worker:";

    /** Event type sent to a worker whose connection for a widget was taken over by another worker. */
    public static final String CONNECTION_SUPERSEDED = "connection:superseded";

    private EventChannels() {}

    public static String widget(String widgetId) {
        return WIDGET_PREFIX + widgetId;
    }

    public static String worker(String workerId) {
        return WORKER_PREFIX + workerId;
    }
}
