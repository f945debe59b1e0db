package com.example.widgetstate.shared.store.redis;

/**
 * Key layout of the Redis backend. Every key and channel is namespaced by the configured prefix.
 */
public final class RedisKeys {

    private final String prefix;

    public RedisKeys(String prefix) {
        this.prefix = prefix;
    }

    public String widget(String widgetId) {
        return prefix + ":widget:" + widgetId;
    }

    public String activeWidgets() {
        return prefix + ":widgets:active";
    }

    public String connection(String widgetId) {
        return prefix + ":conn:" + widgetId;
    }

    public String workerConnections(String workerId) {
        return prefix + ":worker:" + workerId + ":connections";
    }

    public String session(String sessionId) {
        return prefix + ":session:" + sessionId;
    }

    public String userSessions(String userId) {
        return prefix + ":user:" + userId + ":sessions";
    }

    public String rolePermissions() {
        return prefix + ":role_permissions";
    }

    public String channel(String channel) {
        return prefix + ":channel:" + channel;
    }
}
