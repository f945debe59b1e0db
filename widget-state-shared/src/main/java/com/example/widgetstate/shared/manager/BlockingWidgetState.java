package com.example.widgetstate.shared.manager;

import com.example.widgetstate.shared.bridge.BlockingStateBridge;
import com.example.widgetstate.shared.callback.CallbackResult;
import com.example.widgetstate.shared.model.DispatchOutcome;
import com.example.widgetstate.shared.model.UserSession;
import com.example.widgetstate.shared.model.WidgetEvent;
import com.example.widgetstate.shared.model.WidgetRecord;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Synchronous view of {@link WidgetStateManager} for code that cannot compose Reactor types.
 * Every call waits on the {@link BlockingStateBridge}, so it must not be used from event-loop
 * or parallel scheduler threads.
 */
@RequiredArgsConstructor
public class BlockingWidgetState {

    private final WidgetStateManager manager;
    private final BlockingStateBridge bridge;

    public WidgetRecord registerWidget(String widgetId, String html, String token, Map<String, Object> metadata) {
        return bridge.block("registerWidget", manager.registerWidget(widgetId, html, token, metadata));
    }

    public Optional<WidgetRecord> getWidget(String widgetId) {
        return Optional.ofNullable(bridge.block("getWidget", manager.getWidget(widgetId)));
    }

    public Optional<String> getWidgetHtml(String widgetId) {
        return Optional.ofNullable(bridge.block("getWidgetHtml", manager.getWidgetHtml(widgetId)));
    }

    public Optional<String> getWidgetToken(String widgetId) {
        return Optional.ofNullable(bridge.block("getWidgetToken", manager.getWidgetToken(widgetId)));
    }

    public boolean updateWidgetHtml(String widgetId, String html) {
        return Boolean.TRUE.equals(bridge.block("updateWidgetHtml", manager.updateWidgetHtml(widgetId, html)));
    }

    public boolean widgetExists(String widgetId) {
        return Boolean.TRUE.equals(bridge.block("widgetExists", manager.widgetExists(widgetId)));
    }

    public boolean removeWidget(String widgetId) {
        return Boolean.TRUE.equals(bridge.block("removeWidget", manager.removeWidget(widgetId)));
    }

    public List<String> listWidgets() {
        return bridge.block("listWidgets", manager.listWidgets().collectList());
    }

    public void broadcastEvent(String widgetId, String eventType, Map<String, Object> data) {
        bridge.block("broadcastEvent", manager.broadcastEvent(widgetId, eventType, data));
    }

    /**
     * Queues the broadcast without waiting for it; failures are only logged.
     */
    public void broadcastEventInBackground(String widgetId, String eventType, Map<String, Object> data) {
        bridge.fireAndForget("broadcastEvent", manager.broadcastEvent(widgetId, eventType, data));
    }

    public boolean sendToWidget(String widgetId, WidgetEvent event) {
        return Boolean.TRUE.equals(bridge.block("sendToWidget", manager.sendToWidget(widgetId, event)));
    }

    public DispatchOutcome dispatchEvent(String widgetId, String eventType, Map<String, Object> data) {
        return bridge.block("dispatchEvent", manager.dispatchEvent(widgetId, eventType, data));
    }

    public CallbackResult invokeCallback(String widgetId, String eventType, Map<String, Object> data) {
        return bridge.block("invokeCallback", manager.invokeCallback(widgetId, eventType, data));
    }

    public UserSession createSession(String userId, Set<String> roles, Map<String, Object> metadata) {
        return bridge.block("createSession", manager.createSession(userId, roles, metadata));
    }

    public Optional<UserSession> getSession(String sessionId) {
        return Optional.ofNullable(bridge.block("getSession", manager.getSession(sessionId)));
    }

    public boolean validateSession(String sessionId) {
        return Boolean.TRUE.equals(bridge.block("validateSession", manager.validateSession(sessionId)));
    }

    public boolean refreshSession(String sessionId, Duration extendTtl) {
        return Boolean.TRUE.equals(bridge.block("refreshSession", manager.refreshSession(sessionId, extendTtl)));
    }

    public boolean deleteSession(String sessionId) {
        return Boolean.TRUE.equals(bridge.block("deleteSession", manager.deleteSession(sessionId)));
    }

    public boolean checkPermission(String sessionId, String resourceType, String resourceId, String permission) {
        return Boolean.TRUE.equals(bridge.block("checkPermission",
                manager.checkPermission(sessionId, resourceType, resourceId, permission)));
    }
}
