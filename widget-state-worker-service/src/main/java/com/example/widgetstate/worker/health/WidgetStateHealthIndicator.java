package com.example.widgetstate.worker.health;

import com.example.widgetstate.shared.manager.ManagerStats;
import com.example.widgetstate.shared.manager.WidgetStateManager;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports whether the state backend is reachable, along with this worker's connection and
 * callback counts.
 */
@Component
@RequiredArgsConstructor
public class WidgetStateHealthIndicator implements HealthIndicator {

    private final WidgetStateManager widgetStateManager;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        ManagerStats stats = widgetStateManager.getStats();
        details.put("workerId", stats.getWorkerId());
        details.put("deployMode", stats.isDeployMode());
        details.put("backend", stats.getBackend());
        details.put("localConnections", stats.getLocalConnectionCount());
        details.put("callbacks", stats.getCallbacks().getTotalCallbacks());

        if (widgetStateManager.isShutdown()) {
            return Health.outOfService().withDetails(details).build();
        }

        boolean backendHealthy = checkBackend(details);
        Health.Builder healthBuilder = backendHealthy ? Health.up() : Health.down();
        return healthBuilder.withDetails(details).build();
    }

    private boolean checkBackend(Map<String, Object> details) {
        try {
            boolean available = widgetStateManager.isBackendAvailable();
            details.put("backendStatus", available ? "UP" : "DOWN");
            return available;
        } catch (RuntimeException e) {
            details.put("backendStatus", "DOWN");
            details.put("backendError", e.getMessage());
            return false;
        }
    }
}
