package com.example.widgetstate.shared.store.memory;

import com.example.widgetstate.shared.model.ConnectionInfo;
import com.example.widgetstate.shared.store.ConnectionRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Single-process connection router. Connections stay registered until unregistered, heartbeats
 * only move {@code lastHeartbeat} forward.
 */
@Slf4j
@RequiredArgsConstructor
public class MemoryConnectionRouter implements ConnectionRouter {

    private final Object lock = new Object();
    private final Map<String, ConnectionInfo> connections = new HashMap<>();
    private final Map<String, Set<String>> workerConnections = new HashMap<>();
    private final Clock clock;

    @Override
    public Mono<ConnectionInfo> registerConnection(String widgetId, String workerId, String userId, String sessionId) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            ConnectionInfo info = ConnectionInfo.builder()
                    .widgetId(widgetId)
                    .workerId(workerId)
                    .connectedAt(now)
                    .lastHeartbeat(now)
                    .userId(userId)
                    .sessionId(sessionId)
                    .build();
            synchronized (lock) {
                ConnectionInfo previous = connections.put(widgetId, info);
                if (previous != null && !previous.getWorkerId().equals(workerId)) {
                    removeFromWorker(previous.getWorkerId(), widgetId);
                    log.debug("Connection for widget: {} moved from worker {} to {}", widgetId, previous.getWorkerId(), workerId);
                }
                workerConnections.computeIfAbsent(workerId, k -> new LinkedHashSet<>()).add(widgetId);
            }
            return info;
        });
    }

    @Override
    public Mono<ConnectionInfo> getConnectionInfo(String widgetId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return connections.get(widgetId);
            }
        });
    }

    @Override
    public Mono<String> getOwner(String widgetId) {
        return getConnectionInfo(widgetId).map(ConnectionInfo::getWorkerId);
    }

    @Override
    public Mono<Boolean> refreshHeartbeat(String widgetId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                ConnectionInfo current = connections.get(widgetId);
                if (current == null) {
                    return false;
                }
                connections.put(widgetId, current.withLastHeartbeat(clock.instant()));
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> unregisterConnection(String widgetId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                ConnectionInfo removed = connections.remove(widgetId);
                if (removed == null) {
                    return false;
                }
                removeFromWorker(removed.getWorkerId(), widgetId);
                return true;
            }
        });
    }

    @Override
    public Flux<String> listWorkerConnections(String workerId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                Set<String> widgetIds = workerConnections.get(workerId);
                return widgetIds == null ? new ArrayList<String>() : new ArrayList<>(widgetIds);
            }
        }).flatMapIterable(ids -> ids);
    }

    private void removeFromWorker(String workerId, String widgetId) {
        Set<String> widgetIds = workerConnections.get(workerId);
        if (widgetIds != null) {
            widgetIds.remove(widgetId);
            if (widgetIds.isEmpty()) {
                workerConnections.remove(workerId);
            }
        }
    }
}
