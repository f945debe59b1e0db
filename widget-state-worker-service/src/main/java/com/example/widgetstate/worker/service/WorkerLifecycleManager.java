package com.example.widgetstate.worker.service;

import com.example.widgetstate.shared.manager.WidgetStateManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class WorkerLifecycleManager {

    private final WidgetStateManager widgetStateManager;

    @PostConstruct
    public void init() {
        widgetStateManager.start();
        log.info("Worker {} started (deployMode={}, backend={})", widgetStateManager.getWorkerId(),
                widgetStateManager.isDeployMode(), widgetStateManager.getBackend());
    }

    /**
     * Keeps this worker's connection entries alive in the router. Entries of a worker that stops
     * heartbeating expire after the connection TTL.
     */
    @Scheduled(fixedDelayString = "#{@widgetStateProperties.heartbeat.interval.toMillis()}",
            initialDelayString = "#{@widgetStateProperties.heartbeat.interval.toMillis()}")
    public void refreshConnectionHeartbeats() {
        if (widgetStateManager.isShutdown() || widgetStateManager.localConnectionIds().isEmpty()) {
            return;
        }
        try {
            widgetStateManager.refreshHeartbeats().block();
            log.debug("Refreshed heartbeats for {} connection(s)", widgetStateManager.localConnectionIds().size());
        } catch (RuntimeException e) {
            log.warn("Could not refresh connection heartbeats. May be shutting down.", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Commencing widget state shutdown for worker {}...", widgetStateManager.getWorkerId());
        widgetStateManager.shutdown();
    }
}
