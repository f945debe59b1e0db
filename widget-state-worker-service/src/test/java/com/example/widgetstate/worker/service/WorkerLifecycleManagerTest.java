package com.example.widgetstate.worker.service;

import com.example.widgetstate.shared.exception.StateBackendException;
import com.example.widgetstate.shared.manager.WidgetStateManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerLifecycleManagerTest {

    @Mock
    private WidgetStateManager widgetStateManager;

    @InjectMocks
    private WorkerLifecycleManager lifecycleManager;

    @Test
    void initStartsManager() {
        lifecycleManager.init();

        verify(widgetStateManager).start();
    }

    @Test
    void heartbeatSkippedWithoutLocalConnections() {
        when(widgetStateManager.localConnectionIds()).thenReturn(Set.of());

        lifecycleManager.refreshConnectionHeartbeats();

        verify(widgetStateManager, never()).refreshHeartbeats();
    }

    @Test
    void heartbeatSkippedAfterShutdown() {
        when(widgetStateManager.isShutdown()).thenReturn(true);

        lifecycleManager.refreshConnectionHeartbeats();

        verify(widgetStateManager, never()).refreshHeartbeats();
    }

    @Test
    void heartbeatRefreshesLocalConnections() {
        when(widgetStateManager.localConnectionIds()).thenReturn(Set.of("abc"));
        when(widgetStateManager.refreshHeartbeats()).thenReturn(Mono.empty());

        lifecycleManager.refreshConnectionHeartbeats();

        verify(widgetStateManager).refreshHeartbeats();
    }

    @Test
    void heartbeatFailureIsLoggedNotThrown() {
        when(widgetStateManager.localConnectionIds()).thenReturn(Set.of("abc"));
        when(widgetStateManager.refreshHeartbeats())
                .thenReturn(Mono.error(new StateBackendException("redis down", null)));

        assertDoesNotThrow(() -> lifecycleManager.refreshConnectionHeartbeats());
    }

    @Test
    void shutdownDelegatesToManager() {
        lifecycleManager.shutdown();

        verify(widgetStateManager).shutdown();
    }
}
