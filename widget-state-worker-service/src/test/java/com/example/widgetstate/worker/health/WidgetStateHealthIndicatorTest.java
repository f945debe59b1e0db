package com.example.widgetstate.worker.health;

import com.example.widgetstate.shared.callback.CallbackRegistryStats;
import com.example.widgetstate.shared.exception.StateBackendException;
import com.example.widgetstate.shared.manager.ManagerStats;
import com.example.widgetstate.shared.manager.WidgetStateManager;
import com.example.widgetstate.shared.model.StateBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WidgetStateHealthIndicatorTest {

    @Mock
    private WidgetStateManager widgetStateManager;

    @InjectMocks
    private WidgetStateHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        when(widgetStateManager.getStats()).thenReturn(ManagerStats.builder()
                .workerId("worker-a")
                .deployMode(true)
                .backend(StateBackend.REDIS)
                .initialized(true)
                .localConnectionCount(2)
                .localConnectionIds(Set.of("abc", "xyz"))
                .callbacks(CallbackRegistryStats.builder().widgetCount(1).totalCallbacks(3).widgets(Map.of()).build())
                .build());
    }

    @Test
    void upWhenBackendAnswers() {
        when(widgetStateManager.isBackendAvailable()).thenReturn(true);

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("worker-a", health.getDetails().get("workerId"));
        assertEquals(2, health.getDetails().get("localConnections"));
        assertEquals(3, health.getDetails().get("callbacks"));
        assertEquals("UP", health.getDetails().get("backendStatus"));
    }

    @Test
    void downWhenBackendUnreachable() {
        when(widgetStateManager.isBackendAvailable()).thenReturn(false);

        assertEquals(Status.DOWN, healthIndicator.health().getStatus());
    }

    @Test
    void downWithErrorWhenBackendCheckThrows() {
        when(widgetStateManager.isBackendAvailable()).thenThrow(new StateBackendException("connection refused", null));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("connection refused", health.getDetails().get("backendError"));
    }

    @Test
    void outOfServiceAfterShutdown() {
        when(widgetStateManager.isShutdown()).thenReturn(true);

        assertEquals(Status.OUT_OF_SERVICE, healthIndicator.health().getStatus());
        verify(widgetStateManager, never()).isBackendAvailable();
    }
}
