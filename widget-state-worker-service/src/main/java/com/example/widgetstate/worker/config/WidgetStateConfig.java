package com.example.widgetstate.worker.config;

import com.example.widgetstate.shared.auth.SessionTokenService;
import com.example.widgetstate.shared.callback.CallbackRegistry;
import com.example.widgetstate.shared.config.WidgetStateProperties;
import com.example.widgetstate.shared.manager.WidgetStateManager;
import com.example.widgetstate.shared.store.StateBackendFactory;
import com.example.widgetstate.shared.store.memory.MemoryStateBackendFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;

/**
 * Composition root of the state layer. Every collaborator of the manager is a bean here, so
 * connection and HTTP handlers receive the one manager by injection.
 */
@Configuration
public class WidgetStateConfig {

    @Bean
    @ConditionalOnProperty(prefix = "widgetstate", name = "state-backend", havingValue = "memory", matchIfMissing = true)
    public StateBackendFactory memoryStateBackendFactory() {
        return new MemoryStateBackendFactory();
    }

    @Bean
    public CallbackRegistry callbackRegistry(@Qualifier("callbackScheduler") Scheduler callbackScheduler, Clock clock) {
        return new CallbackRegistry(callbackScheduler, clock);
    }

    /**
     * Started and shut down by {@link com.example.widgetstate.worker.service.WorkerLifecycleManager}.
     */
    @Bean(destroyMethod = "")
    public WidgetStateManager widgetStateManager(WidgetStateProperties widgetStateProperties,
                                                 StateBackendFactory stateBackendFactory,
                                                 CallbackRegistry callbackRegistry,
                                                 Clock clock) {
        return new WidgetStateManager(widgetStateProperties, stateBackendFactory, callbackRegistry, clock);
    }

    @Bean
    public SessionTokenService sessionTokenService(WidgetStateProperties widgetStateProperties, Clock clock) {
        WidgetStateProperties.Auth auth = widgetStateProperties.getAuth();
        return new SessionTokenService(auth.getTokenSecret(), auth.getWidgetTokenTtl(), clock);
    }
}
