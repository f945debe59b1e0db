package com.example.widgetstate.shared.store;

import com.example.widgetstate.shared.config.WidgetStateProperties;
import com.example.widgetstate.shared.model.StateBackend;

import java.time.Clock;

/**
 * Builds the stores of one backend. Called once by the state manager on first use.
 */
public interface StateBackendFactory {

    StateBackend backend();

    StateStores create(WidgetStateProperties properties, Clock clock);

    /**
     * Quick reachability check used by health checks. Memory backends are always reachable.
     */
    default boolean isAvailable() {
        return true;
    }
}
