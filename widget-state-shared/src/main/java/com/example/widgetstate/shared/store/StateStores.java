package com.example.widgetstate.shared.store;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The four backend stores built together by a {@link StateBackendFactory}.
 */
@Getter
@RequiredArgsConstructor
public class StateStores {
    private final WidgetStore widgets;
    private final EventBus eventBus;
    private final ConnectionRouter connections;
    private final SessionStore sessions;
}
