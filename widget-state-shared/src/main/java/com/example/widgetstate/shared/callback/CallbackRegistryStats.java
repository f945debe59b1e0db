package com.example.widgetstate.shared.callback;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@ToString
public class CallbackRegistryStats {
    private final int widgetCount;
    private final int totalCallbacks;
    private final long totalInvocations;
    /** Registered event types per widget. */
    private final Map<String, List<String>> widgets;
}
