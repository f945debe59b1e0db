package com.example.widgetstate.shared.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * A rendered widget as held by the widget store: its current HTML document, the optional
 * per-widget secret used to authenticate its live connection, and who registered it.
 */
@Getter
@ToString(exclude = "html")
@EqualsAndHashCode
@Builder(toBuilder = true)
public class WidgetRecord {
    private final String widgetId;
    @With
    private final String html;
    @With
    private final String token;
    private final Instant createdAt;
    private final String ownerWorkerId;
    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    public Optional<String> getToken() {
        return Optional.ofNullable(token);
    }

    public Optional<String> getOwnerWorkerId() {
        return Optional.ofNullable(ownerWorkerId);
    }
}
