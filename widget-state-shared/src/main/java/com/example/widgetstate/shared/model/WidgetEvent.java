package com.example.widgetstate.shared.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * An outbound event queued on a widget's local stream, ready for the duplex handler to forward.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(staticName = "of")
public class WidgetEvent {
    private final String type;
    private final Map<String, Object> data;

    public static WidgetEvent from(EventMessage message) {
        return of(message.getEventType(), message.getData());
    }
}
