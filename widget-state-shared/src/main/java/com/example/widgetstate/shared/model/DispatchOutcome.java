package com.example.widgetstate.shared.model;

/**
 * Result of routing an inbound client event.
 */
public enum DispatchOutcome {
    HANDLED_LOCALLY,
    ROUTED,
    NOT_HANDLED
}
