package com.example.widgetstate.shared.exception;

/**
 * Thrown when the state backend cannot be reached or rejects an operation.
 * The state layer never retries; callers decide how to surface the outage.
 */
public class StateBackendException extends RuntimeException {
    public StateBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
