package com.example.widgetstate.shared.exception;

/**
 * Thrown when a blocking call into the state layer is made from a thread that must not block,
 * where waiting would stall the very scheduler the operation needs.
 */
public class BridgeDeadlockException extends IllegalStateException {
    public BridgeDeadlockException(String message) {
        super(message);
    }
}
