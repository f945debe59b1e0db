package com.example.widgetstate.shared.exception;

import java.time.Duration;

public class StateOperationTimeoutException extends RuntimeException {
    public StateOperationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("State operation '" + operation + "' did not complete within " + timeout, cause);
    }
}
