package com.viral.runtime.exception;

import java.time.Duration;

/**
 * Raised when a model runtime call does not answer within its deadline.
 */
public class ModelRuntimeTimeoutException extends ModelRuntimeException {

    public ModelRuntimeTimeoutException(String operation, Duration timeout) {
        super(operation, "no response within " + timeout.toMillis() + "ms");
    }

    public ModelRuntimeTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(operation, "no response within " + timeout.toMillis() + "ms", cause);
    }
}
