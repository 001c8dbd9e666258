package com.viral.runtime.exception;

/**
 * Raised when the model runtime rejects a call or cannot be reached.
 */
public class ModelRuntimeException extends RuntimeException {

    private final String operation;

    public ModelRuntimeException(String operation, String message) {
        super(String.format("Model runtime %s failed: %s", operation, message));
        this.operation = operation;
    }

    public ModelRuntimeException(String operation, String message, Throwable cause) {
        super(String.format("Model runtime %s failed: %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
