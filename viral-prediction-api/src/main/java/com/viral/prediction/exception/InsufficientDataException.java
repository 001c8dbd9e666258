package com.viral.prediction.exception;

/**
 * Dataset preparation found fewer samples than required.
 */
public class InsufficientDataException extends RuntimeException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super(String.format("Insufficient data: %d < %d", available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() { return available; }
    public int getRequired() { return required; }
}
