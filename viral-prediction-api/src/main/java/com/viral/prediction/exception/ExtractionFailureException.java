package com.viral.prediction.exception;

public class ExtractionFailureException extends RuntimeException {

    public ExtractionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
