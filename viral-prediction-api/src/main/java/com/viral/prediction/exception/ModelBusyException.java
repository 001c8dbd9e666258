package com.viral.prediction.exception;

/**
 * A training or evaluation run for the platform's model is already in progress.
 */
public class ModelBusyException extends RuntimeException {

    private final String platform;

    public ModelBusyException(String platform, String operation) {
        super(String.format("Cannot %s %s model: another run is in progress", operation, platform));
        this.platform = platform;
    }

    public String getPlatform() { return platform; }
}
