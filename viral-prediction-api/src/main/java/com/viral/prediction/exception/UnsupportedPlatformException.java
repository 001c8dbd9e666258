package com.viral.prediction.exception;

/**
 * The requested platform has no registered model. Not retried.
 */
public class UnsupportedPlatformException extends RuntimeException {

    private final String platform;

    public UnsupportedPlatformException(String platform) {
        super("Unsupported platform: " + platform);
        this.platform = platform;
    }

    public String getPlatform() {
        return platform;
    }
}
