package com.viral.prediction.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.viral.prediction.exception.UnsupportedPlatformException;

import java.util.List;
import java.util.Locale;

/**
 * Supported social platforms with their posting-window and caption-length conventions.
 * Days follow ISO numbering (1 = Monday, 7 = Sunday).
 */
public enum Platform {

    TWITTER("twitter", List.of(9, 12, 15, 18), List.of(2, 3, 4), 71, 100, 80),
    INSTAGRAM("instagram", List.of(11, 13, 17, 19), List.of(3, 4, 5, 6), 125, 300, 200),
    TIKTOK("tiktok", List.of(16, 18, 20, 22), List.of(5, 6, 7), 50, 150, 100),
    YOUTUBE("youtube", List.of(14, 16, 18, 20), List.of(4, 5, 6), 200, 1000, 500),
    FACEBOOK("facebook", List.of(9, 13, 15), List.of(2, 3, 4, 5), 100, 400, 250),
    LINKEDIN("linkedin", List.of(8, 10, 12, 14, 17), List.of(2, 3, 4), 150, 600, 300);

    private final String id;
    private final List<Integer> optimalHours;
    private final List<Integer> optimalDays;
    private final int minLength;
    private final int maxLength;
    private final int optimalLength;

    Platform(String id, List<Integer> optimalHours, List<Integer> optimalDays,
             int minLength, int maxLength, int optimalLength) {
        this.id = id;
        this.optimalHours = optimalHours;
        this.optimalDays = optimalDays;
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.optimalLength = optimalLength;
    }

    @JsonValue
    public String getId() { return id; }

    public List<Integer> getOptimalHours() { return optimalHours; }
    public List<Integer> getOptimalDays() { return optimalDays; }
    public int getMinLength() { return minLength; }
    public int getMaxLength() { return maxLength; }
    public int getOptimalLength() { return optimalLength; }

    public boolean usesHashtags() {
        return this == TWITTER || this == INSTAGRAM || this == TIKTOK;
    }

    @JsonCreator
    public static Platform fromId(String id) {
        if (id == null) {
            throw new UnsupportedPlatformException("null");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.id.equals(normalized)) {
                return platform;
            }
        }
        throw new UnsupportedPlatformException(id);
    }
}
