package com.viral.prediction.service.training;

import java.time.Instant;

/**
 * Dataset preparation options. Null fields fall back to the configured defaults.
 */
public record DatasetOptions(
        Integer minSamples,
        Instant timeRangeStart,
        Instant timeRangeEnd,
        Double qualityThreshold,
        Boolean balance
) {
    public DatasetOptions {
        if (timeRangeStart != null && timeRangeEnd != null && timeRangeStart.isAfter(timeRangeEnd)) {
            throw new IllegalArgumentException("timeRangeStart must not be after timeRangeEnd");
        }
        if (minSamples != null && minSamples < 0) {
            throw new IllegalArgumentException("minSamples must not be negative");
        }
    }

    public static DatasetOptions defaults() {
        return new DatasetOptions(null, null, null, null, null);
    }

    public boolean hasTimeRange() {
        return timeRangeStart != null || timeRangeEnd != null;
    }
}
