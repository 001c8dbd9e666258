package com.viral.prediction.model;

public record DataPointLabels(
        boolean viral,
        double viralScore,
        EngagementTier engagementTier,
        int peakHour,
        long totalEngagement
) {}
