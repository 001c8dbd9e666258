package com.viral.prediction.service.feature;

/**
 * Reduced feature set for low-latency paths such as live editor feedback.
 */
public record RealTimeFeatures(
        int textLength,
        int wordCount,
        double sentimentScore,
        int hashtagCount,
        int mentionCount,
        double callToActionScore
) {}
