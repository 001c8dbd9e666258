package com.viral.prediction.dto;

/**
 * Projected engagement dynamics. All rates are in [0,1]; velocity is in [0,100].
 */
public record ViralMetrics(
        double engagementRate,
        double shareRate,
        double commentRate,
        double viralVelocity,
        double sustainedEngagement,
        double crossPlatformSpread
) {
    public static final ViralMetrics NONE = new ViralMetrics(0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
}
