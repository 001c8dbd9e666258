package com.viral.prediction.service.platform;

import com.viral.prediction.model.Platform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable scoring configuration of one platform model.
 *
 * @param weights            component name to weight; must sum to 1
 * @param thresholds         score cut-offs, strictly descending
 * @param contentMultipliers content type (lower case) to score multiplier
 * @param engagement         shape of the projected engagement numbers
 */
public record PlatformModelConfig(
        Platform platform,
        String version,
        Map<String, Double> weights,
        Thresholds thresholds,
        Map<String, Double> contentMultipliers,
        EngagementProfile engagement
) {
    public static final double WEIGHT_TOLERANCE = 1e-6;

    public PlatformModelConfig {
        if (platform == null) {
            throw new IllegalArgumentException("platform is required");
        }
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("weights are required for " + platform.getId());
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            if (weight.getValue() == null || weight.getValue() < 0) {
                throw new IllegalArgumentException("Invalid weight '" + weight.getKey() + "' for " + platform.getId());
            }
            sum += weight.getValue();
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Weights for " + platform.getId() + " sum to " + sum + ", expected 1.0");
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds are required for " + platform.getId());
        }
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        contentMultipliers = contentMultipliers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contentMultipliers));
        if (engagement == null) {
            throw new IllegalArgumentException("engagement profile is required for " + platform.getId());
        }
    }

    /**
     * Multiplier for a content type; unknown or missing types count as 1.
     */
    public double contentMultiplier(String contentType) {
        if (contentType == null) {
            return 1.0;
        }
        return contentMultipliers.getOrDefault(contentType.toLowerCase(Locale.ROOT), 1.0);
    }

    public record Thresholds(double viral, double trending, double popular, double moderate) {
        public Thresholds {
            if (!(viral > trending && trending > popular && popular > moderate && moderate >= 0 && viral <= 100)) {
                throw new IllegalArgumentException(String.format(
                        "Thresholds must be strictly ordered within 0-100: %s/%s/%s/%s",
                        viral, trending, popular, moderate));
            }
        }

        public String tierOf(double score) {
            if (score >= viral) return "viral";
            if (score >= trending) return "trending";
            if (score >= popular) return "popular";
            if (score >= moderate) return "moderate";
            return "low";
        }
    }

    /**
     * @param baseReach     audience reached by a score-50 post from a creator with influence 1
     * @param rateScale     engagement rate at score 100
     * @param maxRate       hard cap on the engagement rate
     */
    public record EngagementProfile(double baseReach, double rateScale, double maxRate) {}
}
