package com.viral.prediction.service.explain;

import java.util.List;

/**
 * Where one feature sits relative to the range that viral content usually shows.
 */
public record FeatureAnalysis(
        String feature,
        double currentValue,
        double optimalMin,
        double optimalMax,
        Status status,
        double confidence,
        List<String> suggestions
) {
    public FeatureAnalysis {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * NEGATIVE when more than 30% outside the range, NEUTRAL when just outside, POSITIVE inside.
     */
    public enum Status { NEGATIVE, NEUTRAL, POSITIVE }
}
