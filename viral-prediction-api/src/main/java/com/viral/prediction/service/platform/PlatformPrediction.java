package com.viral.prediction.service.platform;

import com.viral.prediction.model.Platform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a single {@link PlatformModel} run.
 *
 * @param breakdown        component name to its score (0-100) before weighting
 * @param predictedMetrics projected platform numbers such as views, likes or shares
 */
public record PlatformPrediction(
        Platform platform,
        double viralScore,
        double confidence,
        String tier,
        Map<String, Double> predictedMetrics,
        Map<String, Double> breakdown,
        List<String> recommendations,
        double contentMultiplier,
        double contextMultiplier
) {
    public PlatformPrediction {
        predictedMetrics = predictedMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(predictedMetrics));
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
