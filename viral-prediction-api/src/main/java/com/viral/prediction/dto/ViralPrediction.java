package com.viral.prediction.dto;

import com.viral.prediction.model.Platform;
import com.viral.prediction.service.explain.ViralExplanation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scored prediction for one piece of content on one platform.
 *
 * @param viralScore           0-100
 * @param confidence           0-1
 * @param timeToViral          estimated hours until peak spread
 * @param peakEngagement       projected peak engagement rate, 0-1
 * @param competitiveAdvantage 0-1
 * @param fallback             true when scoring failed and neutral defaults were returned
 */
public record ViralPrediction(
        String predictionId,
        double viralScore,
        double confidence,
        Platform platform,
        double timeToViral,
        double peakEngagement,
        ViralExplanation explanation,
        List<String> recommendations,
        List<String> riskFactors,
        double competitiveAdvantage,
        Instant optimalPostingTime,
        ViralMetrics viralMetrics,
        Map<String, Double> predictedMetrics,
        boolean fallback,
        Instant generatedAt
) {
    public ViralPrediction {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        predictedMetrics = predictedMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(predictedMetrics));
    }
}
