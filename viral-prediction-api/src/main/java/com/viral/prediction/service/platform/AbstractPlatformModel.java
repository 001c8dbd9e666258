package com.viral.prediction.service.platform;

import com.viral.prediction.dto.ContentTypeMetadata;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.ContentFeatures;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.viral.prediction.util.ScoreMath.clamp;
import static com.viral.prediction.util.ScoreMath.clamp100;
import static com.viral.prediction.util.ScoreMath.round3;

/**
 * Shared scoring template: component scores, weighted sum, content multiplier, context multiplier, clamp.
 * Subclasses supply the components and the platform-specific adjustments.
 */
public abstract class AbstractPlatformModel implements PlatformModel {

    public static final double MAX_CONTEXT_MULTIPLIER = 2.0;
    public static final double MAX_CONFIDENCE = 0.95;
    static final double DEFAULT_CREATOR_INFLUENCE = 0.1;

    private final PlatformModelConfig config;

    protected AbstractPlatformModel(PlatformModelConfig config) {
        this.config = config;
    }

    @Override
    public Platform platform() {
        return config.platform();
    }

    @Override
    public PlatformModelConfig config() {
        return config;
    }

    @Override
    public PlatformPrediction predict(ContentFeatures features, ContentTypeMetadata metadata) {
        Map<String, Double> components = componentScores(features, metadata);

        Map<String, Double> breakdown = new LinkedHashMap<>();
        double raw = 0.0;
        for (Map.Entry<String, Double> weight : config.weights().entrySet()) {
            Double component = components.get(weight.getKey());
            if (component == null) {
                throw new IllegalStateException("Missing component '" + weight.getKey() + "' for " + platform().getId());
            }
            double score = clamp100(component);
            breakdown.put(weight.getKey(), round3(score));
            raw += score * weight.getValue();
        }

        double contentMultiplier = contentMultiplier(features, metadata);
        double contextMultiplier = clamp(contextMultiplier(features), 0.0, MAX_CONTEXT_MULTIPLIER);
        double finalScore = clamp100(raw * contentMultiplier * contextMultiplier);

        return new PlatformPrediction(
                platform(),
                finalScore,
                Math.min(MAX_CONFIDENCE, confidence(features, metadata)),
                config.thresholds().tierOf(finalScore),
                predictMetrics(features, metadata, finalScore),
                breakdown,
                recommendations(features, metadata),
                contentMultiplier,
                contextMultiplier
        );
    }

    /**
     * Raw component scores keyed like {@link PlatformModelConfig#weights()}; values are clamped to 0-100 afterwards.
     */
    protected abstract Map<String, Double> componentScores(ContentFeatures features, ContentTypeMetadata metadata);

    /**
     * Confidence from data completeness alone; capped at {@value #MAX_CONFIDENCE} by the caller.
     */
    protected abstract double confidence(ContentFeatures features, ContentTypeMetadata metadata);

    protected abstract List<String> recommendations(ContentFeatures features, ContentTypeMetadata metadata);

    protected double contentMultiplier(ContentFeatures features, ContentTypeMetadata metadata) {
        return config.contentMultiplier(metadata == null ? null : metadata.contentType());
    }

    protected double contextMultiplier(ContentFeatures features) {
        return 1.0;
    }

    /**
     * Baseline projection: reach scales with creator influence and score, engagement splits by fixed ratios.
     * Subclasses add their platform-specific counters.
     */
    protected Map<String, Double> predictMetrics(ContentFeatures features, ContentTypeMetadata metadata, double score) {
        PlatformModelConfig.EngagementProfile profile = config.engagement();
        double reach = Math.floor(features.creator().influenceOr(DEFAULT_CREATOR_INFLUENCE)
                * profile.baseReach() * (score / 50.0));
        double engagementRate = Math.min(profile.maxRate(), score / 100.0 * profile.rateScale());

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("views", reach);
        metrics.put("engagements", Math.floor(reach * engagementRate));
        metrics.put("likes", Math.floor(reach * engagementRate * 0.6));
        metrics.put("comments", Math.floor(reach * engagementRate * 0.15));
        metrics.put("shares", Math.floor(reach * engagementRate * 0.15));
        metrics.put("engagementRate", round3(engagementRate));
        addPlatformMetrics(metrics, features, metadata, score);
        return metrics;
    }

    protected void addPlatformMetrics(Map<String, Double> metrics, ContentFeatures features,
                                      ContentTypeMetadata metadata, double score) {
    }

    // ============ HELPERS FOR SUBCLASSES ============

    protected static boolean between(int value, int min, int max) {
        return value >= min && value <= max;
    }

    protected static String contentType(ContentTypeMetadata metadata, String fallback) {
        return metadata == null || metadata.contentType() == null
                ? fallback
                : metadata.contentType().toLowerCase(Locale.ROOT);
    }
}
