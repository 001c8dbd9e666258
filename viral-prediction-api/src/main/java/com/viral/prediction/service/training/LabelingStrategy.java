package com.viral.prediction.service.training;

import com.viral.prediction.model.ActualPerformanceMetrics;
import com.viral.prediction.model.DataPointLabels;
import com.viral.prediction.model.EngagementTier;
import com.viral.prediction.model.Platform;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Derives training labels from observed performance.
 */
@Component
public class LabelingStrategy {

    public static final double VIRAL_SCORE_CUTOFF = 85.0;

    private static final double ENGAGEMENT_WEIGHT = 0.30;
    private static final double REACH_WEIGHT = 0.20;
    private static final double SHARES_WEIGHT = 0.25;
    private static final double VELOCITY_WEIGHT = 0.15;
    private static final double SUSTAINED_WEIGHT = 0.10;

    private static final Map<Platform, ViewThresholds> THRESHOLDS;
    static {
        Map<Platform, ViewThresholds> m = new EnumMap<>(Platform.class);
        m.put(Platform.TWITTER, new ViewThresholds(1_000_000, 100_000, 10_000, 1_000));
        m.put(Platform.TIKTOK, new ViewThresholds(1_000_000, 100_000, 10_000, 1_000));
        m.put(Platform.INSTAGRAM, new ViewThresholds(100_000, 10_000, 1_000, 100));
        m.put(Platform.YOUTUBE, new ViewThresholds(1_000_000, 100_000, 10_000, 1_000));
        m.put(Platform.FACEBOOK, new ViewThresholds(500_000, 50_000, 5_000, 500));
        m.put(Platform.LINKEDIN, new ViewThresholds(100_000, 10_000, 1_000, 100));
        THRESHOLDS = Collections.unmodifiableMap(m);
    }

    public record ViewThresholds(long viral, long trending, long popular, long moderate) {}

    public ViewThresholds thresholds(Platform platform) {
        return THRESHOLDS.get(platform);
    }

    public DataPointLabels label(ActualPerformanceMetrics metrics, Platform platform) {
        ViewThresholds thresholds = thresholds(platform);
        double score = compositeScore(metrics);

        boolean viral = metrics.views() >= thresholds.viral()
                || metrics.likes() >= thresholds.viral() / 10.0
                || score >= VIRAL_SCORE_CUTOFF;

        EngagementTier tier;
        if (viral) {
            tier = EngagementTier.VIRAL;
        } else if (metrics.views() >= thresholds.popular()) {
            tier = EngagementTier.HIGH;
        } else if (metrics.views() >= thresholds.moderate()) {
            tier = EngagementTier.MODERATE;
        } else {
            tier = EngagementTier.LOW;
        }

        return new DataPointLabels(viral, score, tier, metrics.peakEngagementHour(), metrics.totalEngagement());
    }

    /**
     * Weighted sum of engagement, reach, share, velocity and sustained-engagement ratios, capped at 100.
     * View-based ratios are 0 when there are no views.
     */
    public double compositeScore(ActualPerformanceMetrics m) {
        double engagement = 0.0;
        double reach = 0.0;
        double share = 0.0;
        if (m.views() > 0) {
            engagement = (double) m.totalEngagement() / m.views();
            reach = (double) m.totalReach() / m.views();
            share = m.shareToViewRatio();
        }
        double velocity = m.viralVelocity() / 100.0;
        double sustained = m.sustainedEngagement();

        double score = (engagement * ENGAGEMENT_WEIGHT
                + reach * REACH_WEIGHT
                + share * SHARES_WEIGHT
                + velocity * VELOCITY_WEIGHT
                + sustained * SUSTAINED_WEIGHT) * 100;
        return Double.isFinite(score) ? Math.max(0.0, Math.min(100.0, score)) : 0.0;
    }
}
