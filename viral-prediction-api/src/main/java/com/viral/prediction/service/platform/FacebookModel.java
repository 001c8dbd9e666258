package com.viral.prediction.service.platform;

import com.viral.prediction.dto.ContentTypeMetadata;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.ContentFeatures;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facebook scoring: shareable, emotional posts with native media; outbound links are penalized.
 */
@Component
public class FacebookModel extends AbstractPlatformModel {

    public static final PlatformModelConfig DEFAULT_CONFIG;
    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("content", 0.30);
        weights.put("engagement", 0.25);
        weights.put("social", 0.20);
        weights.put("media", 0.15);
        weights.put("timing", 0.10);

        Map<String, Double> multipliers = new LinkedHashMap<>();
        multipliers.put("video", 1.2);
        multipliers.put("image", 1.0);
        multipliers.put("link", 0.85);
        multipliers.put("text", 0.9);

        DEFAULT_CONFIG = new PlatformModelConfig(Platform.FACEBOOK, "1.0.0", weights,
                new PlatformModelConfig.Thresholds(90, 75, 60, 40), multipliers,
                new PlatformModelConfig.EngagementProfile(15_000, 0.04, 0.06));
    }

    public FacebookModel() {
        super(DEFAULT_CONFIG);
    }

    @Override
    protected Map<String, Double> componentScores(ContentFeatures f, ContentTypeMetadata metadata) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("content", 30
                + f.platformFit().optimalLengthScore() * 20
                + f.text().readabilityScore() / 100 * 15
                + f.quality().entertainmentValue() * 15
                + f.quality().inspirationalValue() * 10
                - (f.social().urlCount() > 0 ? 5 : 0));
        scores.put("engagement", 30
                + f.sentiment().emotionalScore() * 25
                + f.engagement().callToActionScore() * 20
                + f.linguistic().questionCount() * 10
                + f.engagement().controversyScore() * 5);
        scores.put("social", 35
                + f.engagement().personalConnectionScore() * 30
                + (f.social().mentionCount() > 0 ? 10 : 0)
                + f.creator().influenceScore() * 20);
        scores.put("media", 25
                + (f.media().hasMedia() ? 25 : 0)
                + f.media().mediaTypeScore() * 25
                + f.media().mediaQualityScore() * 25);
        scores.put("timing", f.timing().optimalTimingScore() * 60 + 20
                + f.timing().dayOfWeekScore() * 10 + f.timing().hourOfDayScore() * 10);
        return scores;
    }

    @Override
    protected double confidence(ContentFeatures f, ContentTypeMetadata metadata) {
        double confidence = 0.5;
        if (metadata != null) confidence += 0.1;
        if (f.creator().present()) confidence += 0.15;
        if (f.media().hasMedia()) confidence += 0.1;
        if (f.text().textLength() > 20) confidence += 0.05;
        return confidence;
    }

    @Override
    protected void addPlatformMetrics(Map<String, Double> metrics, ContentFeatures f,
                                      ContentTypeMetadata metadata, double score) {
        double views = metrics.get("views");
        double rate = metrics.get("engagementRate");
        metrics.put("reactions", Math.floor(views * rate * 0.7));
        metrics.put("linkClicks", f.social().urlCount() > 0 ? Math.floor(views * 0.01) : 0.0);
    }

    @Override
    protected List<String> recommendations(ContentFeatures f, ContentTypeMetadata metadata) {
        List<String> recommendations = new ArrayList<>();
        if (!f.media().hasMedia()) {
            recommendations.add("Add a native image or video; text-only posts reach fewer people");
        }
        if (f.social().urlCount() > 0) {
            recommendations.add("Move outbound links into the first comment");
        }
        if (f.engagement().personalConnectionScore() < 0.3) {
            recommendations.add("Speak directly to your audience to encourage shares");
        }
        return recommendations;
    }
}
