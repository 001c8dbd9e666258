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
 * LinkedIn scoring: informative, professional long-form posts from well-connected authors.
 */
@Component
public class LinkedInModel extends AbstractPlatformModel {

    public static final PlatformModelConfig DEFAULT_CONFIG;
    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("professional", 0.35);
        weights.put("content", 0.25);
        weights.put("engagement", 0.20);
        weights.put("timing", 0.10);
        weights.put("network", 0.10);

        Map<String, Double> multipliers = new LinkedHashMap<>();
        multipliers.put("article", 1.15);
        multipliers.put("document", 1.2);
        multipliers.put("post", 1.0);
        multipliers.put("video", 1.05);

        DEFAULT_CONFIG = new PlatformModelConfig(Platform.LINKEDIN, "1.0.0", weights,
                new PlatformModelConfig.Thresholds(90, 75, 60, 40), multipliers,
                new PlatformModelConfig.EngagementProfile(8_000, 0.03, 0.05));
    }

    public LinkedInModel() {
        super(DEFAULT_CONFIG);
    }

    @Override
    protected Map<String, Double> componentScores(ContentFeatures f, ContentTypeMetadata metadata) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("professional", 30
                + f.quality().educationalValue() * 25
                + f.quality().informationDensity() * 20
                + f.text().readabilityScore() / 100 * 15
                - f.linguistic().capsRatio() * 20
                - Math.min(f.linguistic().emojiCount(), 5) * 2);
        scores.put("content", 30
                + f.platformFit().optimalLengthScore() * 25
                + f.quality().inspirationalValue() * 20
                + f.quality().uniquenessScore() * 15);
        scores.put("engagement", 30
                + f.linguistic().questionCount() * 15
                + f.engagement().callToActionScore() * 20
                + f.engagement().personalConnectionScore() * 15
                + f.engagement().controversyScore() * 10);
        scores.put("timing", f.timing().optimalTimingScore() * 60 + 20
                + f.timing().dayOfWeekScore() * 10 + f.timing().hourOfDayScore() * 10);
        scores.put("network", 30
                + f.creator().influenceScore() * 35
                + f.creator().nicheAlignment() * 20
                + (f.social().mentionCount() > 0 ? 10 : 0));
        return scores;
    }

    @Override
    protected double confidence(ContentFeatures f, ContentTypeMetadata metadata) {
        double confidence = 0.5;
        if (metadata != null) confidence += 0.1;
        if (f.creator().present()) confidence += 0.2;
        if (f.text().textLength() > 150) confidence += 0.1;
        return confidence;
    }

    @Override
    protected void addPlatformMetrics(Map<String, Double> metrics, ContentFeatures f,
                                      ContentTypeMetadata metadata, double score) {
        double views = metrics.get("views");
        metrics.put("profileViews", Math.floor(views * 0.01));
        metrics.put("followersGained", Math.floor(views * 0.001));
    }

    @Override
    protected List<String> recommendations(ContentFeatures f, ContentTypeMetadata metadata) {
        List<String> recommendations = new ArrayList<>();
        if (f.text().textLength() < 150) {
            recommendations.add("Expand the post with a concrete insight or lesson learned");
        }
        if (f.linguistic().questionCount() == 0) {
            recommendations.add("Close with a question to start a discussion");
        }
        if (f.social().hashtagCount() > 5) {
            recommendations.add("Keep to 3-5 professional hashtags");
        }
        return recommendations;
    }
}
