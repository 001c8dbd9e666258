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
 * YouTube scoring: video and thumbnail quality, searchable descriptions and watch-worthy content.
 */
@Component
public class YouTubeModel extends AbstractPlatformModel {

    public static final PlatformModelConfig DEFAULT_CONFIG;
    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("content", 0.30);
        weights.put("media", 0.25);
        weights.put("seo", 0.20);
        weights.put("engagement", 0.15);
        weights.put("timing", 0.10);

        Map<String, Double> multipliers = new LinkedHashMap<>();
        multipliers.put("short", 1.3);
        multipliers.put("long", 1.0);
        multipliers.put("live", 1.1);

        DEFAULT_CONFIG = new PlatformModelConfig(Platform.YOUTUBE, "1.0.0", weights,
                new PlatformModelConfig.Thresholds(92, 80, 65, 45), multipliers,
                new PlatformModelConfig.EngagementProfile(30_000, 0.04, 0.08));
    }

    public YouTubeModel() {
        super(DEFAULT_CONFIG);
    }

    @Override
    protected Map<String, Double> componentScores(ContentFeatures f, ContentTypeMetadata metadata) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("content", 30
                + f.quality().educationalValue() * 20
                + f.quality().entertainmentValue() * 20
                + f.quality().uniquenessScore() * 15
                + f.sentiment().emotionalScore() * 15);
        scores.put("media", 20
                + (hasVideo(f) ? 30 : 0)
                + f.media().mediaQualityScore() * 30
                + f.media().mediaTrendingScore() * 20);
        scores.put("seo", 25
                + f.platformFit().optimalLengthScore() * 25
                + Math.min(f.social().hashtagCount(), 5) * 4
                + f.trending().trendingTopicsScore() * 20
                + f.text().readabilityScore() / 100 * 10);
        scores.put("engagement", 30
                + f.engagement().callToActionScore() * 30
                + f.linguistic().questionCount() * 10
                + f.engagement().personalConnectionScore() * 15
                + f.engagement().noveltyScore() * 15);
        scores.put("timing", f.timing().optimalTimingScore() * 60 + 20
                + f.timing().dayOfWeekScore() * 10 + f.timing().hourOfDayScore() * 10);
        return scores;
    }

    @Override
    protected double confidence(ContentFeatures f, ContentTypeMetadata metadata) {
        double confidence = 0.5;
        if (metadata != null) confidence += 0.1;
        if (f.creator().present()) confidence += 0.1;
        if (hasVideo(f)) confidence += 0.15;
        if (f.text().textLength() > 100) confidence += 0.05;
        return confidence;
    }

    @Override
    protected void addPlatformMetrics(Map<String, Double> metrics, ContentFeatures f,
                                      ContentTypeMetadata metadata, double score) {
        double views = metrics.get("views");
        metrics.put("subscribersGained", Math.floor(views * 0.002));
        metrics.put("watchHours", Math.floor(views * (0.05 + score / 100 * 0.05)));
    }

    @Override
    protected List<String> recommendations(ContentFeatures f, ContentTypeMetadata metadata) {
        List<String> recommendations = new ArrayList<>();
        if (!hasVideo(f)) {
            recommendations.add("Attach the video so thumbnail and watch signals can be scored");
        }
        if (f.platformFit().optimalLengthScore() < 0.5) {
            recommendations.add("Write a 200-1000 character description with searchable keywords");
        }
        if (f.engagement().callToActionScore() < 0.3) {
            recommendations.add("Ask viewers to like, comment and subscribe");
        }
        return recommendations;
    }

    private static boolean hasVideo(ContentFeatures f) {
        return f.media().hasMedia() && f.media().mediaTypeScore() >= 1.0;
    }
}
