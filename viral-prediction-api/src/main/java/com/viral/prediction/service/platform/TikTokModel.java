package com.viral.prediction.service.platform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.viral.prediction.dto.ContentTypeMetadata;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.ContentFeatures;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static com.viral.prediction.util.ScoreMath.clamp;
import static com.viral.prediction.util.ScoreMath.clamp01;
import static com.viral.prediction.util.ScoreMath.round3;

/**
 * TikTok scoring. Instead of a content-type table the weighted score is scaled by an algorithm boost
 * driven by predicted completion rate, For You page fit and watch time.
 */
@Component
public class TikTokModel extends AbstractPlatformModel {

    public static final PlatformModelConfig DEFAULT_CONFIG;
    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("visual", 0.30);
        weights.put("audio", 0.25);
        weights.put("text", 0.15);
        weights.put("trend", 0.15);
        weights.put("engagement", 0.10);
        weights.put("timing", 0.03);
        weights.put("creator", 0.02);

        DEFAULT_CONFIG = new PlatformModelConfig(Platform.TIKTOK, "3.0.0", weights,
                new PlatformModelConfig.Thresholds(95, 85, 70, 50), Map.of(),
                new PlatformModelConfig.EngagementProfile(50_000, 0.1, 0.15));
    }

    static final double COMPLETION_RATE_FACTOR = 0.35;
    static final double MIN_BOOST = 0.5;
    static final double MAX_BOOST = 2.0;
    private static final double DEFAULT_WATCH_SECONDS = 15;
    private static final double BASELINE_WATCH_SECONDS = 30;
    private static final int MAX_POSTS_PER_DAY = 3;
    private static final List<DayOfWeek> BEST_DAYS = List.of(
            DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);

    public TikTokModel() {
        super(DEFAULT_CONFIG);
    }

    @Override
    protected Map<String, Double> componentScores(ContentFeatures f, ContentTypeMetadata metadata) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("visual", 40 + videoQuality(f, metadata) * 30 + visualAppeal(f) * 20);
        scores.put("audio", audioScore(metadata));
        scores.put("text", textScore(f));
        scores.put("trend", 20
                + trendAlignment(f) * 30
                + challengeParticipation(f) * 25
                + dancePotential(f, metadata) * 15
                + f.trending().trendingTopicsScore() * 10);
        scores.put("engagement", 30
                + duetPotential(f) * 20
                + stitchPotential(f) * 15
                + shareLikelihood(f) * 20
                + f.sentiment().emotionalScore() * 15);
        scores.put("timing", f.timing().optimalTimingScore() * 70 + 15 + maxGenerationAppeal(f) * 15);
        scores.put("creator", creatorScore(f));
        return scores;
    }

    /**
     * The algorithm boost takes the place of the content-type multiplier.
     */
    @Override
    protected double contentMultiplier(ContentFeatures f, ContentTypeMetadata metadata) {
        return algorithmBoost(f, metadata);
    }

    static double algorithmBoost(ContentFeatures f, ContentTypeMetadata metadata) {
        double boost = 1.0
                + (completionRate(f, metadata) - 0.5) * COMPLETION_RATE_FACTOR
                + fypOptimization(f) * 0.2
                + algorithmFriendliness(f, metadata) * 0.15
                + watchTime(f, metadata) / BASELINE_WATCH_SECONDS * 0.1;
        return clamp(boost, MIN_BOOST, MAX_BOOST);
    }

    // ============ COMPONENTS ============

    private static double audioScore(ContentTypeMetadata metadata) {
        double score = 30 + audioEngagement(metadata) * 40;
        String audioType = audioType(metadata);
        if ("trending".equals(audioType)) {
            score += 20;
        } else if ("original".equals(audioType)) {
            score += 10;
        }
        if (hasAudio(metadata)) {
            score += 10;
        }
        return score;
    }

    private static double textScore(ContentFeatures f) {
        int length = f.text().textLength();
        double score = 20;
        if (between(length, 20, 100)) {
            score += 30;
        } else if (length <= 150) {
            score += 20;
        }
        score += f.engagement().callToActionScore() * 15;
        score += f.sentiment().emotionalScore() * 20;
        score += f.linguistic().questionCount() * 10;
        if (between(f.social().hashtagCount(), 3, 8)) {
            score += 15;
        }
        return score;
    }

    private static double creatorScore(ContentFeatures f) {
        double score = 40;
        if (f.creator().present()) {
            score += f.creator().influenceScore() * 30
                    + f.creator().nicheAlignment() * 20
                    + f.creator().engagementHistory() * 10;
        }
        return score;
    }

    @Override
    protected double confidence(ContentFeatures f, ContentTypeMetadata metadata) {
        double confidence = 0.6;
        if (metadata != null) confidence += 0.15;
        if (f.creator().present()) confidence += 0.1;
        if (hasAudio(metadata)) confidence += 0.1;
        if (trendAlignment(f) > 0.3) confidence += 0.05;
        return confidence;
    }

    @Override
    protected void addPlatformMetrics(Map<String, Double> metrics, ContentFeatures f,
                                      ContentTypeMetadata metadata, double score) {
        double views = metrics.get("views");
        double rate = metrics.get("engagementRate");
        metrics.put("saves", Math.floor(views * rate * 0.05));
        metrics.put("duets", Math.floor(views * duetPotential(f) * 0.02));
        metrics.put("stitches", Math.floor(views * stitchPotential(f) * 0.01));
        metrics.put("watchTime", round3(watchTime(f, metadata)));
        metrics.put("completionRate", round3(completionRate(f, metadata)));
        metrics.put("viralVelocity", round3(views / 24));
        metrics.put("fypProbability", round3(Math.min(0.3, fypOptimization(f))));
    }

    @Override
    protected List<String> recommendations(ContentFeatures f, ContentTypeMetadata metadata) {
        List<String> recommendations = new ArrayList<>();
        if (fypOptimization(f) < 0.6) {
            recommendations.add("Increase emotional engagement to improve FYP chances");
        }
        if (completionRate(f, metadata) < 0.7) {
            recommendations.add("Optimize video length for higher completion rate");
        }
        if (!hasAudio(metadata)) {
            recommendations.add("Add trending audio to boost FYP algorithm ranking");
        }
        if (f.social().hashtagCount() < 3) {
            recommendations.add("Use 5-8 strategic hashtags including #fyp #foryou");
        }
        return recommendations;
    }

    // ============ TIKTOK SIGNALS ============

    static double videoQuality(ContentFeatures f, ContentTypeMetadata metadata) {
        Double duration = duration(metadata);
        if (metadata == null) {
            return 0.5;
        }
        double score = 0.5;
        if (duration != null && duration >= 15 && duration <= 60) {
            score += 0.3;
        } else if (duration != null && duration < 15) {
            score += 0.2;
        }
        if (f.media().mediaQualityScore() >= 0.7) {
            score += 0.2;
        }
        return clamp01(score);
    }

    static double audioEngagement(ContentTypeMetadata metadata) {
        if (!hasAudio(metadata)) {
            return 0.2;
        }
        String audioType = audioType(metadata);
        double score = 0.5;
        if ("trending".equals(audioType)) {
            score += 0.4;
        } else if ("original".equals(audioType)) {
            score += 0.2;
        }
        return clamp01(score);
    }

    static double visualAppeal(ContentFeatures f) {
        return clamp01(0.4 + (f.media().hasMedia() ? 0.3 : 0) + f.quality().entertainmentValue() * 0.1);
    }

    /**
     * Trending-topic score, or a moderate 0.3 when no trend data matched.
     */
    static double trendAlignment(ContentFeatures f) {
        double trending = f.trending().trendingTopicsScore();
        return trending > 0 ? trending : 0.3;
    }

    /**
     * Trending audio and entertaining content make a clip easy to dance to.
     */
    static double dancePotential(ContentFeatures f, ContentTypeMetadata metadata) {
        return clamp01(0.2
                + ("trending".equals(audioType(metadata)) ? 0.3 : 0)
                + f.quality().entertainmentValue() * 0.2);
    }

    static double challengeParticipation(ContentFeatures f) {
        return clamp01(0.2 + (f.social().hashtagCount() > 0 ? 0.3 : 0) + f.trending().trendingTopicsScore() * 0.5);
    }

    static double fypOptimization(ContentFeatures f) {
        return clamp01(0.3
                + f.sentiment().emotionalScore() * 0.2
                + f.engagement().callToActionScore() * 0.15
                + f.trending().trendingTopicsScore() * 0.25
                + f.social().hashtagCount() / 10.0 * 0.1);
    }

    static double duetPotential(ContentFeatures f) {
        return clamp01(0.25
                + f.quality().educationalValue() * 0.3
                + f.linguistic().questionCount() * 0.2
                + f.engagement().controversyScore() * 0.25);
    }

    static double stitchPotential(ContentFeatures f) {
        return clamp01(0.2
                + f.quality().informationDensity() * 0.3
                + f.quality().educationalValue() * 0.25
                + f.engagement().noveltyScore() * 0.25);
    }

    static double shareLikelihood(ContentFeatures f) {
        return clamp01(0.15
                + f.quality().entertainmentValue() * 0.3
                + f.sentiment().emotionalScore() * 0.25
                + f.engagement().noveltyScore() * 0.2
                + f.quality().inspirationalValue() * 0.1);
    }

    static double watchTime(ContentFeatures f, ContentTypeMetadata metadata) {
        Double duration = duration(metadata);
        if (duration == null || duration <= 0) {
            return DEFAULT_WATCH_SECONDS;
        }
        double watch = duration * 0.7 + f.quality().entertainmentValue() * 5 + f.quality().educationalValue() * 3;
        return Math.min(duration, watch);
    }

    /**
     * Caller-supplied completion rate when known, otherwise estimated from entertainment, length and emotion.
     */
    static double completionRate(ContentFeatures f, ContentTypeMetadata metadata) {
        if (metadata != null && metadata.expectedCompletionRate() != null) {
            return clamp01(metadata.expectedCompletionRate());
        }
        Double duration = duration(metadata);
        double rate = 0.6 + f.quality().entertainmentValue() * 0.2;
        if (duration != null && duration > 0 && duration <= 30) {
            rate += 0.1;
        }
        rate += f.sentiment().emotionalScore() * 0.1;
        return Math.min(0.95, rate);
    }

    static double algorithmFriendliness(ContentFeatures f, ContentTypeMetadata metadata) {
        Double duration = duration(metadata);
        return clamp01(0.5
                + (duration != null && duration > 0 && duration <= 60 ? 0.2 : 0)
                + f.engagement().callToActionScore() * 0.15
                + f.trending().trendingTopicsScore() * 0.15);
    }

    static Map<Audience, Double> generationAppeal(ContentFeatures f) {
        Map<Audience, Double> appeal = new EnumMap<>(Audience.class);
        appeal.put(Audience.GEN_Z, clamp01(0.4
                + f.quality().entertainmentValue() * 0.25
                + f.sentiment().emotionalScore() * 0.2
                + f.trending().trendingTopicsScore() * 0.15));
        appeal.put(Audience.GEN_ALPHA, clamp01(0.3
                + f.quality().entertainmentValue() * 0.3
                + f.engagement().noveltyScore() * 0.25
                + f.media().mediaTrendingScore() * 0.15));
        appeal.put(Audience.MILLENNIAL, clamp01(0.35
                + f.quality().educationalValue() * 0.25
                + f.quality().inspirationalValue() * 0.2
                + f.quality().informationDensity() * 0.2));
        return appeal;
    }

    private static double maxGenerationAppeal(ContentFeatures f) {
        return generationAppeal(f).values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    private static boolean hasAudio(ContentTypeMetadata metadata) {
        return metadata != null && Boolean.TRUE.equals(metadata.hasAudio());
    }

    private static String audioType(ContentTypeMetadata metadata) {
        return metadata == null || metadata.audioType() == null ? "" : metadata.audioType().toLowerCase(Locale.ROOT);
    }

    private static Double duration(ContentTypeMetadata metadata) {
        return metadata == null ? null : metadata.videoDurationSeconds();
    }

    // ============ SCHEDULING ============

    /**
     * Spreads videos over the audience's peak hours, one slot per video, rolling to the next day when a day is full.
     */
    public Schedule predictOptimalSchedule(List<String> videos, List<ContentFeatures> features, Audience audience,
                                           ZoneId zone, Instant now, int durationDays) {
        if (videos.size() != features.size()) {
            throw new IllegalArgumentException("Expected one feature vector per video");
        }
        if (durationDays <= 0) {
            throw new IllegalArgumentException("durationDays must be positive");
        }

        List<Integer> hours = audience.getPeakHours();
        ZonedDateTime today = now.atZone(zone).truncatedTo(ChronoUnit.DAYS);
        List<ScheduledVideo> schedule = new ArrayList<>();
        for (int i = 0; i < videos.size(); i++) {
            PlatformPrediction prediction = predict(features.get(i), null);
            Instant slot = today.plusDays(i / hours.size()).withHour(hours.get(i % hours.size())).toInstant();
            schedule.add(new ScheduledVideo(videos.get(i), slot,
                    prediction.predictedMetrics().getOrDefault("views", 0.0).longValue(),
                    prediction.predictedMetrics().getOrDefault("fypProbability", 0.0)));
        }

        Strategy strategy = new Strategy(
                round3(Math.min(MAX_POSTS_PER_DAY, (double) videos.size() / durationDays)),
                hours, BEST_DAYS, audience.getActiveTime());
        return new Schedule(schedule, strategy);
    }

    public enum Audience {
        GEN_Z("genZ", List.of(16, 18, 20, 22), "6-10 PM (after school/work)"),
        GEN_ALPHA("genAlpha", List.of(15, 17, 19), "3-7 PM (after school)"),
        MILLENNIAL("millennial", List.of(18, 20, 21), "7-10 PM (evening)"),
        ALL("all", List.of(18, 20, 22), "6-10 PM (peak hours)");

        private final String id;
        private final List<Integer> peakHours;
        private final String activeTime;

        Audience(String id, List<Integer> peakHours, String activeTime) {
            this.id = id;
            this.peakHours = peakHours;
            this.activeTime = activeTime;
        }

        @JsonValue
        public String getId() { return id; }

        public List<Integer> getPeakHours() { return peakHours; }
        public String getActiveTime() { return activeTime; }

        /**
         * Unknown or missing ids fall back to {@link #ALL}.
         */
        @JsonCreator
        public static Audience fromId(String id) {
            if (id != null) {
                for (Audience audience : values()) {
                    if (audience.id.equalsIgnoreCase(id.trim())) {
                        return audience;
                    }
                }
            }
            return ALL;
        }
    }

    public record ScheduledVideo(String video, Instant optimalTime, long expectedViews, double fypProbability) {}

    public record Strategy(double postingFrequency, List<Integer> bestHours, List<DayOfWeek> bestDays,
                           String audienceActiveTime) {}

    public record Schedule(List<ScheduledVideo> schedule, Strategy strategy) {}
}
