package com.viral.prediction.service.platform;

import com.viral.prediction.dto.ContentTypeMetadata;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.ContentFeatures;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.viral.prediction.util.ScoreMath.clamp01;
import static com.viral.prediction.util.ScoreMath.round3;

/**
 * Instagram scoring. Visual quality dominates; reels and carousels get a format multiplier.
 */
@Component
public class InstagramModel extends AbstractPlatformModel {

    public static final PlatformModelConfig DEFAULT_CONFIG;
    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("visual", 0.35);
        weights.put("text", 0.15);
        weights.put("hashtag", 0.20);
        weights.put("timing", 0.10);
        weights.put("engagement", 0.12);
        weights.put("aesthetics", 0.05);
        weights.put("community", 0.03);

        Map<String, Double> multipliers = new LinkedHashMap<>();
        multipliers.put("reels", 1.4);
        multipliers.put("carousel", 1.2);
        multipliers.put("single", 1.0);
        multipliers.put("story", 0.7);
        multipliers.put("igtv", 0.9);

        DEFAULT_CONFIG = new PlatformModelConfig(Platform.INSTAGRAM, "2.5.0", weights,
                new PlatformModelConfig.Thresholds(92, 78, 65, 45), multipliers,
                new PlatformModelConfig.EngagementProfile(20_000, 0.05, 0.08));
    }

    private static final String DEFAULT_TYPE = "single";
    private static final int BRANDED_TAG_LENGTH = 15;
    private static final int MAX_BRANDED_TAGS = 2;
    private static final Set<String> TRENDING_TAGS = Set.of("viral", "trending", "fyp");
    private static final List<String> EVERGREEN_TAGS = List.of("#instagood", "#photooftheday");

    public InstagramModel() {
        super(DEFAULT_CONFIG);
    }

    @Override
    protected Map<String, Double> componentScores(ContentFeatures f, ContentTypeMetadata metadata) {
        String type = contentType(metadata, DEFAULT_TYPE);
        double aesthetic = visualAesthetic(f, metadata);
        double community = communityBuilding(f);
        double lifestyle = lifestyleAlignment(f);
        double ugc = ugcAppeal(f);

        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("visual", visualScore(f, metadata, type, aesthetic));
        scores.put("text", textScore(f, type, lifestyle));
        scores.put("hashtag", hashtagScore(f));
        scores.put("timing", f.timing().optimalTimingScore() * 60 + 20
                + f.timing().dayOfWeekScore() * 10 + f.timing().hourOfDayScore() * 10);
        scores.put("engagement", 25
                + f.engagement().callToActionScore() * 20
                + ugc * 15
                + community * 15
                + f.sentiment().emotionalScore() * 15
                + f.quality().inspirationalValue() * 5
                + f.quality().educationalValue() * 5);
        scores.put("aesthetics", 40 + aesthetic * 35 + brandAlignment(f) * 15 + lifestyle * 10);
        scores.put("community", 30 + community * 40 + ugc * 20 + influencerCollaboration(f, lifestyle) * 10);
        return scores;
    }

    // ============ COMPONENTS ============

    private double visualScore(ContentFeatures f, ContentTypeMetadata metadata, String type, double aesthetic) {
        double score = 30 + aesthetic * 40;
        score += switch (quality(metadata)) {
            case "ultra" -> 15;
            case "high" -> 10;
            case "medium" -> 5;
            default -> 0;
        };
        if ("carousel".equals(type) && imageCount(metadata) > 1) {
            score += carouselEngagement(f, metadata) * 10;
        } else if ("reels".equals(type)) {
            score += reelOptimization(f) * 15;
        }
        return score;
    }

    private double textScore(ContentFeatures f, String type, double lifestyle) {
        int length = f.text().textLength();
        double score = 25;
        switch (type) {
            case "single", "carousel" -> {
                if (between(length, 125, 300)) score += 25;
            }
            case "reels" -> {
                if (between(length, 50, 150)) score += 20;
            }
            case "story" -> {
                if (length <= 80) score += 15;
            }
            default -> {
            }
        }
        score += f.engagement().callToActionScore() * 15;
        score += f.linguistic().questionCount() * 10;
        score += f.engagement().personalConnectionScore() * 10;
        score += formatting(f, type) * 10;
        score += lifestyle * 5;
        return score;
    }

    private double hashtagScore(ContentFeatures f) {
        int count = f.social().hashtagCount();
        double score = 20 + hashtagStrategy(f) * 50;
        if (between(count, 5, 11)) {
            score += 20;
        } else if (between(count, 3, 15)) {
            score += 10;
        }
        return score + f.social().hashtagTrendingScore() * 10;
    }

    @Override
    protected double confidence(ContentFeatures f, ContentTypeMetadata metadata) {
        double confidence = 0.6;
        if (metadata != null) confidence += 0.15;
        if (f.creator().present()) confidence += 0.1;
        if (f.media().hasMedia()) confidence += 0.1;
        if (f.social().hashtagCount() > 0) confidence += 0.05;
        return confidence;
    }

    @Override
    protected void addPlatformMetrics(Map<String, Double> metrics, ContentFeatures f,
                                      ContentTypeMetadata metadata, double score) {
        double reach = metrics.get("views");
        double impressions = Math.floor(reach * 1.2);
        double rate = metrics.get("engagementRate");
        metrics.put("impressions", impressions);
        metrics.put("saves", Math.floor(impressions * rate * 0.1));
        metrics.put("profileVisits", Math.floor(impressions * 0.02));
        metrics.put("exploreImpressions", Math.floor(impressions * explorePotential(f)));
        switch (contentType(metadata, DEFAULT_TYPE)) {
            case "story" -> metrics.put("storyViews", Math.floor(reach * 0.3));
            case "reels" -> metrics.put("reelViews", Math.floor(impressions * 0.8));
            case "carousel" -> metrics.put("carouselSwipes", Math.floor(impressions * 0.4));
            default -> {
            }
        }
    }

    @Override
    protected List<String> recommendations(ContentFeatures f, ContentTypeMetadata metadata) {
        List<String> recommendations = new ArrayList<>();
        if (f.social().hashtagCount() < 5) {
            recommendations.add("Add 5-11 strategic hashtags for better discoverability");
        }
        if (visualAesthetic(f, metadata) < 0.7) {
            recommendations.add("Improve visual quality and aesthetic appeal");
        }
        if ("reels".equals(contentType(metadata, DEFAULT_TYPE)) && reelOptimization(f) < 0.6) {
            recommendations.add("Optimize for Reels with trending audio and effects");
        }
        if (f.engagement().callToActionScore() < 0.5) {
            recommendations.add("Include clear call-to-action to boost engagement");
        }
        if (metadata == null || !Boolean.TRUE.equals(metadata.hasLocation())) {
            recommendations.add("Add location tag to increase local discoverability");
        }
        return recommendations;
    }

    // ============ INSTAGRAM SIGNALS ============

    static double visualAesthetic(ContentFeatures f, ContentTypeMetadata metadata) {
        double score = 0.5;
        if (f.media().hasMedia()) {
            score += 0.3;
            score += switch (quality(metadata)) {
                case "ultra" -> 0.2;
                case "high" -> 0.15;
                case "medium" -> 0.1;
                default -> 0.0;
            };
        }
        return clamp01(score);
    }

    static double reelOptimization(ContentFeatures f) {
        return clamp01(0.6 + f.quality().entertainmentValue() * 0.25 + f.trending().trendingTopicsScore() * 0.15);
    }

    static double carouselEngagement(ContentFeatures f, ContentTypeMetadata metadata) {
        double engagement = 0.5;
        int images = imageCount(metadata);
        if (images > 1) {
            engagement += Math.min(0.3, images * 0.05);
        }
        return clamp01(engagement + f.quality().educationalValue() * 0.2);
    }

    static double hashtagStrategy(ContentFeatures f) {
        int count = f.social().hashtagCount();
        double score = 0.3;
        if (between(count, 5, 11)) {
            score += 0.4;
        } else if (between(count, 3, 15)) {
            score += 0.2;
        }
        return clamp01(score + f.social().hashtagTrendingScore() * 0.3);
    }

    static double communityBuilding(ContentFeatures f) {
        return clamp01(0.3
                + f.engagement().personalConnectionScore() * 0.3
                + f.linguistic().questionCount() * 0.2
                + f.engagement().callToActionScore() * 0.2);
    }

    static double lifestyleAlignment(ContentFeatures f) {
        return clamp01(0.4 + f.quality().inspirationalValue() * 0.3 + f.engagement().personalConnectionScore() * 0.3);
    }

    static double ugcAppeal(ContentFeatures f) {
        return clamp01(0.3
                + f.engagement().personalConnectionScore() * 0.3
                + f.engagement().callToActionScore() * 0.25
                + f.quality().inspirationalValue() * 0.15);
    }

    static double brandAlignment(ContentFeatures f) {
        return clamp01(0.4
                + f.text().readabilityScore() / 100 * 0.3
                + (f.sentiment().sentimentScore() > 0.3 ? 0.2 : 0)
                + f.quality().educationalValue() * 0.1);
    }

    static double influencerCollaboration(ContentFeatures f, double lifestyle) {
        return clamp01(0.3
                + f.quality().inspirationalValue() * 0.25
                + lifestyle * 0.25
                + (f.text().readabilityScore() > 60 ? 0.2 : 0));
    }

    static double explorePotential(ContentFeatures f) {
        return clamp01(0.3
                + f.sentiment().emotionalScore() * 0.25
                + f.quality().entertainmentValue() * 0.2
                + f.trending().trendingTopicsScore() * 0.25);
    }

    private static double formatting(ContentFeatures f, String type) {
        int length = f.text().textLength();
        double formatting = 0.5;
        switch (type) {
            case "single", "carousel" -> formatting += 0.3;
            case "reels" -> {
                if (length <= 150) formatting += 0.3;
            }
            case "story" -> {
                if (length <= 80) formatting += 0.4;
            }
            default -> {
            }
        }
        return clamp01(formatting);
    }

    private static String quality(ContentTypeMetadata metadata) {
        return metadata == null || metadata.quality() == null ? "" : metadata.quality().toLowerCase(Locale.ROOT);
    }

    private static int imageCount(ContentTypeMetadata metadata) {
        return metadata == null || metadata.imageCount() == null ? 0 : metadata.imageCount();
    }

    // ============ HASHTAG STRATEGY ============

    /**
     * Sorts hashtags into strategy buckets and estimates their reach.
     * A tag may land in several buckets. Estimates depend only on the bucket shares.
     */
    public HashtagStrategy analyzeHashtagStrategy(List<String> hashtags, String niche) {
        String nicheKey = niche == null ? "" : niche.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        List<String> tags = hashtags.stream()
                .map(t -> t.trim().replace("#", ""))
                .filter(t -> !t.isEmpty())
                .toList();

        List<String> branded = new ArrayList<>();
        List<String> community = new ArrayList<>();
        List<String> trending = new ArrayList<>();
        List<String> nicheTags = new ArrayList<>();
        List<String> location = new ArrayList<>();
        for (String tag : tags) {
            String lower = tag.toLowerCase(Locale.ROOT);
            if (tag.length() > BRANDED_TAG_LENGTH) branded.add(tag);
            if (lower.contains("community") || lower.contains("tribe")) community.add(tag);
            if (TRENDING_TAGS.contains(lower)) trending.add(tag);
            if (!nicheKey.isEmpty() && lower.contains(nicheKey)) nicheTags.add(tag);
            if (lower.contains("city") || lower.contains("country")) location.add(tag);
        }

        int n = Math.max(1, tags.size());
        double trendingShare = (double) trending.size() / n;
        double communityShare = (double) (community.size() + nicheTags.size()) / n;
        HashtagPerformance performance = new HashtagPerformance(
                round3(0.3 + 0.4 * Math.min(1.0, tags.size() / 11.0)),
                round3(0.2 + 0.5 * trendingShare),
                round3(0.4 + 0.3 * Math.min(1.0, communityShare)),
                round3(0.6 + 0.2 * ((double) nicheTags.size() / n)));

        Set<String> present = new HashSet<>();
        tags.forEach(t -> present.add("#" + t.toLowerCase(Locale.ROOT)));
        List<String> add = new ArrayList<>();
        if (!nicheKey.isEmpty()) {
            add.add("#" + nicheKey);
        }
        add.addAll(EVERGREEN_TAGS);
        add.removeIf(present::contains);

        List<String> remove = branded.size() > MAX_BRANDED_TAGS
                ? List.copyOf(branded.subList(MAX_BRANDED_TAGS, branded.size()))
                : List.of();
        List<String> optimize = new ArrayList<>();
        optimize.add("Use mix of high and low competition hashtags");
        if (location.isEmpty()) {
            optimize.add("Include location-based hashtags");
        }
        if (!between(tags.size(), 5, 11)) {
            optimize.add("Aim for 5-11 hashtags per post");
        }

        return new HashtagStrategy(
                new HashtagBuckets(branded, community, trending, nicheTags, location),
                performance,
                new HashtagRecommendations(add, remove, optimize));
    }

    public record HashtagBuckets(List<String> branded, List<String> community, List<String> trending,
                                 List<String> niche, List<String> location) {}

    public record HashtagPerformance(double reach, double difficulty, double engagement, double relevance) {}

    public record HashtagRecommendations(List<String> add, List<String> remove, List<String> optimize) {}

    public record HashtagStrategy(HashtagBuckets strategy, HashtagPerformance performance,
                                  HashtagRecommendations recommendations) {}
}
