package com.viral.prediction.service.feature;

import com.viral.prediction.service.feature.ContentFeatures.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat {@code snake_case -> double} form of {@link ContentFeatures}.
 * Used as the Model Runtime input and as the persisted feature map of training data points.
 */
public final class FeatureDictionary {

    public static final List<String> EMOTIONS = List.of(
            "joy", "sadness", "anger", "fear", "surprise", "disgust", "excitement", "anticipation");

    /**
     * Counts and averages: non-negative, no upper bound.
     */
    private static final Set<String> UNBOUNDED = Set.of(
            "text_length", "word_count", "sentence_count", "avg_word_length", "avg_sentence_length",
            "exclamation_count", "question_count", "emoji_count",
            "hashtag_count", "mention_count", "url_count", "media_count");

    private FeatureDictionary() {
    }

    /**
     * Clamps a value into the documented range of the named feature: [-1, 1] for the sentiment score,
     * [0, 100] for readability, [0, +inf) for counts and averages, [0, 1] for every other score.
     */
    public static double clampToRange(String name, double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        if ("sentiment_score".equals(name)) {
            return Math.max(-1.0, Math.min(1.0, value));
        }
        if ("readability_score".equals(name)) {
            return Math.max(0.0, Math.min(100.0, value));
        }
        if (UNBOUNDED.contains(name)) {
            return Math.max(0.0, value);
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static Map<String, Double> toMap(ContentFeatures f) {
        Map<String, Double> m = new LinkedHashMap<>();

        m.put("text_length", (double) f.text().textLength());
        m.put("word_count", (double) f.text().wordCount());
        m.put("sentence_count", (double) f.text().sentenceCount());
        m.put("avg_word_length", f.text().avgWordLength());
        m.put("readability_score", f.text().readabilityScore());

        m.put("sentiment_score", f.sentiment().sentimentScore());
        for (String emotion : EMOTIONS) {
            m.put("emotion_" + emotion, f.sentiment().emotionScores().getOrDefault(emotion, 0.0));
        }
        m.put("emotional_score", f.sentiment().emotionalScore());
        m.put("emotional_intensity", f.sentiment().emotionalIntensity());
        m.put("subjectivity_score", f.sentiment().subjectivityScore());

        m.put("exclamation_count", (double) f.linguistic().exclamationCount());
        m.put("question_count", (double) f.linguistic().questionCount());
        m.put("caps_ratio", f.linguistic().capsRatio());
        m.put("emoji_count", (double) f.linguistic().emojiCount());
        m.put("emoji_diversity", f.linguistic().emojiDiversity());
        m.put("lexical_diversity", f.linguistic().lexicalDiversity());
        m.put("avg_sentence_length", f.linguistic().avgSentenceLength());

        m.put("hashtag_count", (double) f.social().hashtagCount());
        m.put("mention_count", (double) f.social().mentionCount());
        m.put("url_count", (double) f.social().urlCount());
        m.put("hashtag_trending_score", f.social().hashtagTrendingScore());
        m.put("mention_influence_score", f.social().mentionInfluenceScore());

        m.put("call_to_action_score", f.engagement().callToActionScore());
        m.put("urgency_score", f.engagement().urgencyScore());
        m.put("personal_connection_score", f.engagement().personalConnectionScore());
        m.put("controversy_score", f.engagement().controversyScore());
        m.put("novelty_score", f.engagement().noveltyScore());

        m.put("platform_optimization_score", f.platformFit().platformOptimizationScore());
        m.put("optimal_length_score", f.platformFit().optimalLengthScore());
        m.put("format_suitability_score", f.platformFit().formatSuitabilityScore());

        m.put("trending_topics_score", f.trending().trendingTopicsScore());
        m.put("seasonality_score", f.trending().seasonalityScore());
        m.put("current_events_relevance", f.trending().currentEventsRelevance());
        m.put("competitive_landscape_score", f.trending().competitiveLandscapeScore());

        m.put("creator_present", f.creator().present() ? 1.0 : 0.0);
        m.put("creator_influence_score", f.creator().influenceScore());
        m.put("creator_niche_alignment", f.creator().nicheAlignment());
        m.put("creator_engagement_history", f.creator().engagementHistory());

        m.put("optimal_timing_score", f.timing().optimalTimingScore());
        m.put("day_of_week_score", f.timing().dayOfWeekScore());
        m.put("hour_of_day_score", f.timing().hourOfDayScore());
        m.put("time_zone_advantage", f.timing().timeZoneAdvantage());

        m.put("has_media", f.media().hasMedia() ? 1.0 : 0.0);
        m.put("media_count", (double) f.media().mediaCount());
        m.put("media_type_score", f.media().mediaTypeScore());
        m.put("media_quality_score", f.media().mediaQualityScore());
        m.put("media_trending_score", f.media().mediaTrendingScore());

        m.put("uniqueness_score", f.quality().uniquenessScore());
        m.put("information_density", f.quality().informationDensity());
        m.put("entertainment_value", f.quality().entertainmentValue());
        m.put("educational_value", f.quality().educationalValue());
        m.put("inspirational_value", f.quality().inspirationalValue());

        return Collections.unmodifiableMap(m);
    }

    /**
     * Rebuilds a feature record from a stored map. Missing keys read as 0.
     */
    public static ContentFeatures fromMap(Map<String, Double> m) {
        Map<String, Double> emotions = new LinkedHashMap<>();
        for (String emotion : EMOTIONS) {
            emotions.put(emotion, get(m, "emotion_" + emotion));
        }

        return new ContentFeatures(
                new TextFeatures((int) get(m, "text_length"), (int) get(m, "word_count"),
                        (int) get(m, "sentence_count"), get(m, "avg_word_length"), get(m, "readability_score")),
                new SentimentFeatures(get(m, "sentiment_score"), emotions, get(m, "emotional_score"),
                        get(m, "emotional_intensity"), get(m, "subjectivity_score")),
                new LinguisticFeatures((int) get(m, "exclamation_count"), (int) get(m, "question_count"),
                        get(m, "caps_ratio"), (int) get(m, "emoji_count"), get(m, "emoji_diversity"),
                        get(m, "lexical_diversity"), get(m, "avg_sentence_length")),
                new SocialFeatures((int) get(m, "hashtag_count"), (int) get(m, "mention_count"),
                        (int) get(m, "url_count"), get(m, "hashtag_trending_score"), get(m, "mention_influence_score")),
                new EngagementFeatures(get(m, "call_to_action_score"), get(m, "urgency_score"),
                        get(m, "personal_connection_score"), get(m, "controversy_score"), get(m, "novelty_score")),
                new PlatformFitFeatures(get(m, "platform_optimization_score"), get(m, "optimal_length_score"),
                        get(m, "format_suitability_score")),
                new TrendingFeatures(get(m, "trending_topics_score"), get(m, "seasonality_score"),
                        get(m, "current_events_relevance"), get(m, "competitive_landscape_score")),
                new CreatorFeatures(get(m, "creator_present") > 0.5, get(m, "creator_influence_score"),
                        get(m, "creator_niche_alignment"), get(m, "creator_engagement_history")),
                new TimingFeatures(get(m, "optimal_timing_score"), get(m, "day_of_week_score"),
                        get(m, "hour_of_day_score"), get(m, "time_zone_advantage")),
                new MediaFeatures(get(m, "has_media") > 0.5, (int) get(m, "media_count"),
                        get(m, "media_type_score"), get(m, "media_quality_score"), get(m, "media_trending_score")),
                new QualityFeatures(get(m, "uniqueness_score"), get(m, "information_density"),
                        get(m, "entertainment_value"), get(m, "educational_value"), get(m, "inspirational_value"))
        );
    }

    private static double get(Map<String, Double> m, String key) {
        Double value = m.get(key);
        return value == null || !Double.isFinite(value) ? 0.0 : value;
    }
}
