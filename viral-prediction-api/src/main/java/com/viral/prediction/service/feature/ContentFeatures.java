package com.viral.prediction.service.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feature vector for one prediction request, assembled from independently extracted groups.
 * Normalized scores are in [0,1] unless the field name says otherwise (readability is 0-100).
 */
public record ContentFeatures(
        TextFeatures text,
        SentimentFeatures sentiment,
        LinguisticFeatures linguistic,
        SocialFeatures social,
        EngagementFeatures engagement,
        PlatformFitFeatures platformFit,
        TrendingFeatures trending,
        CreatorFeatures creator,
        TimingFeatures timing,
        MediaFeatures media,
        QualityFeatures quality
) {

    public record TextFeatures(
            int textLength,
            int wordCount,
            int sentenceCount,
            double avgWordLength,
            double readabilityScore
    ) {
        public static final TextFeatures EMPTY = new TextFeatures(0, 0, 0, 0.0, 50.0);
    }

    public record SentimentFeatures(
            double sentimentScore,
            Map<String, Double> emotionScores,
            double emotionalScore,
            double emotionalIntensity,
            double subjectivityScore
    ) {
        public SentimentFeatures {
            emotionScores = emotionScores == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(emotionScores));
        }
    }

    public record LinguisticFeatures(
            int exclamationCount,
            int questionCount,
            double capsRatio,
            int emojiCount,
            double emojiDiversity,
            double lexicalDiversity,
            double avgSentenceLength
    ) {}

    public record SocialFeatures(
            int hashtagCount,
            int mentionCount,
            int urlCount,
            double hashtagTrendingScore,
            double mentionInfluenceScore
    ) {}

    public record EngagementFeatures(
            double callToActionScore,
            double urgencyScore,
            double personalConnectionScore,
            double controversyScore,
            double noveltyScore
    ) {}

    public record PlatformFitFeatures(
            double platformOptimizationScore,
            double optimalLengthScore,
            double formatSuitabilityScore
    ) {}

    public record TrendingFeatures(
            double trendingTopicsScore,
            double seasonalityScore,
            double currentEventsRelevance,
            double competitiveLandscapeScore
    ) {}

    public record CreatorFeatures(
            boolean present,
            double influenceScore,
            double nicheAlignment,
            double engagementHistory
    ) {
        public static final CreatorFeatures ABSENT = new CreatorFeatures(false, 0.0, 0.0, 0.0);

        /**
         * Influence used by engagement projections; anonymous content counts as a small account.
         */
        public double influenceOr(double fallback) {
            return present && influenceScore > 0 ? influenceScore : fallback;
        }
    }

    public record TimingFeatures(
            double optimalTimingScore,
            double dayOfWeekScore,
            double hourOfDayScore,
            double timeZoneAdvantage
    ) {}

    public record MediaFeatures(
            boolean hasMedia,
            int mediaCount,
            double mediaTypeScore,
            double mediaQualityScore,
            double mediaTrendingScore
    ) {
        public static final MediaFeatures NONE = new MediaFeatures(false, 0, 0.0, 0.0, 0.0);
    }

    public record QualityFeatures(
            double uniquenessScore,
            double informationDensity,
            double entertainmentValue,
            double educationalValue,
            double inspirationalValue
    ) {}
}
