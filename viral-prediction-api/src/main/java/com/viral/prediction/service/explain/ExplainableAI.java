package com.viral.prediction.service.explain;

import com.viral.prediction.model.Platform;
import com.viral.prediction.service.explain.ActionableRecommendation.Difficulty;
import com.viral.prediction.service.explain.ExplanationConfig.AudienceLevel;
import com.viral.prediction.service.feature.ContentFeatures;
import com.viral.prediction.service.feature.FeatureDictionary;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.viral.prediction.util.ScoreMath.clamp;
import static com.viral.prediction.util.ScoreMath.clamp01;
import static com.viral.prediction.util.ScoreMath.clamp100;
import static com.viral.prediction.util.ScoreMath.round1;
import static com.viral.prediction.util.ScoreMath.round3;

/**
 * Turns a scored feature vector into human-readable factors, recommendations and scenarios.
 * Pure and stateless: the same inputs always give the same explanation.
 */
@Service
public class ExplainableAI {

    static final String TEXT_QUALITY = "Text Quality";
    static final String EMOTIONAL_APPEAL = "Emotional Appeal";
    static final String CALL_TO_ACTION = "Call to Action";
    static final String POSTING_TIME = "Posting Time Optimization";
    static final String TREND_ALIGNMENT = "Trend Alignment";
    static final String PLATFORM_OPTIMIZATION = "Platform Optimization";
    static final String HASHTAG_STRATEGY = "Hashtag Strategy";
    static final String MEDIA_IMPACT = "Media Impact";

    private static final double SIGNIFICANT_IMPACT = 0.1;
    private static final double CRITICAL_IMPACT = 0.3;
    private static final double MIN_SCENARIO_DELTA = 1.0;

    /**
     * Score points per unit change of a feature, divided by 100.
     */
    static final Map<String, Double> FEATURE_WEIGHTS;
    static final double DEFAULT_FEATURE_WEIGHT = 0.05;
    static {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("emotional_score", 0.20);
        m.put("trending_topics_score", 0.15);
        m.put("call_to_action_score", 0.12);
        m.put("optimal_timing_score", 0.10);
        m.put("hashtag_trending_score", 0.08);
        FEATURE_WEIGHTS = m;
    }

    // Typical values of content that went viral, used for non-viral comparisons
    private static final Map<String, Double> VIRAL_BENCHMARKS;
    static {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("emotional_score", 0.75);
        m.put("trending_topics_score", 0.60);
        m.put("call_to_action_score", 0.70);
        m.put("optimal_timing_score", 0.90);
        VIRAL_BENCHMARKS = m;
    }

    private static final Map<Platform, List<String>> IMPORTANT_FEATURES;
    static {
        Map<Platform, List<String>> m = new EnumMap<>(Platform.class);
        m.put(Platform.TWITTER, List.of("emotional_score", "trending_topics_score", "hashtag_count",
                "text_length", "optimal_timing_score"));
        m.put(Platform.INSTAGRAM, List.of("has_media", "media_quality_score", "hashtag_count",
                "emotional_score", "optimal_timing_score"));
        m.put(Platform.TIKTOK, List.of("has_media", "trending_topics_score", "emotional_score",
                "entertainment_value", "optimal_timing_score"));
        m.put(Platform.YOUTUBE, List.of("media_quality_score", "readability_score", "information_density",
                "call_to_action_score", "optimal_timing_score"));
        m.put(Platform.FACEBOOK, List.of("emotional_score", "call_to_action_score", "has_media",
                "personal_connection_score", "optimal_timing_score"));
        m.put(Platform.LINKEDIN, List.of("educational_value", "information_density", "readability_score",
                "text_length", "optimal_timing_score"));
        IMPORTANT_FEATURES = m;
    }

    // ============ EXPLAIN PREDICTION ============

    public ViralExplanation explainPrediction(double viralScore, double confidence, ContentFeatures features,
                                              Platform platform, ExplanationConfig config) {
        ExplanationConfig cfg = config == null ? ExplanationConfig.defaults() : config;
        double score = clamp100(viralScore);

        List<ExplanationFactor> allFactors = analyzeFactors(features, platform, cfg.focusAreas());
        List<ExplanationFactor> keyFactors = allFactors.stream()
                .sorted(Comparator.comparingDouble((ExplanationFactor f) -> Math.abs(f.impact())).reversed())
                .limit(cfg.detailLevel().getMaxFactors())
                .toList();

        List<ActionableRecommendation> recommendations =
                generateRecommendations(keyFactors, platform, cfg.maxRecommendations());
        List<WhatIfScenario> whatIf = cfg.includeWhatIf() ? generateWhatIfScenarios(features) : List.of();
        List<Comparison> comparisons = cfg.includeComparisons()
                ? generateComparisons(score, features, platform)
                : List.of();

        return new ViralExplanation(
                summary(score, platform, keyFactors),
                keyFactors,
                recommendations,
                whatIf,
                comparisons,
                reasoning(score, clamp01(confidence), keyFactors, cfg.audienceLevel()),
                clamp01(confidence)
        );
    }

    List<ExplanationFactor> analyzeFactors(ContentFeatures f, Platform platform, Set<FactorCategory> focus) {
        List<ExplanationFactor> factors = new ArrayList<>();

        if (focus.contains(FactorCategory.CONTENT)) {
            double textQuality = (f.text().readabilityScore() + f.quality().informationDensity() * 100) / 2;
            double textImpact = impact((textQuality - 60) / 40);
            factors.add(new ExplanationFactor(FactorCategory.CONTENT, TEXT_QUALITY, textImpact, 0.8,
                    textImpact > 0
                            ? "Clear, information-rich text is easy to consume and share"
                            : "The text is hard to read or light on substance",
                    List.of("Readability score: " + round1(f.text().readabilityScore()),
                            "Information density: " + percent(f.quality().informationDensity())),
                    0.15));

            double emotion = f.sentiment().emotionalScore();
            double emotionImpact = impact((emotion * 100 - 50) / 50);
            factors.add(new ExplanationFactor(FactorCategory.CONTENT, EMOTIONAL_APPEAL, emotionImpact, 0.9,
                    emotionImpact > 0
                            ? "Strong emotional content drives shares and comments"
                            : "Low emotional engagement limits how far the content travels",
                    List.of("Emotional score: " + percent(emotion),
                            "Emotional intensity: " + percent(f.sentiment().emotionalIntensity()),
                            "Sentiment: " + sentimentLabel(f.sentiment().sentimentScore())),
                    0.2));

            double cta = f.engagement().callToActionScore();
            double ctaImpact = impact((cta * 100 - 30) / 70);
            factors.add(new ExplanationFactor(FactorCategory.CONTENT, CALL_TO_ACTION, ctaImpact, 0.7,
                    ctaImpact > 0
                            ? "A clear call to action invites the audience to engage"
                            : "Without a call to action the audience has no prompt to engage",
                    List.of("Call-to-action strength: " + percent(cta)),
                    0.12));

            if (f.media().hasMedia()) {
                double media = (f.media().mediaTypeScore() + f.media().mediaQualityScore()) / 2;
                double mediaImpact = impact((media * 100 - 50) / 50);
                factors.add(new ExplanationFactor(FactorCategory.CONTENT, MEDIA_IMPACT, mediaImpact, 0.75,
                        mediaImpact > 0
                                ? "High-quality media makes the post stand out in the feed"
                                : "The attached media is low quality or a weak format",
                        List.of("Media items: " + f.media().mediaCount(),
                                "Media type score: " + percent(f.media().mediaTypeScore()),
                                "Media quality: " + percent(f.media().mediaQualityScore())),
                        0.1));
            }
        }

        if (focus.contains(FactorCategory.TIMING)) {
            double timing = f.timing().optimalTimingScore();
            double timingImpact = impact((timing * 100 - 50) / 50);
            factors.add(new ExplanationFactor(FactorCategory.TIMING, POSTING_TIME, timingImpact, 0.75,
                    timingImpact > 0
                            ? "Posting time matches when the " + platform.getId() + " audience is most active"
                            : "Posting time misses the " + platform.getId() + " audience's peak activity",
                    List.of("Timing score: " + percent(timing),
                            "Hour fit: " + percent(f.timing().hourOfDayScore()),
                            "Day fit: " + percent(f.timing().dayOfWeekScore())),
                    0.1));

            double trend = f.trending().trendingTopicsScore();
            double trendImpact = impact((trend * 100 - 30) / 70);
            factors.add(new ExplanationFactor(FactorCategory.TIMING, TREND_ALIGNMENT, trendImpact, 0.85,
                    trendImpact > 0
                            ? "The content rides topics that are trending right now"
                            : "The content is not connected to current trends",
                    List.of("Trending topics score: " + percent(trend),
                            "Seasonality: " + percent(f.trending().seasonalityScore())),
                    0.15));
        }

        if (focus.contains(FactorCategory.PLATFORM)) {
            double fit = f.platformFit().platformOptimizationScore();
            double fitImpact = impact((fit * 100 - 60) / 40);
            factors.add(new ExplanationFactor(FactorCategory.PLATFORM, PLATFORM_OPTIMIZATION, fitImpact, 0.8,
                    fitImpact > 0
                            ? "Format and length suit " + platform.getId()
                            : "Format and length are not tuned for " + platform.getId(),
                    List.of("Platform optimization: " + percent(fit),
                            "Length fit: " + percent(f.platformFit().optimalLengthScore())),
                    0.12));

            if (platform.usesHashtags()) {
                double hashtags = f.social().hashtagTrendingScore();
                double hashtagImpact = impact((hashtags * 100 - 40) / 60);
                factors.add(new ExplanationFactor(FactorCategory.PLATFORM, HASHTAG_STRATEGY, hashtagImpact, 0.7,
                        hashtagImpact > 0
                                ? "Hashtags connect the post to active conversations"
                                : "Hashtags are missing or not trending",
                        List.of("Hashtags used: " + f.social().hashtagCount(),
                                "Trending hashtag share: " + percent(hashtags)),
                        0.08));
            }
        }

        return factors;
    }

    List<ActionableRecommendation> generateRecommendations(List<ExplanationFactor> factors, Platform platform,
                                                           int max) {
        List<ActionableRecommendation> recommendations = new ArrayList<>();

        for (ExplanationFactor factor : factors) {
            if (recommendations.size() >= max) {
                break;
            }
            if (factor.impact() < -SIGNIFICANT_IMPACT) {
                RemediationCatalog.forFactor(factor.factor())
                        .map(r -> r.forImpact(factor.impact()))
                        .ifPresent(recommendations::add);
            }
        }

        if (recommendations.size() < max) {
            RemediationCatalog.bestPractice(platform).ifPresent(recommendations::add);
        }

        return recommendations.stream()
                .sorted(Comparator.comparing(ActionableRecommendation::priority))
                .toList();
    }

    List<WhatIfScenario> generateWhatIfScenarios(ContentFeatures f) {
        List<WhatIfScenario> scenarios = new ArrayList<>();

        addScenario(scenarios, "Increase emotional appeal to 80%", "emotional_score",
                f.sentiment().emotionalScore(), 0.8, 0.8,
                "More emotional language typically lifts shares and comments");
        addScenario(scenarios, "Post at optimal time (90% timing score)", "optimal_timing_score",
                f.timing().optimalTimingScore(), 0.9, 0.7,
                "Posting inside the peak window exposes the post to more active users");
        addScenario(scenarios, "Incorporate trending topics (70% alignment)", "trending_topics_score",
                f.trending().trendingTopicsScore(), 0.7, 0.6,
                "Trend-aligned content is boosted by discovery surfaces");

        return scenarios;
    }

    private void addScenario(List<WhatIfScenario> out, String scenario, String feature,
                             double current, double target, double confidence, String explanation) {
        double delta = scoreDelta(feature, current, target);
        if (delta > MIN_SCENARIO_DELTA) {
            out.add(new WhatIfScenario(scenario, feature, round3(current), target, round1(delta), confidence,
                    explanation));
        }
    }

    List<Comparison> generateComparisons(double score, ContentFeatures f, Platform platform) {
        List<Comparison> comparisons = new ArrayList<>();

        List<String> differences = new ArrayList<>();
        List<String> insights = new ArrayList<>();
        int length = f.text().textLength();
        if (length < platform.getMinLength()) {
            differences.add("Text is shorter than typical (" + length + " vs " + platform.getOptimalLength()
                    + " characters)");
            insights.add("Add detail to reach about " + platform.getOptimalLength() + " characters");
        } else if (length > platform.getMaxLength()) {
            differences.add("Text is longer than typical (" + length + " vs " + platform.getOptimalLength()
                    + " characters)");
            insights.add("Trim the text towards " + platform.getOptimalLength() + " characters");
        }
        if (!f.media().hasMedia() && platform != Platform.TWITTER && platform != Platform.LINKEDIN) {
            differences.add("No media attached while most " + platform.getId() + " posts have some");
            insights.add("Attach an image or video");
        }
        if (f.sentiment().emotionalScore() >= 0.6) {
            differences.add("More emotional than average");
        }
        comparisons.add(new Comparison(Comparison.Type.PLATFORM,
                "Compared to average " + platform.getId() + " content",
                round1(score - 50), differences, insights));

        double timing = f.timing().optimalTimingScore();
        comparisons.add(new Comparison(Comparison.Type.TIMING,
                "Compared to optimal posting times",
                round1((timing - 0.7) * 30),
                List.of("Timing score " + percent(timing) + " vs 70% benchmark"),
                timing < 0.7
                        ? List.of("Post around " + hours(platform.getOptimalHours()))
                        : List.of("Keep posting around " + hours(platform.getOptimalHours()))));

        return comparisons;
    }

    // ============ SUMMARY & REASONING ============

    private String summary(double score, Platform platform, List<ExplanationFactor> factors) {
        String level;
        if (score >= 80) {
            level = "High viral potential";
        } else if (score >= 60) {
            level = "Good viral potential";
        } else if (score >= 40) {
            level = "Moderate viral potential";
        } else {
            level = "Low viral potential";
        }

        StringBuilder sb = new StringBuilder()
                .append(level).append(" (").append(round1(score)).append("/100) on ").append(platform.getId())
                .append('.');
        factors.stream().filter(f -> f.impact() > SIGNIFICANT_IMPACT)
                .max(Comparator.comparingDouble(ExplanationFactor::impact))
                .ifPresent(f -> sb.append(" Strongest driver: ").append(f.factor()).append('.'));
        factors.stream().filter(f -> f.impact() < -SIGNIFICANT_IMPACT)
                .min(Comparator.comparingDouble(ExplanationFactor::impact))
                .ifPresent(f -> sb.append(" Main weakness: ").append(f.factor()).append('.'));
        return sb.toString();
    }

    String reasoning(double score, double confidence, List<ExplanationFactor> factors, AudienceLevel audience) {
        List<ExplanationFactor> positive = factors.stream().filter(f -> f.impact() > SIGNIFICANT_IMPACT).toList();
        List<ExplanationFactor> negative = factors.stream().filter(f -> f.impact() < -SIGNIFICANT_IMPACT).toList();

        switch (audience) {
            case BEGINNER: {
                StringBuilder sb = new StringBuilder("Your content scored ")
                        .append(Math.round(score)).append(" out of 100.");
                if (!positive.isEmpty()) {
                    sb.append(" It works well because of its ").append(names(positive)).append('.');
                }
                if (!negative.isEmpty()) {
                    sb.append(" It could do better with improved ").append(names(negative)).append('.');
                }
                return sb.toString();
            }
            case ADVANCED: {
                StringBuilder sb = new StringBuilder(intermediateReasoning(score, confidence, positive, negative));
                double weightSum = factors.stream().mapToDouble(ExplanationFactor::weight).sum();
                double composite = weightSum == 0 ? 0
                        : factors.stream().mapToDouble(f -> f.impact() * f.weight()).sum() / weightSum;
                sb.append(" Weighted factor composite: ").append(String.format(Locale.ROOT, "%.3f", composite))
                        .append('.');
                dominantCategory(factors)
                        .ifPresent(c -> sb.append(" Dominant category: ").append(c.getId()).append('.'));
                List<ExplanationFactor> critical = factors.stream()
                        .filter(f -> Math.abs(f.impact()) > CRITICAL_IMPACT)
                        .toList();
                if (!critical.isEmpty()) {
                    sb.append(" Critical factors: ").append(impacts(critical)).append('.');
                }
                return sb.toString();
            }
            default:
                return intermediateReasoning(score, confidence, positive, negative);
        }
    }

    private String intermediateReasoning(double score, double confidence,
                                         List<ExplanationFactor> positive, List<ExplanationFactor> negative) {
        StringBuilder sb = new StringBuilder("Viral score ").append(round1(score)).append("/100 with ")
                .append(Math.round(confidence * 100)).append("% confidence.");
        if (!positive.isEmpty()) {
            sb.append(" Positive drivers: ").append(impacts(positive)).append('.');
        }
        if (!negative.isEmpty()) {
            sb.append(" Limiting factors: ").append(impacts(negative)).append('.');
        }
        if (positive.isEmpty() && negative.isEmpty()) {
            sb.append(" No single factor stands out; the score reflects balanced signals.");
        }
        return sb.toString();
    }

    private Optional<FactorCategory> dominantCategory(List<ExplanationFactor> factors) {
        Map<FactorCategory, Double> byCategory = new EnumMap<>(FactorCategory.class);
        for (ExplanationFactor f : factors) {
            byCategory.merge(f.category(), Math.abs(f.impact()) * f.weight(), Double::sum);
        }
        return byCategory.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey);
    }

    // ============ NON-VIRAL ANALYSIS ============

    public NonViralAnalysis explainNonViralContent(double viralScore, ContentFeatures f, Platform platform) {
        double score = clamp100(viralScore);
        List<ExplanationFactor> limiting = new ArrayList<>();

        double emotion = f.sentiment().emotionalScore();
        if (emotion < 0.4) {
            limiting.add(new ExplanationFactor(FactorCategory.CONTENT, "Low Emotional Appeal", -0.6, 0.85,
                    "Content lacks emotional hooks that drive sharing",
                    List.of("Emotional score: " + percent(emotion)), 0.2));
        }
        double trend = f.trending().trendingTopicsScore();
        if (trend < 0.2) {
            limiting.add(new ExplanationFactor(FactorCategory.TIMING, "Poor Trend Alignment", -0.5, 0.8,
                    "Content is not connected to current trending topics",
                    List.of("Trending topics score: " + percent(trend)), 0.15));
        }

        List<String> missed = new ArrayList<>();
        if (f.engagement().callToActionScore() < 0.3) {
            missed.add("No clear call-to-action to encourage engagement");
        }
        if (platform == Platform.INSTAGRAM && f.social().hashtagCount() < 5) {
            missed.add("Underutilized hashtag strategy for Instagram");
        }
        if (f.timing().optimalTimingScore() < 0.6) {
            missed.add("Posted outside of optimal engagement windows");
        }

        Map<String, Double> values = FeatureDictionary.toMap(f);
        List<String> differences = new ArrayList<>();
        double gap = 0;
        double potential = 0;
        for (Map.Entry<String, Double> benchmark : VIRAL_BENCHMARKS.entrySet()) {
            double current = values.getOrDefault(benchmark.getKey(), 0.0);
            double target = benchmark.getValue();
            if (current < target) {
                differences.add(label(benchmark.getKey()) + ": " + percent(current) + " vs " + percent(target)
                        + " in successful content");
                gap -= scoreDelta(benchmark.getKey(), current, target);
                potential += scoreDelta(benchmark.getKey(), current, target);
            }
        }
        Comparison comparison = new Comparison(Comparison.Type.SIMILAR_CONTENT,
                "Compared to successful " + platform.getId() + " content",
                round1(gap), differences,
                differences.isEmpty()
                        ? List.of("Core signals match successful content; focus on distribution")
                        : List.of("Close the largest gap first"));

        List<ActionableRecommendation> plan = new ArrayList<>();
        if (emotion < 0.4) {
            RemediationCatalog.forFactor(EMOTIONAL_APPEAL).map(r -> r.forImpact(-0.6)).ifPresent(plan::add);
        }
        if (trend < 0.2) {
            RemediationCatalog.forFactor(TREND_ALIGNMENT).map(r -> r.forImpact(-0.5)).ifPresent(plan::add);
        }
        if (f.engagement().callToActionScore() < 0.3) {
            RemediationCatalog.forFactor(CALL_TO_ACTION).map(r -> r.forImpact(-0.4)).ifPresent(plan::add);
        }
        if (f.timing().optimalTimingScore() < 0.6) {
            RemediationCatalog.forFactor(POSTING_TIME).map(r -> r.forImpact(-0.3)).ifPresent(plan::add);
        }
        plan.sort(Comparator.comparing(ActionableRecommendation::priority));

        return new NonViralAnalysis(limiting, missed, comparison, plan,
                round1(Math.min(100 - score, potential)));
    }

    // ============ FEATURE ANALYSIS ============

    public List<FeatureAnalysis> explainFeatures(ContentFeatures f, Platform platform) {
        Map<String, Double> values = FeatureDictionary.toMap(f);
        List<FeatureAnalysis> analyses = new ArrayList<>();

        for (String feature : IMPORTANT_FEATURES.get(platform)) {
            double value = values.getOrDefault(feature, 0.0);
            double[] range = optimalRange(feature, platform);
            double min = range[0];
            double max = range[1];

            FeatureAnalysis.Status status;
            List<String> suggestions;
            if (value >= min && value <= max) {
                status = FeatureAnalysis.Status.POSITIVE;
                suggestions = List.of(label(feature) + " is in the optimal range");
            } else if (value < min) {
                status = value < min * 0.7 ? FeatureAnalysis.Status.NEGATIVE : FeatureAnalysis.Status.NEUTRAL;
                suggestions = List.of("Increase " + label(feature).toLowerCase(Locale.ROOT) + " to at least "
                        + number(min));
            } else {
                status = value > max * 1.3 ? FeatureAnalysis.Status.NEGATIVE : FeatureAnalysis.Status.NEUTRAL;
                suggestions = List.of("Reduce " + label(feature).toLowerCase(Locale.ROOT) + " to at most "
                        + number(max));
            }
            analyses.add(new FeatureAnalysis(feature, round3(value), min, max, status, 0.8, suggestions));
        }

        analyses.sort(Comparator.comparing(FeatureAnalysis::status));
        return analyses;
    }

    static double[] optimalRange(String feature, Platform platform) {
        switch (feature) {
            case "emotional_score":
                return new double[]{0.6, 0.9};
            case "trending_topics_score":
                return new double[]{0.4, 0.8};
            case "call_to_action_score":
                return new double[]{0.5, 0.8};
            case "optimal_timing_score":
                return new double[]{0.7, 1.0};
            case "readability_score":
                return new double[]{50, 80};
            case "has_media":
                return new double[]{1, 1};
            case "text_length":
                return new double[]{platform.getMinLength(), platform.getMaxLength()};
            case "hashtag_count":
                switch (platform) {
                    case TWITTER:
                        return new double[]{1, 2};
                    case INSTAGRAM:
                        return new double[]{5, 11};
                    case TIKTOK:
                        return new double[]{3, 6};
                    default:
                        return new double[]{0, 3};
                }
            default:
                return new double[]{0.3, 0.8};
        }
    }

    // ============ COUNTERFACTUALS ============

    /**
     * Raises the highest-weighted features first until the estimated score reaches the target.
     */
    public Counterfactual generateCounterfactuals(double viralScore, ContentFeatures f, double targetScore) {
        if (!Double.isFinite(targetScore) || targetScore < 0 || targetScore > 100) {
            throw new IllegalArgumentException("Target score must be between 0 and 100: " + targetScore);
        }
        double score = clamp100(viralScore);
        if (targetScore <= score) {
            return new Counterfactual(score, targetScore, List.of(), true,
                    "Current score already meets the target", 1.0, Difficulty.LOW);
        }

        Map<String, Double> values = FeatureDictionary.toMap(f);
        List<Counterfactual.FeatureChange> changes = new ArrayList<>();
        double needed = targetScore - score;
        double totalRaise = 0;

        for (Map.Entry<String, Double> entry : FEATURE_WEIGHTS.entrySet()) {
            if (needed <= 1e-9) {
                break;
            }
            double current = clamp01(values.getOrDefault(entry.getKey(), 0.0));
            double pointsPerUnit = entry.getValue() * 100;
            double raise = Math.min(1.0 - current, needed / pointsPerUnit);
            if (raise <= 0) {
                continue;
            }
            double gained = raise * pointsPerUnit;
            changes.add(new Counterfactual.FeatureChange(entry.getKey(), round3(current), round3(current + raise),
                    round1(gained)));
            needed -= gained;
            totalRaise += raise;
        }

        boolean achievable = needed <= 1e-9;
        double feasibility = changes.isEmpty() ? 0.0 : clamp01(1 - totalRaise / changes.size());
        Difficulty effort = changes.size() > 3 ? Difficulty.HIGH
                : changes.size() > 1 ? Difficulty.MEDIUM
                : Difficulty.LOW;

        String explanation;
        if (achievable) {
            explanation = changes.stream()
                    .map(c -> "raise " + label(c.feature()).toLowerCase(Locale.ROOT) + " from "
                            + percent(c.from()) + " to " + percent(c.to()))
                    .collect(Collectors.joining(", then ", "To reach " + round1(targetScore) + ": ", ""));
        } else {
            explanation = "Feature changes alone reach about " + round1(targetScore - needed)
                    + "; the target also needs stronger distribution or creator reach";
        }

        return new Counterfactual(score, targetScore, changes, achievable, explanation, round3(feasibility),
                effort);
    }

    // ============ UNCERTAINTY ============

    public UncertaintyExplanation explainUncertainty(double viralScore, double confidence, ContentFeatures f,
                                                     Platform platform) {
        double score = clamp100(viralScore);
        double margin = (1 - clamp01(confidence)) * 50;

        List<String> factors = new ArrayList<>();
        if (f.engagement().noveltyScore() > 0.8) {
            factors.add("Highly novel content has few comparable examples");
        }
        if (f.trending().trendingTopicsScore() < 0.2) {
            factors.add("Weak trend signal makes reach harder to anticipate");
        }
        if (f.engagement().controversyScore() > 0.5) {
            factors.add("Controversial content can swing strongly in either direction");
        }

        boolean visualPlatform = platform == Platform.INSTAGRAM || platform == Platform.TIKTOK
                || platform == Platform.YOUTUBE;
        List<String> dataIssues = new ArrayList<>();
        if (!f.creator().present()) {
            dataIssues.add("No creator data; a small account is assumed");
        }
        if (f.text().textLength() < 20) {
            dataIssues.add("Very short text gives few language signals");
        }
        if (visualPlatform && !f.media().hasMedia()) {
            dataIssues.add("No media attached on a visual platform");
        }

        List<String> limitations = List.of(
                "Feature scores are derived from text and metadata, not from image or audio content",
                "Events after publication are not modelled",
                "Platform ranking algorithms change without notice");

        List<String> recommendations = new ArrayList<>();
        if (margin > 20) {
            recommendations.add("Treat the score as a rough estimate and test with a small audience first");
        }
        if (!f.creator().present()) {
            recommendations.add("Provide follower count and engagement rate for a tighter estimate");
        }
        if (visualPlatform && !f.media().hasMedia()) {
            recommendations.add("Attach the planned media before predicting");
        }
        recommendations.add("Record actual performance after 24 hours to improve future predictions");

        return new UncertaintyExplanation(round1(margin), round1(clamp100(score - margin)),
                round1(clamp100(score + margin)), factors, dataIssues, limitations, recommendations);
    }

    // ============ HELPERS ============

    static double scoreDelta(String feature, double current, double target) {
        double weight = FEATURE_WEIGHTS.getOrDefault(feature, DEFAULT_FEATURE_WEIGHT);
        return Math.max(0, target - current) * weight * 100;
    }

    private static double impact(double raw) {
        return round3(clamp(raw, -1.0, 1.0));
    }

    private static String percent(double value) {
        return Math.round(value * 100) + "%";
    }

    private static String number(double value) {
        return value == Math.rint(value)
                ? String.valueOf((long) value)
                : String.format(Locale.ROOT, "%.2f", value);
    }

    private static String sentimentLabel(double sentiment) {
        String label = sentiment > 0.1 ? "positive" : sentiment < -0.1 ? "negative" : "neutral";
        return label + " (" + String.format(Locale.ROOT, "%.2f", sentiment) + ")";
    }

    private static String hours(List<Integer> hours) {
        return hours.stream().map(h -> h + ":00").collect(Collectors.joining(", "));
    }

    private static String names(List<ExplanationFactor> factors) {
        return factors.stream()
                .map(f -> f.factor().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
    }

    private static String impacts(List<ExplanationFactor> factors) {
        return factors.stream()
                .map(f -> f.factor() + " (" + String.format(Locale.ROOT, "%+.2f", f.impact()) + ")")
                .collect(Collectors.joining(", "));
    }

    static String label(String feature) {
        String words = feature.replace('_', ' ');
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}
