package com.viral.prediction.service.platform;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.viral.prediction.util.ScoreMath.clamp01;
import static com.viral.prediction.util.ScoreMath.round3;

/**
 * Twitter scoring: short text, 1-2 hashtags and conversation starters do best.
 * Breaking news, trend alignment, influential mentions and niche fit multiply the score.
 */
@Component
public class TwitterModel extends AbstractPlatformModel {

    public static final PlatformModelConfig DEFAULT_CONFIG;
    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("text", 0.25);
        weights.put("social", 0.30);
        weights.put("timing", 0.15);
        weights.put("engagement", 0.20);
        weights.put("virality", 0.10);

        Map<String, Double> multipliers = new LinkedHashMap<>();
        multipliers.put("thread", 1.2);
        multipliers.put("single", 1.0);
        multipliers.put("media", 1.1);
        multipliers.put("poll", 1.15);

        DEFAULT_CONFIG = new PlatformModelConfig(Platform.TWITTER, "2.1.0", weights,
                new PlatformModelConfig.Thresholds(95, 80, 65, 45), multipliers,
                new PlatformModelConfig.EngagementProfile(10_000, 0.05, 0.1));
    }

    static final double BREAKING_NEWS_BOOST = 1.5;
    static final double TRENDING_TOPIC_BOOST = 1.3;
    static final double INFLUENCER_BOOST = 1.4;
    static final double COMMUNITY_BOOST = 1.2;

    private static final Pattern HASHTAG = Pattern.compile("#\\w+");
    private static final List<Integer> AVOID_HOURS = List.of(2, 3, 4, 5, 6);
    private static final int MAX_TWEETS_PER_DAY = 5;
    private static final int LONG_THREAD = 10;

    public TwitterModel() {
        super(DEFAULT_CONFIG);
    }

    @Override
    protected Map<String, Double> componentScores(ContentFeatures f, ContentTypeMetadata metadata) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("text", textScore(f));
        scores.put("social", socialScore(f));
        scores.put("timing", timingScore(f));
        scores.put("engagement", engagementScore(f));
        scores.put("virality", viralityScore(f));
        return scores;
    }

    // ============ COMPONENTS ============

    private double textScore(ContentFeatures f) {
        int length = f.text().textLength();
        double score = 50;
        if (between(length, 71, 100)) {
            score += 20;
        } else if (length <= 140) {
            score += 10;
        }
        score += characterEfficiency(f) * 15;
        score += f.text().readabilityScore() / 100 * 10;
        if (f.sentiment().sentimentScore() > 0.2) {
            score += 5;
        }
        return score;
    }

    private double socialScore(ContentFeatures f) {
        int hashtags = f.social().hashtagCount();
        int mentions = f.social().mentionCount();
        double score = 40;
        if (hashtags == 1 || hashtags == 2) {
            score += 20;
        } else if (hashtags == 0) {
            score += 5;
        }
        score += f.social().hashtagTrendingScore() * 25;
        if (mentions == 1) {
            score += 10;
        } else if (mentions > 3) {
            score -= 5;
        }
        score += f.social().mentionInfluenceScore() * 15;
        return score;
    }

    private double timingScore(ContentFeatures f) {
        return f.timing().optimalTimingScore() * 60 + 20
                + f.trending().currentEventsRelevance() * 20
                + f.timing().dayOfWeekScore() * 10
                + f.timing().hourOfDayScore() * 10;
    }

    private double engagementScore(ContentFeatures f) {
        return 30
                + f.engagement().callToActionScore() * 20
                + f.linguistic().questionCount() * 10
                + replyEngagement(f) * 25
                + f.sentiment().emotionalScore() * 15
                + f.engagement().controversyScore() * 5;
    }

    private double viralityScore(ContentFeatures f) {
        return 25
                + retweetLikelihood(f) * 30
                + quoteTweetAppeal(f) * 20
                + threadPotential(f) * 15
                + f.engagement().noveltyScore() * 10;
    }

    @Override
    protected double contextMultiplier(ContentFeatures f) {
        double multiplier = 1.0;
        if (f.trending().currentEventsRelevance() > 0.8) multiplier *= BREAKING_NEWS_BOOST;
        if (f.trending().trendingTopicsScore() > 0.6) multiplier *= TRENDING_TOPIC_BOOST;
        if (f.social().mentionInfluenceScore() > 0.7) multiplier *= INFLUENCER_BOOST;
        if (f.creator().nicheAlignment() > 0.8) multiplier *= COMMUNITY_BOOST;
        return Math.min(MAX_CONTEXT_MULTIPLIER, multiplier);
    }

    @Override
    protected double confidence(ContentFeatures f, ContentTypeMetadata metadata) {
        double confidence = 0.5;
        if (f.creator().present()) confidence += 0.1;
        if (f.social().hashtagCount() > 0) confidence += 0.1;
        if (f.trending().trendingTopicsScore() > 0.3) confidence += 0.15;
        if (f.timing().optimalTimingScore() > 0.7) confidence += 0.1;
        if (f.text().textLength() > 20) confidence += 0.05;
        return confidence;
    }

    @Override
    protected void addPlatformMetrics(Map<String, Double> metrics, ContentFeatures f,
                                      ContentTypeMetadata metadata, double score) {
        double impressions = metrics.get("views");
        double rate = metrics.get("engagementRate");
        metrics.put("retweets", Math.floor(impressions * rate * 0.2));
        metrics.put("quotes", Math.floor(impressions * rate * 0.05));
        metrics.put("linkClicks", f.social().urlCount() > 0 ? Math.floor(impressions * 0.02) : 0.0);
        metrics.put("profileClicks", Math.floor(impressions * 0.01));
        metrics.put("hashtagClicks", f.social().hashtagCount() > 0 ? Math.floor(impressions * 0.005) : 0.0);
        metrics.put("mediaViews", f.media().hasMedia() ? Math.floor(impressions * 0.8) : 0.0);
    }

    @Override
    protected List<String> recommendations(ContentFeatures f, ContentTypeMetadata metadata) {
        List<String> recommendations = new ArrayList<>();
        int hashtags = f.social().hashtagCount();
        if (hashtags == 0) {
            recommendations.add("Add 1-2 relevant hashtags");
        } else if (hashtags > 2) {
            recommendations.add("Trim hashtags to the 1-2 most relevant");
        }
        if (f.text().textLength() > 140) {
            recommendations.add("Tighten the tweet to under 140 characters or split it into a thread");
        }
        if (f.linguistic().questionCount() == 0 && f.engagement().callToActionScore() < 0.3) {
            recommendations.add("Ask a question to invite replies");
        }
        if (f.social().mentionCount() > 3) {
            recommendations.add("Mention fewer accounts; more than three reduces reach");
        }
        return recommendations;
    }

    // ============ TWITTER SIGNALS ============

    static double threadPotential(ContentFeatures f) {
        double potential = 0.3;
        if (f.text().textLength() > 200) potential += 0.3;
        if (f.linguistic().questionCount() > 0) potential += 0.2;
        if (f.quality().informationDensity() > 0.7) potential += 0.2;
        return clamp01(potential);
    }

    static double retweetLikelihood(ContentFeatures f) {
        double sentiment = f.sentiment().sentimentScore();
        return clamp01(0.2
                + (sentiment > 0 ? sentiment * 0.3 : 0)
                + f.sentiment().emotionalScore() * 0.3
                + f.engagement().callToActionScore() * 0.2
                + f.trending().trendingTopicsScore() * 0.3);
    }

    static double quoteTweetAppeal(ContentFeatures f) {
        return clamp01(0.15
                + f.engagement().controversyScore() * 0.4
                + f.engagement().noveltyScore() * 0.3
                + (f.linguistic().questionCount() > 0 ? 0.2 : 0)
                + f.quality().entertainmentValue() * 0.1);
    }

    static double characterEfficiency(ContentFeatures f) {
        int length = f.text().textLength();
        if (length == 0) {
            return 0.0;
        }
        return clamp01(f.quality().informationDensity() / (length / 100.0));
    }

    static double replyEngagement(ContentFeatures f) {
        return clamp01(0.2
                + f.linguistic().questionCount() * 0.3
                + f.engagement().personalConnectionScore() * 0.2
                + f.engagement().controversyScore() * 0.3
                + f.quality().educationalValue() * 0.2);
    }

    // ============ THREADS & SCHEDULING ============

    /**
     * Scores a thread: the mean tweet score lifted by up to 30% for cohesion.
     * The suggested order puts the strongest tweet first, the runner-up last and the rest weakest-first between them.
     *
     * @param tweets   tweet texts in posting order
     * @param features feature vectors aligned with {@code tweets}
     */
    public ThreadAnalysis analyzeThreadPotential(List<String> tweets, List<ContentFeatures> features) {
        if (tweets.isEmpty()) {
            throw new IllegalArgumentException("A thread needs at least one tweet");
        }
        if (tweets.size() != features.size()) {
            throw new IllegalArgumentException("Expected one feature vector per tweet");
        }

        List<Double> scores = features.stream()
                .map(f -> round3(predict(f, ContentTypeMetadata.ofType("thread")).viralScore()))
                .toList();
        double average = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double cohesion = threadCohesion(tweets);
        double threadScore = Math.min(100, average * (1 + cohesion * 0.3));

        List<String> recommendations = new ArrayList<>();
        if (average < 60) {
            recommendations.add("Consider strengthening weaker tweets with more engaging content");
        }
        long weak = scores.stream().filter(s -> s < average - 10).count();
        if (weak > tweets.size() / 2.0) {
            recommendations.add("More than half the tweets are below average - consider rewriting");
        }
        if (tweets.size() > LONG_THREAD) {
            recommendations.add("Consider breaking into multiple shorter threads for better engagement");
        }

        return new ThreadAnalysis(round3(threadScore), scores, optimalOrder(scores), round3(cohesion), recommendations);
    }

    /**
     * Shared hashtags and repeated long words across tweets raise cohesion from a 0.5 base.
     */
    static double threadCohesion(List<String> tweets) {
        double cohesion = 0.5;

        List<String> allTags = new ArrayList<>();
        for (String tweet : tweets) {
            Matcher m = HASHTAG.matcher(tweet);
            while (m.find()) {
                allTags.add(m.group().toLowerCase(Locale.ROOT));
            }
        }
        Set<String> uniqueTags = new HashSet<>(allTags);
        if (!uniqueTags.isEmpty()) {
            cohesion += ((double) allTags.size() / uniqueTags.size() - 1) * 0.1;
        }

        Map<String, Integer> frequency = new HashMap<>();
        for (String word : String.join(" ", tweets).toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() > 4) {
                frequency.merge(word, 1, Integer::sum);
            }
        }
        long repeated = frequency.values().stream().filter(c -> c > 1).count();
        cohesion += (double) repeated / tweets.size() * 0.2;

        return clamp01(cohesion);
    }

    static List<Integer> optimalOrder(List<Double> scores) {
        List<Integer> byScore = new ArrayList<>();
        for (int i = 0; i < scores.size(); i++) {
            byScore.add(i);
        }
        byScore.sort(Comparator.comparing((Integer i) -> scores.get(i)).reversed());

        List<Integer> order = new ArrayList<>();
        order.add(byScore.get(0));
        for (int i = byScore.size() - 1; i >= 2; i--) {
            order.add(byScore.get(i));
        }
        if (byScore.size() > 1) {
            order.add(byScore.get(1));
        }
        return order;
    }

    /**
     * Places every tweet at the next Twitter peak hour after {@code now} in the audience's timezone.
     */
    public Schedule predictOptimalSchedule(List<String> tweets, List<ContentFeatures> features,
                                           ZoneId zone, Instant now, int durationDays) {
        if (tweets.size() != features.size()) {
            throw new IllegalArgumentException("Expected one feature vector per tweet");
        }
        if (durationDays <= 0) {
            throw new IllegalArgumentException("durationDays must be positive");
        }

        Instant optimalTime = nextPeakHour(now.atZone(zone));
        List<ScheduledTweet> schedule = new ArrayList<>();
        for (int i = 0; i < tweets.size(); i++) {
            PlatformPrediction prediction = predict(features.get(i), null);
            schedule.add(new ScheduledTweet(tweets.get(i), optimalTime,
                    Math.min(10_000, Math.round(prediction.viralScore() * 100)),
                    round3(prediction.confidence())));
        }

        Strategy strategy = new Strategy(
                Platform.TWITTER.getOptimalHours(),
                AVOID_HOURS,
                Platform.TWITTER.getOptimalDays().stream().map(DayOfWeek::of).toList(),
                round3(Math.min(MAX_TWEETS_PER_DAY, (double) tweets.size() / durationDays)));
        return new Schedule(schedule, strategy);
    }

    static Instant nextPeakHour(ZonedDateTime now) {
        for (int hour : Platform.TWITTER.getOptimalHours()) {
            if (hour > now.getHour()) {
                return now.truncatedTo(ChronoUnit.DAYS).withHour(hour).toInstant();
            }
        }
        return now.truncatedTo(ChronoUnit.DAYS).plusDays(1)
                .withHour(Platform.TWITTER.getOptimalHours().get(0)).toInstant();
    }

    public record ThreadAnalysis(
            double threadViralScore,
            List<Double> individualScores,
            List<Integer> optimalOrder,
            double cohesion,
            List<String> recommendations
    ) {}

    public record ScheduledTweet(String tweet, Instant optimalTime, long expectedEngagement, double confidence) {}

    public record Strategy(List<Integer> peakHours, List<Integer> avoidHours, List<DayOfWeek> bestDays,
                           double tweetsPerDay) {}

    public record Schedule(List<ScheduledTweet> schedule, Strategy overallStrategy) {}
}
