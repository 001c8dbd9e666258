package com.viral.prediction.service.feature;

import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.exception.ExtractionFailureException;
import com.viral.prediction.exception.UnsupportedPlatformException;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.ContentFeatures.*;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.viral.prediction.util.ScoreMath.clamp;
import static com.viral.prediction.util.ScoreMath.clamp01;

/**
 * Turns a content submission into a {@link ContentFeatures} vector.
 * Each feature group is computed from the request alone, so the groups run concurrently and are merged at the end.
 * Empty inputs produce neutral values rather than errors.
 */
@Service
public class FeatureExtractor {

    public static final int BATCH_CHUNK_SIZE = 10;

    private static final Pattern HASHTAG = Pattern.compile("#(\\w+)");
    private static final Pattern MENTION = Pattern.compile("@(\\w+)");
    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern NON_LETTER = Pattern.compile("[^\\p{L}]+");

    // ============ LEXICONS ============

    private static final Set<String> POSITIVE_WORDS = Set.of(
            "great", "amazing", "love", "awesome", "fantastic", "excellent", "perfect", "wonderful");
    private static final Set<String> NEGATIVE_WORDS = Set.of(
            "hate", "terrible", "awful", "bad", "horrible", "disgusting", "worst", "stupid");
    private static final Set<String> PERSONAL_PRONOUNS = Set.of("i", "me", "my", "mine", "you", "your", "we", "our");
    private static final Set<String> OPINION_WORDS = Set.of("think", "feel", "believe", "opinion", "seems", "appears");

    private static final Map<String, List<String>> EMOTION_KEYWORDS;
    static {
        Map<String, List<String>> emotions = new LinkedHashMap<>();
        emotions.put("joy", List.of("happy", "joy", "excited", "thrilled", "delighted", "cheerful"));
        emotions.put("sadness", List.of("sad", "depressed", "disappointed", "gloomy", "melancholy"));
        emotions.put("anger", List.of("angry", "furious", "rage", "mad", "irritated", "frustrated"));
        emotions.put("fear", List.of("scared", "afraid", "worried", "anxious", "terrified", "nervous"));
        emotions.put("surprise", List.of("surprised", "shocked", "amazed", "astonished", "stunned"));
        emotions.put("disgust", List.of("disgusted", "revolted", "sick", "gross", "repulsed"));
        emotions.put("excitement", List.of("exciting", "thrilling", "exhilarating", "electrifying"));
        emotions.put("anticipation", List.of("waiting", "expecting", "looking forward", "anticipating"));
        EMOTION_KEYWORDS = Collections.unmodifiableMap(emotions);
    }

    private static final List<String> CTA_WORDS = List.of(
            "share", "retweet", "like", "comment", "follow", "subscribe", "click", "watch", "read", "join");
    private static final List<String> URGENCY_WORDS = List.of(
            "now", "today", "urgent", "limited time", "hurry", "quick", "fast", "immediately");
    private static final List<String> PERSONAL_WORDS = List.of("you", "your", "we", "us", "our", "together");
    private static final List<String> CONTROVERSY_WORDS = List.of(
            "controversial", "debate", "argue", "disagree", "unpopular opinion");
    private static final List<String> NOVELTY_WORDS = List.of(
            "new", "first", "never", "discover", "reveal", "secret", "exclusive", "breakthrough");

    private static final Set<String> TRENDING_HASHTAGS = Set.of("viral", "trending", "fyp", "explore", "discover");

    private static final List<String> WINTER_TERMS = List.of("winter", "christmas", "holiday", "snow", "cold");
    private static final List<String> SPRING_TERMS = List.of("spring", "easter", "fresh", "new", "bloom");
    private static final List<String> SUMMER_TERMS = List.of("summer", "vacation", "beach", "hot", "sun");
    private static final List<String> FALL_TERMS = List.of("fall", "autumn", "thanksgiving", "harvest", "cozy");

    private static final Set<String> COMMON_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by", "a", "an");
    private static final List<String> ENTERTAINMENT_WORDS = List.of(
            "funny", "hilarious", "joke", "laugh", "humor", "comedy", "amusing", "entertaining");
    private static final List<String> EDUCATIONAL_WORDS = List.of(
            "learn", "tutorial", "how to", "guide", "tip", "advice", "explain", "teach");
    private static final List<String> INSPIRATIONAL_WORDS = List.of(
            "inspire", "motivate", "achieve", "success", "dream", "goal", "overcome", "believe");

    private static final Set<String> MAJOR_TIMEZONES = Set.of("EST", "PST", "GMT", "UTC");
    private static final Map<String, ZoneId> TIMEZONE_ALIASES = Map.of(
            "EST", ZoneId.of("America/New_York"),
            "PST", ZoneId.of("America/Los_Angeles"),
            "GMT", ZoneOffset.UTC,
            "UTC", ZoneOffset.UTC);

    private final TrendingTopicStore trendingTopics;
    private final Clock clock;
    private final Executor executor;

    public FeatureExtractor(TrendingTopicStore trendingTopics, Clock clock,
                            @Qualifier("predictionExecutor") Executor executor) {
        this.trendingTopics = trendingTopics;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Extracts the full feature vector.
     *
     * @throws UnsupportedPlatformException when the request names an unknown platform
     * @throws ExtractionFailureException when a feature group fails unexpectedly
     */
    public ContentFeatures extractFeatures(ContentRequest request) {
        try {
            return extractFeaturesAsync(request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof UnsupportedPlatformException unsupported) {
                throw unsupported;
            }
            if (cause instanceof ExtractionFailureException failure) {
                throw failure;
            }
            throw new ExtractionFailureException("Feature extraction failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Non-blocking variant: the returned future completes once every feature group has finished.
     */
    public CompletableFuture<ContentFeatures> extractFeaturesAsync(ContentRequest request) {
        Platform platform = Platform.fromId(request.platform());
        ContentRequest.Content content = request.content();
        String text = content.text();
        Instant now = clock.instant();

        CompletableFuture<TextFeatures> text$ = async(() -> extractTextFeatures(text));
        CompletableFuture<SentimentFeatures> sentiment$ = async(() -> extractSentimentFeatures(text));
        CompletableFuture<LinguisticFeatures> linguistic$ = async(() -> extractLinguisticFeatures(text));
        CompletableFuture<SocialFeatures> social$ = async(() -> extractSocialFeatures(request, platform));
        CompletableFuture<EngagementFeatures> engagement$ = async(() -> extractEngagementFeatures(text));
        CompletableFuture<PlatformFitFeatures> platformFit$ = async(() -> extractPlatformFitFeatures(request, platform));
        CompletableFuture<TrendingFeatures> trending$ = async(() -> extractTrendingFeatures(request, platform, now));
        CompletableFuture<CreatorFeatures> creator$ = async(() -> extractCreatorFeatures(request));
        CompletableFuture<TimingFeatures> timing$ = async(() -> extractTimingFeatures(request, platform, now));
        CompletableFuture<MediaFeatures> media$ = async(() -> extractMediaFeatures(content));
        CompletableFuture<QualityFeatures> quality$ = async(() -> extractQualityFeatures(text));

        return CompletableFuture.allOf(text$, sentiment$, linguistic$, social$, engagement$, platformFit$,
                        trending$, creator$, timing$, media$, quality$)
                .thenApply(ignored -> new ContentFeatures(
                        text$.join(), sentiment$.join(), linguistic$.join(), social$.join(), engagement$.join(),
                        platformFit$.join(), trending$.join(), creator$.join(), timing$.join(), media$.join(),
                        quality$.join()));
    }

    /**
     * Extracts features for many requests, {@value #BATCH_CHUNK_SIZE} at a time, preserving input order.
     */
    public List<ContentFeatures> batchExtractFeatures(List<ContentRequest> requests) {
        List<ContentFeatures> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i += BATCH_CHUNK_SIZE) {
            List<ContentRequest> chunk = requests.subList(i, Math.min(i + BATCH_CHUNK_SIZE, requests.size()));
            List<CompletableFuture<ContentFeatures>> futures = chunk.stream()
                    .map(this::extractFeaturesAsync)
                    .toList();
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } catch (CompletionException e) {
                throw new ExtractionFailureException("Batch feature extraction failed: " + e.getMessage(), e.getCause());
            }
            futures.forEach(f -> results.add(f.join()));
        }
        return results;
    }

    /**
     * Text, sentiment and social counts only. Runs on the caller's thread.
     */
    public RealTimeFeatures extractRealTimeFeatures(String text, Platform platform) {
        String safeText = text == null ? "" : text;
        ContentRequest request = new ContentRequest(ContentRequest.Content.text(safeText), platform.getId());
        TextFeatures textFeatures = extractTextFeatures(safeText);
        return new RealTimeFeatures(
                textFeatures.textLength(),
                textFeatures.wordCount(),
                extractSentimentFeatures(safeText).sentimentScore(),
                hashtags(request.content()).size(),
                mentions(request.content()).size(),
                callToActionScore(safeText)
        );
    }

    private <T> CompletableFuture<T> async(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, executor);
    }

    // ============ TEXT ============

    TextFeatures extractTextFeatures(String text) {
        List<String> words = TextStats.words(text);
        if (words.isEmpty()) {
            return new TextFeatures(text == null ? 0 : text.length(), 0, 0, 0.0, TextFeatures.EMPTY.readabilityScore());
        }
        List<String> sentences = TextStats.sentences(text);
        double avgWordLength = words.stream().mapToInt(String::length).average().orElse(0.0);

        return new TextFeatures(text.length(), words.size(), sentences.size(), avgWordLength,
                readability(words, sentences));
    }

    /**
     * Flesch-Kincaid grade mapped onto 0-100, higher is easier to read.
     */
    static double readability(List<String> words, List<String> sentences) {
        if (words.isEmpty()) {
            return TextFeatures.EMPTY.readabilityScore();
        }
        double wordsPerSentence = (double) words.size() / Math.max(1, sentences.size());
        double syllablesPerWord = TextStats.avgSyllablesPerWord(words);
        double grade = 0.39 * wordsPerSentence + 11.8 * syllablesPerWord - 15.59;
        return clamp(100 - grade * 10, 0, 100);
    }

    // ============ SENTIMENT & EMOTION ============

    SentimentFeatures extractSentimentFeatures(String text) {
        List<String> words = TextStats.normalizedWords(text);
        Map<String, Double> emotions = new LinkedHashMap<>();
        if (words.isEmpty()) {
            EMOTION_KEYWORDS.keySet().forEach(e -> emotions.put(e, 0.0));
            return new SentimentFeatures(0.0, emotions, 0.0, 0.0, 0.0);
        }

        long positive = words.stream().filter(POSITIVE_WORDS::contains).count();
        long negative = words.stream().filter(NEGATIVE_WORDS::contains).count();
        long sentimentWords = positive + negative;
        double polarity = sentimentWords > 0 ? (double) (positive - negative) / sentimentWords : 0.0;

        long subjective = words.stream().filter(w -> PERSONAL_PRONOUNS.contains(w) || OPINION_WORDS.contains(w)).count();
        double subjectivity = clamp01((double) subjective / words.size() * 5);

        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : EMOTION_KEYWORDS.entrySet()) {
            long hits = words.stream()
                    .filter(w -> entry.getValue().stream().anyMatch(k -> !k.contains(" ") && w.contains(k)))
                    .count();
            hits += entry.getValue().stream().filter(k -> k.contains(" ") && lower.contains(k)).count();
            emotions.put(entry.getKey(), clamp01((double) hits / words.size() * 20));
        }

        double composite = emotions.get("joy") * 0.3 + emotions.get("excitement") * 0.4 + emotions.get("surprise") * 0.3;
        double intensity = emotions.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        return new SentimentFeatures(polarity, emotions, clamp01(composite), intensity, subjectivity);
    }

    // ============ LINGUISTIC ============

    LinguisticFeatures extractLinguisticFeatures(String text) {
        if (text == null || text.isEmpty()) {
            return new LinguisticFeatures(0, 0, 0.0, 0, 0.0, 0.0, 0.0);
        }
        int exclamations = (int) text.chars().filter(c -> c == '!').count();
        int questions = (int) text.chars().filter(c -> c == '?').count();

        long letters = text.chars().filter(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')).count();
        long caps = text.chars().filter(c -> c >= 'A' && c <= 'Z').count();
        double capsRatio = letters > 0 ? (double) caps / letters : 0.0;

        List<Integer> emojis = text.codePoints().filter(FeatureExtractor::isEmoji).boxed().toList();
        double emojiDiversity = emojis.isEmpty() ? 0.0 : (double) new HashSet<>(emojis).size() / emojis.size();

        List<String> words = TextStats.normalizedWords(text);
        double lexicalDiversity = words.isEmpty() ? 0.0 : (double) new HashSet<>(words).size() / words.size();
        int sentences = TextStats.sentences(text).size();
        double avgSentenceLength = sentences > 0 ? (double) TextStats.words(text).size() / sentences : 0.0;

        return new LinguisticFeatures(exclamations, questions, capsRatio, emojis.size(), emojiDiversity,
                lexicalDiversity, avgSentenceLength);
    }

    static boolean isEmoji(int codePoint) {
        return (codePoint >= 0x1F600 && codePoint <= 0x1F64F)
                || (codePoint >= 0x1F300 && codePoint <= 0x1F5FF)
                || (codePoint >= 0x1F680 && codePoint <= 0x1F6FF)
                || (codePoint >= 0x1F1E0 && codePoint <= 0x1F1FF)
                || (codePoint >= 0x1F900 && codePoint <= 0x1F9FF);
    }

    // ============ SOCIAL ============

    SocialFeatures extractSocialFeatures(ContentRequest request, Platform platform) {
        ContentRequest.Content content = request.content();
        Set<String> hashtags = hashtags(content);
        Set<String> mentions = mentions(content);
        int urls = TextStats.count(URL, content.text());

        return new SocialFeatures(hashtags.size(), mentions.size(), urls,
                hashtagTrendingScore(hashtags, platform),
                mentionInfluenceScore(mentions.size(), request.creator()));
    }

    /**
     * Distinct hashtags written in the text or supplied alongside it, lower-cased without '#'.
     */
    static Set<String> hashtags(ContentRequest.Content content) {
        Set<String> tags = new LinkedHashSet<>();
        Matcher m = HASHTAG.matcher(content.text());
        while (m.find()) {
            tags.add(m.group(1).toLowerCase(Locale.ROOT));
        }
        content.hashtags().stream()
                .map(t -> t.replace("#", "").trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .forEach(tags::add);
        return tags;
    }

    static Set<String> mentions(ContentRequest.Content content) {
        Set<String> handles = new LinkedHashSet<>();
        Matcher m = MENTION.matcher(content.text());
        while (m.find()) {
            handles.add(m.group(1).toLowerCase(Locale.ROOT));
        }
        content.mentions().stream()
                .map(t -> t.replace("@", "").trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .forEach(handles::add);
        return handles;
    }

    private double hashtagTrendingScore(Set<String> hashtags, Platform platform) {
        if (hashtags.isEmpty()) {
            return 0.0;
        }
        Set<String> trending = new HashSet<>(TRENDING_HASHTAGS);
        trendingTopics.getTopics(platform).forEach(t ->
                trending.add(t.topic().replace(" ", "").toLowerCase(Locale.ROOT)));
        long matches = hashtags.stream().filter(trending::contains).count();
        return clamp01((double) matches / hashtags.size());
    }

    /**
     * 0.3 base once anyone is mentioned, growing with the number of mentions (saturating at 3)
     * and with the author's own reach, capped at 0.8.
     */
    static double mentionInfluenceScore(int mentionCount, ContentRequest.Creator creator) {
        if (mentionCount == 0) {
            return 0.0;
        }
        double reach = creator != null ? influence(creator.followersCount()) : 0.0;
        return clamp(0.3 + 0.25 * Math.min(1.0, mentionCount / 3.0) + 0.25 * reach, 0.0, 0.8);
    }

    // ============ ENGAGEMENT PREDICTORS ============

    EngagementFeatures extractEngagementFeatures(String text) {
        int words = TextStats.words(text).size();
        double personal = words > 0 ? clamp01((double) TextStats.phraseHits(text, PERSONAL_WORDS) / words * 10) : 0.0;
        return new EngagementFeatures(
                callToActionScore(text),
                clamp01(TextStats.phraseHits(text, URGENCY_WORDS) / 2.0),
                personal,
                clamp01(TextStats.phraseHits(text, CONTROVERSY_WORDS) / 2.0),
                clamp01(TextStats.phraseHits(text, NOVELTY_WORDS) / 3.0)
        );
    }

    static double callToActionScore(String text) {
        return clamp01(TextStats.phraseHits(text, CTA_WORDS) / 3.0);
    }

    // ============ PLATFORM FIT ============

    PlatformFitFeatures extractPlatformFitFeatures(ContentRequest request, Platform platform) {
        ContentRequest.Content content = request.content();
        return new PlatformFitFeatures(
                platformOptimizationScore(content, platform),
                optimalLengthScore(content.text().length(), platform),
                formatSuitabilityScore(content, platform)
        );
    }

    /**
     * 1 at the platform's optimal caption length, falling linearly to 0 at the farther range edge;
     * a flat 0.3 outside the range.
     */
    static double optimalLengthScore(int length, Platform platform) {
        int min = platform.getMinLength();
        int max = platform.getMaxLength();
        int optimal = platform.getOptimalLength();
        if (length < min || length > max) {
            return 0.3;
        }
        double maxDistance = Math.max(optimal - min, max - optimal);
        return clamp01(1 - Math.abs(length - optimal) / maxDistance);
    }

    private static double platformOptimizationScore(ContentRequest.Content content, Platform platform) {
        int tags = hashtags(content).size();
        int length = content.text().length();
        boolean hasMedia = !content.media().isEmpty();
        boolean hasVideo = content.media().stream().anyMatch(ContentRequest.Media::isVideo);

        double score = 0.5;
        switch (platform) {
            case TWITTER -> {
                if (tags <= 2) score += 0.2;
                if (length <= 280) score += 0.3;
            }
            case INSTAGRAM -> {
                if (hasMedia) score += 0.3;
                if (tags >= 5) score += 0.2;
            }
            case TIKTOK -> {
                if (hasVideo) score += 0.4;
                if (tags >= 3) score += 0.1;
            }
            case YOUTUBE -> {
                if (hasVideo) score += 0.3;
                if (length >= 200) score += 0.1;
            }
            case FACEBOOK -> {
                if (hasMedia) score += 0.2;
                if (length <= 400) score += 0.1;
            }
            case LINKEDIN -> {
                if (length >= 150) score += 0.2;
                if (tags <= 5) score += 0.1;
            }
        }
        return clamp01(score);
    }

    private static double formatSuitabilityScore(ContentRequest.Content content, Platform platform) {
        boolean hasMedia = !content.media().isEmpty();
        boolean hasVideo = content.media().stream().anyMatch(ContentRequest.Media::isVideo);
        boolean hasTags = !hashtags(content).isEmpty();
        int length = content.text().length();

        boolean prefersVisual = platform == Platform.INSTAGRAM || platform == Platform.FACEBOOK;
        boolean prefersVideo = platform == Platform.TIKTOK || platform == Platform.YOUTUBE;
        boolean prefersHashtags = platform == Platform.TWITTER || platform == Platform.INSTAGRAM;
        boolean prefersShortForm = platform == Platform.TWITTER || platform == Platform.TIKTOK;
        boolean prefersLongForm = platform == Platform.YOUTUBE;

        double score = 0.5;
        if (prefersVisual && hasMedia) score += 0.2;
        if (prefersVideo && hasVideo) score += 0.3;
        if (prefersHashtags && hasTags) score += 0.2;
        if (prefersShortForm && length < 200) score += 0.2;
        if (prefersLongForm && length > 300) score += 0.2;
        return clamp01(score);
    }

    // ============ TRENDING & CONTEXT ============

    TrendingFeatures extractTrendingFeatures(ContentRequest request, Platform platform, Instant now) {
        String text = request.content().text();

        double topicsScore = 0.0;
        for (TrendingTopicStore.TrendingTopic topic : trendingTopics.getTopics(platform)) {
            if (TextStats.containsPhrase(text, topic.topic())) {
                topicsScore += topic.score() * topic.momentum();
            }
        }

        return new TrendingFeatures(
                clamp01(topicsScore / 10),
                seasonalityScore(request.content().text(), now.atZone(ZoneOffset.UTC).getMonth()),
                currentEventsRelevance(request),
                competitiveLandscapeScore(request.context())
        );
    }

    static double seasonalityScore(String text, Month month) {
        List<String> terms = switch (month) {
            case DECEMBER, JANUARY, FEBRUARY -> WINTER_TERMS;
            case MARCH, APRIL, MAY -> SPRING_TERMS;
            case JUNE, JULY, AUGUST -> SUMMER_TERMS;
            default -> FALL_TERMS;
        };
        return clamp01(TextStats.phraseHits(text, terms) / 2.0);
    }

    /**
     * Share of the caller-supplied current trends that the content actually references.
     */
    static double currentEventsRelevance(ContentRequest request) {
        if (request.context() == null || request.context().trends().isEmpty()) {
            return 0.0;
        }
        String text = request.content().text();
        Set<String> tags = hashtags(request.content());
        List<String> trends = request.context().trends();
        long referenced = trends.stream()
                .map(t -> t.toLowerCase(Locale.ROOT).trim())
                .filter(t -> !t.isEmpty())
                .filter(t -> TextStats.containsPhrase(text, t) || tags.contains(t.replace("#", "").replace(" ", "")))
                .count();
        return clamp01((double) referenced / trends.size());
    }

    /**
     * Neutral 0.5 without competitor data, otherwise lower the more crowded the space is.
     */
    static double competitiveLandscapeScore(ContentRequest.Context context) {
        if (context == null || context.competitors().isEmpty()) {
            return 0.5;
        }
        return clamp01(1 - Math.min(1.0, context.competitors().size() / 10.0));
    }

    // ============ CREATOR ============

    CreatorFeatures extractCreatorFeatures(ContentRequest request) {
        ContentRequest.Creator creator = request.creator();
        if (creator == null) {
            return CreatorFeatures.ABSENT;
        }
        return new CreatorFeatures(true,
                influence(creator.followersCount()),
                nicheAlignment(creator.niche(), request.content()),
                clamp01(creator.engagementRate() * 20));
    }

    static double influence(long followers) {
        return clamp01(Math.log10(Math.max(0, followers) + 1) / 7);
    }

    /**
     * 0.4 floor plus 0.6 times the share of niche keywords found in the text or hashtags; 0.5 without a niche.
     */
    static double nicheAlignment(String niche, ContentRequest.Content content) {
        if (niche == null || niche.isBlank()) {
            return 0.5;
        }
        List<String> keywords = Arrays.stream(NON_LETTER.split(niche.toLowerCase(Locale.ROOT)))
                .filter(k -> k.length() > 2)
                .toList();
        if (keywords.isEmpty()) {
            return 0.5;
        }
        String lower = content.text().toLowerCase(Locale.ROOT);
        Set<String> tags = hashtags(content);
        long found = keywords.stream()
                .filter(k -> lower.contains(k) || tags.stream().anyMatch(t -> t.contains(k)))
                .count();
        return clamp01(0.4 + 0.6 * found / keywords.size());
    }

    // ============ TIMING ============

    TimingFeatures extractTimingFeatures(ContentRequest request, Platform platform, Instant now) {
        ContentRequest.Timing timing = request.timing();
        Instant postTime = timing != null && timing.scheduledTime() != null ? timing.scheduledTime() : now;
        String timezone = timing != null && timing.timezone() != null ? timing.timezone() : "UTC";

        ZonedDateTime local = postTime.atZone(resolveZone(timezone));
        double hourScore = hourScore(local.getHour(), platform.getOptimalHours());
        double dayScore = platform.getOptimalDays().contains(local.getDayOfWeek().getValue()) ? 1.0 : 0.6;
        double zoneAdvantage = MAJOR_TIMEZONES.contains(timezone.toUpperCase(Locale.ROOT)) ? 0.8 : 0.5;

        return new TimingFeatures((hourScore + dayScore) / 2, dayScore, hourScore, zoneAdvantage);
    }

    static double hourScore(int hour, List<Integer> optimalHours) {
        int distance = optimalHours.stream()
                .mapToInt(h -> Math.abs(h - hour))
                .min()
                .orElse(12);
        return clamp01(1 - distance / 12.0);
    }

    public static ZoneId resolveZone(String timezone) {
        ZoneId alias = TIMEZONE_ALIASES.get(timezone.toUpperCase(Locale.ROOT));
        if (alias != null) {
            return alias;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    // ============ MEDIA ============

    MediaFeatures extractMediaFeatures(ContentRequest.Content content) {
        List<ContentRequest.Media> media = content.media();
        if (media.isEmpty()) {
            return MediaFeatures.NONE;
        }

        double typeScore = 0.0;
        double qualityScore = 0.0;
        double trendingScore = 0.0;
        for (ContentRequest.Media item : media) {
            String type = item.type() == null ? "" : item.type().toLowerCase(Locale.ROOT);
            typeScore += switch (type) {
                case "video" -> 1.0;
                case "gif" -> 0.8;
                case "image" -> 0.6;
                default -> 0.5;
            };
            trendingScore += switch (type) {
                case "video" -> 0.8;
                case "gif" -> 0.6;
                case "image" -> 0.4;
                default -> 0.0;
            };
            qualityScore += mediaQuality(item);
        }

        int n = media.size();
        return new MediaFeatures(true, n, typeScore / n, clamp01(qualityScore / n), clamp01(trendingScore / n));
    }

    private static double mediaQuality(ContentRequest.Media item) {
        double score = 0.5;
        if (item.width() != null && item.height() != null) {
            long resolution = (long) item.width() * item.height();
            if (resolution >= 1920L * 1080) score += 0.3;
            else if (resolution >= 1280L * 720) score += 0.2;
            else if (resolution >= 640L * 480) score += 0.1;
        }
        if (item.isVideo() && item.duration() != null) {
            double duration = item.duration();
            if (duration >= 15 && duration <= 60) score += 0.2;
            else if (duration < 15) score += 0.1;
        }
        return score;
    }

    // ============ CONTENT QUALITY ============

    QualityFeatures extractQualityFeatures(String text) {
        List<String> words = TextStats.normalizedWords(text);
        if (words.isEmpty()) {
            return new QualityFeatures(0.0, 0.0, 0.0, 0.0, 0.0);
        }
        long uncommon = words.stream().filter(w -> !COMMON_WORDS.contains(w) && w.length() > 4).count();
        long informative = words.stream().filter(w -> !STOP_WORDS.contains(w)).count();
        long emojis = text.codePoints().filter(FeatureExtractor::isEmoji).count();

        return new QualityFeatures(
                clamp01((double) uncommon / words.size() * 3),
                (double) informative / words.size(),
                clamp01(TextStats.phraseHits(text, ENTERTAINMENT_WORDS) / 2.0 + emojis / 10.0),
                clamp01(TextStats.phraseHits(text, EDUCATIONAL_WORDS) / 3.0),
                clamp01(TextStats.phraseHits(text, INSPIRATIONAL_WORDS) / 2.0)
        );
    }
}
