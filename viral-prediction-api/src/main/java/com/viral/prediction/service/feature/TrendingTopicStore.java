package com.viral.prediction.service.feature;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.ViralDataPointDocument;
import com.viral.prediction.repository.ViralDataPointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Per-platform trending topic table.
 * Readers get the last published snapshot without locking; {@link #refresh(Instant)} swaps in a new one.
 */
@Component
public class TrendingTopicStore {

    private static final Logger log = LoggerFactory.getLogger(TrendingTopicStore.class);

    private static final Duration LEARNING_WINDOW = Duration.ofDays(7);
    private static final int MAX_LEARNED_TOPICS = 5;

    private static final List<TrendingTopic> SEED_TOPICS = List.of(
            new TrendingTopic("AI", 0.9, 1.2, 1_000_000L),
            new TrendingTopic("sustainability", 0.7, 1.1, 500_000L),
            new TrendingTopic("remote work", 0.6, 0.9, 300_000L)
    );

    private final ViralDataPointRepository dataPointRepository;

    private volatile Map<Platform, List<TrendingTopic>> snapshot;
    private volatile Instant lastRefreshed;

    public TrendingTopicStore(ViralDataPointRepository dataPointRepository) {
        this.dataPointRepository = dataPointRepository;
        this.snapshot = seedSnapshot();
    }

    public List<TrendingTopic> getTopics(Platform platform) {
        return snapshot.getOrDefault(platform, List.of());
    }

    public Instant getLastRefreshed() {
        return lastRefreshed;
    }

    /**
     * Rebuilds every platform table from the seed topics plus hashtags of recent viral outcomes.
     * A platform whose history cannot be read keeps its previous topics.
     */
    public void refresh(Instant now) {
        Map<Platform, List<TrendingTopic>> next = new EnumMap<>(Platform.class);
        Map<Platform, List<TrendingTopic>> current = snapshot;

        for (Platform platform : Platform.values()) {
            try {
                List<ViralDataPointDocument> recent = dataPointRepository
                        .findByPlatformAndTimestampAfter(platform, now.minus(LEARNING_WINDOW));
                next.put(platform, merge(SEED_TOPICS, learnTopics(recent)));
            } catch (Exception e) {
                log.warn("Trend refresh failed for {}: {}", platform.getId(), e.getMessage());
                next.put(platform, current.getOrDefault(platform, SEED_TOPICS));
            }
        }

        snapshot = Collections.unmodifiableMap(next);
        lastRefreshed = now;
        log.info("Trending topics refreshed at {}", now);
    }

    /**
     * Hashtags that appear on viral outcomes, scored by their share of those outcomes.
     */
    static List<TrendingTopic> learnTopics(List<ViralDataPointDocument> recent) {
        List<ViralDataPointDocument> viral = recent.stream()
                .filter(dp -> dp.getLabels() != null && dp.getLabels().viral())
                .toList();
        if (viral.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> counts = new TreeMap<>();
        for (ViralDataPointDocument dp : viral) {
            if (dp.getHashtags() == null) continue;
            new LinkedHashSet<>(dp.getHashtags()).forEach(tag ->
                    counts.merge(normalizeTag(tag), 1, Integer::sum));
        }

        return counts.entrySet().stream()
                .filter(e -> !e.getKey().isEmpty())
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_LEARNED_TOPICS)
                .map(e -> new TrendingTopic(
                        e.getKey(),
                        Math.min(1.0, (double) e.getValue() / viral.size()),
                        1.0 + Math.min(0.5, e.getValue() / 20.0),
                        e.getValue()))
                .toList();
    }

    private static List<TrendingTopic> merge(List<TrendingTopic> seeds, List<TrendingTopic> learned) {
        Map<String, TrendingTopic> byTopic = new LinkedHashMap<>();
        seeds.forEach(t -> byTopic.put(t.topic().toLowerCase(Locale.ROOT), t));
        learned.forEach(t -> byTopic.put(t.topic().toLowerCase(Locale.ROOT), t));
        return List.copyOf(byTopic.values());
    }

    private static Map<Platform, List<TrendingTopic>> seedSnapshot() {
        Map<Platform, List<TrendingTopic>> seeded = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            seeded.put(platform, SEED_TOPICS);
        }
        return Collections.unmodifiableMap(seeded);
    }

    private static String normalizeTag(String tag) {
        return tag == null ? "" : tag.replace("#", "").trim().toLowerCase(Locale.ROOT);
    }

    public record TrendingTopic(String topic, double score, double momentum, long volume) {}
}
