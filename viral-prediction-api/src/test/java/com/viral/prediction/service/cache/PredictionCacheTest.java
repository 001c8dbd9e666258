package com.viral.prediction.service.cache;

import com.viral.prediction.config.PredictionProperties;
import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.model.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PredictionCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private PredictionCache cache;

    @BeforeEach
    void setUp() {
        PredictionProperties properties = new PredictionProperties();
        properties.getCache().setTtl(Duration.ofHours(1));
        cache = new PredictionCache(properties, nanos::get);
    }

    private static ViralPrediction prediction(String id) {
        return new ViralPrediction(id, 64, 0.7, Platform.TWITTER, 12, 0.05, null, List.of(), List.of(), 0.6,
                null, null, null, false, Instant.parse("2024-01-10T12:00:00Z"));
    }

    private static ContentRequest request(String text, List<String> hashtags, long followers) {
        return new ContentRequest(new ContentRequest.Content(text, hashtags, List.of(), List.of()), "twitter",
                new ContentRequest.Creator(followers, 0.02, "tech", false), null, null, null);
    }

    @Test
    void get_returnsStoredPredictionUntilTtlElapses() {
        cache.put("key", prediction("p1"));

        nanos.addAndGet(Duration.ofMinutes(59).toNanos());
        assertEquals("p1", cache.get("key").orElseThrow().predictionId());

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertTrue(cache.get("key").isEmpty());
    }

    @Test
    void clear_dropsAllEntries() {
        cache.put("a", prediction("p1"));
        cache.put("b", prediction("p2"));

        cache.clear();

        assertEquals(0, cache.stats().size());
        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    void stats_countHitsAndMisses() {
        cache.put("a", prediction("p1"));
        cache.get("a");
        cache.get("missing");

        PredictionCache.CacheStats stats = cache.stats();

        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 1e-9);
    }

    @Test
    void fingerprint_ignoresHashtagOrder() {
        String first = PredictionCache.fingerprint(request("hello", List.of("#b", "#a"), 100), Platform.TWITTER);
        String second = PredictionCache.fingerprint(request("hello", List.of("#a", "#b"), 100), Platform.TWITTER);

        assertEquals(first, second);
        assertEquals(64, first.length());
    }

    @Test
    void fingerprint_changesWithPlatformTextAndFollowers() {
        String base = PredictionCache.fingerprint(request("hello", List.of(), 100), Platform.TWITTER);

        assertNotEquals(base, PredictionCache.fingerprint(request("hello", List.of(), 100), Platform.TIKTOK));
        assertNotEquals(base, PredictionCache.fingerprint(request("hello!", List.of(), 100), Platform.TWITTER));
        assertNotEquals(base, PredictionCache.fingerprint(request("hello", List.of(), 101), Platform.TWITTER));
    }
}
