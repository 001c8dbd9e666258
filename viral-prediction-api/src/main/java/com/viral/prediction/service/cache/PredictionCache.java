package com.viral.prediction.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.viral.prediction.config.PredictionProperties;
import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.model.Platform;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * In-process store of served predictions keyed by a content fingerprint.
 * Entries expire a fixed time after being written.
 */
@Component
public class PredictionCache {

    private final Cache<String, ViralPrediction> cache;

    @Autowired
    public PredictionCache(PredictionProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    PredictionCache(PredictionProperties properties, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterWrite(properties.getCache().getTtl())
                .maximumSize(properties.getCache().getMaximumSize())
                .recordStats()
                .build();
    }

    public Optional<ViralPrediction> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(String key, ViralPrediction prediction) {
        cache.put(key, prediction);
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(cache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.hitRate(),
                stats.evictionCount());
    }

    /**
     * SHA-256 over text, platform, sorted hashtags and follower count.
     */
    public static String fingerprint(ContentRequest request, Platform platform) {
        List<String> hashtags = new ArrayList<>(request.content().hashtags());
        hashtags.sort(null);
        long followers = request.creator() != null ? request.creator().followersCount() : 0L;

        String material = request.content().text()
                + '\u0000' + platform.getId()
                + '\u0000' + String.join(",", hashtags)
                + '\u0000' + followers;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record CacheStats(long size, long hitCount, long missCount, double hitRate, long evictionCount) {}
}
