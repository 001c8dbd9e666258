package com.viral.prediction.service;

import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.ContentFeatures;
import com.viral.prediction.service.feature.FeatureExtractor;
import com.viral.prediction.service.platform.InstagramModel;
import com.viral.prediction.service.platform.PlatformModelRegistry;
import com.viral.prediction.service.platform.TikTokModel;
import com.viral.prediction.service.platform.TwitterModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Platform-specific analyses that go beyond a single score: Twitter threads and schedules,
 * Instagram hashtag strategy and TikTok posting schedules.
 */
@Service
public class PlatformAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(PlatformAnalysisService.class);

    private final FeatureExtractor featureExtractor;
    private final PlatformModelRegistry modelRegistry;
    private final Clock clock;

    public PlatformAnalysisService(FeatureExtractor featureExtractor, PlatformModelRegistry modelRegistry,
                                   Clock clock) {
        this.featureExtractor = featureExtractor;
        this.modelRegistry = modelRegistry;
        this.clock = clock;
    }

    // ============ TWITTER ============

    public TwitterModel.ThreadAnalysis analyzeTwitterThread(List<String> tweets) {
        requireNonEmpty(tweets, "tweets");
        log.debug("Analyzing thread of {} tweets", tweets.size());
        return twitter().analyzeThreadPotential(tweets, extract(tweets, Platform.TWITTER));
    }

    public TwitterModel.Schedule scheduleTweets(List<String> tweets, String timezone, int durationDays) {
        requireNonEmpty(tweets, "tweets");
        return twitter().predictOptimalSchedule(tweets, extract(tweets, Platform.TWITTER), zone(timezone),
                clock.instant(), durationDays);
    }

    // ============ INSTAGRAM ============

    public InstagramModel.HashtagStrategy analyzeInstagramHashtags(List<String> hashtags, String niche) {
        requireNonEmpty(hashtags, "hashtags");
        return modelRegistry.get(Platform.INSTAGRAM, InstagramModel.class).analyzeHashtagStrategy(hashtags, niche);
    }

    // ============ TIKTOK ============

    public TikTokModel.Schedule scheduleTikToks(List<String> videos, String audience, String timezone,
                                                int durationDays) {
        requireNonEmpty(videos, "videos");
        return modelRegistry.get(Platform.TIKTOK, TikTokModel.class).predictOptimalSchedule(videos,
                extract(videos, Platform.TIKTOK), TikTokModel.Audience.fromId(audience), zone(timezone),
                clock.instant(), durationDays);
    }

    private TwitterModel twitter() {
        return modelRegistry.get(Platform.TWITTER, TwitterModel.class);
    }

    private List<ContentFeatures> extract(List<String> texts, Platform platform) {
        List<ContentRequest> requests = texts.stream()
                .map(text -> new ContentRequest(ContentRequest.Content.text(text), platform.getId()))
                .toList();
        return featureExtractor.batchExtractFeatures(requests);
    }

    private static ZoneId zone(String timezone) {
        return timezone == null || timezone.isBlank() ? ZoneOffset.UTC : FeatureExtractor.resolveZone(timezone);
    }

    private static void requireNonEmpty(List<String> items, String name) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
