package com.viral.prediction.dto;

import java.time.Instant;
import java.util.List;

/**
 * A piece of content submitted for viral-potential scoring.
 * Only {@code content.text} and {@code platform} are required.
 */
public record ContentRequest(
        Content content,
        String platform,
        Creator creator,
        Timing timing,
        Context context,
        ContentTypeMetadata metadata
) {
    public ContentRequest {
        if (content == null) {
            content = new Content("", List.of(), List.of(), List.of());
        }
    }

    public ContentRequest(Content content, String platform) {
        this(content, platform, null, null, null, null);
    }

    /**
     * Same content retargeted at another platform.
     */
    public ContentRequest withPlatform(String otherPlatform) {
        return new ContentRequest(content, otherPlatform, creator, timing, context, metadata);
    }

    public record Content(
            String text,
            List<String> hashtags,
            List<String> mentions,
            List<Media> media
    ) {
        public Content {
            text = text == null ? "" : text;
            hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
            mentions = mentions == null ? List.of() : List.copyOf(mentions);
            media = media == null ? List.of() : List.copyOf(media);
        }

        public static Content text(String text, String... hashtags) {
            return new Content(text, List.of(hashtags), List.of(), List.of());
        }
    }

    public record Media(
            String type,
            String url,
            Integer width,
            Integer height,
            Double duration
    ) {
        public boolean isVideo() {
            return "video".equalsIgnoreCase(type);
        }
    }

    public record Creator(
            long followersCount,
            double engagementRate,
            String niche,
            boolean verified
    ) {}

    public record Timing(
            Instant scheduledTime,
            String timezone
    ) {}

    public record Context(
            List<String> trends,
            List<String> competitors,
            String targetAudience
    ) {
        public Context {
            trends = trends == null ? List.of() : List.copyOf(trends);
            competitors = competitors == null ? List.of() : List.copyOf(competitors);
        }
    }
}
