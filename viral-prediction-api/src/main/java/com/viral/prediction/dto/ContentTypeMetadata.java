package com.viral.prediction.dto;

/**
 * Optional format details that platform models use for their content-type multipliers.
 * Every field may be null.
 */
public record ContentTypeMetadata(
        String contentType,
        Double videoDurationSeconds,
        Boolean hasAudio,
        String audioType,
        Double expectedCompletionRate,
        String quality,
        Boolean hasLocation,
        Boolean hasUserTags,
        Integer imageCount,
        Integer threadLength
) {
    public static ContentTypeMetadata ofType(String contentType) {
        return new ContentTypeMetadata(contentType, null, null, null, null, null, null, null, null, null);
    }
}
