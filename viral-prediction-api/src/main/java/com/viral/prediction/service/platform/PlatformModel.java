package com.viral.prediction.service.platform;

import com.viral.prediction.dto.ContentTypeMetadata;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.ContentFeatures;

/**
 * Platform-specific scoring over a shared feature vector.
 * Implementations are stateless and safe to call concurrently.
 */
public interface PlatformModel {

    Platform platform();

    PlatformModelConfig config();

    /**
     * @param metadata optional format details; may be null
     */
    PlatformPrediction predict(ContentFeatures features, ContentTypeMetadata metadata);
}
