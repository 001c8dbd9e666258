package com.viral.prediction.service.platform;

import com.viral.prediction.exception.UnsupportedPlatformException;
import com.viral.prediction.model.Platform;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup of the scoring model for each platform.
 */
@Component
public class PlatformModelRegistry {

    private final Map<Platform, PlatformModel> models;

    public PlatformModelRegistry(List<PlatformModel> platformModels) {
        Map<Platform, PlatformModel> byPlatform = new EnumMap<>(Platform.class);
        for (PlatformModel model : platformModels) {
            PlatformModel previous = byPlatform.put(model.platform(), model);
            if (previous != null) {
                throw new IllegalStateException("Duplicate model for platform " + model.platform().getId());
            }
        }
        this.models = Collections.unmodifiableMap(byPlatform);
    }

    public PlatformModel get(Platform platform) {
        PlatformModel model = models.get(platform);
        if (model == null) {
            throw new UnsupportedPlatformException(platform.getId());
        }
        return model;
    }

    public boolean supports(Platform platform) {
        return models.containsKey(platform);
    }

    public Map<Platform, PlatformModel> all() {
        return models;
    }

    /**
     * Typed access for platform-specific analysis endpoints.
     */
    public <T extends PlatformModel> T get(Platform platform, Class<T> type) {
        return type.cast(get(platform));
    }
}
