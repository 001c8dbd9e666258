package com.viral.prediction.service.engine;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.PlatformModelStateDocument;
import com.viral.prediction.repository.PlatformModelStateRepository;
import com.viral.prediction.service.feature.FeatureDictionary;
import com.viral.runtime.client.ModelRuntime;
import com.viral.runtime.dto.ModelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime registration, accuracy and training history per platform.
 * A platform without a stored state reads as a fresh model with the initial accuracy.
 */
@Service
public class PlatformModelStateService {

    private static final Logger log = LoggerFactory.getLogger(PlatformModelStateService.class);

    private final PlatformModelStateRepository repository;
    private final ModelRuntime modelRuntime;
    private final Clock clock;

    public PlatformModelStateService(PlatformModelStateRepository repository, ModelRuntime modelRuntime,
                                     Clock clock) {
        this.repository = repository;
        this.modelRuntime = modelRuntime;
        this.clock = clock;
    }

    public PlatformModelStateDocument state(Platform platform) {
        return repository.findByPlatform(platform)
                .orElseGet(() -> new PlatformModelStateDocument(platform));
    }

    public List<PlatformModelStateDocument> all() {
        List<PlatformModelStateDocument> states = new ArrayList<>();
        for (Platform platform : Platform.values()) {
            states.add(state(platform));
        }
        return states;
    }

    /**
     * Model id used for runtime inference; unregistered platforms use their conventional name.
     */
    public String runtimeModelId(Platform platform) {
        String registered = state(platform).getRuntimeModelId();
        return registered != null ? registered : defaultModelName(platform);
    }

    /**
     * Registers the platform's model with the runtime on first use and remembers the returned id.
     */
    public String ensureRegistered(Platform platform) {
        PlatformModelStateDocument state = state(platform);
        if (state.getRuntimeModelId() != null) {
            return state.getRuntimeModelId();
        }

        String modelId = modelRuntime.registerModel(modelSpec(platform, state.getVersion()));
        state.setRuntimeModelId(modelId);
        state.setUpdatedAt(clock.instant());
        repository.save(state);
        log.info("Platform {} registered as runtime model {}", platform.getId(), modelId);
        return modelId;
    }

    /**
     * Registers every platform that has no runtime model yet. A platform the runtime refuses is logged
     * and left unregistered; the rest still go through.
     *
     * @return the platforms that now have a runtime model id
     */
    public List<Platform> registerAll() {
        List<Platform> registered = new ArrayList<>();
        for (Platform platform : Platform.values()) {
            try {
                ensureRegistered(platform);
                registered.add(platform);
            } catch (Exception e) {
                log.warn("Could not register {} with the model runtime: {}", platform.getId(), e.getMessage());
            }
        }
        return registered;
    }

    public PlatformModelStateDocument markTrained(Platform platform, Double accuracy, String jobId) {
        Instant now = clock.instant();
        PlatformModelStateDocument state = state(platform);
        if (accuracy != null) {
            state.setAccuracy(accuracy);
        }
        state.setLastTrained(now);
        state.setLastTrainingJobId(jobId);
        state.setVersion(nextVersion(state.getVersion()));
        state.setUpdatedAt(now);
        return repository.save(state);
    }

    public PlatformModelStateDocument markEvaluated(Platform platform, double accuracy) {
        Instant now = clock.instant();
        PlatformModelStateDocument state = state(platform);
        state.setAccuracy(accuracy);
        state.setLastEvaluated(now);
        state.setUpdatedAt(now);
        return repository.save(state);
    }

    static ModelSpec modelSpec(Platform platform, String version) {
        int inputFeatures = FeatureDictionary.toMap(FeatureDictionary.fromMap(Map.of())).size();

        Map<String, Object> architecture = new LinkedHashMap<>();
        architecture.put("type", "neural_network");
        architecture.put("inputFeatures", inputFeatures);
        architecture.put("hiddenLayers", List.of(128, 64, 32));
        architecture.put("activation", "relu");
        architecture.put("outputActivation", "sigmoid");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("description", "Viral potential classifier for " + platform.getId());
        metadata.put("createdBy", "viral-prediction-api");

        return new ModelSpec(defaultModelName(platform), platform.getId(), "classification",
                version, architecture, metadata);
    }

    static String defaultModelName(Platform platform) {
        return "viral-" + platform.getId();
    }

    /**
     * Bumps the minor part of a {@code major.minor.patch} version.
     */
    static String nextVersion(String version) {
        if (version == null) {
            return "1.0.0";
        }
        String[] parts = version.split("\\.");
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return major + "." + (minor + 1) + ".0";
        } catch (NumberFormatException e) {
            return version + ".1";
        }
    }
}
