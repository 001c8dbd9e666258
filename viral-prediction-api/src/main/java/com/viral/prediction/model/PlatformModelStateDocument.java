package com.viral.prediction.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mutable side of a platform model: runtime registration, accuracy and training history.
 * Only the retraining and evaluation jobs write here.
 */
@Document(collection = "platform_models")
public class PlatformModelStateDocument {

    public static final double INITIAL_ACCURACY = 0.85;

    @Id
    private String id;

    @Indexed(unique = true)
    private Platform platform;

    private String runtimeModelId;
    private String version;
    private double accuracy;
    private Instant lastTrained;
    private Instant lastEvaluated;
    private String lastTrainingJobId;
    private Instant updatedAt;

    public PlatformModelStateDocument() {
        this.accuracy = INITIAL_ACCURACY;
        this.version = "1.0.0";
        this.updatedAt = Instant.now();
    }

    public PlatformModelStateDocument(Platform platform) {
        this();
        this.platform = platform;
        this.id = platform.getId();
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public String getRuntimeModelId() { return runtimeModelId; }
    public void setRuntimeModelId(String runtimeModelId) { this.runtimeModelId = runtimeModelId; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public double getAccuracy() { return accuracy; }
    public void setAccuracy(double accuracy) { this.accuracy = accuracy; }

    public Instant getLastTrained() { return lastTrained; }
    public void setLastTrained(Instant lastTrained) { this.lastTrained = lastTrained; }

    public Instant getLastEvaluated() { return lastEvaluated; }
    public void setLastEvaluated(Instant lastEvaluated) { this.lastEvaluated = lastEvaluated; }

    public String getLastTrainingJobId() { return lastTrainingJobId; }
    public void setLastTrainingJobId(String lastTrainingJobId) { this.lastTrainingJobId = lastTrainingJobId; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
