package com.viral.prediction.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A served prediction waiting for its real-world outcome.
 * Kept apart from training datasets until {@code recordOutcome} turns it into a labeled data point.
 */
@Document(collection = "prediction_records")
public class PredictionRecordDocument {

    @Id
    private String id;

    @Indexed
    private Platform platform;

    private String contentText;
    private List<String> hashtags;
    private String creatorId;
    private Map<String, Double> features;
    private double predictedScore;
    private double predictedConfidence;
    private Instant timestamp;
    private boolean outcomeRecorded;

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public String getContentText() { return contentText; }
    public void setContentText(String contentText) { this.contentText = contentText; }

    public List<String> getHashtags() { return hashtags; }
    public void setHashtags(List<String> hashtags) { this.hashtags = hashtags; }

    public String getCreatorId() { return creatorId; }
    public void setCreatorId(String creatorId) { this.creatorId = creatorId; }

    public Map<String, Double> getFeatures() { return features; }
    public void setFeatures(Map<String, Double> features) { this.features = features; }

    public double getPredictedScore() { return predictedScore; }
    public void setPredictedScore(double predictedScore) { this.predictedScore = predictedScore; }

    public double getPredictedConfidence() { return predictedConfidence; }
    public void setPredictedConfidence(double predictedConfidence) { this.predictedConfidence = predictedConfidence; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public boolean isOutcomeRecorded() { return outcomeRecorded; }
    public void setOutcomeRecorded(boolean outcomeRecorded) { this.outcomeRecorded = outcomeRecorded; }
}
