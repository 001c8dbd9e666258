package com.viral.prediction.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A labeled training sample: the features seen at prediction time plus the observed outcome.
 * Labels are derived from {@code actualMetrics} once and never rewritten.
 */
@Document(collection = "viral_data_points")
@CompoundIndex(name = "platform_time_idx", def = "{'platform': 1, 'timestamp': -1}")
public class ViralDataPointDocument {

    @Id
    private String id;

    private Platform platform;
    private String contentText;
    private List<String> hashtags;

    // Flat feature map (see FeatureDictionary)
    private Map<String, Double> features;

    private ActualPerformanceMetrics actualMetrics;
    private Double predictedScore;
    private Instant timestamp;
    private DataPointLabels labels;
    private DataPointMetadata metadata;

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public String getContentText() { return contentText; }
    public void setContentText(String contentText) { this.contentText = contentText; }

    public List<String> getHashtags() { return hashtags; }
    public void setHashtags(List<String> hashtags) { this.hashtags = hashtags; }

    public Map<String, Double> getFeatures() { return features; }
    public void setFeatures(Map<String, Double> features) { this.features = features; }

    public ActualPerformanceMetrics getActualMetrics() { return actualMetrics; }
    public void setActualMetrics(ActualPerformanceMetrics actualMetrics) { this.actualMetrics = actualMetrics; }

    public Double getPredictedScore() { return predictedScore; }
    public void setPredictedScore(Double predictedScore) { this.predictedScore = predictedScore; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public DataPointLabels getLabels() { return labels; }
    public void setLabels(DataPointLabels labels) { this.labels = labels; }

    public DataPointMetadata getMetadata() { return metadata; }
    public void setMetadata(DataPointMetadata metadata) { this.metadata = metadata; }
}
