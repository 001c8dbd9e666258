package com.viral.prediction.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A per-platform collection of labeled data point ids with its splits and statistics.
 * Append-only: points are added, never removed.
 */
@Document(collection = "training_datasets")
@CompoundIndex(name = "platform_created_idx", def = "{'platform': 1, 'createdAt': -1}")
public class TrainingDatasetDocument {

    @Id
    private String id;

    private String name;
    private Platform platform;
    private String version;
    private Instant createdAt;
    private Instant updatedAt;

    private List<String> dataPointIds = new ArrayList<>();
    private Statistics statistics;
    private Splits splits;
    private FeatureAnalysis featureAnalysis;

    public record Statistics(
            int totalSamples,
            int viralSamples,
            double viralRate,
            double avgEngagement,
            Instant timeRangeStart,
            Instant timeRangeEnd,
            double qualityScore
    ) {}

    public record Splits(
            List<String> train,
            List<String> validation,
            List<String> test
    ) {
        public int size() {
            return train.size() + validation.size() + test.size();
        }
    }

    public record FeatureAnalysis(
            int count,
            List<String> names,
            Map<String, Double> correlations,
            Map<String, Double> importance
    ) {}

    public TrainingDatasetDocument() {
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public List<String> getDataPointIds() { return dataPointIds; }
    public void setDataPointIds(List<String> dataPointIds) { this.dataPointIds = dataPointIds; }

    public Statistics getStatistics() { return statistics; }
    public void setStatistics(Statistics statistics) { this.statistics = statistics; }

    public Splits getSplits() { return splits; }
    public void setSplits(Splits splits) { this.splits = splits; }

    public FeatureAnalysis getFeatureAnalysis() { return featureAnalysis; }
    public void setFeatureAnalysis(FeatureAnalysis featureAnalysis) { this.featureAnalysis = featureAnalysis; }
}
