package com.viral.prediction.service.training;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.TrainingDatasetDocument;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of a prepared dataset: sizes, split ratios and the quality findings it passed with.
 */
public record DatasetInfo(
        String id,
        String name,
        Platform platform,
        String version,
        Instant createdAt,
        int samples,
        int featureCount,
        SplitRatios split,
        Validation validation
) {

    public record SplitRatios(double train, double validation, double test) {}

    public record Validation(
            double qualityScore,
            int missingValues,
            int duplicates,
            int outliers,
            Map<String, Double> correlations,
            DataQualityReport.Distribution distribution
    ) {}

    static DatasetInfo of(TrainingDatasetDocument dataset, DataQualityReport report) {
        TrainingDatasetDocument.Splits splits = dataset.getSplits();
        int samples = dataset.getDataPointIds().size();
        double denominator = Math.max(1, samples);

        return new DatasetInfo(
                dataset.getId(),
                dataset.getName(),
                dataset.getPlatform(),
                dataset.getVersion(),
                dataset.getCreatedAt(),
                samples,
                dataset.getFeatureAnalysis().count(),
                new SplitRatios(splits.train().size() / denominator,
                        splits.validation().size() / denominator,
                        splits.test().size() / denominator),
                new Validation(
                        report.score(),
                        report.issues().missingValues().count(),
                        report.issues().duplicates().count(),
                        report.issues().outliers().count(),
                        dataset.getFeatureAnalysis().correlations(),
                        report.distribution()));
    }
}
