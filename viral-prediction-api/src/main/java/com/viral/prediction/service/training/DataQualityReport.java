package com.viral.prediction.service.training;

import java.util.List;
import java.util.Map;

/**
 * @param score 0-1, higher is cleaner
 */
public record DataQualityReport(
        double score,
        Issues issues,
        List<String> recommendations,
        Distribution distribution
) {

    public record Issues(
            MissingValues missingValues,
            Outliers outliers,
            Duplicates duplicates,
            Inconsistencies inconsistencies,
            List<Bias> biases
    ) {}

    public record MissingValues(int count, double percentage, List<String> fields) {}

    /**
     * @param samples up to ten outlier ids
     */
    public record Outliers(int count, double percentage, List<String> samples) {}

    public record Duplicates(int count, double percentage) {}

    /**
     * @param descriptions up to ten examples
     */
    public record Inconsistencies(int count, List<String> descriptions) {}

    public record Bias(String type, double severity, String description) {}

    public record Distribution(
            Map<String, Long> platforms,
            Map<String, Long> engagementTiers,
            Map<String, Long> timeRanges,
            double viralRate,
            double averagePlatformViralRate
    ) {}
}
