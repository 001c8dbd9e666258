package com.viral.prediction.service.training;

import com.viral.prediction.model.ActualPerformanceMetrics;
import com.viral.prediction.model.DataPointLabels;
import com.viral.prediction.model.ViralDataPointDocument;
import com.viral.prediction.service.training.DataQualityReport.*;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scores a batch of labeled data points for missing values, outliers, duplicates,
 * logical inconsistencies and sampling bias.
 */
@Component
public class DataQualityAssessor {

    private static final double OUTLIER_Z = 3.0;
    private static final int MAX_EXAMPLES = 10;

    private final Clock clock;

    public DataQualityAssessor(Clock clock) {
        this.clock = clock;
    }

    public DataQualityReport assess(List<ViralDataPointDocument> points) {
        if (points == null || points.isEmpty()) {
            Issues none = new Issues(new MissingValues(0, 0.0, List.of()), new Outliers(0, 0.0, List.of()),
                    new Duplicates(0, 0.0), new Inconsistencies(0, List.of()), List.of());
            return new DataQualityReport(1.0, none, List.of(),
                    new Distribution(Map.of(), Map.of(), Map.of(), 0.0, 0.0));
        }

        Issues issues = new Issues(
                detectMissingValues(points),
                detectOutliers(points),
                detectDuplicates(points),
                detectInconsistencies(points),
                detectBiases(points));

        return new DataQualityReport(score(issues), issues, recommendations(issues), distribution(points));
    }

    // ============ ISSUE DETECTION ============

    MissingValues detectMissingValues(List<ViralDataPointDocument> points) {
        int missing = 0;
        long totalFields = 0;
        Set<String> fields = new TreeSet<>();

        for (ViralDataPointDocument dp : points) {
            Map<String, Double> features = dp.getFeatures();
            if (features == null || features.isEmpty()) {
                missing++;
                totalFields++;
                fields.add("features");
                continue;
            }
            totalFields += features.size();
            for (Map.Entry<String, Double> e : features.entrySet()) {
                if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                    missing++;
                    fields.add(e.getKey());
                }
            }
        }

        return new MissingValues(missing, (double) missing / totalFields, List.copyOf(fields));
    }

    Outliers detectOutliers(List<ViralDataPointDocument> points) {
        double[] scores = points.stream().mapToDouble(DataQualityAssessor::viralScore).toArray();
        double mean = Arrays.stream(scores).average().orElse(0.0);
        double variance = Arrays.stream(scores).map(s -> (s - mean) * (s - mean)).average().orElse(0.0);
        double std = Math.sqrt(variance);

        List<String> ids = new ArrayList<>();
        if (std > 0) {
            for (int i = 0; i < scores.length; i++) {
                if (Math.abs(scores[i] - mean) > OUTLIER_Z * std) {
                    ids.add(points.get(i).getId());
                }
            }
        }

        return new Outliers(ids.size(), (double) ids.size() / points.size(),
                List.copyOf(ids.subList(0, Math.min(MAX_EXAMPLES, ids.size()))));
    }

    Duplicates detectDuplicates(List<ViralDataPointDocument> points) {
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (ViralDataPointDocument dp : points) {
            String key = dp.getContentText() + "|" + dp.getPlatform() + "|" + dp.getTimestamp();
            if (!seen.add(key)) {
                duplicates++;
            }
        }
        return new Duplicates(duplicates, (double) duplicates / points.size());
    }

    Inconsistencies detectInconsistencies(List<ViralDataPointDocument> points) {
        List<String> descriptions = new ArrayList<>();
        int count = 0;

        for (ViralDataPointDocument dp : points) {
            ActualPerformanceMetrics m = dp.getActualMetrics();
            if (m == null) {
                continue;
            }
            if (m.likes() > m.views() * 0.5) {
                descriptions.add("High like-to-view ratio for " + dp.getId());
                count++;
            }
            if (m.shares() > m.likes()) {
                descriptions.add("More shares than likes for " + dp.getId());
                count++;
            }
            if (dp.getLabels() != null && dp.getLabels().viral() && m.views() < 1000) {
                descriptions.add("Labeled viral but low views for " + dp.getId());
                count++;
            }
        }

        return new Inconsistencies(count, List.copyOf(descriptions.subList(0, Math.min(MAX_EXAMPLES,
                descriptions.size()))));
    }

    List<Bias> detectBiases(List<ViralDataPointDocument> points) {
        List<Bias> biases = new ArrayList<>();

        Map<String, Long> platformCounts = points.stream()
                .collect(Collectors.groupingBy(dp -> String.valueOf(dp.getPlatform()), TreeMap::new,
                        Collectors.counting()));
        if (platformCounts.size() > 1) {
            double imbalance = imbalance(platformCounts.values());
            if (imbalance > 3) {
                biases.add(new Bias("platform_bias", Math.min(1.0, imbalance / 10),
                        "Significant platform imbalance: " + platformCounts));
            }
        }

        Map<Integer, Long> monthCounts = points.stream()
                .filter(dp -> dp.getTimestamp() != null)
                .collect(Collectors.groupingBy(dp -> dp.getTimestamp().atZone(ZoneOffset.UTC).getMonthValue(),
                        TreeMap::new, Collectors.counting()));
        if (!monthCounts.isEmpty()) {
            double imbalance = imbalance(monthCounts.values());
            if (imbalance > 2) {
                biases.add(new Bias("temporal_bias", Math.min(1.0, imbalance / 5),
                        "Seasonal data imbalance detected"));
            }
        }

        return biases;
    }

    // ============ SCORING ============

    static double score(Issues issues) {
        double avgBiasSeverity = issues.biases().stream().mapToDouble(Bias::severity).average().orElse(0.0);

        double score = 1.0
                - issues.missingValues().percentage() * 0.3
                - issues.outliers().percentage() * 0.2
                - issues.duplicates().percentage() * 0.2
                - Math.min(1.0, issues.inconsistencies().count() / 100.0) * 0.2
                - avgBiasSeverity * 0.1;

        return Math.max(0.0, score);
    }

    static List<String> recommendations(Issues issues) {
        List<String> recommendations = new ArrayList<>();
        if (issues.missingValues().percentage() > 0.1) {
            recommendations.add("Improve data collection to reduce missing values");
        }
        if (issues.outliers().percentage() > 0.05) {
            recommendations.add("Review and potentially remove outlier samples");
        }
        if (issues.duplicates().percentage() > 0.02) {
            recommendations.add("Implement deduplication process");
        }
        if (issues.inconsistencies().count() > 10) {
            recommendations.add("Review data validation rules and fix inconsistencies");
        }
        if (!issues.biases().isEmpty()) {
            recommendations.add("Address dataset biases through balanced sampling");
        }
        return recommendations;
    }

    Distribution distribution(List<ViralDataPointDocument> points) {
        Map<String, Long> platforms = countBy(points, dp -> String.valueOf(dp.getPlatform()));
        Map<String, Long> tiers = countBy(points, dp -> dp.getLabels() == null
                ? "unlabeled"
                : dp.getLabels().engagementTier().getId());

        Instant now = clock.instant();
        Map<String, Long> timeRanges = countBy(points, dp -> timeRange(now, dp.getTimestamp()));

        long viral = points.stream().filter(DataQualityAssessor::isViral).count();

        Map<String, List<ViralDataPointDocument>> byPlatform = points.stream()
                .collect(Collectors.groupingBy(dp -> String.valueOf(dp.getPlatform()), TreeMap::new,
                        Collectors.toList()));
        double avgPlatformRate = byPlatform.values().stream()
                .mapToDouble(list -> (double) list.stream().filter(DataQualityAssessor::isViral).count()
                        / list.size())
                .average()
                .orElse(0.0);

        return new Distribution(platforms, tiers, timeRanges, (double) viral / points.size(), avgPlatformRate);
    }

    private static String timeRange(Instant now, Instant timestamp) {
        if (timestamp == null) {
            return "older";
        }
        Duration age = Duration.between(timestamp, now);
        if (age.compareTo(Duration.ofDays(1)) < 0) {
            return "last_24h";
        } else if (age.compareTo(Duration.ofDays(7)) < 0) {
            return "last_7d";
        } else if (age.compareTo(Duration.ofDays(30)) < 0) {
            return "last_30d";
        }
        return "older";
    }

    private static double imbalance(Collection<Long> counts) {
        long max = counts.stream().mapToLong(Long::longValue).max().orElse(1L);
        long min = counts.stream().mapToLong(Long::longValue).min().orElse(1L);
        return (double) max / min;
    }

    private static Map<String, Long> countBy(List<ViralDataPointDocument> points,
                                             Function<ViralDataPointDocument, String> key) {
        return points.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    private static boolean isViral(ViralDataPointDocument dp) {
        return dp.getLabels() != null && dp.getLabels().viral();
    }

    private static double viralScore(ViralDataPointDocument dp) {
        DataPointLabels labels = dp.getLabels();
        return labels == null ? 0.0 : labels.viralScore();
    }
}
