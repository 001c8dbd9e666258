package com.viral.prediction.service.training;

import com.viral.prediction.model.ActualPerformanceMetrics;
import com.viral.prediction.model.DataPointLabels;
import com.viral.prediction.model.EngagementTier;
import com.viral.prediction.model.Platform;
import com.viral.prediction.model.ViralDataPointDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DataQualityAssessorTest {

    private static final Instant NOW = Instant.parse("2024-03-20T12:00:00Z");

    private DataQualityAssessor assessor;

    @BeforeEach
    void setUp() {
        assessor = new DataQualityAssessor(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    static ViralDataPointDocument point(String id, Platform platform, Instant timestamp, boolean viral,
                                        double score, ActualPerformanceMetrics metrics) {
        ViralDataPointDocument dp = new ViralDataPointDocument();
        dp.setId(id);
        dp.setPlatform(platform);
        dp.setContentText("content " + id);
        dp.setTimestamp(timestamp);
        dp.setFeatures(new HashMap<>(Map.of("emotional_score", 0.5, "hashtag_count", 2.0)));
        dp.setActualMetrics(metrics);
        dp.setLabels(new DataPointLabels(viral, score, viral ? EngagementTier.VIRAL : EngagementTier.MODERATE,
                12, metrics.totalEngagement()));
        return dp;
    }

    private static ActualPerformanceMetrics consistent() {
        return ActualPerformanceMetrics.of(50_000, 2_000, 200, 100, 12, 10, 0.4, 60_000);
    }

    private static List<ViralDataPointDocument> cleanPoints(int n) {
        List<ViralDataPointDocument> points = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            points.add(point("p" + i, Platform.TWITTER, NOW.minus(Duration.ofHours(i + 1)), i % 2 == 0, 50,
                    consistent()));
        }
        return points;
    }

    @Test
    void assess_emptyInputIsPerfect() {
        DataQualityReport report = assessor.assess(List.of());

        assertEquals(1.0, report.score());
        assertThat(report.recommendations()).isEmpty();
    }

    @Test
    void assess_cleanDataScoresOne() {
        DataQualityReport report = assessor.assess(cleanPoints(10));

        assertEquals(1.0, report.score(), 1e-9);
        assertThat(report.issues().biases()).isEmpty();
        assertEquals(0.5, report.distribution().viralRate(), 1e-9);
        assertEquals(10L, report.distribution().timeRanges().get("last_24h"));
    }

    @Test
    void assess_duplicatesLowerScoreByTwentyPercentOfTheirShare() {
        List<ViralDataPointDocument> points = cleanPoints(8);
        for (int i = 0; i < 2; i++) {
            ViralDataPointDocument copy = point("dup" + i, Platform.TWITTER, points.get(i).getTimestamp(),
                    i % 2 == 0, 50, consistent());
            copy.setContentText(points.get(i).getContentText());
            points.add(copy);
        }

        DataQualityReport report = assessor.assess(points);

        assertEquals(2, report.issues().duplicates().count());
        assertEquals(0.2, report.issues().duplicates().percentage(), 1e-9);
        assertEquals(0.96, report.score(), 1e-9);
        assertThat(report.recommendations()).containsExactly("Implement deduplication process");
    }

    @Test
    void detectMissingValues_countsNonFiniteFeatures() {
        List<ViralDataPointDocument> points = cleanPoints(2);
        points.get(0).getFeatures().put("trending_topics_score", Double.NaN);

        DataQualityReport.MissingValues missing = assessor.detectMissingValues(points);

        assertEquals(1, missing.count());
        assertEquals(0.2, missing.percentage(), 1e-9);
        assertThat(missing.fields()).containsExactly("trending_topics_score");
    }

    @Test
    void detectOutliers_flagsScoresBeyondThreeStandardDeviations() {
        List<ViralDataPointDocument> points = cleanPoints(20);
        points.add(point("outlier", Platform.TWITTER, NOW, true, 100, consistent()));

        DataQualityReport.Outliers outliers = assessor.detectOutliers(points);

        assertEquals(1, outliers.count());
        assertThat(outliers.samples()).containsExactly("outlier");
    }

    @Test
    void detectInconsistencies_findsImplausibleMetrics() {
        List<ViralDataPointDocument> points = List.of(
                point("likes", Platform.TIKTOK, NOW, false, 40, ActualPerformanceMetrics.of(100, 80, 10, 0, 1, 0, 0, 100)),
                point("shares", Platform.TIKTOK, NOW, false, 40, ActualPerformanceMetrics.of(1_000, 10, 20, 0, 1, 0, 0, 1_000)),
                point("lowviews", Platform.TIKTOK, NOW, true, 90, ActualPerformanceMetrics.of(900, 100, 10, 0, 1, 0, 0, 900)));

        DataQualityReport.Inconsistencies inconsistencies = assessor.detectInconsistencies(points);

        assertEquals(3, inconsistencies.count());
        assertThat(inconsistencies.descriptions()).containsExactly(
                "High like-to-view ratio for likes",
                "More shares than likes for shares",
                "Labeled viral but low views for lowviews");
    }

    @Test
    void detectBiases_reportsPlatformAndSeasonalImbalance() {
        Instant january = Instant.parse("2024-01-15T00:00:00Z");
        Instant february = Instant.parse("2024-02-15T00:00:00Z");
        List<ViralDataPointDocument> points = List.of(
                point("a", Platform.TWITTER, january, false, 50, consistent()),
                point("b", Platform.TWITTER, january, false, 50, consistent()),
                point("c", Platform.TWITTER, january, false, 50, consistent()),
                point("d", Platform.TWITTER, february, false, 50, consistent()),
                point("e", Platform.INSTAGRAM, january, false, 50, consistent()),
                point("f", Platform.INSTAGRAM, january, false, 50, consistent()));

        List<DataQualityReport.Bias> biases = assessor.detectBiases(points);

        // twitter:instagram is 4:2, below the platform cut-off; january:february is 5:1
        assertThat(biases).extracting(DataQualityReport.Bias::type).containsExactly("temporal_bias");
        assertEquals(1.0, biases.get(0).severity(), 1e-9);
    }
}
