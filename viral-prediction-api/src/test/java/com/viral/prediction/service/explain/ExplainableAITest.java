package com.viral.prediction.service.explain;

import com.viral.prediction.model.Platform;
import com.viral.prediction.service.explain.ActionableRecommendation.Difficulty;
import com.viral.prediction.service.explain.ExplanationConfig.AudienceLevel;
import com.viral.prediction.service.explain.ExplanationConfig.DetailLevel;
import com.viral.prediction.service.feature.ContentFeatures;
import com.viral.prediction.service.feature.FeatureDictionary;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExplainableAITest {

    private final ExplainableAI explainer = new ExplainableAI();

    private static final ContentFeatures EMPTY = FeatureDictionary.fromMap(Map.of());

    private static final ContentFeatures STRONG = FeatureDictionary.fromMap(Map.of(
            "readability_score", 80.0,
            "information_density", 0.8,
            "emotional_score", 0.9,
            "call_to_action_score", 0.8,
            "optimal_timing_score", 0.95,
            "trending_topics_score", 0.7,
            "platform_optimization_score", 0.9,
            "hashtag_trending_score", 0.7,
            "hashtag_count", 2.0,
            "text_length", 90.0));

    // ============ EXPLAIN PREDICTION ============

    @Test
    void explainPrediction_detailedCoversEveryCategory() {
        ViralExplanation explanation = explainer.explainPrediction(72, 0.8, STRONG, Platform.TWITTER,
                ExplanationConfig.defaults());

        assertThat(explanation.keyFactors()).hasSize(7);
        assertThat(explanation.keyFactors()).extracting(ExplanationFactor::category)
                .contains(FactorCategory.CONTENT, FactorCategory.TIMING, FactorCategory.PLATFORM);
        assertThat(explanation.keyFactors()).isSortedAccordingTo(
                Comparator.comparingDouble((ExplanationFactor f) -> Math.abs(f.impact())).reversed());
        assertThat(explanation.summary()).startsWith("Good viral potential (72.0/100) on twitter.");
        assertEquals(0.8, explanation.confidence());
    }

    @Test
    void explainPrediction_basicDetailKeepsThreeFactors() {
        ViralExplanation explanation = explainer.explainPrediction(72, 0.8, STRONG, Platform.TWITTER,
                ExplanationConfig.defaults().withDetailLevel(DetailLevel.BASIC));

        assertThat(explanation.keyFactors()).hasSize(3);
    }

    @Test
    void explainPrediction_focusAreasRestrictFactors() {
        ExplanationConfig timingOnly = new ExplanationConfig(DetailLevel.DETAILED, false, false, 5,
                Set.of(FactorCategory.TIMING), AudienceLevel.INTERMEDIATE);

        ViralExplanation explanation = explainer.explainPrediction(40, 0.5, EMPTY, Platform.INSTAGRAM, timingOnly);

        assertThat(explanation.keyFactors()).hasSize(2)
                .allSatisfy(f -> assertEquals(FactorCategory.TIMING, f.category()));
        assertThat(explanation.whatIfScenarios()).isEmpty();
        assertThat(explanation.comparisons()).isEmpty();
    }

    @Test
    void explainPrediction_weakContentGetsPrioritizedRecommendations() {
        ViralExplanation explanation = explainer.explainPrediction(20, 0.5, EMPTY, Platform.TIKTOK,
                ExplanationConfig.defaults());

        assertThat(explanation.recommendations()).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(explanation.recommendations()).extracting(ActionableRecommendation::priority).isSorted();
        assertThat(explanation.summary()).contains("Main weakness");
    }

    @Test
    void explainPrediction_scoreAndConfidenceAreClamped() {
        ViralExplanation explanation = explainer.explainPrediction(250, 1.7, STRONG, Platform.LINKEDIN, null);

        assertEquals(1.0, explanation.confidence());
        assertThat(explanation.summary()).startsWith("High viral potential (100.0/100)");
    }

    @Test
    void reasoning_variesWithAudienceLevel() {
        var factors = explainer.analyzeFactors(STRONG, Platform.TWITTER, ExplanationConfig.defaults().focusAreas());

        String beginner = explainer.reasoning(72, 0.8, factors, AudienceLevel.BEGINNER);
        String advanced = explainer.reasoning(72, 0.8, factors, AudienceLevel.ADVANCED);

        assertThat(beginner).startsWith("Your content scored 72 out of 100.");
        assertThat(advanced).startsWith("Viral score 72.0/100 with 80% confidence.")
                .contains("Weighted factor composite");
    }

    // ============ WHAT-IF ============

    @Test
    void whatIf_onlyScenariosWorthMoreThanOnePoint() {
        assertThat(explainer.generateWhatIfScenarios(EMPTY)).hasSize(3)
                .allSatisfy(s -> assertThat(s.predictedScoreDelta()).isGreaterThan(1.0));

        ContentFeatures nearlyThere = FeatureDictionary.fromMap(Map.of(
                "emotional_score", 0.8, "optimal_timing_score", 0.85, "trending_topics_score", 0.1));
        assertThat(explainer.generateWhatIfScenarios(nearlyThere))
                .extracting(WhatIfScenario::feature)
                .containsExactly("trending_topics_score");
    }

    // ============ COUNTERFACTUALS ============

    @Test
    void counterfactuals_raiseHighestWeightedFeaturesFirst() {
        Counterfactual counterfactual = explainer.generateCounterfactuals(50, EMPTY, 80);

        assertTrue(counterfactual.achievable());
        assertThat(counterfactual.changes()).extracting(Counterfactual.FeatureChange::feature)
                .containsExactly("emotional_score", "trending_topics_score");
        assertEquals(1.0, counterfactual.changes().get(0).to(), 1e-9);
        assertEquals(0.667, counterfactual.changes().get(1).to(), 1e-9);
        assertEquals(Difficulty.MEDIUM, counterfactual.effortRequired());
    }

    @Test
    void counterfactuals_unreachableTargetIsReported() {
        Counterfactual counterfactual = explainer.generateCounterfactuals(0, EMPTY, 100);

        assertFalse(counterfactual.achievable());
        assertThat(counterfactual.changes()).hasSize(5);
        assertEquals(Difficulty.HIGH, counterfactual.effortRequired());
        assertThat(counterfactual.explanation()).startsWith("Feature changes alone reach about 65.0");
    }

    @Test
    void counterfactuals_targetAlreadyMet() {
        Counterfactual counterfactual = explainer.generateCounterfactuals(85, EMPTY, 80);

        assertTrue(counterfactual.achievable());
        assertThat(counterfactual.changes()).isEmpty();
        assertEquals(1.0, counterfactual.feasibility());
    }

    @Test
    void counterfactuals_invalidTargetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> explainer.generateCounterfactuals(50, EMPTY, 120));
        assertThrows(IllegalArgumentException.class, () -> explainer.generateCounterfactuals(50, EMPTY, -1));
        assertThrows(IllegalArgumentException.class,
                () -> explainer.generateCounterfactuals(50, EMPTY, Double.NaN));
    }

    // ============ UNCERTAINTY ============

    @Test
    void uncertainty_marginShrinksWithConfidence() {
        UncertaintyExplanation uncertainty = explainer.explainUncertainty(60, 0.6, EMPTY, Platform.INSTAGRAM);

        assertEquals(20.0, uncertainty.margin(), 1e-9);
        assertEquals(40.0, uncertainty.lower(), 1e-9);
        assertEquals(80.0, uncertainty.upper(), 1e-9);
        assertThat(uncertainty.dataQualityIssues()).contains("No creator data; a small account is assumed",
                "No media attached on a visual platform");
    }

    @Test
    void uncertainty_boundsStayInsideScoreRange() {
        UncertaintyExplanation uncertainty = explainer.explainUncertainty(95, 0.2, EMPTY, Platform.TWITTER);

        assertEquals(40.0, uncertainty.margin(), 1e-9);
        assertEquals(100.0, uncertainty.upper(), 1e-9);
        assertThat(uncertainty.recommendations().get(0)).startsWith("Treat the score as a rough estimate");
    }

    // ============ NON-VIRAL & FEATURES ============

    @Test
    void nonViral_listsLimitingFactorsAndRecoverablePoints() {
        NonViralAnalysis analysis = explainer.explainNonViralContent(30, EMPTY, Platform.INSTAGRAM);

        assertThat(analysis.limitingFactors()).extracting(ExplanationFactor::factor)
                .containsExactly("Low Emotional Appeal", "Poor Trend Alignment");
        assertThat(analysis.missedOpportunities()).hasSize(3);
        assertEquals(41.4, analysis.improvementPotential(), 1e-9);
        assertEquals(-41.4, analysis.successfulContentComparison().score(), 1e-9);
        assertThat(analysis.improvementPlan()).hasSize(4)
                .extracting(ActionableRecommendation::priority).isSorted();
    }

    @Test
    void explainFeatures_negativeFirst() {
        var analyses = explainer.explainFeatures(STRONG, Platform.TWITTER);

        assertThat(analyses).hasSize(5);
        assertThat(analyses).extracting(FeatureAnalysis::status).isSorted();
        assertThat(analyses).filteredOn(a -> a.feature().equals("hashtag_count"))
                .singleElement()
                .extracting(FeatureAnalysis::status)
                .isEqualTo(FeatureAnalysis.Status.POSITIVE);
    }
}
