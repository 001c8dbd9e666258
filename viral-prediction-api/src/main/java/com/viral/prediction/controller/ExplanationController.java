package com.viral.prediction.controller;

import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import com.viral.prediction.service.explain.Counterfactual;
import com.viral.prediction.service.explain.ExplainableAI;
import com.viral.prediction.service.explain.FeatureAnalysis;
import com.viral.prediction.service.explain.NonViralAnalysis;
import com.viral.prediction.service.explain.UncertaintyExplanation;
import com.viral.prediction.service.feature.ContentFeatures;
import com.viral.prediction.service.feature.FeatureExtractor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/explanations")
@Tag(name = "Explanations", description = "Feature analysis, counterfactuals and uncertainty for content")
public class ExplanationController {

    private static final double DEFAULT_TARGET_SCORE = 80.0;

    private final FeatureExtractor featureExtractor;
    private final ExplainableAI explainableAI;
    private final ViralPredictionEngine engine;

    public ExplanationController(FeatureExtractor featureExtractor, ExplainableAI explainableAI,
                                 ViralPredictionEngine engine) {
        this.featureExtractor = featureExtractor;
        this.explainableAI = explainableAI;
        this.engine = engine;
    }

    @PostMapping("/features")
    @Operation(summary = "Explain features", description = "Each feature against its optimal range, weakest first")
    public List<FeatureAnalysis> explainFeatures(@RequestBody ExplanationRequest request) {
        Platform platform = Platform.fromId(request.content().platform());
        return explainableAI.explainFeatures(featureExtractor.extractFeatures(request.content()), platform);
    }

    @PostMapping("/counterfactuals")
    @Operation(summary = "Counterfactuals", description = "Smallest feature changes that reach a target score")
    public Counterfactual counterfactuals(@RequestBody ExplanationRequest request) {
        Platform.fromId(request.content().platform());
        ContentFeatures features = featureExtractor.extractFeatures(request.content());
        double target = request.targetScore() != null ? request.targetScore() : DEFAULT_TARGET_SCORE;
        return explainableAI.generateCounterfactuals(score(request).viralScore(), features, target);
    }

    @PostMapping("/uncertainty")
    @Operation(summary = "Explain uncertainty", description = "Score interval and what drives its width")
    public UncertaintyExplanation uncertainty(@RequestBody ExplanationRequest request) {
        Platform platform = Platform.fromId(request.content().platform());
        ContentFeatures features = featureExtractor.extractFeatures(request.content());
        Scored scored = score(request);
        return explainableAI.explainUncertainty(scored.viralScore(), scored.confidence(), features, platform);
    }

    @PostMapping("/non-viral")
    @Operation(summary = "Explain non-viral content", description = "Limiting factors and an improvement plan")
    public NonViralAnalysis nonViral(@RequestBody ExplanationRequest request) {
        Platform platform = Platform.fromId(request.content().platform());
        ContentFeatures features = featureExtractor.extractFeatures(request.content());
        return explainableAI.explainNonViralContent(score(request).viralScore(), features, platform);
    }

    /**
     * Uses the caller's score when given, otherwise runs a prediction.
     */
    private Scored score(ExplanationRequest request) {
        if (request.viralScore() != null) {
            return new Scored(request.viralScore(), request.confidence() != null ? request.confidence() : 0.5);
        }
        ViralPrediction prediction = engine.predictViralPotential(request.content());
        return new Scored(prediction.viralScore(), prediction.confidence());
    }

    private record Scored(double viralScore, double confidence) {}

    // ============ REQUEST DTOs ============

    /**
     * @param viralScore  known score; predicted when absent
     * @param confidence  known confidence; ignored when {@code viralScore} is absent
     * @param targetScore counterfactual target, 80 by default
     */
    public record ExplanationRequest(
            ContentRequest content,
            Double viralScore,
            Double confidence,
            Double targetScore
    ) {
        public ExplanationRequest {
            if (content == null) {
                throw new IllegalArgumentException("content is required");
            }
        }
    }
}
