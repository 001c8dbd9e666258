package com.viral.prediction.controller;

import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.model.ActualPerformanceMetrics;
import com.viral.prediction.model.Platform;
import com.viral.prediction.model.ViralDataPointDocument;
import com.viral.prediction.service.cache.PredictionCache;
import com.viral.prediction.service.engine.ABTestResult;
import com.viral.prediction.service.engine.OptimalStrategy;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import com.viral.prediction.service.training.TrainingDataManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/predictions")
@Tag(name = "Predictions", description = "Viral potential scoring endpoints")
public class PredictionController {

    private final ViralPredictionEngine engine;
    private final TrainingDataManager trainingDataManager;

    public PredictionController(ViralPredictionEngine engine, TrainingDataManager trainingDataManager) {
        this.engine = engine;
        this.trainingDataManager = trainingDataManager;
    }

    // ============ PREDICTIONS ============

    @PostMapping
    @Operation(summary = "Predict viral potential", description = "Score one piece of content on its target platform")
    public ViralPrediction predict(@RequestBody ContentRequest request) {
        return engine.predictViralPotential(request);
    }

    @PostMapping("/batch")
    @Operation(summary = "Batch predict", description = "Score many requests; failed items come back as fallback predictions")
    public List<ViralPrediction> batchPredict(@RequestBody List<ContentRequest> requests) {
        return engine.batchPredict(requests);
    }

    @PostMapping("/compare")
    @Operation(summary = "Compare platforms", description = "Score the same content on several platforms")
    public Map<String, ViralPrediction> comparePlatforms(@RequestBody CompareRequest request) {
        Map<Platform, ViralPrediction> comparison = engine.comparePlatforms(request.content(), platforms(request));
        Map<String, ViralPrediction> response = new LinkedHashMap<>();
        comparison.forEach((platform, prediction) -> response.put(platform.getId(), prediction));
        return response;
    }

    @PostMapping("/strategy")
    @Operation(summary = "Optimal cross-platform strategy", description = "Primary and secondary platforms, timing and edits per platform")
    public OptimalStrategy optimalStrategy(@RequestBody CompareRequest request) {
        return engine.getOptimalStrategy(request.content(), platforms(request));
    }

    @PostMapping("/ab-test")
    @Operation(summary = "A/B test variants", description = "Score content variants on one platform and pick a winner")
    public ABTestResult abTest(@RequestBody ABTestRequest request) {
        return engine.abTestContent(request.variants(), Platform.fromId(request.platform()));
    }

    @PostMapping("/{predictionId}/outcome")
    @Operation(summary = "Record actual outcome", description = "Attach observed metrics to a prediction and add it to the training data")
    public ViralDataPointDocument recordOutcome(
            @PathVariable String predictionId,
            @RequestBody ActualPerformanceMetrics metrics
    ) {
        return trainingDataManager.recordOutcome(predictionId, metrics);
    }

    // ============ CACHE ============

    @DeleteMapping("/cache")
    @Operation(summary = "Clear prediction cache")
    public ResponseEntity<Void> clearCache() {
        engine.clearCache();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cache/stats")
    @Operation(summary = "Prediction cache statistics")
    public PredictionCache.CacheStats cacheStats() {
        return engine.getCacheStats();
    }

    private static List<Platform> platforms(CompareRequest request) {
        if (request.platforms() == null || request.platforms().isEmpty()) {
            return List.of(Platform.values());
        }
        return request.platforms().stream().map(Platform::fromId).toList();
    }

    // ============ REQUEST DTOs ============

    /**
     * @param platforms platform ids; all platforms when empty
     */
    public record CompareRequest(ContentRequest content, List<String> platforms) {}

    public record ABTestRequest(List<ContentRequest> variants, String platform) {}
}
