package com.viral.prediction.controller;

import com.viral.prediction.repository.PredictionRecordRepository;
import com.viral.prediction.repository.ViralDataPointRepository;
import com.viral.prediction.scheduler.LearningScheduler;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final ViralDataPointRepository dataPointRepository;
    private final PredictionRecordRepository predictionRecordRepository;
    private final ViralPredictionEngine engine;
    private final LearningScheduler learningScheduler;
    private final Clock clock;

    public HealthController(
            ViralDataPointRepository dataPointRepository,
            PredictionRecordRepository predictionRecordRepository,
            ViralPredictionEngine engine,
            LearningScheduler learningScheduler,
            Clock clock
    ) {
        this.dataPointRepository = dataPointRepository;
        this.predictionRecordRepository = predictionRecordRepository;
        this.engine = engine;
        this.learningScheduler = learningScheduler;
        this.clock = clock;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check database connectivity, cache and scheduler state")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", clock.instant());

        try {
            health.put("dataPointCount", dataPointRepository.count());
            health.put("pendingPredictionCount", predictionRecordRepository.count());
            health.put("dataAccess", "OK");
        } catch (Exception e) {
            health.put("dataAccess", "ERROR: " + e.getMessage());
        }

        health.put("cache", engine.getCacheStats());
        health.put("scheduledJobs", learningScheduler.getJobs());
        return health;
    }
}
