package com.viral.prediction.controller;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.PlatformModelStateDocument;
import com.viral.prediction.service.engine.ModelPerformance;
import com.viral.prediction.service.engine.PlatformModelStateService;
import com.viral.prediction.service.engine.TrainingResult;
import com.viral.prediction.service.engine.TrendingFactors;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import com.viral.prediction.service.platform.PlatformModel;
import com.viral.prediction.service.platform.PlatformModelConfig;
import com.viral.prediction.service.platform.PlatformModelRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/models")
@Tag(name = "Models", description = "Platform model configuration, evaluation and training")
public class ModelController {

    private final PlatformModelRegistry modelRegistry;
    private final PlatformModelStateService modelStateService;
    private final ViralPredictionEngine engine;

    public ModelController(PlatformModelRegistry modelRegistry, PlatformModelStateService modelStateService,
                           ViralPredictionEngine engine) {
        this.modelRegistry = modelRegistry;
        this.modelStateService = modelStateService;
        this.engine = engine;
    }

    @GetMapping
    @Operation(summary = "List models", description = "Configuration and training state of every platform model")
    public List<ModelSummary> getAllModels() {
        return modelRegistry.all().values().stream()
                .map(this::summary)
                .toList();
    }

    @GetMapping("/{platform}")
    @Operation(summary = "Get model", description = "Configuration and training state of one platform model")
    public ModelSummary getModel(@PathVariable String platform) {
        return summary(modelRegistry.get(Platform.fromId(platform)));
    }

    @PostMapping("/{platform}/evaluate")
    @Operation(summary = "Evaluate model", description = "Re-score the latest test split and record the accuracy")
    public ModelPerformance evaluate(@PathVariable String platform) {
        return engine.evaluateModel(Platform.fromId(platform));
    }

    @PostMapping("/{platform}/train")
    @Operation(summary = "Train model", description = "Prepare a dataset and run a training job on the model runtime")
    public TrainingResult train(@PathVariable String platform) {
        return engine.trainModel(Platform.fromId(platform));
    }

    @GetMapping("/{platform}/trending")
    @Operation(summary = "Trending factors", description = "Current trending topics and posting windows")
    public TrendingFactors trending(@PathVariable String platform) {
        return engine.getTrendingFactors(Platform.fromId(platform));
    }

    private ModelSummary summary(PlatformModel model) {
        PlatformModelStateDocument state = modelStateService.state(model.platform());
        return new ModelSummary(model.platform(), model.config(), state.getRuntimeModelId(), state.getVersion(),
                state.getAccuracy(), state);
    }

    public record ModelSummary(
            Platform platform,
            PlatformModelConfig config,
            String runtimeModelId,
            String version,
            double accuracy,
            PlatformModelStateDocument state
    ) {}
}
