package com.viral.runtime.dto;

public record TrainRequest(
        String modelId,
        String datasetId,
        TrainingConfig trainingConfig
) {}
