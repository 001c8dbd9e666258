package com.viral.runtime.client;

import com.viral.runtime.dto.ModelMetrics;
import com.viral.runtime.dto.ModelSpec;
import com.viral.runtime.dto.PredictRequest;
import com.viral.runtime.dto.RuntimePrediction;
import com.viral.runtime.dto.TrainRequest;
import com.viral.runtime.dto.TrainingJob;

/**
 * Model registry and training runtime that executes inference and training jobs.
 * Implementations throw {@link com.viral.runtime.exception.ModelRuntimeException} on failure.
 */
public interface ModelRuntime {

    String registerModel(ModelSpec spec);

    RuntimePrediction predict(PredictRequest request);

    String trainModel(TrainRequest request);

    TrainingJob getTrainingJob(String jobId);

    ModelMetrics getModelMetrics(String modelId);
}
