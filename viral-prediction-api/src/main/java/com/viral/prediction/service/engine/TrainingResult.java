package com.viral.prediction.service.engine;

import com.viral.prediction.model.Platform;
import com.viral.runtime.dto.TrainingJob;

/**
 * Outcome of one platform's training run. {@code status} is null when the run failed before a job was started.
 */
public record TrainingResult(
        Platform platform,
        TrainingJob.Status status,
        String jobId,
        String datasetId,
        Double accuracy,
        String message
) {
    public boolean succeeded() {
        return status == TrainingJob.Status.COMPLETED;
    }
}
