package com.viral.prediction.service.engine;

import com.viral.prediction.model.Platform;

import java.time.Instant;
import java.util.List;

/**
 * @param confusionMatrix {@code [[tn, fp], [fn, tp]]}
 * @param source          {@code test-split} when re-scored locally, {@code runtime} when reported by the runtime
 */
public record ModelPerformance(
        Platform platform,
        double accuracy,
        double precision,
        double recall,
        double f1Score,
        double auc,
        List<List<Long>> confusionMatrix,
        int samples,
        String source,
        Instant evaluatedAt
) {}
