package com.viral.prediction.service.engine;

import com.viral.prediction.dto.ContentRequest;
import com.viral.prediction.dto.ViralMetrics;

import java.util.List;

/**
 * @param scoreSpread highest minus lowest variant score
 */
public record ABTestResult(
        int winnerIndex,
        ContentRequest winner,
        double confidence,
        double scoreSpread,
        List<VariantResult> variants
) {

    public record VariantResult(
            String variantId,
            double viralScore,
            double confidence,
            double compositeScore,
            ViralMetrics metrics,
            boolean fallback
    ) {}
}
