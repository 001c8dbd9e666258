package com.viral.prediction.service.explain;

import java.util.List;

/**
 * One human-readable driver of a prediction.
 *
 * @param impact     -1 (hurts) to 1 (helps)
 * @param confidence how reliable the heuristic behind this factor is, 0-1
 * @param weight     share of the overall score this factor stands for
 */
public record ExplanationFactor(
        FactorCategory category,
        String factor,
        double impact,
        double confidence,
        String explanation,
        List<String> evidence,
        double weight
) {
    public ExplanationFactor {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
