package com.viral.prediction.service.explain;

import java.util.List;

/**
 * Smallest set of feature changes estimated to lift a score to a target.
 *
 * @param achievable  false when even maxing every weighted feature falls short of the target
 * @param feasibility 0-1, lower for larger changes
 */
public record Counterfactual(
        double currentScore,
        double targetScore,
        List<FeatureChange> changes,
        boolean achievable,
        String explanation,
        double feasibility,
        ActionableRecommendation.Difficulty effortRequired
) {
    public Counterfactual {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public record FeatureChange(String feature, double from, double to, double impact) {}
}
