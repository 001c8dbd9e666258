package com.viral.prediction.service.explain;

import java.util.List;

public record ViralExplanation(
        String summary,
        List<ExplanationFactor> keyFactors,
        List<ActionableRecommendation> recommendations,
        List<WhatIfScenario> whatIfScenarios,
        List<Comparison> comparisons,
        String reasoning,
        double confidence
) {
    public ViralExplanation {
        keyFactors = keyFactors == null ? List.of() : List.copyOf(keyFactors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        whatIfScenarios = whatIfScenarios == null ? List.of() : List.copyOf(whatIfScenarios);
        comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
    }

    public static ViralExplanation empty(String summary) {
        return new ViralExplanation(summary, List.of(), List.of(), List.of(), List.of(), "", 0.0);
    }
}
