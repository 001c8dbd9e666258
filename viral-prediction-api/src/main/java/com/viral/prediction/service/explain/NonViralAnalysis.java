package com.viral.prediction.service.explain;

import java.util.List;

/**
 * Why a piece of content underperformed and what would have helped.
 *
 * @param improvementPotential estimated score points recoverable by fixing the limiting factors
 */
public record NonViralAnalysis(
        List<ExplanationFactor> limitingFactors,
        List<String> missedOpportunities,
        Comparison successfulContentComparison,
        List<ActionableRecommendation> improvementPlan,
        double improvementPotential
) {}
