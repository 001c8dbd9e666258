package com.viral.prediction.service.explain;

import java.util.List;

/**
 * @param expectedImpact estimated score points gained when the action is taken
 */
public record ActionableRecommendation(
        Type type,
        Priority priority,
        FactorCategory category,
        String action,
        double expectedImpact,
        Difficulty difficulty,
        Timeframe timeframe,
        List<String> specifics,
        List<String> examples
) {
    public ActionableRecommendation {
        specifics = specifics == null ? List.of() : List.copyOf(specifics);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    /**
     * Same recommendation with a different expected impact.
     */
    public ActionableRecommendation withExpectedImpact(double impact) {
        return new ActionableRecommendation(type, priority, category, action, impact, difficulty, timeframe,
                specifics, examples);
    }

    public enum Type { IMPROVE, MAINTAIN, AVOID, EXPERIMENT }

    /**
     * Declaration order is the display order.
     */
    public enum Priority { HIGH, MEDIUM, LOW }

    public enum Difficulty { LOW, MEDIUM, HIGH }

    public enum Timeframe { IMMEDIATE, SHORT_TERM, LONG_TERM }
}
