package com.viral.prediction.service.explain;

import java.util.List;

/**
 * @param score difference against the reference, in score points
 */
public record Comparison(
        Type type,
        String description,
        double score,
        List<String> keyDifferences,
        List<String> actionableInsights
) {
    public Comparison {
        keyDifferences = keyDifferences == null ? List.of() : List.copyOf(keyDifferences);
        actionableInsights = actionableInsights == null ? List.of() : List.copyOf(actionableInsights);
    }

    public enum Type { PLATFORM, TIMING, SIMILAR_CONTENT }
}
