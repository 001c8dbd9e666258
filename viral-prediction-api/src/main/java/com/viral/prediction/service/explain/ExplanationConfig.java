package com.viral.prediction.service.explain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Controls how much an explanation contains and how its reasoning is worded.
 */
public record ExplanationConfig(
        DetailLevel detailLevel,
        boolean includeWhatIf,
        boolean includeComparisons,
        int maxRecommendations,
        Set<FactorCategory> focusAreas,
        AudienceLevel audienceLevel
) {
    public ExplanationConfig {
        detailLevel = detailLevel == null ? DetailLevel.DETAILED : detailLevel;
        audienceLevel = audienceLevel == null ? AudienceLevel.INTERMEDIATE : audienceLevel;
        focusAreas = focusAreas == null || focusAreas.isEmpty()
                ? Set.copyOf(EnumSet.of(FactorCategory.CONTENT, FactorCategory.TIMING, FactorCategory.PLATFORM))
                : Set.copyOf(focusAreas);
        if (maxRecommendations < 0) {
            throw new IllegalArgumentException("maxRecommendations must not be negative");
        }
    }

    public static ExplanationConfig defaults() {
        return new ExplanationConfig(DetailLevel.DETAILED, true, true, 5, null, AudienceLevel.INTERMEDIATE);
    }

    public ExplanationConfig withAudienceLevel(AudienceLevel level) {
        return new ExplanationConfig(detailLevel, includeWhatIf, includeComparisons, maxRecommendations,
                focusAreas, level);
    }

    public ExplanationConfig withDetailLevel(DetailLevel level) {
        return new ExplanationConfig(level, includeWhatIf, includeComparisons, maxRecommendations,
                focusAreas, audienceLevel);
    }

    public enum DetailLevel {
        BASIC(3), DETAILED(7), COMPREHENSIVE(12);

        private final int maxFactors;

        DetailLevel(int maxFactors) {
            this.maxFactors = maxFactors;
        }

        public int getMaxFactors() { return maxFactors; }
    }

    public enum AudienceLevel { BEGINNER, INTERMEDIATE, ADVANCED }
}
