package com.viral.prediction.service.explain;

/**
 * Estimated score change if one feature moved to a new value.
 */
public record WhatIfScenario(
        String scenario,
        String feature,
        double originalValue,
        double newValue,
        double predictedScoreDelta,
        double confidence,
        String explanation
) {}
