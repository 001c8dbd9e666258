package com.viral.prediction.service.engine;

import com.viral.prediction.model.Platform;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Where to publish first, where to follow up, when, and what to change per platform.
 */
public record OptimalStrategy(
        Platform primary,
        List<Platform> secondary,
        Map<Platform, Instant> timing,
        Map<Platform, List<String>> modifications
) {}
