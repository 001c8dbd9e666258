package com.viral.prediction.service.engine;

import com.viral.prediction.model.Platform;
import com.viral.prediction.service.feature.TrendingTopicStore.TrendingTopic;

import java.time.Instant;
import java.util.List;

public record TrendingFactors(
        Platform platform,
        List<TrendingTopic> topics,
        List<Integer> optimalHours,
        List<Integer> optimalDays,
        Instant lastRefreshed
) {}
