package com.viral.runtime.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelMetrics(
        String modelId,
        double accuracy,
        Double precision,
        Double recall,
        Double f1Score,
        Double auc
) {}
