package com.viral.runtime.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Raw inference output: prediction is a 0-1 viral probability.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuntimePrediction(
        double prediction,
        double confidence,
        Map<String, Double> explanation
) {}
