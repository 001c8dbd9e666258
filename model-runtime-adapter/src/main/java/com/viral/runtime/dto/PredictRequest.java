package com.viral.runtime.dto;

import java.util.Map;

public record PredictRequest(
        String modelId,
        Map<String, Double> features,
        Options options
) {
    public record Options(boolean explainability, boolean confidence, boolean alternatives) {

        public static Options full() {
            return new Options(true, true, true);
        }
    }
}
