package com.viral.prediction.service.explain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FactorCategory {
    CONTENT, TIMING, AUDIENCE, PLATFORM, TREND, CREATOR;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
