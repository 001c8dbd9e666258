package com.viral.prediction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EngagementTier {
    LOW, MODERATE, HIGH, VIRAL;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
