package com.viral.prediction.service.training;

import java.util.Locale;

public enum ExportFormat {
    JSON, CSV, PARQUET;

    public static ExportFormat fromId(String id) {
        if (id == null || id.isBlank()) {
            return JSON;
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + id);
        }
    }
}
