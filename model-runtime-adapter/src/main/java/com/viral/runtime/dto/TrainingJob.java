package com.viral.runtime.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingJob(
        String jobId,
        Status status,
        Map<String, Double> metrics,
        String error
) {
    public enum Status { QUEUED, RUNNING, COMPLETED, FAILED }

    public boolean isTerminal() {
        return status == Status.COMPLETED || status == Status.FAILED;
    }

    public Double metric(String name) {
        return metrics != null ? metrics.get(name) : null;
    }
}
