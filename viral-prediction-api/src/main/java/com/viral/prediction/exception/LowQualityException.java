package com.viral.prediction.exception;

/**
 * Dataset preparation rejected a sample whose quality score is below the threshold.
 */
public class LowQualityException extends RuntimeException {

    private final double score;
    private final double threshold;

    public LowQualityException(double score, double threshold) {
        super(String.format("Data quality too low: %.3f < %.3f", score, threshold));
        this.score = score;
        this.threshold = threshold;
    }

    public double getScore() { return score; }
    public double getThreshold() { return threshold; }
}
