package com.viral.prediction.util;

/**
 * Clamping and rounding for normalized scores. Out-of-range values are clipped, never rejected.
 */
public final class ScoreMath {

    private ScoreMath() {
    }

    public static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static double clamp100(double value) {
        return clamp(value, 0.0, 100.0);
    }

    /**
     * NaN maps to {@code min}.
     */
    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
