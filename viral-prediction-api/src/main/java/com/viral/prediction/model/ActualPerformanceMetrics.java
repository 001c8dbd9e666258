package com.viral.prediction.model;

/**
 * Observed outcome of a published post. Platform-specific counters may be null.
 */
public record ActualPerformanceMetrics(
        long views,
        long likes,
        long shares,
        long comments,
        Long saves,
        Long retweets,
        Long quotes,
        Long duets,
        Long stitches,
        Long storiesReposts,
        int peakEngagementHour,
        double viralVelocity,
        double sustainedEngagement,
        long totalReach,
        long impressions,
        Double completionRate,
        Double clickThroughRate,
        Double conversionRate,
        double shareToViewRatio
) {
    /**
     * Core counters only; platform extras and rates left empty.
     */
    public static ActualPerformanceMetrics of(long views, long likes, long shares, long comments,
                                              int peakHour, double viralVelocity, double sustainedEngagement,
                                              long totalReach) {
        double shareRatio = views > 0 ? (double) shares / views : 0.0;
        return new ActualPerformanceMetrics(views, likes, shares, comments, null, null, null, null, null, null,
                peakHour, viralVelocity, sustainedEngagement, totalReach, views, null, null, null, shareRatio);
    }

    public long totalEngagement() {
        return likes + comments + shares;
    }
}
