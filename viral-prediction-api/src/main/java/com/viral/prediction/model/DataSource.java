package com.viral.prediction.model;

/**
 * Origin of a training data point. SYNTHETIC points are jittered copies of real ones.
 */
public enum DataSource {
    ORGANIC, PROMOTED, INFLUENCER, SYNTHETIC
}
