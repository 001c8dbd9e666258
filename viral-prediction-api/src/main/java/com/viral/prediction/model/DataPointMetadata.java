package com.viral.prediction.model;

public record DataPointMetadata(
        String creatorId,
        String campaignId,
        String version,
        DataSource source
) {
    public static DataPointMetadata organic(String creatorId) {
        return new DataPointMetadata(creatorId, null, "1.0.0", DataSource.ORGANIC);
    }
}
