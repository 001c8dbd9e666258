package com.viral.prediction.repository;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.ViralDataPointDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Labeled training samples.
 */
@Repository
public interface ViralDataPointRepository extends MongoRepository<ViralDataPointDocument, String> {

    List<ViralDataPointDocument> findByPlatform(Platform platform);

    List<ViralDataPointDocument> findByPlatformAndTimestampAfter(Platform platform, Instant since);

    @Query("{ 'platform': ?0, 'timestamp': { $gte: ?1, $lte: ?2 } }")
    List<ViralDataPointDocument> findByPlatformAndTimeRange(Platform platform, Instant start, Instant end);

    long countByPlatform(Platform platform);
}
