package com.viral.prediction.repository;

import com.viral.prediction.model.PredictionRecordDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Served predictions awaiting outcome data.
 */
@Repository
public interface PredictionRecordRepository extends MongoRepository<PredictionRecordDocument, String> {
}
