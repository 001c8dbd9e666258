package com.viral.prediction.repository;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.TrainingDatasetDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TrainingDatasetRepository extends MongoRepository<TrainingDatasetDocument, String> {

    Optional<TrainingDatasetDocument> findFirstByPlatformOrderByCreatedAtDesc(Platform platform);

    List<TrainingDatasetDocument> findByPlatformOrderByCreatedAtDesc(Platform platform);
}
