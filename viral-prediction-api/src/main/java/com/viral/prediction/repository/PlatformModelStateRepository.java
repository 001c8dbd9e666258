package com.viral.prediction.repository;

import com.viral.prediction.model.Platform;
import com.viral.prediction.model.PlatformModelStateDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PlatformModelStateRepository extends MongoRepository<PlatformModelStateDocument, String> {

    Optional<PlatformModelStateDocument> findByPlatform(Platform platform);
}
