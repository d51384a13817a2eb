package com.placement.repository;

import com.placement.model.PlacementDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data repository for plain reads of placement documents.
 * Conditional writes go through {@link MongoPlacementRecordStore} and MongoTemplate.
 */
@Repository
public interface PlacementDocumentRepository extends MongoRepository<PlacementDocument, String> {
}
