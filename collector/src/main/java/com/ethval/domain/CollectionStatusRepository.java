package com.ethval.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for data_collection_status, one document per dataset.
 */
public interface CollectionStatusRepository extends MongoRepository<CollectionStatus, String> {

    Optional<CollectionStatus> findByDatasetName(String datasetName);

    boolean existsByDatasetName(String datasetName);
}
