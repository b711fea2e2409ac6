package com.ethval.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CollectionLogRepository extends MongoRepository<CollectionLog, String> {

    List<CollectionLog> findByDatasetNameOrderByCreatedAtDesc(String datasetName);
}
