package com.ethval.ingestion.store;

import com.ethval.catalog.KeyDefinition;
import com.ethval.domain.MetricRecord;
import com.ethval.domain.RecordKey;
import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * MongoDB metric store. One unordered bulk of upserts per call, each keyed by the deterministic
 * {@code _id} ({@code 2024-03-09} or {@code 2024-03-09|Arbitrum}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoMetricStore implements MetricStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public List<MetricRecord> query(String collection, StoreQuery storeQuery) {
        Criteria criteria = new Criteria();
        List<Criteria> and = new ArrayList<>();
        if (storeQuery.from() != null) {
            and.add(Criteria.where(MetricDocumentMapper.DATE).gte(storeQuery.from().toString()));
        }
        if (storeQuery.to() != null) {
            and.add(Criteria.where(MetricDocumentMapper.DATE).lte(storeQuery.to().toString()));
        }
        for (String field : storeQuery.nullFields()) {
            and.add(Criteria.where(field).is(null));
        }
        if (!and.isEmpty()) {
            criteria = criteria.andOperator(and.toArray(new Criteria[0]));
        }
        Query query = Query.query(criteria);
        Sort sort = Sort.by(Sort.Direction.ASC, MetricDocumentMapper.DATE);
        if (storeQuery.dimensionField() != null) {
            sort = sort.and(Sort.by(Sort.Direction.ASC, storeQuery.dimensionField()));
        }
        query.with(sort);
        if (storeQuery.limit() > 0) {
            query.limit(storeQuery.limit());
        }
        return mongoTemplate.find(query, Document.class, collection).stream()
                .map(doc -> MetricDocumentMapper.fromDocument(doc, storeQuery.dimensionField()))
                .toList();
    }

    @Override
    public void upsert(String collection, List<MetricRecord> records, KeyDefinition key) {
        if (records.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, collection);
        for (MetricRecord record : records) {
            Query byId = Query.query(Criteria.where(MetricDocumentMapper.ID).is(record.key().documentId()));
            ops.upsert(byId, MetricDocumentMapper.toUpdate(record, key, now));
        }
        BulkWriteResult result = ops.execute();
        log.debug("Upserted {} into {}: {} inserted, {} matched", records.size(), collection,
                result.getUpserts().size(), result.getMatchedCount());
    }

    @Override
    public long patch(String collection, RecordKey key, Map<String, Object> fields) {
        Update update = new Update().set(MetricDocumentMapper.UPDATED_AT, Date.from(clock.instant()));
        fields.forEach((field, value) -> update.set(field, MetricDocumentMapper.toBson(value)));
        Query byId = Query.query(Criteria.where(MetricDocumentMapper.ID).is(key.documentId()));
        return mongoTemplate.updateFirst(byId, update, collection).getModifiedCount();
    }

    @Override
    public void ensureIndexes(String collection, KeyDefinition key) {
        Index index = new Index().on(MetricDocumentMapper.DATE, Sort.Direction.ASC);
        if (key.isComposite()) {
            index = index.on(key.dimensionField(), Sort.Direction.ASC);
        }
        mongoTemplate.indexOps(collection).ensureIndex(index.unique().named("uk_" + key.conflictKey().replace(',', '_')));
    }

    @Override
    public long count(String collection) {
        return mongoTemplate.getCollection(collection).countDocuments();
    }
}
