package com.ethval.ingestion.store;

import com.ethval.catalog.KeyDefinition;
import com.ethval.domain.MetricRecord;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.query.Update;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Record to document mapping. Dates are stored in canonical {@code YYYY-MM-DD} form, decimals as
 * Decimal128, and the document id is the natural key so a replayed upsert hits the same document.
 */
final class MetricDocumentMapper {

    static final String ID = "_id";
    static final String DATE = "date";
    static final String TIMESTAMP = "timestamp";
    static final String SOURCE = "source";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private static final Set<String> RESERVED = Set.of(ID, DATE, TIMESTAMP, SOURCE, CREATED_AT, UPDATED_AT);

    private MetricDocumentMapper() {
    }

    static Update toUpdate(MetricRecord record, KeyDefinition key, Instant now) {
        Update update = new Update()
                .set(DATE, record.getDate().toString())
                .set(SOURCE, record.getSource())
                .set(UPDATED_AT, Date.from(now))
                .setOnInsert(CREATED_AT, Date.from(now));
        if (record.getTimestamp() != null) {
            update.set(TIMESTAMP, record.getTimestamp());
        }
        if (key.isComposite()) {
            update.set(key.dimensionField(), record.getDimension());
        }
        record.getValues().forEach((field, value) -> update.set(field, toBson(value)));
        return update;
    }

    static MetricRecord fromDocument(Document doc, String dimensionField) {
        LocalDate date = LocalDate.parse(doc.getString(DATE));
        Object ts = doc.get(TIMESTAMP);
        Long timestamp = ts instanceof Number n ? n.longValue() : null;
        String dimension = dimensionField == null ? null : doc.getString(dimensionField);
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : doc.entrySet()) {
            if (RESERVED.contains(e.getKey()) || e.getKey().equals(dimensionField)) {
                continue;
            }
            values.put(e.getKey(), fromBson(e.getValue()));
        }
        String source = doc.getString(SOURCE);
        return new MetricRecord(date, timestamp, dimension, values, source == null ? "unknown" : source);
    }

    static Object toBson(Object value) {
        if (value instanceof BigDecimal d) {
            return new Decimal128(d);
        }
        return value;
    }

    static Object fromBson(Object value) {
        if (value instanceof Decimal128 d) {
            return d.bigDecimalValue();
        }
        if (value instanceof Integer i) {
            return i.longValue();
        }
        if (value instanceof Double d) {
            return BigDecimal.valueOf(d);
        }
        return value;
    }
}
