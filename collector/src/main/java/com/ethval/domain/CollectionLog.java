package com.ethval.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only diagnostic entry of a collection run.
 */
@Document(collection = "data_collection_logs")
@CompoundIndex(name = "dataset_created", def = "{'dataset_name': 1, 'created_at': -1}")
@NoArgsConstructor
@Getter
@Setter
public class CollectionLog {

    @Id
    private String id;
    @Field("dataset_name")
    private String datasetName;
    @Field("log_type")
    private LogType logType;
    private String message;
    private Map<String, Object> details = new LinkedHashMap<>();
    @Field("created_at")
    private Instant createdAt;

    /** Stored as the lowercase {@link #value()}. */
    public enum LogType {
        INFO("info"),
        WARNING("warning"),
        ERROR("error");

        private final String value;

        LogType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static LogType fromValue(String value) {
            for (LogType type : values()) {
                if (type.value.equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown log type: " + value);
        }
    }
}
