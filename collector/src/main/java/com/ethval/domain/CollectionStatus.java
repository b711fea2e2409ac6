package com.ethval.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Run status per dataset. Seeded as pending, updated at the end of every run, never deleted.
 */
@Document(collection = "data_collection_status")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CollectionStatus {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    @Field("dataset_name")
    private String datasetName;
    private CollectionStatusValue status;
    @Field("record_count")
    private Integer recordCount;
    @Field("date_from")
    private LocalDate dateFrom;
    @Field("date_to")
    private LocalDate dateTo;
    @Field("last_error")
    private String lastError;
    @Field("last_warning")
    private String lastWarning;
    @Field("last_run_at")
    private Instant lastRunAt;
    @Field("created_at")
    private Instant createdAt;
    @Field("updated_at")
    private Instant updatedAt;

    /** Stored as the lowercase {@link #value()}. */
    public enum CollectionStatusValue {
        PENDING("pending"),
        SUCCESS("success"),
        PARTIAL("partial"),
        FAILED("failed");

        private final String value;

        CollectionStatusValue(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static CollectionStatusValue fromValue(String value) {
            for (CollectionStatusValue status : values()) {
                if (status.value.equalsIgnoreCase(value)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown collection status: " + value);
        }
    }
}
