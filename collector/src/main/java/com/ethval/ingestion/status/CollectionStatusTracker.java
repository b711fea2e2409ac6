package com.ethval.ingestion.status;

import com.ethval.domain.CollectionStatus;
import com.ethval.domain.CollectionStatus.CollectionStatusValue;
import com.ethval.domain.CollectionStatusRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Updates data_collection_status at the end of every metric run. Creates the row on first use.
 */
@Component
@RequiredArgsConstructor
public class CollectionStatusTracker {

    private final CollectionStatusRepository statusRepository;
    private final Clock clock;

    /**
     * Sets status, last run and update time; fields left null in {@code fields} keep their stored value.
     */
    public CollectionStatus update(String datasetName, CollectionStatusValue status, StatusFields fields) {
        Instant now = clock.instant();
        CollectionStatus row = statusRepository.findByDatasetName(datasetName).orElseGet(() -> newRow(datasetName, now));
        row.setStatus(status);
        if (fields.recordCount() != null) {
            row.setRecordCount(fields.recordCount());
        }
        if (fields.dateFrom() != null) {
            row.setDateFrom(fields.dateFrom());
        }
        if (fields.dateTo() != null) {
            row.setDateTo(fields.dateTo());
        }
        if (fields.lastError() != null) {
            row.setLastError(fields.lastError());
        }
        if (fields.lastWarning() != null) {
            row.setLastWarning(fields.lastWarning());
        }
        row.setLastRunAt(now);
        row.setUpdatedAt(now);
        return statusRepository.save(row);
    }

    public CollectionStatus markFailed(String datasetName, String error) {
        return update(datasetName, CollectionStatusValue.FAILED, StatusFields.error(error));
    }

    /**
     * PENDING row for a dataset that has none yet; existing rows are left untouched.
     *
     * @return true if a row was created
     */
    public boolean seedIfMissing(String datasetName) {
        if (statusRepository.existsByDatasetName(datasetName)) {
            return false;
        }
        CollectionStatus row = newRow(datasetName, clock.instant());
        row.setStatus(CollectionStatusValue.PENDING);
        statusRepository.save(row);
        return true;
    }

    private static CollectionStatus newRow(String datasetName, Instant now) {
        CollectionStatus row = new CollectionStatus();
        row.setDatasetName(datasetName);
        row.setCreatedAt(now);
        row.setUpdatedAt(now);
        return row;
    }
}
