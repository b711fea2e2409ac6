package com.ethval.ingestion.status;

import java.time.LocalDate;

/**
 * Optional fields of a status update; a null field keeps the stored value.
 */
public record StatusFields(Integer recordCount, LocalDate dateFrom, LocalDate dateTo, String lastError,
                           String lastWarning) {

    public static StatusFields none() {
        return new StatusFields(null, null, null, null, null);
    }

    public static StatusFields error(String message) {
        return new StatusFields(null, null, null, message, null);
    }
}
