package com.ethval.catalog;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One GET of a REST-JSON tier and where its rows live in the response.
 * Pointers are RFC 6901 JSON Pointers; field pointers are relative to a row, which may be an object
 * ({@code /close}) or an array ({@code /1}).
 *
 * @param rowsPointer node holding the rows: an array (one row per element) or an object (a single row)
 * @param datePointer null for snapshot endpoints; the row is then dated on the last day of the window
 * @param statusPointer optional envelope field checked against {@code expectedStatus} (e.g. Etherscan {@code /status == 1})
 */
public record JsonRequest(String urlTemplate, String rowsPointer, String datePointer, String timestampPointer,
                          Map<String, String> fieldPointers, String statusPointer, String expectedStatus) {

    public JsonRequest {
        Objects.requireNonNull(urlTemplate, "urlTemplate");
        rowsPointer = rowsPointer == null ? "" : rowsPointer;
        fieldPointers = Map.copyOf(fieldPointers);
    }

    public static Builder get(String urlTemplate) {
        return new Builder(urlTemplate);
    }

    public static final class Builder {
        private final String urlTemplate;
        private String rowsPointer = "";
        private String datePointer;
        private String timestampPointer;
        private final Map<String, String> fieldPointers = new LinkedHashMap<>();
        private String statusPointer;
        private String expectedStatus;

        private Builder(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public Builder rows(String pointer) {
            this.rowsPointer = pointer;
            return this;
        }

        public Builder date(String pointer) {
            this.datePointer = pointer;
            return this;
        }

        public Builder timestamp(String pointer) {
            this.timestampPointer = pointer;
            return this;
        }

        public Builder field(String field, String pointer) {
            this.fieldPointers.put(field, pointer);
            return this;
        }

        public Builder expect(String statusPointer, String expectedStatus) {
            this.statusPointer = statusPointer;
            this.expectedStatus = expectedStatus;
            return this;
        }

        public JsonRequest build() {
            return new JsonRequest(urlTemplate, rowsPointer, datePointer, timestampPointer, fieldPointers,
                    statusPointer, expectedStatus);
        }
    }
}
