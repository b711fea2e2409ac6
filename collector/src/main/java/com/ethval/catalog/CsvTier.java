package com.ethval.catalog;

import java.util.Map;
import java.util.Set;

/**
 * CSV-over-HTTP tier. Column names match a header exactly, or failing that the first header starting
 * with the name (Etherscan exports {@code Value} as {@code Value (Wei)} on some charts).
 *
 * @param timestampColumn optional Unix-seconds column
 */
public record CsvTier(String sourceTag, SourceApi api, String urlTemplate, String dateColumn, String timestampColumn,
                      Map<String, String> fieldColumns) implements TierSpec {

    public static final String ETHERSCAN_CSV = "etherscan_csv";

    public CsvTier {
        fieldColumns = Map.copyOf(fieldColumns);
    }

    /**
     * Etherscan chart export: {@code "Date(UTC)","UnixTimeStamp","Value"} with M/D/YYYY dates.
     */
    public static CsvTier etherscanChart(String chart, String field) {
        return new CsvTier(ETHERSCAN_CSV, SourceApi.ETHERSCAN_WEB,
                "{etherscan_web}/chart/" + chart + "?output=csv",
                "Date(UTC)", "UnixTimeStamp", Map.of(field, "Value"));
    }

    @Override
    public Set<String> producedFields() {
        return fieldColumns.keySet();
    }
}
