package com.ethval.ingestion.adapter;

import com.ethval.catalog.CsvTier;
import com.ethval.catalog.TierSpec;
import lombok.RequiredArgsConstructor;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Headered CSV over HTTP (Etherscan chart exports). Quoted fields may contain commas; redirects are
 * followed by {@link SourceHttpClient}.
 */
@Component
@RequiredArgsConstructor
public class CsvHttpSourceAdapter implements SourceAdapter {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final SourceHttpClient httpClient;
    private final SourceVariables sourceVariables;

    @Override
    public boolean supports(TierSpec tier) {
        return tier instanceof CsvTier;
    }

    @Override
    public List<RawRow> fetch(TierSpec spec, FetchContext context) {
        CsvTier tier = (CsvTier) spec;
        sourceVariables.requireKey(tier.api());
        String url = UrlTemplate.expand(tier.urlTemplate(), sourceVariables.forWindow(context, context.window()));
        List<RawRow> rows = parse(httpClient.get(tier.api(), url), tier);
        if (rows.isEmpty()) {
            throw new EmptyResultException(tier.sourceTag() + " CSV had no data rows");
        }
        return rows;
    }

    /**
     * @throws SchemaMismatchException when the body is not CSV or lacks a configured column
     */
    static List<RawRow> parse(String body, CsvTier tier) {
        String content = body.startsWith("\uFEFF") ? body.substring(1) : body;
        if (content.isBlank()) {
            return List.of();
        }
        if (content.stripLeading().startsWith("<")) {
            throw new SchemaMismatchException(tier.sourceTag() + " returned HTML instead of CSV");
        }
        try (CSVParser parser = FORMAT.parse(new StringReader(content))) {
            List<String> headers = parser.getHeaderNames();
            String dateColumn = resolveColumn(headers, tier.dateColumn(), tier);
            String timestampColumn = tier.timestampColumn() == null ? null : findColumn(headers, tier.timestampColumn());
            Map<String, String> fieldColumns = new LinkedHashMap<>();
            tier.fieldColumns().forEach((field, column) -> fieldColumns.put(field, resolveColumn(headers, column, tier)));

            List<RawRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, Object> values = new LinkedHashMap<>();
                fieldColumns.forEach((field, column) -> values.put(field, cell(record, column)));
                rows.add(new RawRow(cell(record, dateColumn),
                        timestampColumn == null ? null : cell(record, timestampColumn),
                        values, tier.sourceTag()));
            }
            return rows;
        } catch (IOException | UncheckedIOException e) {
            throw new SchemaMismatchException(tier.sourceTag() + " CSV unreadable: " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new SchemaMismatchException(tier.sourceTag() + " CSV malformed: " + e.getMessage(), e);
        }
    }

    private static String resolveColumn(List<String> headers, String column, CsvTier tier) {
        String found = findColumn(headers, column);
        if (found == null) {
            throw new SchemaMismatchException(tier.sourceTag() + " CSV has no column '" + column + "' in " + headers);
        }
        return found;
    }

    /** Exact header, else the first header starting with {@code column} (case-insensitive). */
    private static String findColumn(List<String> headers, String column) {
        for (String h : headers) {
            if (h.equals(column)) {
                return h;
            }
        }
        String prefix = column.toLowerCase();
        for (String h : headers) {
            if (h.toLowerCase().startsWith(prefix)) {
                return h;
            }
        }
        return null;
    }

    private static String cell(CSVRecord record, String column) {
        return record.isMapped(column) && record.isSet(column) ? record.get(column) : null;
    }
}
