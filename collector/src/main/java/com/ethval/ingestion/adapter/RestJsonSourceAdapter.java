package com.ethval.ingestion.adapter;

import com.ethval.catalog.JsonRequest;
import com.ethval.catalog.Pagination;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.TierSpec;
import com.ethval.domain.DateWindow;
import com.ethval.ingestion.normalizer.DateNormalizer;
import com.ethval.ingestion.normalizer.NormalizationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON API tier: templated GET, optional envelope status check, rows selected by JSON Pointer.
 * Extra requests of a tier are joined onto the first one by calendar date; a failing extra request only
 * leaves its fields empty. A failing date chunk is skipped; the tier fails only when every chunk did.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestJsonSourceAdapter implements SourceAdapter {

    private static final long SECONDS_PER_DAY = 86_400L;

    private final SourceHttpClient httpClient;
    private final SourceVariables sourceVariables;
    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(TierSpec tier) {
        return tier instanceof RestJsonTier;
    }

    @Override
    public List<RawRow> fetch(TierSpec spec, FetchContext context) {
        RestJsonTier tier = (RestJsonTier) spec;
        sourceVariables.requireKey(tier.api());
        List<RawRow> rows = fetchRequest(tier, tier.requests().get(0), context);
        if (rows.isEmpty()) {
            throw new EmptyResultException(tier.sourceTag() + " returned no rows");
        }
        for (JsonRequest extra : tier.requests().subList(1, tier.requests().size())) {
            try {
                rows = joinByDate(rows, fetchRequest(tier, extra, context));
            } catch (SourceFetchException e) {
                log.warn("{} {} join request failed, fields {} left empty: {}", context.label(), tier.sourceTag(),
                        extra.fieldPointers().keySet(), e.getMessage());
            }
        }
        return rows;
    }

    private List<RawRow> fetchRequest(RestJsonTier tier, JsonRequest request, FetchContext context) {
        Pagination pagination = tier.pagination();
        return switch (pagination.mode()) {
            case NONE -> extractRows(get(tier, request, sourceVariables.forWindow(context, context.window())),
                    tier, request, context);
            case DATE_CHUNKS -> fetchChunks(tier, request, context, pagination);
            case END_TIMESTAMP_CURSOR -> fetchWithCursor(tier, request, context, pagination);
        };
    }

    private List<RawRow> fetchChunks(RestJsonTier tier, JsonRequest request, FetchContext context,
                                     Pagination pagination) {
        List<RawRow> rows = new ArrayList<>();
        List<DateWindow> chunks = context.window().chunks(pagination.chunkDays());
        int attempted = 0;
        int failed = 0;
        SourceFetchException lastFailure = null;
        for (int i = 0; i < chunks.size() && i < pagination.maxPages(); i++) {
            DateWindow chunk = chunks.get(i);
            context.deadline().check(tier.sourceTag() + " chunk " + chunk.from());
            attempted++;
            try {
                String body = get(tier, request, sourceVariables.forWindow(context, chunk));
                rows.addAll(extractRows(body, tier, request, context));
            } catch (SourceFetchException e) {
                failed++;
                lastFailure = e;
                log.warn("{} {} chunk {}..{} failed, continuing: {}", context.label(), tier.sourceTag(),
                        chunk.from(), chunk.to(), e.getMessage());
            }
        }
        if (lastFailure != null && failed == attempted) {
            throw lastFailure;
        }
        return rows;
    }

    /**
     * Pages backward from the end of the window until a page is empty, the window start is reached or
     * enough distinct days were collected.
     */
    private List<RawRow> fetchWithCursor(RestJsonTier tier, JsonRequest request, FetchContext context,
                                         Pagination pagination) {
        DateWindow window = context.window();
        List<RawRow> rows = new ArrayList<>();
        Set<LocalDate> days = new HashSet<>();
        long toTs = DateWindow.epochSeconds(window.to());
        for (int page = 0; page < pagination.maxPages(); page++) {
            context.deadline().check(tier.sourceTag() + " page " + page);
            Map<String, String> vars = sourceVariables.forWindow(context, window);
            vars.put("limit", String.valueOf(pagination.pageSize()));
            vars.put("toTs", String.valueOf(toTs));
            List<RawRow> pageRows = extractRows(get(tier, request, vars), tier, request, context);
            LocalDate earliest = null;
            int newDays = 0;
            for (RawRow row : pageRows) {
                LocalDate day = dayOf(row);
                if (day == null) {
                    continue;
                }
                if (days.add(day)) {
                    newDays++;
                    rows.add(row);
                }
                if (earliest == null || day.isBefore(earliest)) {
                    earliest = day;
                }
            }
            if (earliest == null || newDays == 0 || days.size() >= window.days() || !earliest.isAfter(window.from())) {
                break;
            }
            toTs = DateWindow.epochSeconds(earliest) - SECONDS_PER_DAY;
        }
        return rows;
    }

    private String get(RestJsonTier tier, JsonRequest request, Map<String, String> vars) {
        return httpClient.get(tier.api(), UrlTemplate.expand(request.urlTemplate(), vars));
    }

    List<RawRow> extractRows(String body, RestJsonTier tier, JsonRequest request, FetchContext context) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException(tier.sourceTag() + " returned a body that is not JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new SchemaMismatchException(tier.sourceTag() + " returned an empty body");
        }
        if (request.statusPointer() != null) {
            String status = root.at(request.statusPointer()).asText(null);
            if (!request.expectedStatus().equals(status)) {
                throw new SchemaMismatchException(tier.sourceTag() + " status " + status + ": " + message(root));
            }
        }
        JsonNode rowsNode = request.rowsPointer().isEmpty() ? root : root.at(request.rowsPointer());
        List<JsonNode> nodes = new ArrayList<>();
        if (rowsNode.isArray()) {
            rowsNode.forEach(nodes::add);
        } else if (rowsNode.isObject()) {
            nodes.add(rowsNode);
        } else {
            throw new SchemaMismatchException(tier.sourceTag() + ": no rows at '" + request.rowsPointer() + "'");
        }
        List<RawRow> rows = new ArrayList<>(nodes.size());
        boolean anyField = false;
        for (JsonNode node : nodes) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, String> field : request.fieldPointers().entrySet()) {
                Object value = scalar(node.at(field.getValue()));
                anyField |= value != null;
                values.put(field.getKey(), value);
            }
            String dateToken = request.datePointer() != null
                    ? text(node.at(request.datePointer()))
                    : request.timestampPointer() == null ? context.window().to().toString() : null;
            String timestampToken = request.timestampPointer() == null ? null : text(node.at(request.timestampPointer()));
            rows.add(new RawRow(dateToken, timestampToken, values, tier.sourceTag()));
        }
        if (!rows.isEmpty() && !anyField) {
            throw new SchemaMismatchException(tier.sourceTag() + ": none of " + request.fieldPointers().values()
                    + " present in " + rows.size() + " rows");
        }
        return rows;
    }

    private static List<RawRow> joinByDate(List<RawRow> driver, List<RawRow> joined) {
        Map<LocalDate, Map<String, Object>> byDay = new HashMap<>();
        for (RawRow row : joined) {
            LocalDate day = dayOf(row);
            if (day != null) {
                byDay.putIfAbsent(day, row.values());
            }
        }
        List<RawRow> out = new ArrayList<>(driver.size());
        for (RawRow row : driver) {
            LocalDate day = dayOf(row);
            Map<String, Object> extra = day == null ? null : byDay.get(day);
            out.add(extra == null ? row : row.withValues(extra));
        }
        return out;
    }

    private static LocalDate dayOf(RawRow row) {
        try {
            return DateNormalizer.parse(row.dateToken() != null ? row.dateToken() : row.timestampToken());
        } catch (NormalizationException e) {
            return null;
        }
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return null;
    }

    private static String text(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String message(JsonNode root) {
        JsonNode m = root.path("message");
        if (m.isMissingNode()) {
            m = root.path("Message");
        }
        String result = root.path("result").isTextual() ? root.path("result").asText() : "";
        return (m.asText("") + " " + result).trim();
    }
}
