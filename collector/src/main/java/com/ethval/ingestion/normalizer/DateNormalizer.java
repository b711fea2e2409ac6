package com.ethval.ingestion.normalizer;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Turns source date encodings into UTC calendar days. Accepted forms:
 * <ul>
 *   <li>Unix seconds ({@code 1709942400}); values above 10^11 are taken as milliseconds</li>
 *   <li>ISO date ({@code 2024-03-09}), optionally followed by a time and offset</li>
 *   <li>US date ({@code 3/9/2024}) as exported by Etherscan charts</li>
 * </ul>
 */
public final class DateNormalizer {

    private static final Pattern EPOCH = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ].+$");
    private static final Pattern US_DATE = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}$");

    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    private static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter US = DateTimeFormatter.ofPattern("M/d/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private DateNormalizer() {
    }

    /**
     * @throws UnparseableDateException when the token is empty, in an unknown form or not a calendar day
     */
    public static LocalDate parse(String token) {
        if (token == null || token.isBlank()) {
            throw new UnparseableDateException(String.valueOf(token));
        }
        String t = token.trim();
        try {
            if (EPOCH.matcher(t).matches()) {
                long value = new BigDecimal(t).longValue();
                long seconds = Math.abs(value) > MILLIS_THRESHOLD ? Math.floorDiv(value, 1000L) : value;
                return Instant.ofEpochSecond(seconds).atZone(ZoneOffset.UTC).toLocalDate();
            }
            if (ISO_DATE.matcher(t).matches()) {
                return LocalDate.parse(t, ISO);
            }
            if (ISO_DATE_TIME.matcher(t).matches()) {
                return parseDateTime(t.replace(' ', 'T'));
            }
            if (US_DATE.matcher(t).matches()) {
                return LocalDate.parse(t, US);
            }
        } catch (DateTimeException | ArithmeticException e) {
            throw new UnparseableDateException(t, e);
        }
        throw new UnparseableDateException(t);
    }

    /** Canonical {@code YYYY-MM-DD} form of {@code token}. */
    public static String canonical(String token) {
        return parse(token).toString();
    }

    private static LocalDate parseDateTime(String t) {
        try {
            return OffsetDateTime.parse(t).atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeException withoutOffset) {
            return LocalDateTime.parse(t).toLocalDate();
        }
    }
}
