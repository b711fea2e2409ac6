package com.ethval.domain;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of UTC calendar days requested for a metric.
 */
public record DateWindow(LocalDate from, LocalDate to) {

    public DateWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window end " + to + " before start " + from);
        }
    }

    /** The {@code days} days ending with (and including) {@code today}. */
    public static DateWindow ending(LocalDate today, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be positive");
        }
        return new DateWindow(today.minusDays(days - 1L), today);
    }

    public int days() {
        return (int) ChronoUnit.DAYS.between(from, to) + 1;
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(from) && !day.isAfter(to);
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(days());
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            out.add(d);
        }
        return out;
    }

    /**
     * Consecutive sub-windows of at most {@code chunkDays} days covering this window.
     */
    public List<DateWindow> chunks(int chunkDays) {
        List<DateWindow> out = new ArrayList<>();
        LocalDate start = from;
        while (!start.isAfter(to)) {
            LocalDate end = start.plusDays(chunkDays - 1L);
            if (end.isAfter(to)) {
                end = to;
            }
            out.add(new DateWindow(start, end));
            start = end.plusDays(1);
        }
        return out;
    }

    public static long epochSeconds(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }
}
