package com.example.clubadmin.service.ledger;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * Inclusive day window used by the money page filters.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start date must not be after end date");
        }
    }

    public LocalDateTime startTime() {
        return start.atStartOfDay();
    }

    public LocalDateTime endTime() {
        return end.atTime(LocalTime.MAX);
    }

    /**
     * Both blank → null (no filter).
     *
     * @throws IllegalArgumentException "Invalid date format" when either side does not parse
     */
    public static DateRange parse(String start, String end) {
        boolean noStart = start == null || start.isBlank();
        boolean noEnd = end == null || end.isBlank();
        if (noStart && noEnd) {
            return null;
        }
        try {
            LocalDate s = noStart ? LocalDate.of(1970, 1, 1) : LocalDate.parse(start.trim());
            LocalDate e = noEnd ? LocalDate.now() : LocalDate.parse(end.trim());
            return new DateRange(s, e);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid date format", ex);
        }
    }
}
