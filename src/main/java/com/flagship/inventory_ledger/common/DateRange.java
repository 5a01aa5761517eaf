package com.flagship.inventory_ledger.common;

import com.flagship.inventory_ledger.common.exception.ValidationException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Inclusive range of calendar days in the organization zone. Either end may be
 * open.
 */
@Value
public class DateRange {
    LocalDate from;
    LocalDate to;

    public static DateRange of(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("from date " + from + " is after to date " + to);
        }
        return new DateRange(from, to);
    }

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    /**
     * Start of {@code from} in the given zone, or null when open.
     */
    public Instant startInclusive(ZoneId zone) {
        return from == null ? null : from.atStartOfDay(zone).toInstant();
    }

    /**
     * Start of the day after {@code to}, so the whole last day is included.
     */
    public Instant endExclusive(ZoneId zone) {
        return to == null ? null : to.plusDays(1).atStartOfDay(zone).toInstant();
    }
}
