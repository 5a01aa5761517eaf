package com.flagship.inventory_ledger.report;

import com.flagship.inventory_ledger.common.exception.ValidationException;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Locale;

/**
 * Calendar-aligned time buckets. Labels are {@code yyyy-MM-dd} for days,
 * ISO week {@code YYYY-Www} for weeks and {@code yyyy-MM} for months.
 */
public enum GroupBy {
    DAY("YYYY-MM-DD"),
    WEEK("IYYY-\"W\"IW"),
    MONTH("YYYY-MM");

    private final String postgresPattern;

    GroupBy(String postgresPattern) {
        this.postgresPattern = postgresPattern;
    }

    /**
     * Pattern for Postgres {@code to_char}, producing the same label as {@link #label}.
     */
    String postgresPattern() {
        return postgresPattern;
    }

    public String label(LocalDate date) {
        switch (this) {
            case WEEK:
                return String.format(Locale.ROOT, "%04d-W%02d",
                        date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTH:
                return String.format(Locale.ROOT, "%04d-%02d", date.getYear(), date.getMonthValue());
            default:
                return date.toString();
        }
    }

    /**
     * Lenient parse of a request parameter; null or blank means DAY.
     */
    public static GroupBy parse(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        try {
            return GroupBy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("groupBy must be one of day, week, month");
        }
    }
}
