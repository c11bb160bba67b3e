package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Bucket width of a timeseries. Weeks start on Monday.
 */
public enum Interval {
    DAY,
    WEEK;

    public LocalDate truncate(LocalDate date) {
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.minusDays(date.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue());
        };
    }

    public LocalDate next(LocalDate bucket) {
        return switch (this) {
            case DAY -> bucket.plusDays(1);
            case WEEK -> bucket.plusWeeks(1);
        };
    }

    public static Interval fromParam(String value) {
        if (value != null) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new RequestValidationException("Unknown interval '" + value + "', expected day or week", e);
            }
        }
        throw new RequestValidationException("interval is required, expected day or week");
    }
}
