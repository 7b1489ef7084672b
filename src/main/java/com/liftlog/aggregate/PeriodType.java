package com.liftlog.aggregate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;

/**
 * Calendar bucket sizes. Weekly buckets follow ISO-8601 week numbering, so the
 * last days of December can belong to week 1 of the next week-based year.
 */
public enum PeriodType {
    DAILY("daily") {
        @Override
        public String periodKey(LocalDate date) {
            return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
    },
    WEEKLY("weekly") {
        @Override
        public String periodKey(LocalDate date) {
            return String.format("%d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
    },
    MONTHLY("monthly") {
        @Override
        public String periodKey(LocalDate date) {
            return String.format("%d-%02d", date.getYear(), date.getMonthValue());
        }
    },
    YEARLY("yearly") {
        @Override
        public String periodKey(LocalDate date) {
            return String.valueOf(date.getYear());
        }
    };

    private final String value;

    PeriodType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public abstract String periodKey(LocalDate date);

    /** Storage and query key, e.g. {@code weekly:2026-W42}. */
    public String key(LocalDate date) {
        return value + ":" + periodKey(date);
    }
}
