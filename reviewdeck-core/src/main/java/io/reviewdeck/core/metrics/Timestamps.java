package io.reviewdeck.core.metrics;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

final class Timestamps {
    static final String UNSET_YEAR_PREFIX = "0001";

    private Timestamps() {
    }

    static boolean isUnset(String raw) {
        return raw == null || raw.isBlank() || raw.startsWith(UNSET_YEAR_PREFIX);
    }

    /**
     * Parses ISO 8601 date-times with or without an offset, a space instead of {@code T},
     * or a bare date. Offset values are normalised to UTC wall-clock time.
     */
    static LocalDateTime parse(String raw) {
        String value = normalize(raw);
        if (value.length() == 10) {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
        }
        if (hasOffset(value)) {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                .withOffsetSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
        }
        return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    /**
     * Calendar date as written in the value, without shifting an offset to UTC.
     */
    static LocalDate calendarDate(String raw) {
        String value = normalize(raw);
        if (value.length() == 10) {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (hasOffset(value)) {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate();
        }
        return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate();
    }

    static String datePart(String raw) {
        String value = raw.trim();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == 'T' || c == ' ') {
                return value.substring(0, i);
            }
        }
        return value;
    }

    private static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DateTimeParseException("empty timestamp", raw == null ? "" : raw, 0);
        }
        String value = raw.trim();
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        return value;
    }

    private static boolean hasOffset(String value) {
        if (value.endsWith("Z") || value.endsWith("z")) {
            return true;
        }
        int timeStart = value.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = value.substring(timeStart);
        return time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }
}
