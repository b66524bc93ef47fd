package io.github.whento.application.util;

import io.github.whento.application.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/** Parses raw request strings, turning format errors into {@link ValidationException}. */
public final class RequestValues {

    private RequestValues() {}

    public static LocalDate date(String value, String field) {
        try {
            return TimeOfDayUtils.parseDate(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be a date in yyyy-MM-dd format", e);
        }
    }

    public static LocalDate optionalDate(String value, String field) {
        return isBlank(value) ? null : date(value, field);
    }

    /** Null for a missing or empty value. */
    public static LocalTime optionalTime(String value, String field) {
        if (isBlank(value)) return null;
        try {
            return TimeOfDayUtils.parseTime(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be a time in HH:mm format", e);
        }
    }

    public static UUID uuid(String value, String field) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException("invalid " + field, e);
        }
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
