package io.github.whento.application.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Minute-of-day arithmetic shared by the resolver and the write boundary. All comparisons are done
 * on whole minutes; seconds are never stored.
 */
public final class TimeOfDayUtils {
    public static final int MINUTES_PER_DAY = 24 * 60;
    /** Last representable minute; an all-day window spans [0, LAST_MINUTE]. */
    public static final int LAST_MINUTE = MINUTES_PER_DAY - 1;

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private TimeOfDayUtils() {}

    public static int toMinutes(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }

    public static LocalTime fromMinutes(int minutes) {
        if (minutes < 0 || minutes > LAST_MINUTE) throw new IllegalArgumentException("Minute of day out of range: " + minutes);
        return LocalTime.of(minutes / 60, minutes % 60);
    }

    public static int startMinutes(LocalTime start) {
        return start == null ? 0 : toMinutes(start);
    }

    public static int endMinutes(LocalTime end) {
        return end == null ? LAST_MINUTE : toMinutes(end);
    }

    /** Strict "HH:mm" parsing; throws DateTimeParseException on anything else. */
    public static LocalTime parseTime(String value) {
        if (value == null || value.length() != 5) {
            throw new DateTimeParseException("Expected HH:mm", String.valueOf(value), 0);
        }
        return LocalTime.parse(value, HH_MM);
    }

    public static String formatTime(LocalTime t) {
        return t == null ? null : t.format(HH_MM);
    }

    /** Strict "yyyy-MM-dd" parsing. */
    public static LocalDate parseDate(String value) {
        if (value == null) throw new DateTimeParseException("Expected yyyy-MM-dd", "null", 0);
        return LocalDate.parse(value, ISO_DATE);
    }

    /** 0 = Sunday .. 6 = Saturday. */
    public static int dayOfWeekIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    public static DayOfWeek toDayOfWeek(int index) {
        if (index < 0 || index > 6) throw new IllegalArgumentException("Day of week must be 0..6: " + index);
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }

    /** Minutes between two bounds, counting the closing 23:59 minute as part of the range. */
    public static int durationMinutes(int startMinute, int endMinute) {
        int d = endMinute - startMinute;
        return endMinute == LAST_MINUTE ? d + 1 : d;
    }
}
