package io.github.whento.application.service;

import io.github.whento.application.exception.ValidationException;
import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.ResolvedSlot;
import io.github.whento.domain.model.TimeRange;

import java.time.LocalTime;

/** Time-window checks shared by manual entries and recurrences. */
final class WindowRules {

    private WindowRules() {}

    /**
     * Completes a single bound with the start or end of the day and swaps reversed bounds.
     * Both bounds missing means the whole day.
     */
    static TimeRange normalize(LocalTime start, LocalTime end) {
        if (start == null && end == null) return TimeRange.unrestricted();
        LocalTime s = start != null ? start : ResolvedSlot.DAY_START;
        LocalTime e = end != null ? end : ResolvedSlot.DAY_END;
        if (s.equals(e)) throw new ValidationException("start time and end time must differ");
        return s.isAfter(e) ? TimeRange.of(e, s) : TimeRange.of(s, e);
    }

    static void requireNonEmpty(TimeRange range) {
        if (range.isComplete() && !range.getStart().isBefore(range.getEnd())) {
            throw new ValidationException("time range does not fit within allowed hours for this day");
        }
    }

    static void requireMinDuration(TimeRange range, int minDurationHours) {
        if (minDurationHours <= 0 || !range.isComplete()) return;
        int minutes = TimeOfDayUtils.durationMinutes(TimeOfDayUtils.toMinutes(range.getStart()), TimeOfDayUtils.toMinutes(range.getEnd()));
        if (minutes < minDurationHours * 60) {
            throw new ValidationException("availability must last at least " + minDurationHours + " hour(s)");
        }
    }
}
