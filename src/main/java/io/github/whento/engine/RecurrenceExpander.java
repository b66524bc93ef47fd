package io.github.whento.engine;

import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.AvailabilitySource;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.RecurrencePattern;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Turns a weekly pattern into concrete recurring windows for a date range. The returned sequence is
 * computed lazily and every call to {@code iterator()} starts again from the beginning of the range.
 */
@Component
public class RecurrenceExpander {

    public Iterable<AvailabilityWindow> expand(RecurrencePattern pattern, LocalDate rangeStart, LocalDate rangeEnd) {
        return () -> new OccurrenceIterator(pattern, rangeStart, rangeEnd);
    }

    /** The single occurrence on {@code date}, or null when the pattern does not produce one. */
    public AvailabilityWindow occurrenceOn(RecurrencePattern pattern, LocalDate date) {
        if (TimeOfDayUtils.dayOfWeekIndex(date) != pattern.getDayOfWeek()) return null;
        if (!pattern.isValidOn(date) || pattern.isExcluded(date)) return null;
        return toWindow(pattern, date);
    }

    static AvailabilityWindow toWindow(RecurrencePattern pattern, LocalDate date) {
        return AvailabilityWindow.builder()
                .participantId(pattern.getParticipantId())
                .date(date)
                .startTime(pattern.getStartTime())
                .endTime(pattern.getEndTime())
                .note(pattern.getNote())
                .source(AvailabilitySource.RECURRING)
                .recurrenceId(pattern.getId())
                .build();
    }

    private static final class OccurrenceIterator implements Iterator<AvailabilityWindow> {
        private final RecurrencePattern pattern;
        private final LocalDate last;
        private LocalDate cursor;

        OccurrenceIterator(RecurrencePattern pattern, LocalDate rangeStart, LocalDate rangeEnd) {
            this.pattern = pattern;
            LocalDate from = rangeStart;
            if (pattern.getValidFrom() != null && pattern.getValidFrom().isAfter(from)) from = pattern.getValidFrom();
            LocalDate to = rangeEnd;
            if (pattern.getValidTo() != null && pattern.getValidTo().isBefore(to)) to = pattern.getValidTo();
            this.last = to;
            this.cursor = from.with(TemporalAdjusters.nextOrSame(TimeOfDayUtils.toDayOfWeek(pattern.getDayOfWeek())));
            skipExcluded();
        }

        private void skipExcluded() {
            while (!cursor.isAfter(last) && pattern.isExcluded(cursor)) {
                cursor = cursor.plusWeeks(1);
            }
        }

        @Override
        public boolean hasNext() {
            return !cursor.isAfter(last);
        }

        @Override
        public AvailabilityWindow next() {
            if (!hasNext()) throw new NoSuchElementException();
            AvailabilityWindow w = toWindow(pattern, cursor);
            cursor = cursor.plusWeeks(1);
            skipExcluded();
            return w;
        }
    }
}
