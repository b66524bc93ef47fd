package io.github.whento.engine;

import io.github.whento.domain.model.AllowedHours;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.HolidaysPolicy;
import io.github.whento.domain.model.ResolvedSlot;
import io.github.whento.domain.model.TimeRange;
import io.github.whento.application.util.TimeOfDayUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Applies a calendar's allowed hours to requested availability times.
 *
 * <p>On an allowed weekday without configured hours the whole day is open. Holidays (under the
 * {@code allow} policy) and holiday eves use their own hours; when they also fall on an allowed
 * weekday the two ranges are combined into the earliest start and the latest end.
 */
@Component
public class AllowedHoursPolicy {
    private static final TimeRange FULL_DAY = TimeRange.of(ResolvedSlot.DAY_START, ResolvedSlot.DAY_END);

    private final DateEligibility eligibility;

    public AllowedHoursPolicy(DateEligibility eligibility) {
        this.eligibility = eligibility;
    }

    public TimeRange rangeForDate(LocalDate date, CalendarConfig calendar) {
        AllowedHours hours = calendar.getAllowedHours();
        int dow = TimeOfDayUtils.dayOfWeekIndex(date);
        boolean weekdayAllowed = DateEligibility.isWeekdayAllowed(dow, calendar.getAllowedWeekdays());
        TimeRange weekdayRange = weekdayAllowed ? hours.forWeekday(dow).orElse(FULL_DAY) : TimeRange.unrestricted();

        if (calendar.getHolidaysPolicy() == HolidaysPolicy.ALLOW && eligibility.isHoliday(date, calendar.getTimezone())) {
            return weekdayAllowed ? combine(hours.getHolidays(), weekdayRange) : hours.getHolidays();
        }
        if (calendar.isAllowHolidayEves() && eligibility.isHolidayEve(date, calendar.getTimezone())) {
            return weekdayAllowed ? combine(hours.getHolidayEves(), weekdayRange) : hours.getHolidayEves();
        }
        return weekdayRange;
    }

    /** Recurrences span many dates, so only the weekday hours apply to them. */
    public TimeRange rangeForWeekday(int dayOfWeek, CalendarConfig calendar) {
        return calendar.getAllowedHours().forWeekday(dayOfWeek).orElse(TimeRange.unrestricted());
    }

    /**
     * Narrows {@code requested} to {@code allowed}. Missing requested bounds take the allowed bound;
     * when only one side is limited the other defaults to the start or end of the day. A full-day
     * allowance leaves the request untouched so all-day entries stay all-day.
     */
    public TimeRange clamp(TimeRange requested, TimeRange allowed) {
        if (allowed == null || allowed.isUnrestricted() || FULL_DAY.equals(allowed)) return requested;
        LocalTime start;
        if (allowed.getStart() != null) {
            start = requested.getStart() == null || requested.getStart().isBefore(allowed.getStart())
                    ? allowed.getStart() : requested.getStart();
        } else {
            start = requested.getStart() == null ? ResolvedSlot.DAY_START : requested.getStart();
        }
        LocalTime end;
        if (allowed.getEnd() != null) {
            end = requested.getEnd() == null || requested.getEnd().isAfter(allowed.getEnd())
                    ? allowed.getEnd() : requested.getEnd();
        } else {
            end = requested.getEnd() == null ? ResolvedSlot.DAY_END : requested.getEnd();
        }
        return TimeRange.of(start, end);
    }

    static TimeRange combine(TimeRange special, TimeRange weekday) {
        if (special == null || !special.isComplete()) return weekday;
        if (!weekday.isComplete()) return special;
        LocalTime start = weekday.getStart().isBefore(special.getStart()) ? weekday.getStart() : special.getStart();
        LocalTime end = weekday.getEnd().isAfter(special.getEnd()) ? weekday.getEnd() : special.getEnd();
        return TimeRange.of(start, end);
    }
}
