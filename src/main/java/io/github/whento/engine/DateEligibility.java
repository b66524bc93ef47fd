package io.github.whento.engine;

import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.HolidaysPolicy;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;

/**
 * Decides whether a date can carry availability for a calendar, from its weekday list, holiday
 * policy and holiday-eve flag.
 */
@Component
public class DateEligibility {
    private final HolidayLookup holidays;

    public DateEligibility(HolidayLookup holidays) {
        this.holidays = holidays;
    }

    public boolean isAllowed(LocalDate date, CalendarConfig calendar) {
        return isAllowed(date, calendar.getTimezone(), calendar.getAllowedWeekdays(),
                calendar.getHolidaysPolicy(), calendar.isAllowHolidayEves());
    }

    /**
     * Holiday checks are skipped when no country can be derived from the timezone; the date is
     * then judged on its weekday alone.
     */
    public boolean isAllowed(LocalDate date, String timezone, Collection<Integer> allowedWeekdays,
                             HolidaysPolicy policy, boolean allowHolidayEves) {
        Optional<String> country = holidays.countryForTimezone(timezone);
        boolean holiday = country.map(c -> holidays.isHoliday(date, c)).orElse(false);

        if (policy == HolidaysPolicy.BLOCK && holiday) return false;
        if (policy == HolidaysPolicy.ALLOW && holiday) return true;

        if (isWeekdayAllowed(TimeOfDayUtils.dayOfWeekIndex(date), allowedWeekdays)) return true;

        return allowHolidayEves && country.map(c -> holidays.isHoliday(date.plusDays(1), c)).orElse(false);
    }

    public boolean isHoliday(LocalDate date, String timezone) {
        return holidays.countryForTimezone(timezone)
                .map(c -> holidays.isHoliday(date, c))
                .orElse(false);
    }

    public boolean isHolidayEve(LocalDate date, String timezone) {
        return isHoliday(date.plusDays(1), timezone);
    }

    public static boolean isWeekdayAllowed(int dayOfWeek, Collection<Integer> allowedWeekdays) {
        return allowedWeekdays != null && allowedWeekdays.contains(dayOfWeek);
    }
}
