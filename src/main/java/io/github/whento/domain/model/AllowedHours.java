package io.github.whento.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Per-calendar hour limits: one range per weekday (0 = Sunday .. 6 = Saturday), plus optional
 * ranges for public holidays and holiday eves.
 */
@Value
@Builder
public class AllowedHours {
    @Singular
    Map<Integer, TimeRange> weekdays;
    @Builder.Default
    TimeRange holidays = TimeRange.unrestricted();
    @Builder.Default
    TimeRange holidayEves = TimeRange.unrestricted();

    public static AllowedHours unrestricted() {
        return AllowedHours.builder().build();
    }

    public Optional<TimeRange> forWeekday(int dayOfWeek) {
        return Optional.ofNullable(weekdays.get(dayOfWeek));
    }
}
