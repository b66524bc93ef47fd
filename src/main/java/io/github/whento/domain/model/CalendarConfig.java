package io.github.whento.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Calendar settings that drive date eligibility, quorum resolution and feed rendering.
 */
@Value
@Builder(toBuilder = true)
public class CalendarConfig {
    UUID id;
    String name;
    String description;
    @Builder.Default
    int threshold = 1;
    @Singular
    Set<Integer> allowedWeekdays;
    @Builder.Default
    String timezone = "Europe/Paris";
    @Builder.Default
    HolidaysPolicy holidaysPolicy = HolidaysPolicy.IGNORE;
    boolean allowHolidayEves;
    int minDurationHours;
    LocalDate startDate;
    LocalDate endDate;
    @Builder.Default
    AllowedHours allowedHours = AllowedHours.unrestricted();
    boolean lockParticipants;

    /** True when the date lies inside the optional [startDate, endDate] bounds. */
    public boolean isWithinDateRange(LocalDate date) {
        if (startDate != null && date.isBefore(startDate)) return false;
        return endDate == null || !date.isAfter(endDate);
    }
}
