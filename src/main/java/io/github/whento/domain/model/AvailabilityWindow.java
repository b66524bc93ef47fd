package io.github.whento.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * One participant's availability on one date. A null start and end means the whole day.
 */
@Value
@Builder(toBuilder = true)
public class AvailabilityWindow {
    UUID participantId;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    String note;
    @Builder.Default
    AvailabilitySource source = AvailabilitySource.MANUAL;
    UUID recurrenceId;

    public boolean isAllDay() {
        return startTime == null && endTime == null;
    }

    public boolean isManual() {
        return source == AvailabilitySource.MANUAL;
    }
}
