package io.github.whento.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;
import java.util.UUID;

/**
 * Weekly availability template. dayOfWeek uses 0 = Sunday .. 6 = Saturday.
 */
@Value
@Builder(toBuilder = true)
public class RecurrencePattern {
    UUID id;
    UUID participantId;
    int dayOfWeek;
    LocalTime startTime;
    LocalTime endTime;
    String note;
    LocalDate validFrom;
    LocalDate validTo;
    @Singular
    Set<LocalDate> exceptionDates;

    public boolean isValidOn(LocalDate date) {
        if (validFrom != null && date.isBefore(validFrom)) return false;
        return validTo == null || !date.isAfter(validTo);
    }

    public boolean isExcluded(LocalDate date) {
        return exceptionDates.contains(date);
    }
}
