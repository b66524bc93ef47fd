package io.github.whento.application.event;

import io.github.whento.domain.model.CalendarConfig;
import lombok.Value;

import java.time.LocalDate;

/**
 * Published after a manual availability write. {@code previousCount} is the number of available
 * participants on the date before the write, or -1 when it could not be determined.
 */
@Value
public class AvailabilityChangedEvent {
    CalendarConfig calendar;
    LocalDate date;
    int previousCount;
}
