package io.github.whento.engine;

import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.RecurrencePattern;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable view of one calendar's stored availability: manual entries and recurring patterns
 * (with their exception dates already attached).
 */
@Value
@Builder
public class AvailabilitySnapshot {
    @Singular
    List<AvailabilityWindow> manualWindows;
    @Singular
    List<RecurrencePattern> recurrences;

    public static AvailabilitySnapshot empty() {
        return AvailabilitySnapshot.builder().build();
    }
}
