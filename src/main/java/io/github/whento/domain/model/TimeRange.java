package io.github.whento.domain.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalTime;

/**
 * A time-of-day range where either bound may be missing. Used for allowed-hours configuration,
 * where a missing bound means "no restriction on that side".
 */
@Value
@AllArgsConstructor(staticName = "of")
public class TimeRange {
    LocalTime start;
    LocalTime end;

    public static TimeRange unrestricted() {
        return new TimeRange(null, null);
    }

    public boolean isUnrestricted() {
        return start == null && end == null;
    }

    public boolean isComplete() {
        return start != null && end != null;
    }
}
