package io.github.whento.domain.model;

import io.github.whento.application.util.TimeOfDayUtils;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A maximal continuous time range on one date where the quorum is met. Recomputed on every
 * request and never stored.
 */
@Value
@Builder
public class ResolvedSlot {
    public static final LocalTime DAY_START = LocalTime.MIDNIGHT;
    public static final LocalTime DAY_END = LocalTime.of(23, 59);

    LocalDate date;
    LocalTime start;
    LocalTime end;
    int index;
    /** Everyone covering at least one qualifying part of the slot. */
    @Singular
    List<SlotParticipant> participants;
    /** Ids of participants whose window covers the entire slot. */
    @Singular
    Set<UUID> fullyCoveringIds;

    public boolean isAllDay() {
        return DAY_START.equals(start) && DAY_END.equals(end);
    }

    /** Length in minutes; a slot closing at 23:59 includes that last minute. */
    public int durationMinutes() {
        return TimeOfDayUtils.durationMinutes(TimeOfDayUtils.toMinutes(start), TimeOfDayUtils.toMinutes(end));
    }
}
