package io.github.whento.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;
import java.util.UUID;

/** A participant attributed to a resolved slot, with the window that put them there. */
@Value
@Builder
public class SlotParticipant {
    UUID id;
    String name;
    LocalTime startTime;
    LocalTime endTime;
    String note;

    public boolean isAllDay() {
        return startTime == null && endTime == null;
    }
}
