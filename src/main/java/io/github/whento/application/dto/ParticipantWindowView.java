package io.github.whento.application.dto;

import java.util.UUID;

/** A participant's effective window on a date. The id is null when masked. */
public record ParticipantWindowView(
        UUID participantId,
        String participantName,
        String startTime,
        String endTime,
        String note,
        String source) {}
