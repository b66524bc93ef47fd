package io.github.whento.application.dto;

import java.util.List;
import java.util.UUID;

public record ParticipantAvailabilitiesView(
        UUID participantId,
        String participantName,
        List<AvailabilityView> availabilities,
        List<RecurrenceView> recurrences) {}
