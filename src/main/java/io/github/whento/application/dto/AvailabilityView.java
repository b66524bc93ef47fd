package io.github.whento.application.dto;

import java.util.UUID;

public record AvailabilityView(
        UUID participantId,
        String date,
        String startTime,
        String endTime,
        String note,
        String source) {}
