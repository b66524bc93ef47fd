package io.github.whento.application.dto;

import java.util.List;
import java.util.UUID;

public record RecurrenceView(
        UUID id,
        UUID participantId,
        int dayOfWeek,
        String startTime,
        String endTime,
        String note,
        String startDate,
        String endDate,
        List<String> exceptions) {}
