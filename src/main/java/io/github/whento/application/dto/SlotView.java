package io.github.whento.application.dto;

import java.util.List;

public record SlotView(
        int index,
        String start,
        String end,
        boolean allDay,
        List<ParticipantWindowView> participants,
        int fullCoverageCount) {}
