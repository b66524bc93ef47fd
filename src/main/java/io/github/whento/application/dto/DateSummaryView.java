package io.github.whento.application.dto;

import java.util.List;

public record DateSummaryView(
        String date,
        int totalCount,
        boolean thresholdMet,
        List<ParticipantWindowView> participants,
        List<SlotView> slots) {}
