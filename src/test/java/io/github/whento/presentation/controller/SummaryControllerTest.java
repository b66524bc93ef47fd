package io.github.whento.presentation.controller;

import io.github.whento.application.dto.DateSummaryView;
import io.github.whento.application.dto.ParticipantWindowView;
import io.github.whento.application.dto.SlotView;
import io.github.whento.application.exception.ValidationException;
import io.github.whento.application.service.SlotResolutionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SummaryController.class)
@AutoConfigureMockMvc(addFilters = false)
class SummaryControllerTest {
    private static final String BASE = "/api/v1/availabilities/calendar/{token}";

    @SpringBootConfiguration
    @Import({SummaryController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @MockBean
    SlotResolutionService slotResolution;

    @BeforeEach
    void setup() {
        Mockito.reset(slotResolution);
    }

    private static DateSummaryView summary(String date) {
        ParticipantWindowView alice = new ParticipantWindowView(null, "Alice", null, null, null, "manual");
        SlotView slot = new SlotView(0, "00:00", "23:59", true, List.of(alice), 1);
        return new DateSummaryView(date, 1, true, List.of(alice), List.of(slot));
    }

    @Test
    void dateSummary_passesRequesterId() throws Exception {
        when(slotResolution.dateSummary("tok", "2025-06-15", "p-1")).thenReturn(summary("2025-06-15"));

        mockMvc.perform(get(BASE + "/dates/{date}", "tok", "2025-06-15").param("participant_id", "p-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-06-15"))
                .andExpect(jsonPath("$.thresholdMet").value(true))
                .andExpect(jsonPath("$.slots[0].allDay").value(true))
                .andExpect(jsonPath("$.participants[0].participantName").value("Alice"));
    }

    @Test
    void rangeSummary_returnsOneEntryPerDate() throws Exception {
        when(slotResolution.rangeSummary("tok", "2025-06-01", "2025-06-30", null))
                .thenReturn(List.of(summary("2025-06-15"), summary("2025-06-22")));

        mockMvc.perform(get(BASE + "/range", "tok").param("start", "2025-06-01").param("end", "2025-06-30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].date").value("2025-06-22"));
    }

    @Test
    void rangeSummary_returns400_whenBoundMissing() throws Exception {
        mockMvc.perform(get(BASE + "/range", "tok").param("start", "2025-06-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid request"));
        verifyNoInteractions(slotResolution);
    }

    @Test
    void rangeSummary_returns400_onInvalidRange() throws Exception {
        when(slotResolution.rangeSummary("tok", "2025-06-30", "2025-06-01", null))
                .thenThrow(new ValidationException("end must not be before start"));

        mockMvc.perform(get(BASE + "/range", "tok").param("start", "2025-06-30").param("end", "2025-06-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("end must not be before start"));
    }
}
