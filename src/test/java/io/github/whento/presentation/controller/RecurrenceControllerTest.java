package io.github.whento.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.whento.application.dto.RecurrenceExceptionRequest;
import io.github.whento.application.dto.RecurrenceRequest;
import io.github.whento.application.dto.RecurrenceView;
import io.github.whento.application.exception.ConflictException;
import io.github.whento.application.service.RecurrenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = RecurrenceController.class)
@AutoConfigureMockMvc(addFilters = false)
class RecurrenceControllerTest {
    private static final String BASE = "/api/v1/availabilities/calendar/{token}/participant/{pid}";
    private static final String PID = "3f2b9c1e-8d7a-4e6f-9b0c-1a2d3e4f5a6b";
    private static final String RID = "0b7e5a44-2c61-4f0e-8f39-6c0d9e1b2a73";

    @SpringBootConfiguration
    @Import({RecurrenceController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    RecurrenceService recurrenceService;

    @BeforeEach
    void setup() {
        Mockito.reset(recurrenceService);
    }

    private static RecurrenceView view(List<String> exceptions) {
        return new RecurrenceView(UUID.fromString(RID), UUID.fromString(PID), 2, "18:00", "20:00", null,
                "2025-06-01", null, exceptions);
    }

    @Test
    void create_returns201() throws Exception {
        when(recurrenceService.create(eq("tok"), eq(PID), any(RecurrenceRequest.class))).thenReturn(view(List.of()));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("dayOfWeek", 2);
        req.put("startTime", "18:00");
        req.put("endTime", "20:00");
        req.put("startDate", "2025-06-01");

        mockMvc.perform(post(BASE + "/recurrence", "tok", PID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(RID))
                .andExpect(jsonPath("$.dayOfWeek").value(2));

        ArgumentCaptor<RecurrenceRequest> captor = ArgumentCaptor.forClass(RecurrenceRequest.class);
        verify(recurrenceService).create(eq("tok"), eq(PID), captor.capture());
        assertThat(captor.getValue().getDayOfWeek()).isEqualTo(2);
        assertThat(captor.getValue().getStartDate()).isEqualTo("2025-06-01");
    }

    @Test
    void create_returns409_onOverlap() throws Exception {
        when(recurrenceService.create(any(), any(), any()))
                .thenThrow(new ConflictException("an overlapping recurrence already exists for this day of week"));

        mockMvc.perform(post(BASE + "/recurrence", "tok", PID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dayOfWeek\":2,\"startDate\":\"2025-06-01\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("an overlapping recurrence already exists for this day of week"));
    }

    @Test
    void list_returnsRecurrences() throws Exception {
        when(recurrenceService.list("tok", PID)).thenReturn(List.of(view(List.of("2025-06-10"))));

        mockMvc.perform(get(BASE + "/recurrences", "tok", PID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].exceptions[0]").value("2025-06-10"));
    }

    @Test
    void addException_returns201_andRemoveException_returns204() throws Exception {
        when(recurrenceService.addException(eq("tok"), eq(PID), eq(RID), any(RecurrenceExceptionRequest.class)))
                .thenReturn(view(List.of("2025-06-10")));

        mockMvc.perform(post(BASE + "/recurrence/{rid}/exception", "tok", PID, RID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"excludedDate\":\"2025-06-10\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.exceptions[0]").value("2025-06-10"));

        mockMvc.perform(delete(BASE + "/recurrence/{rid}/exception/{date}", "tok", PID, RID, "2025-06-10"))
                .andExpect(status().isNoContent());
        verify(recurrenceService).removeException("tok", PID, RID, "2025-06-10");
    }

    @Test
    void addException_returns400_whenDateMissing() throws Exception {
        mockMvc.perform(post(BASE + "/recurrence/{rid}/exception", "tok", PID, RID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(recurrenceService);
    }

    @Test
    void update_andDelete_delegateToService() throws Exception {
        when(recurrenceService.update(eq("tok"), eq(PID), eq(RID), any(RecurrenceRequest.class))).thenReturn(view(List.of()));

        mockMvc.perform(patch(BASE + "/recurrence/{rid}", "tok", PID, RID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"indoor\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(delete(BASE + "/recurrence/{rid}", "tok", PID, RID))
                .andExpect(status().isNoContent());

        verify(recurrenceService).delete("tok", PID, RID);
    }
}
