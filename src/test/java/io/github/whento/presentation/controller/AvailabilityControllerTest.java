package io.github.whento.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.whento.application.dto.AvailabilityCreateRequest;
import io.github.whento.application.dto.AvailabilityUpdateRequest;
import io.github.whento.application.dto.AvailabilityView;
import io.github.whento.application.dto.ParticipantView;
import io.github.whento.application.exception.ConflictException;
import io.github.whento.application.exception.NotFoundException;
import io.github.whento.application.exception.ValidationException;
import io.github.whento.application.service.AvailabilityService;
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

@WebMvcTest(controllers = AvailabilityController.class)
@AutoConfigureMockMvc(addFilters = false)
class AvailabilityControllerTest {
    private static final String BASE = "/api/v1/availabilities/calendar/{token}";
    private static final String PID = "3f2b9c1e-8d7a-4e6f-9b0c-1a2d3e4f5a6b";

    @SpringBootConfiguration
    @Import({AvailabilityController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    AvailabilityService availabilityService;

    @BeforeEach
    void setup() {
        Mockito.reset(availabilityService);
    }

    @Test
    void participants_listsCalendarParticipants() throws Exception {
        UUID id = UUID.fromString(PID);
        when(availabilityService.participants("tok")).thenReturn(List.of(new ParticipantView(id, "Alice")));

        mockMvc.perform(get(BASE + "/participants", "tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(PID))
                .andExpect(jsonPath("$[0].name").value("Alice"));
    }

    @Test
    void create_returns201_andPassesBody() throws Exception {
        when(availabilityService.create(eq("tok"), eq(PID), any(AvailabilityCreateRequest.class)))
                .thenReturn(new AvailabilityView(UUID.fromString(PID), "2025-06-02", "18:00", "22:00", null, "manual"));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("date", "2025-06-02");
        req.put("startTime", "17:00");
        req.put("endTime", "22:00");

        mockMvc.perform(post(BASE + "/participant/{pid}", "tok", PID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.startTime").value("18:00"))
                .andExpect(jsonPath("$.source").value("manual"));

        ArgumentCaptor<AvailabilityCreateRequest> captor = ArgumentCaptor.forClass(AvailabilityCreateRequest.class);
        verify(availabilityService, times(1)).create(eq("tok"), eq(PID), captor.capture());
        assertThat(captor.getValue().getStartTime()).isEqualTo("17:00");
    }

    @Test
    void create_returns400_whenDateMissing() throws Exception {
        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("startTime", "17:00");

        mockMvc.perform(post(BASE + "/participant/{pid}", "tok", PID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.error").value("Bad Request"));
        verifyNoInteractions(availabilityService);
    }

    @Test
    void create_returns400_onServiceValidation() throws Exception {
        when(availabilityService.create(any(), any(), any())).thenThrow(new ValidationException("date is in the past"));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("date", "2020-01-01");

        mockMvc.perform(post(BASE + "/participant/{pid}", "tok", PID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("date is in the past"));
    }

    @Test
    void create_returns409_whenEntryExists() throws Exception {
        when(availabilityService.create(any(), any(), any()))
                .thenThrow(new ConflictException("availability already exists for this date"));

        var req = new java.util.LinkedHashMap<String, Object>();
        req.put("date", "2025-06-02");

        mockMvc.perform(post(BASE + "/participant/{pid}", "tok", PID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    void create_returns400_whenBodyUnreadable() throws Exception {
        mockMvc.perform(post(BASE + "/participant/{pid}", "tok", PID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid request"));
    }

    @Test
    void update_returns404_whenMissing() throws Exception {
        when(availabilityService.update(eq("tok"), eq(PID), eq("2025-06-02"), any(AvailabilityUpdateRequest.class)))
                .thenThrow(new NotFoundException("availability not found"));

        mockMvc.perform(patch(BASE + "/participant/{pid}/{date}", "tok", PID, "2025-06-02")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"late\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("availability not found"));
    }

    @Test
    void delete_returns204() throws Exception {
        mockMvc.perform(delete(BASE + "/participant/{pid}/{date}", "tok", PID, "2025-06-02"))
                .andExpect(status().isNoContent());
        verify(availabilityService, times(1)).delete("tok", PID, "2025-06-02");
    }
}
