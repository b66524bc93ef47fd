package io.github.whento.presentation.controller;

import io.github.whento.application.dto.AvailabilityCreateRequest;
import io.github.whento.application.dto.AvailabilityUpdateRequest;
import io.github.whento.application.dto.AvailabilityView;
import io.github.whento.application.dto.ParticipantAvailabilitiesView;
import io.github.whento.application.dto.ParticipantView;
import io.github.whento.application.service.AvailabilityService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/availabilities/calendar/{token}")
public class AvailabilityController {
    private final AvailabilityService availabilityService;

    public AvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @GetMapping(path = "/participants", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ParticipantView> participants(@PathVariable("token") String token) {
        return availabilityService.participants(token);
    }

    @GetMapping(path = "/participant/{participantId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ParticipantAvailabilitiesView participantAvailabilities(@PathVariable("token") String token,
                                                                   @PathVariable("participantId") String participantId,
                                                                   @RequestParam(name = "start", required = false) String start,
                                                                   @RequestParam(name = "end", required = false) String end) {
        return availabilityService.participantAvailabilities(token, participantId, start, end);
    }

    @PostMapping(path = "/participant/{participantId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AvailabilityView> create(@PathVariable("token") String token,
                                                   @PathVariable("participantId") String participantId,
                                                   @Valid @RequestBody AvailabilityCreateRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(availabilityService.create(token, participantId, req));
    }

    @PatchMapping(path = "/participant/{participantId}/{date}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AvailabilityView update(@PathVariable("token") String token,
                                   @PathVariable("participantId") String participantId,
                                   @PathVariable("date") String date,
                                   @Valid @RequestBody AvailabilityUpdateRequest req) {
        return availabilityService.update(token, participantId, date, req);
    }

    @DeleteMapping("/participant/{participantId}/{date}")
    public ResponseEntity<Void> delete(@PathVariable("token") String token,
                                       @PathVariable("participantId") String participantId,
                                       @PathVariable("date") String date) {
        availabilityService.delete(token, participantId, date);
        return ResponseEntity.noContent().build();
    }
}
