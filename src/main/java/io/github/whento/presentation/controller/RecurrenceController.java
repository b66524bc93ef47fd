package io.github.whento.presentation.controller;

import io.github.whento.application.dto.RecurrenceExceptionRequest;
import io.github.whento.application.dto.RecurrenceRequest;
import io.github.whento.application.dto.RecurrenceView;
import io.github.whento.application.service.RecurrenceService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/availabilities/calendar/{token}/participant/{participantId}")
public class RecurrenceController {
    private final RecurrenceService recurrenceService;

    public RecurrenceController(RecurrenceService recurrenceService) {
        this.recurrenceService = recurrenceService;
    }

    @GetMapping(path = "/recurrences", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<RecurrenceView> list(@PathVariable("token") String token,
                                     @PathVariable("participantId") String participantId) {
        return recurrenceService.list(token, participantId);
    }

    @PostMapping(path = "/recurrence", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecurrenceView> create(@PathVariable("token") String token,
                                                 @PathVariable("participantId") String participantId,
                                                 @Valid @RequestBody RecurrenceRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(recurrenceService.create(token, participantId, req));
    }

    @PatchMapping(path = "/recurrence/{recurrenceId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RecurrenceView update(@PathVariable("token") String token,
                                 @PathVariable("participantId") String participantId,
                                 @PathVariable("recurrenceId") String recurrenceId,
                                 @Valid @RequestBody RecurrenceRequest req) {
        return recurrenceService.update(token, participantId, recurrenceId, req);
    }

    @DeleteMapping("/recurrence/{recurrenceId}")
    public ResponseEntity<Void> delete(@PathVariable("token") String token,
                                       @PathVariable("participantId") String participantId,
                                       @PathVariable("recurrenceId") String recurrenceId) {
        recurrenceService.delete(token, participantId, recurrenceId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = "/recurrence/{recurrenceId}/exception", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecurrenceView> addException(@PathVariable("token") String token,
                                                       @PathVariable("participantId") String participantId,
                                                       @PathVariable("recurrenceId") String recurrenceId,
                                                       @Valid @RequestBody RecurrenceExceptionRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(recurrenceService.addException(token, participantId, recurrenceId, req));
    }

    @DeleteMapping("/recurrence/{recurrenceId}/exception/{date}")
    public ResponseEntity<Void> removeException(@PathVariable("token") String token,
                                                @PathVariable("participantId") String participantId,
                                                @PathVariable("recurrenceId") String recurrenceId,
                                                @PathVariable("date") String date) {
        recurrenceService.removeException(token, participantId, recurrenceId, date);
        return ResponseEntity.noContent().build();
    }
}
