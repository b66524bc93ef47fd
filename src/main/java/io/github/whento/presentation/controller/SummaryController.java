package io.github.whento.presentation.controller;

import io.github.whento.application.dto.DateSummaryView;
import io.github.whento.application.service.SlotResolutionService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/availabilities/calendar/{token}")
public class SummaryController {
    private final SlotResolutionService slotResolution;

    public SummaryController(SlotResolutionService slotResolution) {
        this.slotResolution = slotResolution;
    }

    @GetMapping(path = "/dates/{date}", produces = MediaType.APPLICATION_JSON_VALUE)
    public DateSummaryView dateSummary(@PathVariable("token") String token,
                                       @PathVariable("date") String date,
                                       @RequestParam(name = "participant_id", required = false) String participantId) {
        return slotResolution.dateSummary(token, date, participantId);
    }

    @GetMapping(path = "/range", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<DateSummaryView> rangeSummary(@PathVariable("token") String token,
                                              @RequestParam("start") String start,
                                              @RequestParam("end") String end,
                                              @RequestParam(name = "participant_id", required = false) String participantId) {
        return slotResolution.rangeSummary(token, start, end, participantId);
    }
}
