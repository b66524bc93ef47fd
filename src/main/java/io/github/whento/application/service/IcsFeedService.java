package io.github.whento.application.service;

import io.github.whento.application.repository.ParticipantRepository;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.RecurrencePattern;
import io.github.whento.domain.model.ResolvedSlot;
import io.github.whento.engine.AvailabilitySnapshot;
import io.github.whento.engine.IcsFeedRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

@Slf4j
@Service
public class IcsFeedService {
    private final CalendarAccessService calendarAccess;
    private final ParticipantRepository participantRepository;
    private final SlotResolutionService slotResolution;
    private final IcsFeedRenderer renderer;
    private final Period recurrenceHorizon;

    public IcsFeedService(CalendarAccessService calendarAccess,
                          ParticipantRepository participantRepository,
                          SlotResolutionService slotResolution,
                          IcsFeedRenderer renderer,
                          @Value("${whento.feed.recurrence-horizon:P1Y}") Period recurrenceHorizon) {
        this.calendarAccess = calendarAccess;
        this.participantRepository = participantRepository;
        this.slotResolution = slotResolution;
        this.renderer = renderer;
        this.recurrenceHorizon = recurrenceHorizon;
    }

    public String feed(String icsToken, String host) {
        CalendarConfig calendar = calendarAccess.byIcsToken(icsToken);
        AvailabilitySnapshot snapshot = slotResolution.loadSnapshot(calendar, calendar.getStartDate(), calendar.getEndDate());
        List<Participant> participants = participantRepository.findByCalendar(calendar.getId());

        NavigableMap<LocalDate, List<ResolvedSlot>> slots = new TreeMap<>();
        LocalDate[] range = feedRange(calendar, snapshot);
        if (range != null) {
            slots = slotResolution.resolveRange(calendar, range[0], range[1], snapshot, participants);
        }
        int events = slots.values().stream().mapToInt(List::size).sum();
        log.info("Rendering ICS feed for calendar {}: {} dates, {} events", calendar.getId(), slots.size(), events);
        return renderer.render(calendar, slots, host);
    }

    /**
     * Dates covered by the feed: from the earliest stored entry or recurrence start to the latest
     * entry or recurrence end. Open-ended recurrences run until today plus the configured horizon.
     * The calendar's own bounds narrow the result. Null when there is nothing to render.
     */
    LocalDate[] feedRange(CalendarConfig calendar, AvailabilitySnapshot snapshot) {
        LocalDate from = null;
        LocalDate to = null;
        for (AvailabilityWindow w : snapshot.getManualWindows()) {
            from = min(from, w.getDate());
            to = max(to, w.getDate());
        }
        LocalDate horizon = calendarAccess.today(calendar).plus(recurrenceHorizon);
        for (RecurrencePattern p : snapshot.getRecurrences()) {
            if (p.getValidFrom() != null) from = min(from, p.getValidFrom());
            to = max(to, p.getValidTo() != null ? p.getValidTo() : horizon);
        }
        if (from == null || to == null) return null;
        if (calendar.getStartDate() != null && from.isBefore(calendar.getStartDate())) from = calendar.getStartDate();
        if (calendar.getEndDate() != null && to.isAfter(calendar.getEndDate())) to = calendar.getEndDate();
        if (to.isBefore(from)) return null;
        return new LocalDate[]{from, to};
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a == null || b.isBefore(a) ? b : a;
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a == null || b.isAfter(a) ? b : a;
    }
}
