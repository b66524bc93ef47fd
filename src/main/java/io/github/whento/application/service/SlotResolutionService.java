package io.github.whento.application.service;

import io.github.whento.application.dto.DateSummaryView;
import io.github.whento.application.dto.ParticipantWindowView;
import io.github.whento.application.dto.SlotView;
import io.github.whento.application.exception.ValidationException;
import io.github.whento.application.repository.AvailabilityRepository;
import io.github.whento.application.repository.ParticipantRepository;
import io.github.whento.application.repository.RecurrenceRepository;
import io.github.whento.application.util.RequestValues;
import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.ResolvedSlot;
import io.github.whento.domain.model.SlotParticipant;
import io.github.whento.engine.AvailabilityAggregator;
import io.github.whento.engine.AvailabilitySnapshot;
import io.github.whento.engine.DateEligibility;
import io.github.whento.engine.QuorumSlotResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Read side: loads a calendar's availability, runs eligibility, aggregation and quorum resolution,
 * and shapes the result for the summary API and the feed.
 */
@Slf4j
@Service
public class SlotResolutionService {
    static final int MAX_RANGE_DAYS = 366;

    private final CalendarAccessService calendarAccess;
    private final ParticipantRepository participantRepository;
    private final AvailabilityRepository availabilityRepository;
    private final RecurrenceRepository recurrenceRepository;
    private final DateEligibility eligibility;
    private final AvailabilityAggregator aggregator;
    private final QuorumSlotResolver resolver;

    public SlotResolutionService(CalendarAccessService calendarAccess,
                                 ParticipantRepository participantRepository,
                                 AvailabilityRepository availabilityRepository,
                                 RecurrenceRepository recurrenceRepository,
                                 DateEligibility eligibility,
                                 AvailabilityAggregator aggregator,
                                 QuorumSlotResolver resolver) {
        this.calendarAccess = calendarAccess;
        this.participantRepository = participantRepository;
        this.availabilityRepository = availabilityRepository;
        this.recurrenceRepository = recurrenceRepository;
        this.eligibility = eligibility;
        this.aggregator = aggregator;
        this.resolver = resolver;
    }

    /** Manual windows in [from, to] (open bounds when null) and every recurrence of the calendar. */
    public AvailabilitySnapshot loadSnapshot(CalendarConfig calendar, LocalDate from, LocalDate to) {
        return AvailabilitySnapshot.builder()
                .manualWindows(availabilityRepository.findByCalendar(calendar.getId(), from, to))
                .recurrences(recurrenceRepository.findByCalendar(calendar.getId()))
                .build();
    }

    /**
     * Slots for one date. Dates outside the calendar range or not eligible yield no slots; a date
     * whose stored data is malformed is logged and yields no slots instead of failing the caller.
     */
    public List<ResolvedSlot> resolveDate(CalendarConfig calendar, LocalDate date,
                                          AvailabilitySnapshot snapshot, List<Participant> participants) {
        if (!calendar.isWithinDateRange(date) || !eligibility.isAllowed(date, calendar)) return List.of();
        Map<Participant, AvailabilityWindow> windows = aggregator.forDate(snapshot, date, participants);
        try {
            return resolver.resolve(date, windows, calendar.getThreshold(), calendar.getMinDurationHours());
        } catch (IllegalArgumentException e) {
            log.warn("Skipping {} for calendar {}: {}", date, calendar.getId(), e.getMessage());
            return List.of();
        }
    }

    /** Slots for every date in [from, to] that has availability, keyed chronologically. */
    public NavigableMap<LocalDate, List<ResolvedSlot>> resolveRange(CalendarConfig calendar, LocalDate from, LocalDate to,
                                                                    AvailabilitySnapshot snapshot, List<Participant> participants) {
        NavigableMap<LocalDate, List<ResolvedSlot>> result = new TreeMap<>();
        for (LocalDate date : aggregator.datesWithAvailability(snapshot, from, to)) {
            List<ResolvedSlot> slots = resolveDate(calendar, date, snapshot, participants);
            if (!slots.isEmpty()) result.put(date, slots);
        }
        return result;
    }

    /** Number of participants with an effective window on the date. */
    public int countAvailable(CalendarConfig calendar, LocalDate date) {
        AvailabilitySnapshot snapshot = loadSnapshot(calendar, date, date);
        return aggregator.forDate(snapshot, date, participantRepository.findByCalendar(calendar.getId())).size();
    }

    public DateSummaryView dateSummary(String token, String dateValue, String requesterId) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        LocalDate date = RequestValues.date(dateValue, "date");
        AvailabilitySnapshot snapshot = loadSnapshot(calendar, date, date);
        List<Participant> participants = participantRepository.findByCalendar(calendar.getId());
        return summarize(calendar, date, snapshot, participants, parseRequester(requesterId));
    }

    public List<DateSummaryView> rangeSummary(String token, String startValue, String endValue, String requesterId) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        LocalDate start = RequestValues.date(startValue, "start");
        LocalDate end = RequestValues.date(endValue, "end");
        if (end.isBefore(start)) throw new ValidationException("end must not be before start");
        if (ChronoUnit.DAYS.between(start, end) >= MAX_RANGE_DAYS) {
            throw new ValidationException("range must not exceed " + MAX_RANGE_DAYS + " days");
        }
        AvailabilitySnapshot snapshot = loadSnapshot(calendar, start, end);
        List<Participant> participants = participantRepository.findByCalendar(calendar.getId());
        UUID requester = parseRequester(requesterId);

        List<DateSummaryView> result = new ArrayList<>();
        for (LocalDate date : aggregator.datesWithAvailability(snapshot, start, end)) {
            result.add(summarize(calendar, date, snapshot, participants, requester));
        }
        return result;
    }

    private DateSummaryView summarize(CalendarConfig calendar, LocalDate date, AvailabilitySnapshot snapshot,
                                      List<Participant> participants, UUID requester) {
        Map<Participant, AvailabilityWindow> windows = aggregator.forDate(snapshot, date, participants);
        List<ResolvedSlot> slots = resolveDate(calendar, date, snapshot, participants);

        List<ParticipantWindowView> views = new ArrayList<>();
        for (Map.Entry<Participant, AvailabilityWindow> e : windows.entrySet()) {
            AvailabilityWindow w = e.getValue();
            views.add(new ParticipantWindowView(
                    visibleId(calendar, e.getKey().getId(), requester),
                    e.getKey().getName(),
                    TimeOfDayUtils.formatTime(w.getStartTime()),
                    TimeOfDayUtils.formatTime(w.getEndTime()),
                    w.getNote(),
                    w.getSource().getValue()));
        }

        int total;
        try {
            total = resolver.maxSimultaneous(windows);
        } catch (IllegalArgumentException ex) {
            log.warn("Cannot count participants on {} for calendar {}: {}", date, calendar.getId(), ex.getMessage());
            total = 0;
        }

        List<SlotView> slotViews = new ArrayList<>();
        for (ResolvedSlot slot : slots) {
            List<ParticipantWindowView> slotParticipants = new ArrayList<>();
            for (SlotParticipant p : slot.getParticipants()) {
                slotParticipants.add(new ParticipantWindowView(
                        visibleId(calendar, p.getId(), requester),
                        p.getName(),
                        TimeOfDayUtils.formatTime(p.getStartTime()),
                        TimeOfDayUtils.formatTime(p.getEndTime()),
                        p.getNote(),
                        null));
            }
            slotViews.add(new SlotView(slot.getIndex(),
                    TimeOfDayUtils.formatTime(slot.getStart()),
                    TimeOfDayUtils.formatTime(slot.getEnd()),
                    slot.isAllDay(),
                    slotParticipants,
                    slot.getFullyCoveringIds().size()));
        }
        return new DateSummaryView(date.toString(), total, !slots.isEmpty(), views, slotViews);
    }

    // Locked calendars only reveal the requester's own id.
    private static UUID visibleId(CalendarConfig calendar, UUID participantId, UUID requester) {
        if (!calendar.isLockParticipants()) return participantId;
        return participantId.equals(requester) ? participantId : null;
    }

    private static UUID parseRequester(String requesterId) {
        if (RequestValues.isBlank(requesterId)) return null;
        try {
            return UUID.fromString(requesterId);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
