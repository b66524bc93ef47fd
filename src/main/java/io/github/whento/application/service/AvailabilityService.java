package io.github.whento.application.service;

import io.github.whento.application.dto.AvailabilityCreateRequest;
import io.github.whento.application.dto.AvailabilityUpdateRequest;
import io.github.whento.application.dto.AvailabilityView;
import io.github.whento.application.dto.ParticipantAvailabilitiesView;
import io.github.whento.application.dto.ParticipantView;
import io.github.whento.application.event.AvailabilityChangedEvent;
import io.github.whento.application.exception.NotFoundException;
import io.github.whento.application.exception.ValidationException;
import io.github.whento.application.repository.AvailabilityRepository;
import io.github.whento.application.repository.ParticipantRepository;
import io.github.whento.application.repository.RecurrenceRepository;
import io.github.whento.application.util.RequestValues;
import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.AvailabilitySource;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.TimeRange;
import io.github.whento.engine.AllowedHoursPolicy;
import io.github.whento.engine.DateEligibility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Write boundary for one-off availability entries. Every accepted entry is on a current or future,
 * eligible date, fits the calendar's allowed hours and lasts at least the minimum duration.
 */
@Slf4j
@Service
public class AvailabilityService {
    private final CalendarAccessService calendarAccess;
    private final ParticipantRepository participantRepository;
    private final AvailabilityRepository availabilityRepository;
    private final RecurrenceRepository recurrenceRepository;
    private final DateEligibility eligibility;
    private final AllowedHoursPolicy allowedHours;
    private final SlotResolutionService slotResolution;
    private final ApplicationEventPublisher events;

    public AvailabilityService(CalendarAccessService calendarAccess,
                               ParticipantRepository participantRepository,
                               AvailabilityRepository availabilityRepository,
                               RecurrenceRepository recurrenceRepository,
                               DateEligibility eligibility,
                               AllowedHoursPolicy allowedHours,
                               SlotResolutionService slotResolution,
                               ApplicationEventPublisher events) {
        this.calendarAccess = calendarAccess;
        this.participantRepository = participantRepository;
        this.availabilityRepository = availabilityRepository;
        this.recurrenceRepository = recurrenceRepository;
        this.eligibility = eligibility;
        this.allowedHours = allowedHours;
        this.slotResolution = slotResolution;
        this.events = events;
    }

    public List<ParticipantView> participants(String token) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        return participantRepository.findByCalendar(calendar.getId()).stream()
                .map(p -> new ParticipantView(p.getId(), p.getName()))
                .collect(Collectors.toList());
    }

    public ParticipantAvailabilitiesView participantAvailabilities(String token, String participantId,
                                                                   String startValue, String endValue) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        LocalDate from = RequestValues.optionalDate(startValue, "start");
        LocalDate to = RequestValues.optionalDate(endValue, "end");
        List<AvailabilityView> availabilities = availabilityRepository.findByParticipant(participant.getId(), from, to).stream()
                .map(AvailabilityService::toView)
                .collect(Collectors.toList());
        return new ParticipantAvailabilitiesView(participant.getId(), participant.getName(), availabilities,
                recurrenceRepository.findByParticipant(participant.getId()).stream()
                        .map(RecurrenceService::toView)
                        .collect(Collectors.toList()));
    }

    public AvailabilityView create(String token, String participantId, AvailabilityCreateRequest req) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        LocalDate date = RequestValues.date(req.getDate(), "date");
        requireNotPast(calendar, date);
        if (!calendar.isWithinDateRange(date)) {
            throw new ValidationException("date is outside the calendar date range");
        }
        if (!eligibility.isAllowed(date, calendar)) {
            throw new ValidationException("date is not allowed for this calendar");
        }

        TimeRange range = checkedRange(calendar, date,
                RequestValues.optionalTime(req.getStartTime(), "startTime"),
                RequestValues.optionalTime(req.getEndTime(), "endTime"));

        int previous = currentCount(calendar, date);
        AvailabilityWindow window = AvailabilityWindow.builder()
                .participantId(participant.getId())
                .date(date)
                .startTime(range.getStart())
                .endTime(range.getEnd())
                .note(req.getNote())
                .source(AvailabilitySource.MANUAL)
                .build();
        availabilityRepository.create(window);
        log.info("Availability created: calendar={}, participant={}, date={}", calendar.getId(), participant.getId(), date);
        events.publishEvent(new AvailabilityChangedEvent(calendar, date, previous));
        return toView(window);
    }

    public AvailabilityView update(String token, String participantId, String dateValue, AvailabilityUpdateRequest req) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        LocalDate date = RequestValues.date(dateValue, "date");
        requireNotPast(calendar, date);
        AvailabilityWindow existing = availabilityRepository.find(participant.getId(), date)
                .orElseThrow(() -> new NotFoundException("availability not found"));

        LocalTime start = req.getStartTime() == null ? existing.getStartTime() : RequestValues.optionalTime(req.getStartTime(), "startTime");
        LocalTime end = req.getEndTime() == null ? existing.getEndTime() : RequestValues.optionalTime(req.getEndTime(), "endTime");
        TimeRange range = checkedRange(calendar, date, start, end);

        int previous = currentCount(calendar, date);
        AvailabilityWindow updated = existing.toBuilder()
                .startTime(range.getStart())
                .endTime(range.getEnd())
                .note(req.getNote() == null ? existing.getNote() : req.getNote())
                .build();
        availabilityRepository.update(updated);
        log.info("Availability updated: calendar={}, participant={}, date={}", calendar.getId(), participant.getId(), date);
        events.publishEvent(new AvailabilityChangedEvent(calendar, date, previous));
        return toView(updated);
    }

    public void delete(String token, String participantId, String dateValue) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        LocalDate date = RequestValues.date(dateValue, "date");
        requireNotPast(calendar, date);

        int previous = currentCount(calendar, date);
        availabilityRepository.delete(participant.getId(), date);
        log.info("Availability deleted: calendar={}, participant={}, date={}", calendar.getId(), participant.getId(), date);
        events.publishEvent(new AvailabilityChangedEvent(calendar, date, previous));
    }

    private TimeRange checkedRange(CalendarConfig calendar, LocalDate date, LocalTime start, LocalTime end) {
        TimeRange range = WindowRules.normalize(start, end);
        range = allowedHours.clamp(range, allowedHours.rangeForDate(date, calendar));
        WindowRules.requireNonEmpty(range);
        WindowRules.requireMinDuration(range, calendar.getMinDurationHours());
        return range;
    }

    private void requireNotPast(CalendarConfig calendar, LocalDate date) {
        if (date.isBefore(calendarAccess.today(calendar))) {
            throw new ValidationException("date is in the past");
        }
    }

    private int currentCount(CalendarConfig calendar, LocalDate date) {
        try {
            return slotResolution.countAvailable(calendar, date);
        } catch (RuntimeException e) {
            log.warn("Could not count participants on {} for calendar {}: {}", date, calendar.getId(), e.getMessage());
            return -1;
        }
    }

    static AvailabilityView toView(AvailabilityWindow w) {
        return new AvailabilityView(w.getParticipantId(), w.getDate().toString(),
                TimeOfDayUtils.formatTime(w.getStartTime()), TimeOfDayUtils.formatTime(w.getEndTime()),
                w.getNote(), w.getSource().getValue());
    }
}
