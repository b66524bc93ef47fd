package io.github.whento.application.service;

import io.github.whento.application.dto.RecurrenceExceptionRequest;
import io.github.whento.application.dto.RecurrenceRequest;
import io.github.whento.application.dto.RecurrenceView;
import io.github.whento.application.exception.ConflictException;
import io.github.whento.application.exception.NotFoundException;
import io.github.whento.application.exception.ValidationException;
import io.github.whento.application.repository.RecurrenceRepository;
import io.github.whento.application.util.RequestValues;
import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.RecurrencePattern;
import io.github.whento.domain.model.TimeRange;
import io.github.whento.engine.AllowedHoursPolicy;
import io.github.whento.engine.DateEligibility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RecurrenceService {
    private final CalendarAccessService calendarAccess;
    private final RecurrenceRepository recurrenceRepository;
    private final AllowedHoursPolicy allowedHours;

    public RecurrenceService(CalendarAccessService calendarAccess,
                             RecurrenceRepository recurrenceRepository,
                             AllowedHoursPolicy allowedHours) {
        this.calendarAccess = calendarAccess;
        this.recurrenceRepository = recurrenceRepository;
        this.allowedHours = allowedHours;
    }

    public List<RecurrenceView> list(String token, String participantId) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        return recurrenceRepository.findByParticipant(participant.getId()).stream()
                .map(RecurrenceService::toView)
                .collect(Collectors.toList());
    }

    @Transactional
    public RecurrenceView create(String token, String participantId, RecurrenceRequest req) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        if (RequestValues.isBlank(req.getStartDate())) throw new ValidationException("startDate is required");
        recurrenceRepository.lockParticipant(participant.getId());

        RecurrencePattern pattern = validated(calendar, RecurrencePattern.builder()
                .id(UUID.randomUUID())
                .participantId(participant.getId())
                .dayOfWeek(requireDayOfWeek(req.getDayOfWeek()))
                .startTime(RequestValues.optionalTime(req.getStartTime(), "startTime"))
                .endTime(RequestValues.optionalTime(req.getEndTime(), "endTime"))
                .note(req.getNote())
                .validFrom(RequestValues.date(req.getStartDate(), "startDate"))
                .validTo(RequestValues.optionalDate(req.getEndDate(), "endDate"))
                .build());
        recurrenceRepository.create(pattern);
        log.info("Recurrence created: calendar={}, participant={}, dayOfWeek={}", calendar.getId(), participant.getId(), pattern.getDayOfWeek());
        return toView(pattern);
    }

    /** Fields left null keep their stored value; an empty time or end date clears it. */
    @Transactional
    public RecurrenceView update(String token, String participantId, String recurrenceId, RecurrenceRequest req) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        recurrenceRepository.lockParticipant(participant.getId());
        RecurrencePattern existing = owned(participant, recurrenceId);

        LocalTime start = req.getStartTime() == null ? existing.getStartTime() : RequestValues.optionalTime(req.getStartTime(), "startTime");
        LocalTime end = req.getEndTime() == null ? existing.getEndTime() : RequestValues.optionalTime(req.getEndTime(), "endTime");
        RecurrencePattern pattern = validated(calendar, existing.toBuilder()
                .dayOfWeek(req.getDayOfWeek() == null ? existing.getDayOfWeek() : requireDayOfWeek(req.getDayOfWeek()))
                .startTime(start)
                .endTime(end)
                .note(req.getNote() == null ? existing.getNote() : req.getNote())
                .validFrom(RequestValues.isBlank(req.getStartDate()) ? existing.getValidFrom() : RequestValues.date(req.getStartDate(), "startDate"))
                .validTo(req.getEndDate() == null ? existing.getValidTo() : RequestValues.optionalDate(req.getEndDate(), "endDate"))
                .build());
        recurrenceRepository.update(pattern);
        log.info("Recurrence updated: calendar={}, recurrence={}", calendar.getId(), pattern.getId());
        return toView(pattern);
    }

    public void delete(String token, String participantId, String recurrenceId) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        RecurrencePattern existing = owned(participant, recurrenceId);
        recurrenceRepository.delete(existing.getId());
        log.info("Recurrence deleted: calendar={}, recurrence={}", calendar.getId(), existing.getId());
    }

    public RecurrenceView addException(String token, String participantId, String recurrenceId, RecurrenceExceptionRequest req) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        RecurrencePattern existing = owned(participant, recurrenceId);
        LocalDate date = RequestValues.date(req.getExcludedDate(), "excludedDate");
        recurrenceRepository.addException(existing.getId(), date);
        log.info("Recurrence exception added: recurrence={}, date={}", existing.getId(), date);
        return toView(existing.toBuilder().exceptionDate(date).build());
    }

    public void removeException(String token, String participantId, String recurrenceId, String dateValue) {
        CalendarConfig calendar = calendarAccess.byPublicToken(token);
        Participant participant = calendarAccess.participant(calendar, participantId);
        RecurrencePattern existing = owned(participant, recurrenceId);
        LocalDate date = RequestValues.date(dateValue, "date");
        recurrenceRepository.removeException(existing.getId(), date);
        log.info("Recurrence exception removed: recurrence={}, date={}", existing.getId(), date);
    }

    private RecurrencePattern validated(CalendarConfig calendar, RecurrencePattern pattern) {
        if (!DateEligibility.isWeekdayAllowed(pattern.getDayOfWeek(), calendar.getAllowedWeekdays())) {
            throw new ValidationException("day of week is not allowed for this calendar");
        }
        if (pattern.getValidTo() != null && pattern.getValidTo().isBefore(pattern.getValidFrom())) {
            throw new ValidationException("endDate must not be before startDate");
        }
        TimeRange range = WindowRules.normalize(pattern.getStartTime(), pattern.getEndTime());
        range = allowedHours.clamp(range, allowedHours.rangeForWeekday(pattern.getDayOfWeek(), calendar));
        WindowRules.requireNonEmpty(range);
        WindowRules.requireMinDuration(range, calendar.getMinDurationHours());
        requireNoOverlap(pattern);
        return pattern.toBuilder().startTime(range.getStart()).endTime(range.getEnd()).build();
    }

    // Two recurrences of one participant on the same weekday must not have overlapping validity.
    private void requireNoOverlap(RecurrencePattern candidate) {
        for (RecurrencePattern other : recurrenceRepository.findByParticipant(candidate.getParticipantId())) {
            if (other.getId().equals(candidate.getId()) || other.getDayOfWeek() != candidate.getDayOfWeek()) continue;
            if (validityOverlaps(candidate, other)) {
                throw new ConflictException("an overlapping recurrence already exists for this day of week");
            }
        }
    }

    static boolean validityOverlaps(RecurrencePattern a, RecurrencePattern b) {
        boolean aStartsBeforeBEnds = b.getValidTo() == null || !a.getValidFrom().isAfter(b.getValidTo());
        boolean bStartsBeforeAEnds = a.getValidTo() == null || !b.getValidFrom().isAfter(a.getValidTo());
        return aStartsBeforeBEnds && bStartsBeforeAEnds;
    }

    private RecurrencePattern owned(Participant participant, String recurrenceId) {
        UUID id = RequestValues.uuid(recurrenceId, "recurrence id");
        return recurrenceRepository.findById(id)
                .filter(r -> r.getParticipantId().equals(participant.getId()))
                .orElseThrow(() -> new NotFoundException("recurrence not found"));
    }

    private static int requireDayOfWeek(Integer dayOfWeek) {
        if (dayOfWeek == null || dayOfWeek < 0 || dayOfWeek > 6) {
            throw new ValidationException("dayOfWeek must be between 0 (Sunday) and 6 (Saturday)");
        }
        return dayOfWeek;
    }

    static RecurrenceView toView(RecurrencePattern p) {
        return new RecurrenceView(p.getId(), p.getParticipantId(), p.getDayOfWeek(),
                TimeOfDayUtils.formatTime(p.getStartTime()), TimeOfDayUtils.formatTime(p.getEndTime()),
                p.getNote(),
                p.getValidFrom() == null ? null : p.getValidFrom().toString(),
                p.getValidTo() == null ? null : p.getValidTo().toString(),
                p.getExceptionDates().stream().sorted().map(LocalDate::toString).collect(Collectors.toList()));
    }
}
