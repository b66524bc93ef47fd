package io.github.whento.application.service;

import io.github.whento.application.exception.NotFoundException;
import io.github.whento.application.repository.CalendarRepository;
import io.github.whento.application.repository.ParticipantRepository;
import io.github.whento.application.util.RequestValues;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.Participant;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;

/** Resolves public tokens and participant ids, and the calendar-local "today". */
@Service
public class CalendarAccessService {
    private final CalendarRepository calendarRepository;
    private final ParticipantRepository participantRepository;
    private final Clock clock;

    public CalendarAccessService(CalendarRepository calendarRepository,
                                 ParticipantRepository participantRepository,
                                 Clock clock) {
        this.calendarRepository = calendarRepository;
        this.participantRepository = participantRepository;
        this.clock = clock;
    }

    public CalendarConfig byPublicToken(String token) {
        return calendarRepository.findByPublicToken(token)
                .orElseThrow(() -> new NotFoundException("calendar not found"));
    }

    public CalendarConfig byIcsToken(String token) {
        return calendarRepository.findByIcsToken(token)
                .orElseThrow(() -> new NotFoundException("calendar not found"));
    }

    public Participant participant(CalendarConfig calendar, String participantId) {
        return participantRepository.findInCalendar(calendar.getId(), RequestValues.uuid(participantId, "participant id"))
                .orElseThrow(() -> new NotFoundException("participant not found"));
    }

    public LocalDate today(CalendarConfig calendar) {
        try {
            return LocalDate.now(clock.withZone(ZoneId.of(calendar.getTimezone())));
        } catch (DateTimeException e) {
            return LocalDate.now(clock);
        }
    }
}
