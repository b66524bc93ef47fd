package io.github.whento.application.repository;

import io.github.whento.domain.model.RecurrencePattern;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Weekly recurrences. Every returned pattern carries its exception dates. */
public interface RecurrenceRepository {
    List<RecurrencePattern> findByCalendar(UUID calendarId);
    List<RecurrencePattern> findByParticipant(UUID participantId);
    Optional<RecurrencePattern> findById(UUID id);
    /**
     * Row-locks the participant until the surrounding transaction ends, so overlap checks and the
     * following write for that participant run one at a time.
     */
    void lockParticipant(UUID participantId);
    void create(RecurrencePattern pattern);
    void update(RecurrencePattern pattern);
    void delete(UUID id);
    void addException(UUID recurrenceId, LocalDate date);
    void removeException(UUID recurrenceId, LocalDate date);
}
