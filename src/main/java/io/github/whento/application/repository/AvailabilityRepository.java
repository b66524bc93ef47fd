package io.github.whento.application.repository;

import io.github.whento.domain.model.AvailabilityWindow;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Manual availability entries. Date bounds are inclusive and optional. */
public interface AvailabilityRepository {
    List<AvailabilityWindow> findByCalendar(UUID calendarId, LocalDate from, LocalDate to);
    List<AvailabilityWindow> findByParticipant(UUID participantId, LocalDate from, LocalDate to);
    Optional<AvailabilityWindow> find(UUID participantId, LocalDate date);

    /** @throws io.github.whento.application.exception.ConflictException when an entry already exists for the date */
    void create(AvailabilityWindow window);

    /** @throws io.github.whento.application.exception.NotFoundException when no entry exists for the date */
    void update(AvailabilityWindow window);

    /** @throws io.github.whento.application.exception.NotFoundException when no entry exists for the date */
    void delete(UUID participantId, LocalDate date);
}
