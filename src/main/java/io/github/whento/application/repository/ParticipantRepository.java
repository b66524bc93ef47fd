package io.github.whento.application.repository;

import io.github.whento.domain.model.Participant;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ParticipantRepository {
    List<Participant> findByCalendar(UUID calendarId);

    /** Empty when the participant does not exist or belongs to another calendar. */
    Optional<Participant> findInCalendar(UUID calendarId, UUID participantId);
}
