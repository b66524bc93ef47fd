package io.github.whento.infrastructure.repository;

import io.github.whento.application.repository.ParticipantRepository;
import io.github.whento.domain.model.Participant;
import io.github.whento.infrastructure.mapper.ParticipantMapper;
import io.github.whento.infrastructure.persistence.entity.ParticipantRecord;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
public class ParticipantRepositoryImpl implements ParticipantRepository {
    private final ParticipantMapper mapper;

    public ParticipantRepositoryImpl(ParticipantMapper mapper) { this.mapper = mapper; }

    @Override
    public List<Participant> findByCalendar(UUID calendarId) {
        return mapper.selectByCalendar(calendarId).stream()
                .map(r -> Participant.of(r.getId(), r.getName()))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Participant> findInCalendar(UUID calendarId, UUID participantId) {
        ParticipantRecord r = mapper.selectById(participantId);
        if (r == null || !calendarId.equals(r.getCalendarId())) return Optional.empty();
        return Optional.of(Participant.of(r.getId(), r.getName()));
    }
}
