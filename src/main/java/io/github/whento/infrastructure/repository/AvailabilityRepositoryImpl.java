package io.github.whento.infrastructure.repository;

import io.github.whento.application.exception.ConflictException;
import io.github.whento.application.exception.NotFoundException;
import io.github.whento.application.repository.AvailabilityRepository;
import io.github.whento.domain.model.AvailabilitySource;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.infrastructure.mapper.AvailabilityMapper;
import io.github.whento.infrastructure.persistence.entity.AvailabilityRecord;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
public class AvailabilityRepositoryImpl implements AvailabilityRepository {
    private final AvailabilityMapper mapper;

    public AvailabilityRepositoryImpl(AvailabilityMapper mapper) { this.mapper = mapper; }

    @Override
    public List<AvailabilityWindow> findByCalendar(UUID calendarId, LocalDate from, LocalDate to) {
        return mapper.selectByCalendar(calendarId, from, to).stream().map(AvailabilityRepositoryImpl::toModel).collect(Collectors.toList());
    }

    @Override
    public List<AvailabilityWindow> findByParticipant(UUID participantId, LocalDate from, LocalDate to) {
        return mapper.selectByParticipant(participantId, from, to).stream().map(AvailabilityRepositoryImpl::toModel).collect(Collectors.toList());
    }

    @Override
    public Optional<AvailabilityWindow> find(UUID participantId, LocalDate date) {
        return Optional.ofNullable(mapper.selectByParticipantAndDate(participantId, date)).map(AvailabilityRepositoryImpl::toModel);
    }

    @Override
    public void create(AvailabilityWindow window) {
        AvailabilityRecord row = toRecord(window);
        row.setId(UUID.randomUUID());
        try {
            mapper.insert(row);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Availability already exists for " + window.getDate(), e);
        }
    }

    @Override
    public void update(AvailabilityWindow window) {
        if (mapper.update(toRecord(window)) == 0) {
            throw new NotFoundException("Availability not found for " + window.getDate());
        }
    }

    @Override
    public void delete(UUID participantId, LocalDate date) {
        if (mapper.delete(participantId, date) == 0) {
            throw new NotFoundException("Availability not found for " + date);
        }
    }

    static AvailabilityWindow toModel(AvailabilityRecord r) {
        return AvailabilityWindow.builder()
                .participantId(r.getParticipantId())
                .date(r.getDate())
                .startTime(r.getStartTime())
                .endTime(r.getEndTime())
                .note(r.getNote())
                .source(AvailabilitySource.fromValue(r.getSource()))
                .recurrenceId(r.getRecurrenceId())
                .build();
    }

    static AvailabilityRecord toRecord(AvailabilityWindow w) {
        AvailabilityRecord r = new AvailabilityRecord();
        r.setParticipantId(w.getParticipantId());
        r.setDate(w.getDate());
        r.setStartTime(w.getStartTime());
        r.setEndTime(w.getEndTime());
        r.setNote(w.getNote());
        r.setSource(w.getSource().getValue());
        r.setRecurrenceId(w.getRecurrenceId());
        return r;
    }
}
