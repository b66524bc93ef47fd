package io.github.whento.infrastructure.repository;

import io.github.whento.application.exception.ConflictException;
import io.github.whento.application.exception.NotFoundException;
import io.github.whento.application.repository.RecurrenceRepository;
import io.github.whento.domain.model.RecurrencePattern;
import io.github.whento.infrastructure.mapper.RecurrenceMapper;
import io.github.whento.infrastructure.persistence.entity.RecurrenceExceptionRecord;
import io.github.whento.infrastructure.persistence.entity.RecurrenceRecord;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
public class RecurrenceRepositoryImpl implements RecurrenceRepository {
    private final RecurrenceMapper mapper;

    public RecurrenceRepositoryImpl(RecurrenceMapper mapper) { this.mapper = mapper; }

    @Override
    public List<RecurrencePattern> findByCalendar(UUID calendarId) {
        Map<UUID, Set<LocalDate>> exceptions = new HashMap<>();
        for (RecurrenceExceptionRecord e : mapper.selectExceptionsByCalendar(calendarId)) {
            exceptions.computeIfAbsent(e.getRecurrenceId(), k -> new HashSet<>()).add(e.getExcludedDate());
        }
        return mapper.selectByCalendar(calendarId).stream()
                .map(r -> toModel(r, exceptions.getOrDefault(r.getId(), Set.of())))
                .collect(Collectors.toList());
    }

    @Override
    public List<RecurrencePattern> findByParticipant(UUID participantId) {
        return mapper.selectByParticipant(participantId).stream()
                .map(r -> toModel(r, exceptionDates(r.getId())))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<RecurrencePattern> findById(UUID id) {
        RecurrenceRecord r = mapper.selectById(id);
        return r == null ? Optional.empty() : Optional.of(toModel(r, exceptionDates(id)));
    }

    @Override
    public void lockParticipant(UUID participantId) {
        if (mapper.lockParticipant(participantId) == null) throw new NotFoundException("Participant not found: " + participantId);
    }

    @Override public void create(RecurrencePattern pattern) { mapper.insert(toRecord(pattern)); }

    @Override
    public void update(RecurrencePattern pattern) {
        if (mapper.update(toRecord(pattern)) == 0) throw new NotFoundException("Recurrence not found: " + pattern.getId());
    }

    @Override
    public void delete(UUID id) {
        if (mapper.deleteById(id) == 0) throw new NotFoundException("Recurrence not found: " + id);
    }

    @Override
    public void addException(UUID recurrenceId, LocalDate date) {
        RecurrenceExceptionRecord row = new RecurrenceExceptionRecord();
        row.setId(UUID.randomUUID());
        row.setRecurrenceId(recurrenceId);
        row.setExcludedDate(date);
        try {
            mapper.insertException(row);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Exception already exists for " + date, e);
        }
    }

    @Override
    public void removeException(UUID recurrenceId, LocalDate date) {
        if (mapper.deleteException(recurrenceId, date) == 0) {
            throw new NotFoundException("No exception on " + date + " for recurrence " + recurrenceId);
        }
    }

    private Set<LocalDate> exceptionDates(UUID recurrenceId) {
        return mapper.selectExceptionsByRecurrence(recurrenceId).stream()
                .map(RecurrenceExceptionRecord::getExcludedDate)
                .collect(Collectors.toSet());
    }

    static RecurrencePattern toModel(RecurrenceRecord r, Collection<LocalDate> exceptionDates) {
        return RecurrencePattern.builder()
                .id(r.getId())
                .participantId(r.getParticipantId())
                .dayOfWeek(r.getDayOfWeek())
                .startTime(r.getStartTime())
                .endTime(r.getEndTime())
                .note(r.getNote())
                .validFrom(r.getStartDate())
                .validTo(r.getEndDate())
                .exceptionDates(exceptionDates)
                .build();
    }

    static RecurrenceRecord toRecord(RecurrencePattern p) {
        RecurrenceRecord r = new RecurrenceRecord();
        r.setId(p.getId());
        r.setParticipantId(p.getParticipantId());
        r.setDayOfWeek(p.getDayOfWeek());
        r.setStartTime(p.getStartTime());
        r.setEndTime(p.getEndTime());
        r.setNote(p.getNote());
        r.setStartDate(p.getValidFrom());
        r.setEndDate(p.getValidTo());
        return r;
    }
}
