package io.github.whento.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

public class AvailabilityRecord implements Serializable {
    private UUID id;
    private UUID participantId;
    private LocalDate date;
    private LocalTime startTime;
    private LocalTime endTime;
    private String note;
    private String source;
    private UUID recurrenceId;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public UUID getParticipantId() { return participantId; }
    public void setParticipantId(UUID participantId) { this.participantId = participantId; }
    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public LocalTime getEndTime() { return endTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public UUID getRecurrenceId() { return recurrenceId; }
    public void setRecurrenceId(UUID recurrenceId) { this.recurrenceId = recurrenceId; }
}
