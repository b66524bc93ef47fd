package io.github.whento.infrastructure.persistence.entity;

import java.io.Serializable;
import java.util.UUID;

public class ParticipantRecord implements Serializable {
    private UUID id;
    private UUID calendarId;
    private String name;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public UUID getCalendarId() { return calendarId; }
    public void setCalendarId(UUID calendarId) { this.calendarId = calendarId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
