package io.github.whento.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.UUID;

public class RecurrenceExceptionRecord implements Serializable {
    private UUID id;
    private UUID recurrenceId;
    private LocalDate excludedDate;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public UUID getRecurrenceId() { return recurrenceId; }
    public void setRecurrenceId(UUID recurrenceId) { this.recurrenceId = recurrenceId; }
    public LocalDate getExcludedDate() { return excludedDate; }
    public void setExcludedDate(LocalDate excludedDate) { this.excludedDate = excludedDate; }
}
