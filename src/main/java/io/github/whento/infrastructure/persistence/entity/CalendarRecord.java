package io.github.whento.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Row of {@code calendars}. {@code allowedWeekdays} is read as a comma-separated list and
 * {@code allowedHours} as JSON text.
 */
public class CalendarRecord implements Serializable {
    private UUID id;
    private String name;
    private String description;
    private String publicToken;
    private String icsToken;
    private Integer threshold;
    private String allowedWeekdays;
    private Integer minDurationHours;
    private String timezone;
    private String holidaysPolicy;
    private Boolean allowHolidayEves;
    private String allowedHours;
    private Boolean lockParticipants;
    private LocalDate startDate;
    private LocalDate endDate;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getPublicToken() { return publicToken; }
    public void setPublicToken(String publicToken) { this.publicToken = publicToken; }
    public String getIcsToken() { return icsToken; }
    public void setIcsToken(String icsToken) { this.icsToken = icsToken; }
    public Integer getThreshold() { return threshold; }
    public void setThreshold(Integer threshold) { this.threshold = threshold; }
    public String getAllowedWeekdays() { return allowedWeekdays; }
    public void setAllowedWeekdays(String allowedWeekdays) { this.allowedWeekdays = allowedWeekdays; }
    public Integer getMinDurationHours() { return minDurationHours; }
    public void setMinDurationHours(Integer minDurationHours) { this.minDurationHours = minDurationHours; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public String getHolidaysPolicy() { return holidaysPolicy; }
    public void setHolidaysPolicy(String holidaysPolicy) { this.holidaysPolicy = holidaysPolicy; }
    public Boolean getAllowHolidayEves() { return allowHolidayEves; }
    public void setAllowHolidayEves(Boolean allowHolidayEves) { this.allowHolidayEves = allowHolidayEves; }
    public String getAllowedHours() { return allowedHours; }
    public void setAllowedHours(String allowedHours) { this.allowedHours = allowedHours; }
    public Boolean getLockParticipants() { return lockParticipants; }
    public void setLockParticipants(Boolean lockParticipants) { this.lockParticipants = lockParticipants; }
    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }
    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }
}
