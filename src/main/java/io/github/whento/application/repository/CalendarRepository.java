package io.github.whento.application.repository;

import io.github.whento.domain.model.CalendarConfig;

import java.util.Optional;

/** Read-only access to calendars; they are created and edited elsewhere. */
public interface CalendarRepository {
    Optional<CalendarConfig> findByPublicToken(String token);
    Optional<CalendarConfig> findByIcsToken(String token);
}
