package io.github.whento.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Ensures the tables this service reads and writes exist. Calendars and participants are owned by
 * the calendar-management side; they are created here only so a fresh database is usable.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "whento.schema.init", havingValue = "true", matchIfMissing = true)
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            jdbc.execute("CREATE TABLE IF NOT EXISTS calendars (" +
                    "id UUID PRIMARY KEY, " +
                    "name VARCHAR(200) NOT NULL, " +
                    "description TEXT, " +
                    "public_token VARCHAR(64) UNIQUE NOT NULL, " +
                    "ics_token VARCHAR(64) UNIQUE NOT NULL, " +
                    "threshold INTEGER DEFAULT 1 CHECK (threshold >= 1), " +
                    "allowed_weekdays INTEGER[] DEFAULT '{0,1,2,3,4,5,6}', " +
                    "min_duration_hours INTEGER DEFAULT 0 CHECK (min_duration_hours >= 0), " +
                    "timezone VARCHAR(50) DEFAULT 'Europe/Paris', " +
                    "holidays_policy VARCHAR(6) DEFAULT 'ignore' CHECK (holidays_policy IN ('ignore', 'allow', 'block')), " +
                    "allow_holiday_eves BOOLEAN DEFAULT false, " +
                    "allowed_hours JSONB, " +
                    "lock_participants BOOLEAN DEFAULT false, " +
                    "start_date DATE, " +
                    "end_date DATE, " +
                    "created_at TIMESTAMPTZ DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS participants (" +
                    "id UUID PRIMARY KEY, " +
                    "calendar_id UUID NOT NULL REFERENCES calendars(id) ON DELETE CASCADE, " +
                    "name VARCHAR(100) NOT NULL, " +
                    "created_at TIMESTAMPTZ DEFAULT now(), " +
                    "UNIQUE (calendar_id, name)" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS recurrences (" +
                    "id UUID PRIMARY KEY, " +
                    "participant_id UUID NOT NULL REFERENCES participants(id) ON DELETE CASCADE, " +
                    "day_of_week INTEGER NOT NULL CHECK (day_of_week BETWEEN 0 AND 6), " +
                    "start_time TIME, " +
                    "end_time TIME, " +
                    "note TEXT, " +
                    "start_date DATE NOT NULL, " +
                    "end_date DATE, " +
                    "created_at TIMESTAMPTZ DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS availabilities (" +
                    "id UUID PRIMARY KEY, " +
                    "participant_id UUID NOT NULL REFERENCES participants(id) ON DELETE CASCADE, " +
                    "date DATE NOT NULL, " +
                    "start_time TIME, " +
                    "end_time TIME, " +
                    "note TEXT, " +
                    "source VARCHAR(20) DEFAULT 'manual' CHECK (source IN ('manual', 'recurrence')), " +
                    "recurrence_id UUID REFERENCES recurrences(id) ON DELETE SET NULL, " +
                    "created_at TIMESTAMPTZ DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ DEFAULT now(), " +
                    "UNIQUE (participant_id, date)" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS recurrence_exceptions (" +
                    "id UUID PRIMARY KEY, " +
                    "recurrence_id UUID NOT NULL REFERENCES recurrences(id) ON DELETE CASCADE, " +
                    "excluded_date DATE NOT NULL, " +
                    "created_at TIMESTAMPTZ DEFAULT now(), " +
                    "UNIQUE (recurrence_id, excluded_date)" +
                    ")");

            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_participants_calendar ON participants(calendar_id)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_availabilities_date ON availabilities(date)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_recurrences_participant ON recurrences(participant_id)");

            log.info("Schema checked/initialized: calendars, participants, recurrences, availabilities, recurrence_exceptions ensured.");
        } catch (Exception e) {
            log.warn("Schema initialization failed: {}", e.getMessage());
        }
    }
}
