package io.github.whento.engine;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of public-holiday data for date eligibility. Implementations must be deterministic for a
 * given (date, country) pair.
 */
public interface HolidayLookup {

    /**
     * Resolves the ISO 3166 country code a timezone belongs to, or empty when the timezone is
     * unknown or not tied to a single country.
     */
    Optional<String> countryForTimezone(String timezone);

    boolean isHoliday(LocalDate date, String countryCode);
}
