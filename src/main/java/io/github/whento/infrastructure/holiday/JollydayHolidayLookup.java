package io.github.whento.infrastructure.holiday;

import io.github.whento.engine.HolidayLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JollydayHolidayLookup implements HolidayLookup {
    private final TimezoneCountryResolver countryResolver;
    private final HolidayCalendarCache cache;

    @Override
    public Optional<String> countryForTimezone(String timezone) {
        return countryResolver.countryFor(timezone);
    }

    @Override
    public boolean isHoliday(LocalDate date, String countryCode) {
        if (countryCode == null) return false;
        return cache.forCountry(countryCode)
                .map(m -> m.isHoliday(date))
                .orElse(false);
    }
}
