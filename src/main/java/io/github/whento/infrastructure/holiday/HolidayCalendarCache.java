package io.github.whento.infrastructure.holiday;

import de.focus_shift.jollyday.core.HolidayCalendar;
import de.focus_shift.jollyday.core.HolidayManager;
import de.focus_shift.jollyday.core.ManagerParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Read-through cache of holiday managers keyed by ISO country code. Countries without holiday data
 * are cached as empty so they are looked up only once.
 */
@Slf4j
@Component
public class HolidayCalendarCache {
    private final ConcurrentMap<String, Optional<HolidayManager>> managers = new ConcurrentHashMap<>();

    public Optional<HolidayManager> forCountry(String countryCode) {
        return managers.computeIfAbsent(countryCode, this::load);
    }

    int size() {
        return managers.size();
    }

    private Optional<HolidayManager> load(String countryCode) {
        for (HolidayCalendar calendar : HolidayCalendar.values()) {
            if (calendar.getId().equalsIgnoreCase(countryCode)) {
                try {
                    return Optional.of(HolidayManager.getInstance(ManagerParameters.create(calendar)));
                } catch (RuntimeException e) {
                    log.warn("Holiday calendar for {} could not be loaded; holidays ignored", countryCode, e);
                    return Optional.empty();
                }
            }
        }
        log.warn("No holiday calendar for country {}; holidays ignored", countryCode);
        return Optional.empty();
    }
}
