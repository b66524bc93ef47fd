package io.github.whento.infrastructure.holiday;

import com.ibm.icu.util.TimeZone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps an IANA timezone id to the country it belongs to, using ICU's zone metadata.
 */
@Slf4j
@Component
public class TimezoneCountryResolver {

    public Optional<String> countryFor(String timezone) {
        if (timezone == null || timezone.isBlank()) return Optional.empty();
        String region;
        try {
            region = TimeZone.getRegion(timezone.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Unknown timezone id {}", timezone);
            return Optional.empty();
        }
        // "001" and other numeric codes denote a world region rather than a country
        if (region == null || region.length() != 2 || !Character.isLetter(region.charAt(0))) {
            return Optional.empty();
        }
        return Optional.of(region.toUpperCase(Locale.ROOT));
    }
}
