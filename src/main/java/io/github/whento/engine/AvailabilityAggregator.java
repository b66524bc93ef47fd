package io.github.whento.engine;

import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.RecurrencePattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Computes the single effective window of each participant on a date. A manual entry replaces the
 * participant's recurring occurrence for that date. A stored pattern that cannot be expanded is
 * skipped with a warning; it never hides other participants' data.
 */
@Slf4j
@Component
public class AvailabilityAggregator {
    private final RecurrenceExpander expander;

    public AvailabilityAggregator(RecurrenceExpander expander) {
        this.expander = expander;
    }

    /**
     * Effective windows keyed by participant, in the order of {@code participants}. Participants
     * without availability on the date are absent.
     */
    public Map<Participant, AvailabilityWindow> forDate(AvailabilitySnapshot snapshot, LocalDate date,
                                                       Collection<Participant> participants) {
        Map<UUID, AvailabilityWindow> manual = new HashMap<>();
        for (AvailabilityWindow w : snapshot.getManualWindows()) {
            if (w.isManual() && date.equals(w.getDate())) manual.putIfAbsent(w.getParticipantId(), w);
        }
        Map<UUID, AvailabilityWindow> recurring = new HashMap<>();
        for (RecurrencePattern p : snapshot.getRecurrences()) {
            if (recurring.containsKey(p.getParticipantId())) continue;
            AvailabilityWindow w;
            try {
                w = expander.occurrenceOn(p, date);
            } catch (IllegalArgumentException | DateTimeException e) {
                log.warn("Skipping recurrence {} on {}: {}", p.getId(), date, e.getMessage());
                continue;
            }
            if (w != null) recurring.put(p.getParticipantId(), w);
        }

        Map<Participant, AvailabilityWindow> result = new LinkedHashMap<>();
        for (Participant participant : participants) {
            AvailabilityWindow w = manual.get(participant.getId());
            if (w == null) w = recurring.get(participant.getId());
            if (w != null) result.put(participant, w);
        }
        return result;
    }

    /** Every date in [from, to] on which at least one window exists, manual or recurring. */
    public NavigableSet<LocalDate> datesWithAvailability(AvailabilitySnapshot snapshot, LocalDate from, LocalDate to) {
        NavigableSet<LocalDate> dates = new TreeSet<>();
        for (AvailabilityWindow w : snapshot.getManualWindows()) {
            if (!w.isManual() || w.getDate() == null) continue;
            if (!w.getDate().isBefore(from) && !w.getDate().isAfter(to)) dates.add(w.getDate());
        }
        for (RecurrencePattern p : snapshot.getRecurrences()) {
            // collected per pattern so a failure midway adds nothing from that pattern
            NavigableSet<LocalDate> occurrences = new TreeSet<>();
            try {
                for (AvailabilityWindow w : expander.expand(p, from, to)) {
                    occurrences.add(w.getDate());
                }
            } catch (IllegalArgumentException | DateTimeException e) {
                log.warn("Skipping recurrence {} for {}..{}: {}", p.getId(), from, to, e.getMessage());
                continue;
            }
            dates.addAll(occurrences);
        }
        return dates;
    }
}
