package io.github.whento.engine;

import io.github.whento.domain.model.AvailabilitySource;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.RecurrencePattern;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityAggregatorTest {
    private static final LocalDate MONDAY = LocalDate.of(2025, 6, 2);

    private final AvailabilityAggregator aggregator = new AvailabilityAggregator(new RecurrenceExpander());
    private final Participant alice = Participant.of(UUID.randomUUID(), "Alice");
    private final Participant bob = Participant.of(UUID.randomUUID(), "Bob");
    private final Participant carol = Participant.of(UUID.randomUUID(), "Carol");

    private RecurrencePattern mondayEvenings(Participant p) {
        return RecurrencePattern.builder()
                .id(UUID.randomUUID())
                .participantId(p.getId())
                .dayOfWeek(1)
                .startTime(LocalTime.of(18, 0))
                .endTime(LocalTime.of(22, 0))
                .validFrom(LocalDate.of(2025, 1, 1))
                .build();
    }

    @Test
    void manualEntry_replacesRecurringOccurrence() {
        AvailabilityWindow manual = AvailabilityWindow.builder()
                .participantId(alice.getId()).date(MONDAY)
                .startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(10, 0))
                .build();
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
                .manualWindow(manual)
                .recurrence(mondayEvenings(alice))
                .recurrence(mondayEvenings(bob))
                .build();

        Map<Participant, AvailabilityWindow> result = aggregator.forDate(snapshot, MONDAY, List.of(alice, bob, carol));

        assertThat(result).containsOnlyKeys(alice, bob);
        assertThat(result.get(alice)).isSameAs(manual);
        assertThat(result.get(bob).getSource()).isEqualTo(AvailabilitySource.RECURRING);
        assertThat(result.keySet()).containsExactly(alice, bob);
    }

    @Test
    void forDate_emptyWhenNothingApplies() {
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder().recurrence(mondayEvenings(alice)).build();

        assertThat(aggregator.forDate(snapshot, MONDAY.plusDays(1), List.of(alice))).isEmpty();
        assertThat(aggregator.forDate(AvailabilitySnapshot.empty(), MONDAY, List.of(alice))).isEmpty();
    }

    @Test
    void datesWithAvailability_collectsManualAndRecurringDates() {
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
                .manualWindow(AvailabilityWindow.builder().participantId(carol.getId()).date(LocalDate.of(2025, 6, 4)).build())
                .manualWindow(AvailabilityWindow.builder().participantId(carol.getId()).date(LocalDate.of(2025, 7, 1)).build())
                .recurrence(mondayEvenings(alice))
                .build();

        assertThat(aggregator.datesWithAvailability(snapshot, LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 10)))
                .containsExactly(LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 4), LocalDate.of(2025, 6, 9));
    }

    @Test
    void datesWithAvailability_skipsPatternThatCannotExpand() {
        RecurrencePattern broken = mondayEvenings(bob).toBuilder().dayOfWeek(7).build();
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
                .manualWindow(AvailabilityWindow.builder().participantId(carol.getId()).date(LocalDate.of(2025, 6, 4)).build())
                .recurrence(broken)
                .recurrence(mondayEvenings(alice))
                .build();

        assertThat(aggregator.datesWithAvailability(snapshot, LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 8)))
                .containsExactly(LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 4));
        assertThat(aggregator.forDate(snapshot, MONDAY, List.of(alice, bob))).containsOnlyKeys(alice);
    }

    @Test
    void storedRecurringRows_doNotActAsManualEntries() {
        AvailabilityWindow materialized = AvailabilityWindow.builder()
                .participantId(alice.getId()).date(MONDAY)
                .startTime(LocalTime.of(6, 0)).endTime(LocalTime.of(7, 0))
                .source(AvailabilitySource.RECURRING)
                .build();
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
                .manualWindow(materialized)
                .recurrence(mondayEvenings(alice))
                .build();

        AvailabilityWindow effective = aggregator.forDate(snapshot, MONDAY, List.of(alice)).get(alice);

        assertThat(effective.getStartTime()).isEqualTo(LocalTime.of(18, 0));
        assertThat(aggregator.datesWithAvailability(
                AvailabilitySnapshot.builder().manualWindow(materialized).build(), MONDAY, MONDAY)).isEmpty();
    }
}
