package io.github.whento.engine;

import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.ResolvedSlot;
import io.github.whento.domain.model.SlotParticipant;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuorumSlotResolverTest {
    private static final LocalDate DATE = LocalDate.of(2025, 6, 15);

    private final QuorumSlotResolver resolver = new QuorumSlotResolver();
    private final Participant alice = Participant.of(UUID.randomUUID(), "Alice");
    private final Participant bob = Participant.of(UUID.randomUUID(), "Bob");
    private final Participant carol = Participant.of(UUID.randomUUID(), "Carol");

    @Test
    void gapBelowThreshold_splitsDayIntoTwoSlots() {
        Map<Participant, AvailabilityWindow> windows = windows(
                alice, "00:00", "23:59",
                bob, "00:00", "12:00",
                carol, "14:00", "23:59");

        List<ResolvedSlot> slots = resolver.resolve(DATE, windows, 2, 0);

        assertThat(slots).hasSize(2);
        assertThat(slots.get(0).getStart()).isEqualTo(LocalTime.MIDNIGHT);
        assertThat(slots.get(0).getEnd()).isEqualTo(LocalTime.NOON);
        assertThat(slots.get(0).getIndex()).isZero();
        assertThat(names(slots.get(0))).containsExactly("Alice", "Bob");
        assertThat(slots.get(1).getStart()).isEqualTo(LocalTime.of(14, 0));
        assertThat(slots.get(1).getEnd()).isEqualTo(LocalTime.of(23, 59));
        assertThat(slots.get(1).getIndex()).isEqualTo(1);
        assertThat(names(slots.get(1))).containsExactly("Alice", "Carol");
    }

    @Test
    void continuousCoverage_mergesIntoSingleSlot() {
        Map<Participant, AvailabilityWindow> windows = windows(
                alice, "00:00", "23:59",
                bob, "00:00", "12:00",
                carol, "12:00", "23:59");

        List<ResolvedSlot> slots = resolver.resolve(DATE, windows, 2, 0);

        assertThat(slots).hasSize(1);
        ResolvedSlot slot = slots.get(0);
        assertThat(slot.isAllDay()).isTrue();
        assertThat(names(slot)).containsExactly("Alice", "Bob", "Carol");
        assertThat(slot.getFullyCoveringIds()).containsExactly(alice.getId());
    }

    @Test
    void thresholdAboveParticipantCount_yieldsNoSlots() {
        Map<Participant, AvailabilityWindow> windows = windows(alice, "09:00", "17:00", bob, "09:00", "17:00");

        assertThat(resolver.resolve(DATE, windows, 3, 0)).isEmpty();
    }

    @Test
    void noWindows_yieldsNoSlots() {
        assertThat(resolver.resolve(DATE, Map.of(), 1, 0)).isEmpty();
    }

    @Test
    void everySlotHasAtLeastThresholdParticipants() {
        Map<Participant, AvailabilityWindow> windows = windows(
                alice, "08:00", "11:00",
                bob, "10:00", "15:00",
                carol, "14:00", "18:00");

        List<ResolvedSlot> slots = resolver.resolve(DATE, windows, 2, 0);

        assertThat(slots).extracting(ResolvedSlot::getStart).containsExactly(LocalTime.of(10, 0), LocalTime.of(14, 0));
        assertThat(slots).extracting(ResolvedSlot::getEnd).containsExactly(LocalTime.of(11, 0), LocalTime.of(15, 0));
        assertThat(slots).allSatisfy(s -> assertThat(s.getParticipants()).hasSizeGreaterThanOrEqualTo(2));
    }

    @Test
    void shortSlots_areDroppedAndRemainingRenumbered() {
        Map<Participant, AvailabilityWindow> windows = windows(
                alice, "08:00", "20:00",
                bob, "08:00", "09:00",
                carol, "12:00", "16:00");

        List<ResolvedSlot> slots = resolver.resolve(DATE, windows, 2, 2);

        assertThat(slots).hasSize(1);
        assertThat(slots.get(0).getStart()).isEqualTo(LocalTime.NOON);
        assertThat(slots.get(0).getIndex()).isZero();
    }

    @Test
    void allDaySlot_countsAsTwentyFourHours() {
        Map<Participant, AvailabilityWindow> windows = new LinkedHashMap<>();
        windows.put(alice, allDay(alice));

        assertThat(resolver.resolve(DATE, windows, 1, 24)).hasSize(1);
        assertThat(resolver.resolve(DATE, windows, 1, 25)).isEmpty();
    }

    @Test
    void attribution_includesPartialContributors_andMarksFullCover() {
        Map<Participant, AvailabilityWindow> windows = windows(
                alice, "09:00", "18:00",
                bob, "09:00", "12:00",
                carol, "12:00", "18:00");

        ResolvedSlot slot = resolver.resolve(DATE, windows, 2, 0).get(0);

        assertThat(slot.getStart()).isEqualTo(LocalTime.of(9, 0));
        assertThat(slot.getEnd()).isEqualTo(LocalTime.of(18, 0));
        assertThat(slot.getParticipants()).extracting(SlotParticipant::getId)
                .containsExactly(alice.getId(), bob.getId(), carol.getId());
        assertThat(slot.getFullyCoveringIds()).containsExactly(alice.getId());
    }

    @Test
    void resolve_isIdempotent() {
        Map<Participant, AvailabilityWindow> windows = windows(
                alice, "07:30", "19:15",
                bob, "10:00", "12:45",
                carol, "12:45", "22:00");

        assertThat(resolver.resolve(DATE, windows, 2, 1)).isEqualTo(resolver.resolve(DATE, windows, 2, 1));
    }

    @Test
    void maxSimultaneous_countsPeakOverlap() {
        Map<Participant, AvailabilityWindow> windows = windows(
                alice, "08:00", "11:00",
                bob, "10:00", "15:00",
                carol, "10:30", "18:00");

        assertThat(resolver.maxSimultaneous(windows)).isEqualTo(3);
        assertThat(resolver.maxSimultaneous(Map.of())).isZero();
    }

    @Test
    void reversedWindow_isRejected() {
        Map<Participant, AvailabilityWindow> windows = windows(alice, "18:00", "09:00");

        assertThatThrownBy(() -> resolver.resolve(DATE, windows, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<String> names(ResolvedSlot slot) {
        return slot.getParticipants().stream().map(SlotParticipant::getName).toList();
    }

    private static AvailabilityWindow allDay(Participant p) {
        return AvailabilityWindow.builder().participantId(p.getId()).date(DATE).build();
    }

    // Alternating participant, start, end triples.
    private static Map<Participant, AvailabilityWindow> windows(Object... entries) {
        Map<Participant, AvailabilityWindow> map = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i += 3) {
            Participant p = (Participant) entries[i];
            map.put(p, AvailabilityWindow.builder()
                    .participantId(p.getId())
                    .date(DATE)
                    .startTime(LocalTime.parse((String) entries[i + 1]))
                    .endTime(LocalTime.parse((String) entries[i + 2]))
                    .build());
        }
        return map;
    }
}
