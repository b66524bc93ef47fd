package io.github.whento.application.service;

import io.github.whento.application.exception.NotFoundException;
import io.github.whento.application.repository.AvailabilityRepository;
import io.github.whento.application.repository.CalendarRepository;
import io.github.whento.application.repository.ParticipantRepository;
import io.github.whento.application.repository.RecurrenceRepository;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.RecurrencePattern;
import io.github.whento.engine.AvailabilityAggregator;
import io.github.whento.engine.AvailabilitySnapshot;
import io.github.whento.engine.DateEligibility;
import io.github.whento.engine.HolidayLookup;
import io.github.whento.engine.IcsFeedRenderer;
import io.github.whento.engine.QuorumSlotResolver;
import io.github.whento.engine.RecurrenceExpander;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IcsFeedServiceTest {
    private static final String ICS_TOKEN = "ics-token";

    private final Participant alice = Participant.of(UUID.randomUUID(), "Alice");
    private final Participant bob = Participant.of(UUID.randomUUID(), "Bob");

    private final CalendarRepository calendarRepository = mock(CalendarRepository.class);
    private final ParticipantRepository participantRepository = mock(ParticipantRepository.class);
    private final AvailabilityRepository availabilityRepository = mock(AvailabilityRepository.class);
    private final RecurrenceRepository recurrenceRepository = mock(RecurrenceRepository.class);

    private IcsFeedService service;
    private CalendarConfig calendar;

    @BeforeEach
    void setUp() {
        // today is 2025-06-01
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);
        CalendarAccessService access = new CalendarAccessService(calendarRepository, participantRepository, clock);
        SlotResolutionService slotResolution = new SlotResolutionService(access,
                participantRepository, availabilityRepository, recurrenceRepository,
                new DateEligibility(mock(HolidayLookup.class)),
                new AvailabilityAggregator(new RecurrenceExpander()),
                new QuorumSlotResolver());
        service = new IcsFeedService(access, participantRepository, slotResolution,
                new IcsFeedRenderer(clock), Period.ofYears(1));

        calendar = CalendarConfig.builder()
                .id(UUID.randomUUID())
                .name("Band practice")
                .timezone("Asia/Tokyo")
                .threshold(2)
                .allowedWeekday(0)
                .build();
        when(calendarRepository.findByIcsToken(ICS_TOKEN)).thenReturn(Optional.of(calendar));
        when(participantRepository.findByCalendar(calendar.getId())).thenReturn(List.of(alice, bob));
    }

    private static AvailabilityWindow window(Participant p, LocalDate date, String start, String end) {
        return AvailabilityWindow.builder().participantId(p.getId()).date(date)
                .startTime(LocalTime.parse(start)).endTime(LocalTime.parse(end)).build();
    }

    private static RecurrencePattern sundays(Participant p, LocalDate from, LocalDate to) {
        return RecurrencePattern.builder().id(UUID.randomUUID()).participantId(p.getId())
                .dayOfWeek(0).validFrom(from).validTo(to).build();
    }

    @Test
    void feed_rendersQuorumSlotsAsFloatingEvents() {
        LocalDate sunday = LocalDate.of(2025, 6, 15);
        when(availabilityRepository.findByCalendar(eq(calendar.getId()), any(), any())).thenReturn(List.of(
                window(alice, sunday, "09:00", "13:00"),
                window(bob, sunday, "10:00", "12:00")));

        String ics = service.feed(ICS_TOKEN, "whento.example").replace("\r\n ", "");

        assertThat(ics).contains("X-WR-TIMEZONE:Asia/Tokyo");
        assertThat(ics).contains("DTSTART:20250615T100000");
        assertThat(ics).contains("DTEND:20250615T120000");
        assertThat(ics).contains("UID:20250615-whento-" + calendar.getId() + "@whento.example");
        assertThat(ics).contains("SUMMARY:Band practice #1");
    }

    @Test
    void feed_withoutAvailability_isEmptyCalendar() {
        String ics = service.feed(ICS_TOKEN, "whento.example");

        assertThat(ics).contains("BEGIN:VCALENDAR").doesNotContain("BEGIN:VEVENT");
    }

    @Test
    void feed_unknownToken_isNotFound() {
        assertThatThrownBy(() -> service.feed("nope", "h")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void feedRange_spansManualEntriesAndRecurrences() {
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
                .manualWindow(window(alice, LocalDate.of(2025, 7, 3), "10:00", "11:00"))
                .recurrence(sundays(bob, LocalDate.of(2025, 6, 8), LocalDate.of(2025, 6, 29)))
                .build();

        assertThat(service.feedRange(calendar, snapshot))
                .containsExactly(LocalDate.of(2025, 6, 8), LocalDate.of(2025, 7, 3));
    }

    @Test
    void feedRange_openRecurrenceRunsToHorizon() {
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
                .recurrence(sundays(bob, LocalDate.of(2025, 6, 8), null))
                .build();

        assertThat(service.feedRange(calendar, snapshot))
                .containsExactly(LocalDate.of(2025, 6, 8), LocalDate.of(2026, 6, 1));
    }

    @Test
    void feedRange_clampedToCalendarBounds() {
        CalendarConfig bounded = calendar.toBuilder()
                .startDate(LocalDate.of(2025, 6, 10))
                .endDate(LocalDate.of(2025, 6, 20))
                .build();
        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
                .recurrence(sundays(bob, LocalDate.of(2025, 6, 1), null))
                .build();

        assertThat(service.feedRange(bounded, snapshot))
                .containsExactly(LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 20));
    }

    @Test
    void feedRange_nullWhenNothingStored() {
        assertThat(service.feedRange(calendar, AvailabilitySnapshot.empty())).isNull();
    }
}
