package io.github.whento.engine;

import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.ResolvedSlot;
import io.github.whento.domain.model.SlotParticipant;
import net.fortuna.ical4j.data.CalendarOutputter;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.parameter.Cn;
import net.fortuna.ical4j.model.parameter.CuType;
import net.fortuna.ical4j.model.parameter.PartStat;
import net.fortuna.ical4j.model.parameter.Role;
import net.fortuna.ical4j.model.property.Attendee;
import net.fortuna.ical4j.model.property.Description;
import net.fortuna.ical4j.model.property.DtEnd;
import net.fortuna.ical4j.model.property.DtStamp;
import net.fortuna.ical4j.model.property.DtStart;
import net.fortuna.ical4j.model.property.ProdId;
import net.fortuna.ical4j.model.property.Summary;
import net.fortuna.ical4j.model.property.Uid;
import net.fortuna.ical4j.model.property.XProperty;
import net.fortuna.ical4j.model.property.immutable.ImmutableCalScale;
import net.fortuna.ical4j.model.property.immutable.ImmutableMethod;
import net.fortuna.ical4j.model.property.immutable.ImmutableStatus;
import net.fortuna.ical4j.model.property.immutable.ImmutableVersion;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.zone.ZoneRulesProvider;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Renders resolved slots as an RFC 5545 feed.
 *
 * <p>Times are floating (no TZID, no UTC suffix) and {@code X-WR-TIMEZONE} hints the calendar's
 * zone. UIDs depend only on the calendar, the date and the slot index, so refetching a feed updates
 * events in place. Events are numbered once per date that has at least one slot.
 */
@Component
public class IcsFeedRenderer {
    public static final String DEFAULT_PRODUCT_ID = "-//WhenTo//WhenTo Calendar//EN";
    public static final String DEFAULT_ATTENDEE_ADDRESS = "noreply@whento.be";
    private static final DateTimeFormatter UID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    static {
        // ical4j registers its own ZoneRulesProvider, whose constructor reads ical4j's Configurator.
        // The JDK provider registry must be up before Configurator initializes or that read sees a
        // half-built Configurator.
        ZoneRulesProvider.getAvailableZoneIds();
    }

    private final Clock clock;
    private final String productId;
    private final URI attendeeAddress;

    @Autowired
    public IcsFeedRenderer(Clock clock,
                           @Value("${whento.feed.product-id:" + DEFAULT_PRODUCT_ID + "}") String productId,
                           @Value("${whento.feed.attendee-address:" + DEFAULT_ATTENDEE_ADDRESS + "}") String attendeeAddress) {
        this.clock = clock;
        this.productId = productId;
        this.attendeeAddress = URI.create("mailto:" + attendeeAddress);
    }

    public IcsFeedRenderer(Clock clock) {
        this(clock, DEFAULT_PRODUCT_ID, DEFAULT_ATTENDEE_ADDRESS);
    }

    public String render(CalendarConfig calendar, NavigableMap<LocalDate, List<ResolvedSlot>> slotsByDate, String host) {
        Calendar ical = new Calendar();
        ical.add(new ProdId(productId));
        ical.add(ImmutableVersion.VERSION_2_0);
        ical.add(ImmutableCalScale.GREGORIAN);
        ical.add(ImmutableMethod.PUBLISH);
        ical.add(new XProperty("X-WR-CALNAME", calendar.getName()));
        ical.add(new XProperty("X-WR-TIMEZONE", calendar.getTimezone()));
        ical.add(new XProperty("X-PUBLISHED-TTL", "PT1H"));

        int eventNumber = 0;
        for (Map.Entry<LocalDate, List<ResolvedSlot>> e : slotsByDate.entrySet()) {
            if (e.getValue().isEmpty()) continue;
            eventNumber++;
            for (ResolvedSlot slot : e.getValue()) {
                ical.add(toEvent(calendar, slot, eventNumber, host));
            }
        }

        StringWriter out = new StringWriter();
        try {
            new CalendarOutputter(false).output(ical, out);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write iCalendar feed for calendar " + calendar.getId(), ex);
        }
        return out.toString();
    }

    private VEvent toEvent(CalendarConfig calendar, ResolvedSlot slot, int eventNumber, String host) {
        VEvent event = new VEvent();
        event.add(new Uid(uid(calendar, slot, host)));
        event.add(new DtStamp(clock.instant()));
        event.add(ImmutableStatus.VEVENT_CONFIRMED);
        event.add(new Summary(calendar.getName() + " #" + eventNumber));
        event.add(new Description(describe(calendar, slot)));

        if (slot.isAllDay()) {
            // LocalDate values render as VALUE=DATE
            event.add(new DtStart<>(slot.getDate()));
            event.add(new DtEnd<>(slot.getDate().plusDays(1)));
        } else {
            event.add(new DtStart<>(LocalDateTime.of(slot.getDate(), slot.getStart())));
            event.add(new DtEnd<>(LocalDateTime.of(slot.getDate(), slot.getEnd())));
        }

        for (SlotParticipant p : slot.getParticipants()) {
            Attendee attendee = new Attendee(attendeeAddress);
            attendee.add(new Cn(p.getName()));
            attendee.add(Role.REQ_PARTICIPANT);
            attendee.add(PartStat.ACCEPTED);
            attendee.add(CuType.INDIVIDUAL);
            event.add(attendee);
        }
        return event;
    }

    /** {@code yyyyMMdd[-index]-whento-{calendarId}@host}; the index is omitted for the first slot of a date. */
    public static String uid(CalendarConfig calendar, ResolvedSlot slot, String host) {
        String date = slot.getDate().format(UID_DATE);
        String suffix = slot.getIndex() > 0 ? "-" + slot.getIndex() : "";
        return date + suffix + "-whento-" + calendar.getId() + "@" + host;
    }

    static String describe(CalendarConfig calendar, ResolvedSlot slot) {
        StringBuilder sb = new StringBuilder("Available participants:\n");
        for (SlotParticipant p : slot.getParticipants()) {
            sb.append("- ").append(p.getName());
            int start = TimeOfDayUtils.startMinutes(p.getStartTime());
            int end = TimeOfDayUtils.endMinutes(p.getEndTime());
            if (start != 0 || end != TimeOfDayUtils.LAST_MINUTE) {
                sb.append(" (").append(TimeOfDayUtils.formatTime(TimeOfDayUtils.fromMinutes(start)))
                        .append('-').append(TimeOfDayUtils.formatTime(TimeOfDayUtils.fromMinutes(end))).append(')');
            }
            if (p.getNote() != null && !p.getNote().isBlank()) {
                sb.append(": ").append(p.getNote());
            }
            sb.append('\n');
        }
        if (calendar.getDescription() != null && !calendar.getDescription().isBlank()) {
            sb.append("\n---\n").append(calendar.getDescription());
        }
        return sb.toString();
    }
}
