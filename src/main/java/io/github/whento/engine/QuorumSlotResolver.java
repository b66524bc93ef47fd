package io.github.whento.engine;

import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.AvailabilityWindow;
import io.github.whento.domain.model.Participant;
import io.github.whento.domain.model.ResolvedSlot;
import io.github.whento.domain.model.SlotParticipant;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Sweep-line resolution of the time ranges on one date where at least {@code threshold} participants
 * are available at once.
 *
 * <p>Every window start and end becomes a boundary; consecutive boundaries delimit micro-intervals,
 * each qualifying when enough windows cover it. Adjacent qualifying micro-intervals merge into a
 * slot, so any gap below the threshold splits the day. Slots shorter than the minimum duration are
 * dropped and the rest are numbered from 0 in chronological order.
 */
@Component
public class QuorumSlotResolver {

    /**
     * @throws IllegalArgumentException when a window's start is not before its end
     */
    public List<ResolvedSlot> resolve(LocalDate date, Map<Participant, AvailabilityWindow> windows,
                                      int threshold, int minDurationHours) {
        if (windows.isEmpty() || threshold > windows.size()) return List.of();
        List<Span> spans = toSpans(windows);
        int effectiveThreshold = Math.max(1, threshold);
        int minMinutes = Math.max(0, minDurationHours) * 60;

        int[] bounds = boundaries(spans);
        List<int[]> merged = new ArrayList<>();
        int[] open = null;
        for (int i = 0; i + 1 < bounds.length; i++) {
            int from = bounds[i];
            int to = bounds[i + 1];
            if (countCovering(spans, from, to) >= effectiveThreshold) {
                if (open == null) {
                    open = new int[]{from, to};
                } else {
                    open[1] = to;
                }
            } else if (open != null) {
                merged.add(open);
                open = null;
            }
        }
        if (open != null) merged.add(open);

        List<ResolvedSlot> slots = new ArrayList<>();
        for (int[] range : merged) {
            if (TimeOfDayUtils.durationMinutes(range[0], range[1]) < minMinutes) continue;
            slots.add(buildSlot(date, range, slots.size(), spans, bounds, effectiveThreshold));
        }
        return slots;
    }

    /** Highest number of participants available at the same minute of the date. */
    public int maxSimultaneous(Map<Participant, AvailabilityWindow> windows) {
        if (windows.isEmpty()) return 0;
        List<Span> spans = toSpans(windows);
        int[] bounds = boundaries(spans);
        int max = 0;
        for (int i = 0; i + 1 < bounds.length; i++) {
            max = Math.max(max, countCovering(spans, bounds[i], bounds[i + 1]));
        }
        return max;
    }

    private ResolvedSlot buildSlot(LocalDate date, int[] range, int index, List<Span> spans,
                                   int[] bounds, int threshold) {
        ResolvedSlot.ResolvedSlotBuilder slot = ResolvedSlot.builder()
                .date(date)
                .start(TimeOfDayUtils.fromMinutes(range[0]))
                .end(TimeOfDayUtils.fromMinutes(range[1]))
                .index(index);
        for (Span span : spans) {
            if (contributes(span, range, spans, bounds, threshold)) {
                AvailabilityWindow w = span.window;
                slot.participant(SlotParticipant.builder()
                        .id(span.participant.getId())
                        .name(span.participant.getName())
                        .startTime(w.getStartTime())
                        .endTime(w.getEndTime())
                        .note(w.getNote())
                        .build());
                if (span.start <= range[0] && span.end >= range[1]) {
                    slot.fullyCoveringId(span.participant.getId());
                }
            }
        }
        return slot.build();
    }

    // True when the span covers at least one qualifying micro-interval inside the slot.
    private static boolean contributes(Span span, int[] range, List<Span> spans, int[] bounds, int threshold) {
        for (int i = 0; i + 1 < bounds.length; i++) {
            int from = bounds[i];
            int to = bounds[i + 1];
            if (from < range[0] || to > range[1]) continue;
            if (span.covers(from, to) && countCovering(spans, from, to) >= threshold) return true;
        }
        return false;
    }

    private static int countCovering(List<Span> spans, int from, int to) {
        int n = 0;
        for (Span s : spans) {
            if (s.covers(from, to)) n++;
        }
        return n;
    }

    private static int[] boundaries(List<Span> spans) {
        TreeSet<Integer> set = new TreeSet<>();
        for (Span s : spans) {
            set.add(s.start);
            set.add(s.end);
        }
        return set.stream().mapToInt(Integer::intValue).toArray();
    }

    private static List<Span> toSpans(Map<Participant, AvailabilityWindow> windows) {
        List<Span> spans = new ArrayList<>(windows.size());
        for (Map.Entry<Participant, AvailabilityWindow> e : windows.entrySet()) {
            AvailabilityWindow w = e.getValue();
            int start = TimeOfDayUtils.startMinutes(w.getStartTime());
            int end = TimeOfDayUtils.endMinutes(w.getEndTime());
            if (start >= end) {
                throw new IllegalArgumentException("Window of participant " + e.getKey().getId()
                        + " on " + w.getDate() + " has start " + w.getStartTime() + " not before end " + w.getEndTime());
            }
            spans.add(new Span(e.getKey(), w, start, end));
        }
        return spans;
    }

    private static final class Span {
        final Participant participant;
        final AvailabilityWindow window;
        final int start;
        final int end;

        Span(Participant participant, AvailabilityWindow window, int start, int end) {
            this.participant = participant;
            this.window = window;
            this.start = start;
            this.end = end;
        }

        boolean covers(int from, int to) {
            return start <= from && to <= end;
        }
    }
}
