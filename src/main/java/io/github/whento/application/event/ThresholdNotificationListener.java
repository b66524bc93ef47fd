package io.github.whento.application.event;

import io.github.whento.application.service.SlotResolutionService;
import io.github.whento.domain.model.CalendarConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Detects when a date crosses the calendar threshold after a write. Delivery to external channels
 * is handled elsewhere; this listener only records the transition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThresholdNotificationListener {
    private final SlotResolutionService slotResolution;

    @Async("notificationExecutor")
    @EventListener
    public void onAvailabilityChanged(AvailabilityChangedEvent event) {
        CalendarConfig calendar = event.getCalendar();
        try {
            int current = slotResolution.countAvailable(calendar, event.getDate());
            ThresholdTransition transition = ThresholdTransition.detect(event.getPreviousCount(), current, calendar.getThreshold());
            if (transition == ThresholdTransition.NONE) {
                log.debug("No threshold transition for calendar {} on {} ({} -> {})",
                        calendar.getId(), event.getDate(), event.getPreviousCount(), current);
                return;
            }
            log.info("Threshold {} for calendar {} on {}: {} -> {} (threshold {})",
                    transition, calendar.getId(), event.getDate(), event.getPreviousCount(), current, calendar.getThreshold());
        } catch (RuntimeException e) {
            log.error("Threshold check failed for calendar {} on {}", calendar.getId(), event.getDate(), e);
        }
    }
}
