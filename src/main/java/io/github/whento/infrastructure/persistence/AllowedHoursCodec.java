package io.github.whento.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.whento.application.exception.ConfigurationException;
import io.github.whento.application.util.TimeOfDayUtils;
import io.github.whento.domain.model.AllowedHours;
import io.github.whento.domain.model.TimeRange;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads the {@code allowed_hours} JSON column:
 * <pre>{"weekdays": {"1": {"start": "09:00", "end": "18:00"}}, "holidays": {...}, "holiday_eves": {...}}</pre>
 * Empty or missing bounds mean no restriction.
 */
@Component
public class AllowedHoursCodec {
    private final ObjectMapper objectMapper;

    public AllowedHoursCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AllowedHours decode(String json) {
        if (json == null || json.isBlank()) return AllowedHours.unrestricted();
        try {
            JsonNode root = objectMapper.readTree(json);
            AllowedHours.AllowedHoursBuilder builder = AllowedHours.builder();
            JsonNode weekdays = root.path("weekdays");
            for (Iterator<Map.Entry<String, JsonNode>> it = weekdays.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                int day = Integer.parseInt(e.getKey());
                if (day < 0 || day > 6) throw new ConfigurationException("Weekday key out of range: " + day, null);
                builder.weekday(day, range(e.getValue()));
            }
            if (root.has("holidays")) builder.holidays(range(root.get("holidays")));
            if (root.has("holiday_eves")) builder.holidayEves(range(root.get("holiday_eves")));
            return builder.build();
        } catch (JsonProcessingException | NumberFormatException | DateTimeParseException e) {
            throw new ConfigurationException("Unreadable allowed_hours configuration", e);
        }
    }

    private static TimeRange range(JsonNode node) {
        return TimeRange.of(time(node.path("start")), time(node.path("end")));
    }

    private static LocalTime time(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) return null;
        String text = node.asText();
        return text.isEmpty() ? null : TimeOfDayUtils.parseTime(text);
    }
}
