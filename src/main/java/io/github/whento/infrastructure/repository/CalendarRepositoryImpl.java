package io.github.whento.infrastructure.repository;

import io.github.whento.application.repository.CalendarRepository;
import io.github.whento.domain.model.CalendarConfig;
import io.github.whento.domain.model.HolidaysPolicy;
import io.github.whento.infrastructure.mapper.CalendarMapper;
import io.github.whento.infrastructure.persistence.AllowedHoursCodec;
import io.github.whento.infrastructure.persistence.entity.CalendarRecord;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.Optional;

@Repository
public class CalendarRepositoryImpl implements CalendarRepository {
    private final CalendarMapper mapper;
    private final AllowedHoursCodec allowedHoursCodec;

    public CalendarRepositoryImpl(CalendarMapper mapper, AllowedHoursCodec allowedHoursCodec) {
        this.mapper = mapper;
        this.allowedHoursCodec = allowedHoursCodec;
    }

    @Override public Optional<CalendarConfig> findByPublicToken(String token) { return Optional.ofNullable(mapper.selectByPublicToken(token)).map(this::toModel); }
    @Override public Optional<CalendarConfig> findByIcsToken(String token) { return Optional.ofNullable(mapper.selectByIcsToken(token)).map(this::toModel); }

    CalendarConfig toModel(CalendarRecord r) {
        CalendarConfig.CalendarConfigBuilder b = CalendarConfig.builder()
                .id(r.getId())
                .name(r.getName())
                .description(r.getDescription())
                .holidaysPolicy(HolidaysPolicy.fromValue(r.getHolidaysPolicy()))
                .allowHolidayEves(Boolean.TRUE.equals(r.getAllowHolidayEves()))
                .minDurationHours(r.getMinDurationHours() == null ? 0 : r.getMinDurationHours())
                .allowedHours(allowedHoursCodec.decode(r.getAllowedHours()))
                .lockParticipants(Boolean.TRUE.equals(r.getLockParticipants()))
                .startDate(r.getStartDate())
                .endDate(r.getEndDate());
        if (r.getThreshold() != null) b.threshold(r.getThreshold());
        if (r.getTimezone() != null && !r.getTimezone().isBlank()) b.timezone(r.getTimezone());
        if (r.getAllowedWeekdays() != null && !r.getAllowedWeekdays().isBlank()) {
            Arrays.stream(r.getAllowedWeekdays().split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Integer::valueOf)
                    .forEach(b::allowedWeekday);
        }
        return b.build();
    }
}
