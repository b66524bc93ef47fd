package io.github.whento.infrastructure.mapper;

import io.github.whento.infrastructure.persistence.entity.CalendarRecord;
import org.apache.ibatis.annotations.*;


@Mapper
public interface CalendarMapper {
    String COLUMNS = "id, name, description, public_token, ics_token, threshold, " +
            "array_to_string(allowed_weekdays, ',') AS allowed_weekdays, min_duration_hours, timezone, " +
            "holidays_policy, allow_holiday_eves, allowed_hours::text AS allowed_hours, lock_participants, " +
            "start_date, end_date";

    @Select("SELECT " + COLUMNS + " FROM calendars WHERE public_token = #{token}")
    @Results(id = "calendarResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "name", column = "name"),
        @Result(property = "description", column = "description"),
        @Result(property = "publicToken", column = "public_token"),
        @Result(property = "icsToken", column = "ics_token"),
        @Result(property = "threshold", column = "threshold"),
        @Result(property = "allowedWeekdays", column = "allowed_weekdays"),
        @Result(property = "minDurationHours", column = "min_duration_hours"),
        @Result(property = "timezone", column = "timezone"),
        @Result(property = "holidaysPolicy", column = "holidays_policy"),
        @Result(property = "allowHolidayEves", column = "allow_holiday_eves"),
        @Result(property = "allowedHours", column = "allowed_hours"),
        @Result(property = "lockParticipants", column = "lock_participants"),
        @Result(property = "startDate", column = "start_date"),
        @Result(property = "endDate", column = "end_date")
    })
    CalendarRecord selectByPublicToken(@Param("token") String token);

    @Select("SELECT " + COLUMNS + " FROM calendars WHERE ics_token = #{token}")
    @ResultMap("calendarResult")
    CalendarRecord selectByIcsToken(@Param("token") String token);
}
