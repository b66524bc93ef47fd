package io.github.whento.infrastructure.mapper;

import io.github.whento.infrastructure.persistence.entity.RecurrenceExceptionRecord;
import io.github.whento.infrastructure.persistence.entity.RecurrenceRecord;
import org.apache.ibatis.annotations.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Mapper
public interface RecurrenceMapper {
    @Select("SELECT r.id, r.participant_id, r.day_of_week, r.start_time, r.end_time, r.note, r.start_date, r.end_date " +
            "FROM recurrences r JOIN participants p ON p.id = r.participant_id " +
            "WHERE p.calendar_id = #{calendarId} ORDER BY r.day_of_week, r.start_date")
    @Results(id = "recurrenceResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "participantId", column = "participant_id"),
        @Result(property = "dayOfWeek", column = "day_of_week"),
        @Result(property = "startTime", column = "start_time"),
        @Result(property = "endTime", column = "end_time"),
        @Result(property = "note", column = "note"),
        @Result(property = "startDate", column = "start_date"),
        @Result(property = "endDate", column = "end_date")
    })
    List<RecurrenceRecord> selectByCalendar(@Param("calendarId") UUID calendarId);

    @Select("SELECT id, participant_id, day_of_week, start_time, end_time, note, start_date, end_date " +
            "FROM recurrences WHERE participant_id = #{participantId} ORDER BY day_of_week, start_date")
    @ResultMap("recurrenceResult")
    List<RecurrenceRecord> selectByParticipant(@Param("participantId") UUID participantId);

    @Select("SELECT id, participant_id, day_of_week, start_time, end_time, note, start_date, end_date " +
            "FROM recurrences WHERE id = #{id}")
    @ResultMap("recurrenceResult")
    RecurrenceRecord selectById(@Param("id") UUID id);

    @Select("SELECT id FROM participants WHERE id = #{participantId} FOR UPDATE")
    UUID lockParticipant(@Param("participantId") UUID participantId);

    @Insert("INSERT INTO recurrences (id, participant_id, day_of_week, start_time, end_time, note, start_date, end_date) " +
            "VALUES (#{id}, #{participantId}, #{dayOfWeek}, #{startTime}, #{endTime}, #{note}, #{startDate}, #{endDate})")
    int insert(RecurrenceRecord row);

    @Update("UPDATE recurrences SET day_of_week = #{dayOfWeek}, start_time = #{startTime}, end_time = #{endTime}, " +
            "note = #{note}, start_date = #{startDate}, end_date = #{endDate} WHERE id = #{id}")
    int update(RecurrenceRecord row);

    @Delete("DELETE FROM recurrences WHERE id = #{id}")
    int deleteById(@Param("id") UUID id);

    @Select("SELECT e.id, e.recurrence_id, e.excluded_date FROM recurrence_exceptions e " +
            "JOIN recurrences r ON r.id = e.recurrence_id JOIN participants p ON p.id = r.participant_id " +
            "WHERE p.calendar_id = #{calendarId}")
    @Results(id = "exceptionResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "recurrenceId", column = "recurrence_id"),
        @Result(property = "excludedDate", column = "excluded_date")
    })
    List<RecurrenceExceptionRecord> selectExceptionsByCalendar(@Param("calendarId") UUID calendarId);

    @Select("SELECT id, recurrence_id, excluded_date FROM recurrence_exceptions " +
            "WHERE recurrence_id = #{recurrenceId} ORDER BY excluded_date")
    @ResultMap("exceptionResult")
    List<RecurrenceExceptionRecord> selectExceptionsByRecurrence(@Param("recurrenceId") UUID recurrenceId);

    @Insert("INSERT INTO recurrence_exceptions (id, recurrence_id, excluded_date) VALUES (#{id}, #{recurrenceId}, #{excludedDate})")
    int insertException(RecurrenceExceptionRecord row);

    @Delete("DELETE FROM recurrence_exceptions WHERE recurrence_id = #{recurrenceId} AND excluded_date = #{date}")
    int deleteException(@Param("recurrenceId") UUID recurrenceId, @Param("date") LocalDate date);
}
