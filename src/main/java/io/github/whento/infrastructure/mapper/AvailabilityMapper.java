package io.github.whento.infrastructure.mapper;

import io.github.whento.infrastructure.persistence.entity.AvailabilityRecord;
import org.apache.ibatis.annotations.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Mapper
public interface AvailabilityMapper {
    @Select("<script>" +
            "SELECT a.id, a.participant_id, a.date, a.start_time, a.end_time, a.note, a.source, a.recurrence_id " +
            "FROM availabilities a JOIN participants p ON p.id = a.participant_id " +
            "WHERE p.calendar_id = #{calendarId} AND a.source = 'manual' " +
            "<if test='from != null'>AND a.date &gt;= #{from} </if>" +
            "<if test='to != null'>AND a.date &lt;= #{to} </if>" +
            "ORDER BY a.date, a.start_time NULLS FIRST" +
            "</script>")
    @Results(id = "availabilityResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "participantId", column = "participant_id"),
        @Result(property = "date", column = "date"),
        @Result(property = "startTime", column = "start_time"),
        @Result(property = "endTime", column = "end_time"),
        @Result(property = "note", column = "note"),
        @Result(property = "source", column = "source"),
        @Result(property = "recurrenceId", column = "recurrence_id")
    })
    List<AvailabilityRecord> selectByCalendar(@Param("calendarId") UUID calendarId,
                                              @Param("from") LocalDate from,
                                              @Param("to") LocalDate to);

    @Select("<script>" +
            "SELECT id, participant_id, date, start_time, end_time, note, source, recurrence_id " +
            "FROM availabilities WHERE participant_id = #{participantId} " +
            "<if test='from != null'>AND date &gt;= #{from} </if>" +
            "<if test='to != null'>AND date &lt;= #{to} </if>" +
            "ORDER BY date" +
            "</script>")
    @ResultMap("availabilityResult")
    List<AvailabilityRecord> selectByParticipant(@Param("participantId") UUID participantId,
                                                 @Param("from") LocalDate from,
                                                 @Param("to") LocalDate to);

    @Select("SELECT id, participant_id, date, start_time, end_time, note, source, recurrence_id " +
            "FROM availabilities WHERE participant_id = #{participantId} AND date = #{date}")
    @ResultMap("availabilityResult")
    AvailabilityRecord selectByParticipantAndDate(@Param("participantId") UUID participantId,
                                                  @Param("date") LocalDate date);

    @Insert("INSERT INTO availabilities (id, participant_id, date, start_time, end_time, note, source, recurrence_id) " +
            "VALUES (#{id}, #{participantId}, #{date}, #{startTime}, #{endTime}, #{note}, #{source}, #{recurrenceId})")
    int insert(AvailabilityRecord row);

    @Update("UPDATE availabilities SET start_time = #{startTime}, end_time = #{endTime}, note = #{note}, " +
            "updated_at = now() WHERE participant_id = #{participantId} AND date = #{date}")
    int update(AvailabilityRecord row);

    @Delete("DELETE FROM availabilities WHERE participant_id = #{participantId} AND date = #{date}")
    int delete(@Param("participantId") UUID participantId, @Param("date") LocalDate date);
}
