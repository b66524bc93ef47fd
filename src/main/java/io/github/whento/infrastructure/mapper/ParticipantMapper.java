package io.github.whento.infrastructure.mapper;

import io.github.whento.infrastructure.persistence.entity.ParticipantRecord;
import org.apache.ibatis.annotations.*;

import java.util.List;
import java.util.UUID;

@Mapper
public interface ParticipantMapper {
    @Select("SELECT id, calendar_id, name FROM participants WHERE calendar_id = #{calendarId} ORDER BY created_at, name")
    @Results(id = "participantResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "calendarId", column = "calendar_id"),
        @Result(property = "name", column = "name")
    })
    List<ParticipantRecord> selectByCalendar(@Param("calendarId") UUID calendarId);

    @Select("SELECT id, calendar_id, name FROM participants WHERE id = #{id}")
    @ResultMap("participantResult")
    ParticipantRecord selectById(@Param("id") UUID id);
}
