package io.github.whento.application.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RecurrenceRequest {
    private Integer dayOfWeek;  // 0 = Sunday .. 6 = Saturday
    private String startTime;
    private String endTime;
    @Size(max = 500)
    private String note;
    private String startDate;
    private String endDate;
}
