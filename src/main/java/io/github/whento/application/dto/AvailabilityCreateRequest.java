package io.github.whento.application.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AvailabilityCreateRequest {
    @NotBlank
    private String date;        // yyyy-MM-dd

    // HH:mm; both empty means the whole day
    private String startTime;
    private String endTime;

    @Size(max = 500)
    private String note;
}
