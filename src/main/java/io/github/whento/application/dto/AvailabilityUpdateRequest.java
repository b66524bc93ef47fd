package io.github.whento.application.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update. A null field keeps the stored value; an empty time clears that bound.
 */
@Data
public class AvailabilityUpdateRequest {
    private String startTime;
    private String endTime;
    @Size(max = 500)
    private String note;
}
