package io.github.whento.application.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RecurrenceExceptionRequest {
    @NotBlank
    private String excludedDate;
}
