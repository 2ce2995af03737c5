package com.koni.ems.infrastructure.web.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Retention period in days. An empty body uses the configured default.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RetentionRequest {

    @Min(value = 1, message = "days must be at least 1")
    private Integer days;
}
