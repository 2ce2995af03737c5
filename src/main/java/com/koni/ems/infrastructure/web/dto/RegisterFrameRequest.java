package com.koni.ems.infrastructure.web.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A frame of raw holding-register words, keyed by register map parameter.
 *
 * Example:
 * {
 *   "timestamp": "2025-01-31T13:00:00Z",
 *   "registers": { "Ptotal": [17224, 0], "PFavg": [950] }
 * }
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RegisterFrameRequest {

    private OffsetDateTime timestamp;

    @NotEmpty(message = "registers is required")
    private Map<String, int[]> registers;
}
