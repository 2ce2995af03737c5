package com.koni.ems.infrastructure.web.dto;

import lombok.Getter;

import java.time.Instant;

/**
 * DTO for error responses returned by the REST API.
 */
@Getter
public class ErrorResponse {

    private final int status;
    private final String message;
    private final Instant timestamp;

    public ErrorResponse(int status, String message) {
        this.status = status;
        this.message = message;
        this.timestamp = Instant.now();
    }
}
