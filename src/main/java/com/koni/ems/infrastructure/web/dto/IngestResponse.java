package com.koni.ems.infrastructure.web.dto;

import com.koni.ems.domain.model.IngestResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Response of a successful ingestion: the generated row id and the stored timestamp.
 */
@Getter
@AllArgsConstructor
public class IngestResponse {

    private final long id;
    private final Instant timestamp;

    public static IngestResponse from(IngestResult result) {
        return new IngestResponse(result.getId(), result.getTimestamp());
    }
}
