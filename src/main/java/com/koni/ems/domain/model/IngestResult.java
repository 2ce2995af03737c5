package com.koni.ems.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome of a committed insert: the generated row id and the timestamp actually stored.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class IngestResult {

    private final long id;
    private final Instant timestamp;
}
