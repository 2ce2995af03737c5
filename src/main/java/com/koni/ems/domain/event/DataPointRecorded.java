package com.koni.ems.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * DataPointRecorded domain event.
 * Published to the streaming bus after a reading has been committed to the device relation.
 * Values are keyed by canonical field name and only contain the fields the reading reported.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DataPointRecorded {

    private final UUID eventId;
    private final String deviceId;
    private final long rowId;
    private final Instant timestamp;
    private final Instant recordedAt;
    private final Map<String, BigDecimal> values;

    /**
     * Creates a new DataPointRecorded event.
     * This constructor is used by Jackson for JSON deserialization.
     *
     * @param eventId    the unique identifier of this event
     * @param deviceId   the registry identifier of the device
     * @param rowId      the id generated for the stored row
     * @param timestamp  the measurement time stored with the row
     * @param recordedAt the time the event was created
     * @param values     measurement values by canonical field name
     */
    @JsonCreator
    public DataPointRecorded(
            @JsonProperty("eventId") UUID eventId,
            @JsonProperty("deviceId") String deviceId,
            @JsonProperty("rowId") long rowId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("recordedAt") Instant recordedAt,
            @JsonProperty("values") Map<String, BigDecimal> values) {
        this.eventId = eventId;
        this.deviceId = deviceId;
        this.rowId = rowId;
        this.timestamp = timestamp;
        this.recordedAt = recordedAt;
        this.values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
