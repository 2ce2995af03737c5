package com.koni.ems.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One stored row of a device relation.
 * Every known measurement field is present in {@link #getValues()}; fields the
 * reading did not report are mapped to {@code null}.
 */
@Getter
@JsonPropertyOrder({"id", "timestamp"})
public final class DataPoint {

    private final long id;
    private final Instant timestamp;
    private final Map<String, BigDecimal> values;

    public DataPoint(long id, Instant timestamp, Map<MeasurementField, BigDecimal> columns) {
        this.id = id;
        this.timestamp = timestamp;
        Map<String, BigDecimal> byName = new LinkedHashMap<>();
        for (MeasurementField field : MeasurementField.values()) {
            byName.put(field.getFieldName(), columns.get(field));
        }
        this.values = Collections.unmodifiableMap(byName);
    }

    public BigDecimal get(MeasurementField field) {
        return values.get(field.getFieldName());
    }

    /**
     * Flattens the measurement values into the serialized row.
     */
    @JsonAnyGetter
    public Map<String, BigDecimal> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "DataPoint{" +
                "id=" + id +
                ", timestamp=" + timestamp +
                '}';
    }
}
