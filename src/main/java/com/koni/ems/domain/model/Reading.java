package com.koni.ems.domain.model;

import com.koni.ems.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A partial electrical reading for one device: any non-empty subset of the known
 * measurement fields plus an optional timestamp. This is an immutable value object;
 * a reading that exists has already passed validation.
 */
@Getter
@EqualsAndHashCode
public final class Reading {

    public static final String TIMESTAMP = "timestamp";

    /**
     * Measurement time, or {@code null} when the database should use insertion time.
     */
    private final Instant timestamp;
    private final Map<MeasurementField, BigDecimal> values;

    /**
     * Creates a reading from already typed values.
     *
     * @throws ValidationException if no value is present
     */
    public Reading(Instant timestamp, Map<MeasurementField, BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("No data fields provided");
        }
        EnumMap<MeasurementField, BigDecimal> copy = new EnumMap<>(MeasurementField.class);
        values.forEach((field, value) -> {
            if (value == null) {
                throw new ValidationException(field.getFieldName() + " must be a number");
            }
            copy.put(field, value);
        });
        this.timestamp = timestamp;
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a reading from a decoded JSON payload such as
     * {@code {"timestamp": "2025-01-31T13:00:00Z", "Ptotal": 10.5}}.
     * Field names are case-sensitive. Values must be JSON numbers; the timestamp,
     * when present, must be an ISO-8601 date-time with an offset.
     *
     * @param payload the request body
     * @return the validated reading
     * @throws ValidationException if a field is unknown, a value is not numeric,
     *                             the timestamp is malformed or no field is present
     */
    public static Reading fromPayload(Map<String, ?> payload) {
        if (payload == null) {
            throw new ValidationException("Request body is required");
        }

        List<String> unknown = new ArrayList<>();
        Instant timestamp = null;
        EnumMap<MeasurementField, BigDecimal> values = new EnumMap<>(MeasurementField.class);

        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            String name = entry.getKey();
            Object raw = entry.getValue();

            if (TIMESTAMP.equals(name)) {
                timestamp = parseTimestamp(raw);
                continue;
            }

            MeasurementField field = MeasurementField.fromFieldName(name).orElse(null);
            if (field == null) {
                unknown.add(name);
                continue;
            }
            values.put(field, toDecimal(name, raw));
        }

        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown data fields: " + String.join(", ", unknown));
        }
        return new Reading(timestamp, values);
    }

    /**
     * Returns the value of a field, or {@code null} when the reading does not report it.
     */
    public BigDecimal get(MeasurementField field) {
        return values.get(field);
    }

    /**
     * Values keyed by payload field name, in column order.
     */
    public Map<String, BigDecimal> toFieldMap() {
        Map<String, BigDecimal> map = new LinkedHashMap<>();
        values.forEach((field, value) -> map.put(field.getFieldName(), value));
        return map;
    }

    static Instant parseTimestamp(Object raw) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof String)) {
            throw new ValidationException("timestamp must be an ISO-8601 string");
        }
        try {
            return OffsetDateTime.parse((String) raw).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException("timestamp is not a valid ISO-8601 date-time: " + raw, e);
        }
    }

    private static BigDecimal toDecimal(String name, Object raw) {
        if (raw instanceof BigDecimal) {
            return (BigDecimal) raw;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger) {
            return new BigDecimal((BigInteger) raw);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (!Double.isFinite(value)) {
                throw new ValidationException(name + " must be a finite number");
            }
            return BigDecimal.valueOf(value);
        }
        throw new ValidationException(name + " must be a number");
    }

    @Override
    public String toString() {
        return "Reading{" +
                "timestamp=" + timestamp +
                ", values=" + toFieldMap() +
                '}';
    }
}
