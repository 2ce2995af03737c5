package com.koni.ems.domain.model;

import com.koni.ems.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * Name of the time-series relation that stores the data points of one device.
 * This is an immutable value object; the mapping from device identifier is
 * deterministic and has no side effects.
 *
 * <p>The name is always a safe, unquoted SQL identifier: the device identifier is
 * reduced to {@code [a-z0-9_]} and prefixed with {@value #PREFIX}. Because PostgreSQL
 * folds unquoted identifiers to lower case, the name is lower-cased here too, which
 * makes {@code "Meter-A"} and {@code "meter_a"} map to the same relation. Such
 * collisions are detected at registration time, not here.
 */
@Getter
@EqualsAndHashCode
public final class RelationName {

    public static final String PREFIX = "device_";

    /**
     * PostgreSQL truncates identifiers to 63 bytes. Index names append up to 14
     * characters ({@code _timestamp_idx}), so relation names stay below this length.
     */
    static final int MAX_LENGTH = 48;

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern SAFE_RELATION = Pattern.compile("[a-z0-9_]+");

    private final String value;

    private RelationName(String value) {
        this.value = value;
    }

    /**
     * Computes the relation name for a device identifier.
     *
     * @param deviceId the registry identifier of the device
     * @return the relation name
     * @throws ValidationException if the identifier is null or blank
     */
    public static RelationName forDevice(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new ValidationException("deviceId is required");
        }

        String name = PREFIX + UNSAFE.matcher(deviceId).replaceAll("_").toLowerCase();
        if (name.length() > MAX_LENGTH) {
            name = name.substring(0, MAX_LENGTH - 9) + "_" + checksum(deviceId);
        }
        return new RelationName(name);
    }

    /**
     * Wraps a relation name read back from the database catalog.
     *
     * @throws IllegalArgumentException if the name is not a device relation name
     */
    public static RelationName of(String relation) {
        if (relation == null || !relation.startsWith(PREFIX) || !SAFE_RELATION.matcher(relation).matches()) {
            throw new IllegalArgumentException("Not a device relation name: " + relation);
        }
        return new RelationName(relation);
    }

    /**
     * Name of an index on this relation, e.g. {@code device_m1_timestamp_idx}.
     */
    public String index(String suffix) {
        return value + "_" + suffix + "_idx";
    }

    private static String checksum(String deviceId) {
        CRC32 crc = new CRC32();
        crc.update(deviceId.getBytes(StandardCharsets.UTF_8));
        return String.format("%08x", crc.getValue());
    }

    @Override
    public String toString() {
        return value;
    }
}
