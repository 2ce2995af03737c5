package com.koni.ems.domain.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of numeric measurement columns every device relation carries.
 * The same set drives the table DDL, the accepted ingestion fields and the
 * serialized data rows, so a reading can never address a column that does not exist.
 */
@Getter
public enum MeasurementField {

    VR("VR", Group.VOLTAGE, 10, 3),
    VY("VY", Group.VOLTAGE, 10, 3),
    VB("VB", Group.VOLTAGE, 10, 3),
    V1("V1", Group.VOLTAGE, 10, 3),
    V2("V2", Group.VOLTAGE, 10, 3),
    V3("V3", Group.VOLTAGE, 10, 3),
    V("V", Group.VOLTAGE, 10, 3),
    VAVG("Vavg", Group.VOLTAGE, 10, 3),
    VPEAK("Vpeak", Group.VOLTAGE, 10, 3),

    IR("IR", Group.CURRENT, 10, 3),
    IY("IY", Group.CURRENT, 10, 3),
    IB("IB", Group.CURRENT, 10, 3),
    I1("I1", Group.CURRENT, 10, 3),
    I2("I2", Group.CURRENT, 10, 3),
    I3("I3", Group.CURRENT, 10, 3),
    I("I", Group.CURRENT, 10, 3),
    IAVG("Iavg", Group.CURRENT, 10, 3),
    IPEAK("Ipeak", Group.CURRENT, 10, 3),

    P1("P1", Group.POWER, 10, 3),
    P2("P2", Group.POWER, 10, 3),
    P3("P3", Group.POWER, 10, 3),
    PTOTAL("Ptotal", Group.POWER, 10, 3),
    Q1("Q1", Group.POWER, 10, 3),
    Q2("Q2", Group.POWER, 10, 3),
    Q3("Q3", Group.POWER, 10, 3),
    QTOTAL("Qtotal", Group.POWER, 10, 3),
    S1("S1", Group.POWER, 10, 3),
    S2("S2", Group.POWER, 10, 3),
    S3("S3", Group.POWER, 10, 3),
    STOTAL("Stotal", Group.POWER, 10, 3),

    PF1("PF1", Group.POWER_FACTOR, 5, 3),
    PF2("PF2", Group.POWER_FACTOR, 5, 3),
    PF3("PF3", Group.POWER_FACTOR, 5, 3),
    PFAVG("PFavg", Group.POWER_FACTOR, 5, 3),
    PF("PF", Group.POWER_FACTOR, 5, 3),

    FREQUENCY("frequency", Group.FREQUENCY, 6, 3),

    ENERGY_ACTIVE("energy_active", Group.ENERGY, 15, 3),
    ENERGY_REACTIVE("energy_reactive", Group.ENERGY, 15, 3),
    ENERGY_APPARENT("energy_apparent", Group.ENERGY, 15, 3),

    THD_V1("THD_V1", Group.HARMONICS, 6, 3),
    THD_V2("THD_V2", Group.HARMONICS, 6, 3),
    THD_V3("THD_V3", Group.HARMONICS, 6, 3),
    THD_I1("THD_I1", Group.HARMONICS, 6, 3),
    THD_I2("THD_I2", Group.HARMONICS, 6, 3),
    THD_I3("THD_I3", Group.HARMONICS, 6, 3),
    THD_V("THD_V", Group.HARMONICS, 6, 3),
    THD_I("THD_I", Group.HARMONICS, 6, 3),

    TEMPERATURE("temperature", Group.ENVIRONMENTAL, 6, 2),
    HUMIDITY("humidity", Group.ENVIRONMENTAL, 6, 2);

    /**
     * Semantic grouping of the measurement columns.
     */
    public enum Group {
        VOLTAGE, CURRENT, POWER, POWER_FACTOR, FREQUENCY, ENERGY, HARMONICS, ENVIRONMENTAL
    }

    private static final Map<String, MeasurementField> BY_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(
                    MeasurementField::getFieldName, Function.identity(), (a, b) -> a, LinkedHashMap::new)));

    /**
     * Name used in ingestion payloads, register maps and serialized rows.
     */
    private final String fieldName;
    private final Group group;
    private final int precision;
    private final int scale;

    MeasurementField(String fieldName, Group group, int precision, int scale) {
        this.fieldName = fieldName;
        this.group = group;
        this.precision = precision;
        this.scale = scale;
    }

    /**
     * Column name in the device relation. PostgreSQL folds unquoted identifiers
     * to lower case, so the column is always the lower-cased field name.
     */
    public String columnName() {
        return fieldName.toLowerCase();
    }

    public String sqlType() {
        return "NUMERIC(" + precision + ", " + scale + ")";
    }

    /**
     * Looks up a field by its exact (case-sensitive) payload name.
     */
    public static Optional<MeasurementField> fromFieldName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isKnown(String name) {
        return BY_NAME.containsKey(name);
    }
}
