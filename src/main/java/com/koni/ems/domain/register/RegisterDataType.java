package com.koni.ems.domain.register;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.koni.ems.domain.exception.ValidationException;
import lombok.Getter;

/**
 * Binary encodings of holding-register values supported by the decoder.
 * Multi-register types are always big-endian (high word first); this is part of the
 * meter protocol and not configurable.
 */
@Getter
public enum RegisterDataType {

    INT16U("INT16U", 1, true),
    INT16S("INT16S", 1, true),
    INT32U("INT32U", 2, true),
    FLOAT32("FLOAT32", 2, true),
    UTF8("UTF8", 16, false),
    FOUR_QUADRANT_POWER_FACTOR("4Q_FP_PF", 1, true);

    private final String wireName;

    /**
     * Register count the type needs. For {@link #UTF8} this is only the default
     * used when a register map entry does not state its own length.
     */
    private final int registerCount;
    private final boolean numeric;

    RegisterDataType(String wireName, int registerCount, boolean numeric) {
        this.wireName = wireName;
        this.registerCount = registerCount;
        this.numeric = numeric;
    }

    public boolean hasVariableLength() {
        return this == UTF8;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RegisterDataType fromWireName(String name) {
        for (RegisterDataType type : values()) {
            if (type.wireName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new ValidationException("Unknown register data type: " + name);
    }
}
