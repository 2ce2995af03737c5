package com.koni.ems.domain.register;

import com.koni.ems.domain.exception.DecodeException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * A decoded register value: a number for the numeric types, text for {@link RegisterDataType#UTF8}.
 */
@Getter
@EqualsAndHashCode
public final class RegisterValue {

    private final RegisterDataType type;
    private final Number number;
    private final String text;

    private RegisterValue(RegisterDataType type, Number number, String text) {
        this.type = type;
        this.number = number;
        this.text = text;
    }

    static RegisterValue ofNumber(RegisterDataType type, Number number) {
        return new RegisterValue(type, number, null);
    }

    static RegisterValue ofText(String text) {
        return new RegisterValue(RegisterDataType.UTF8, null, text);
    }

    public boolean isNumeric() {
        return number != null;
    }

    /**
     * Converts the value to a decimal suitable for a NUMERIC column.
     * Floats are converted through their shortest decimal representation, so the
     * registers {@code [0x4348, 0x0000]} give exactly {@code 200.0}.
     *
     * @throws DecodeException if the value is text or a non-finite float
     */
    public BigDecimal toDecimal() {
        if (number == null) {
            throw new DecodeException(type.getWireName() + " value is not numeric");
        }
        if (number instanceof Float) {
            float f = number.floatValue();
            if (!Float.isFinite(f)) {
                throw new DecodeException("FLOAT32 value is not finite: " + f);
            }
            return new BigDecimal(Float.toString(f));
        }
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return BigDecimal.valueOf(number.longValue());
    }

    @Override
    public String toString() {
        return type.getWireName() + "(" + (number != null ? number : '"' + text + '"') + ")";
    }
}
