package com.koni.ems.domain.register;

import com.koni.ems.domain.exception.DecodeException;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Stateless decoder for Modbus-style holding registers.
 * Each register word is an unsigned 16-bit value passed as an {@code int}; bits above
 * the low 16 are ignored. Multi-register values are big-endian: the first word carries
 * the high 16 bits.
 */
public final class RegisterDecoder {

    private static final char REPLACEMENT = '\uFFFD';

    private RegisterDecoder() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Decodes the words according to the data type.
     *
     * @param words the raw register words
     * @param type  the encoding
     * @return the decoded value
     * @throws DecodeException if the word count does not match the type
     */
    public static RegisterValue decode(int[] words, RegisterDataType type) {
        if (type == null) {
            throw new DecodeException("data type is required");
        }
        switch (type) {
            case INT16U:
                return RegisterValue.ofNumber(type, decodeUnsigned16(single(words, type)));
            case INT16S:
                return RegisterValue.ofNumber(type, decodeSigned16(single(words, type)));
            case INT32U:
                return RegisterValue.ofNumber(type, decodeUnsigned32(words));
            case FLOAT32:
                return RegisterValue.ofNumber(type, decodeFloat32(words));
            case UTF8:
                return RegisterValue.ofText(decodeUtf8(words));
            case FOUR_QUADRANT_POWER_FACTOR:
                return RegisterValue.ofNumber(type, decodeFourQuadrantPowerFactor(single(words, type)));
            default:
                throw new DecodeException("Unsupported data type: " + type);
        }
    }

    public static int decodeUnsigned16(int word) {
        return word & 0xFFFF;
    }

    public static int decodeSigned16(int word) {
        return (short) (word & 0xFFFF);
    }

    public static long decodeUnsigned32(int[] words) {
        requireCount(words, RegisterDataType.INT32U);
        return ((long) (words[0] & 0xFFFF) << 16) | (words[1] & 0xFFFF);
    }

    public static float decodeFloat32(int[] words) {
        requireCount(words, RegisterDataType.FLOAT32);
        int bits = ((words[0] & 0xFFFF) << 16) | (words[1] & 0xFFFF);
        return Float.intBitsToFloat(bits);
    }

    /**
     * Decodes a string packed two bytes per register (high byte first).
     * The text ends at the first NUL byte. Malformed UTF-8 sequences are dropped
     * rather than failing the whole value.
     *
     * @throws DecodeException if no register is given
     */
    public static String decodeUtf8(int[] words) {
        if (words == null || words.length == 0) {
            throw new DecodeException("UTF8 requires at least 1 register");
        }

        ByteArrayOutputStream bytes = new ByteArrayOutputStream(words.length * 2);
        outer:
        for (int word : words) {
            int[] pair = {(word >> 8) & 0xFF, word & 0xFF};
            for (int b : pair) {
                if (b == 0) {
                    break outer;
                }
                bytes.write(b);
            }
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .replaceWith(String.valueOf(REPLACEMENT));
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes.toByteArray()));
            return chars.toString().replace(String.valueOf(REPLACEMENT), "");
        } catch (CharacterCodingException e) {
            throw new DecodeException("UTF8 registers could not be decoded", e);
        }
    }

    /**
     * Four-quadrant power factor: the signed 16-bit value is the power factor times 1000,
     * the sign carrying the quadrant.
     */
    public static BigDecimal decodeFourQuadrantPowerFactor(int word) {
        return BigDecimal.valueOf(decodeSigned16(word), 3);
    }

    private static int single(int[] words, RegisterDataType type) {
        requireCount(words, type);
        return words[0];
    }

    private static void requireCount(int[] words, RegisterDataType type) {
        int actual = words == null ? 0 : words.length;
        if (actual != type.getRegisterCount()) {
            throw new DecodeException(type.getWireName() + " requires " + type.getRegisterCount()
                    + " register(s) but got " + actual);
        }
    }
}
