package edu.stanford.futuredata.shardgate.sqltypes;

import java.util.HashMap;
import java.util.Map;

/**
 * Storage engine column types.  The wire number of each type carries flag bits describing
 * the common properties of the type.
 */
public enum Type {
    NULL_TYPE(0),
    INT8(257),
    UINT8(770),
    INT16(259),
    UINT16(772),
    INT24(261),
    UINT24(774),
    INT32(263),
    UINT32(776),
    INT64(265),
    UINT64(778),
    FLOAT32(1035),
    FLOAT64(1036),
    TIMESTAMP(2061),
    DATE(2062),
    TIME(2063),
    DATETIME(2064),
    YEAR(785),
    DECIMAL(18),
    TEXT(6163),
    BLOB(10260),
    VARCHAR(6165),
    VARBINARY(10262),
    CHAR(6167),
    BINARY(10264),
    BIT(2073),
    ENUM(2074),
    SET(2075),
    TUPLE(28);

    private static final int FLAG_IS_INTEGRAL = 256;
    private static final int FLAG_IS_UNSIGNED = 512;
    private static final int FLAG_IS_FLOAT = 1024;
    private static final int FLAG_IS_QUOTED = 2048;
    private static final int FLAG_IS_TEXT = 4096;
    private static final int FLAG_IS_BINARY = 8192;

    private static final Map<Integer, Type> byNumber = new HashMap<>();

    static {
        for (Type t: values()) {
            byNumber.put(t.number, t);
        }
    }

    private final int number;

    Type(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public static Type forNumber(int number) {
        Type t = byNumber.get(number);
        if (t == null) {
            throw new IllegalArgumentException(String.format("unknown type number %d", number));
        }
        return t;
    }

    // Integral (signed or unsigned) and representable in 64 bits.
    public boolean isIntegral() {
        return (number & FLAG_IS_INTEGRAL) == FLAG_IS_INTEGRAL;
    }

    public boolean isSigned() {
        return (number & (FLAG_IS_INTEGRAL | FLAG_IS_UNSIGNED)) == FLAG_IS_INTEGRAL;
    }

    // Not the same as !isSigned().
    public boolean isUnsigned() {
        return (number & (FLAG_IS_INTEGRAL | FLAG_IS_UNSIGNED)) == (FLAG_IS_INTEGRAL | FLAG_IS_UNSIGNED);
    }

    public boolean isFloat() {
        return (number & FLAG_IS_FLOAT) == FLAG_IS_FLOAT;
    }

    public boolean isQuoted() {
        return (number & FLAG_IS_QUOTED) == FLAG_IS_QUOTED;
    }

    public boolean isText() {
        return (number & FLAG_IS_TEXT) == FLAG_IS_TEXT;
    }

    public boolean isBinary() {
        return (number & FLAG_IS_BINARY) == FLAG_IS_BINARY;
    }
}
