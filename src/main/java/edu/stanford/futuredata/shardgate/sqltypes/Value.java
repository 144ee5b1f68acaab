package edu.stanford.futuredata.shardgate.sqltypes;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable typed value as stored by the storage engine.  Numbers are kept in their
 * decimal text form, which is also how they travel on the wire.
 */
public final class Value {

    public static final Value NULL = new Value(Type.NULL_TYPE, new byte[0]);

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final Type type;
    private final byte[] raw;

    private Value(Type type, byte[] raw) {
        this.type = type;
        this.raw = raw;
    }

    /** Build a value from its wire form.  A NULL_TYPE value never carries bytes. */
    public static Value make(Type type, byte[] raw) {
        Objects.requireNonNull(type, "type");
        if (type == Type.NULL_TYPE) {
            return NULL;
        }
        return new Value(type, raw == null ? new byte[0] : raw.clone());
    }

    public static Value newInt64(long v) {
        return new Value(Type.INT64, Long.toString(v).getBytes(StandardCharsets.US_ASCII));
    }

    /** The argument is interpreted as the bits of an unsigned 64-bit integer. */
    public static Value newUint64(long unsignedBits) {
        return new Value(Type.UINT64, Long.toUnsignedString(unsignedBits).getBytes(StandardCharsets.US_ASCII));
    }

    public static Value newFloat64(double v) {
        return new Value(Type.FLOAT64, Double.toString(v).getBytes(StandardCharsets.US_ASCII));
    }

    public static Value newVarChar(String v) {
        return new Value(Type.VARCHAR, v.getBytes(StandardCharsets.UTF_8));
    }

    public static Value newVarBinary(byte[] v) {
        return new Value(Type.VARBINARY, v.clone());
    }

    /**
     * Convert a bind variable or id supplied as a plain Java object.
     *
     * @throws IllegalArgumentException if the object has no value representation
     */
    public static Value of(Object o) {
        if (o == null) {
            return NULL;
        } else if (o instanceof Value) {
            return (Value) o;
        } else if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return newInt64(((Number) o).longValue());
        } else if (o instanceof BigInteger) {
            BigInteger b = (BigInteger) o;
            if (b.signum() < 0 || b.compareTo(MAX_UINT64) > 0) {
                throw new IllegalArgumentException(String.format("%s is out of range for uint64", b));
            }
            return newUint64(b.longValue());
        } else if (o instanceof Double || o instanceof Float) {
            return newFloat64(((Number) o).doubleValue());
        } else if (o instanceof String) {
            return newVarChar((String) o);
        } else if (o instanceof byte[]) {
            return newVarBinary((byte[]) o);
        }
        throw new IllegalArgumentException(String.format("unsupported value type %s", o.getClass().getName()));
    }

    public Type getType() {
        return type;
    }

    public boolean isNull() {
        return type == Type.NULL_TYPE;
    }

    public boolean isIntegral() {
        return type.isIntegral();
    }

    /** A copy of the raw bytes. */
    public byte[] raw() {
        return raw.clone();
    }

    public String toText() {
        return new String(raw, StandardCharsets.UTF_8);
    }

    /**
     * The bits of an integral value as an unsigned 64-bit integer.  Signed values keep their
     * two's complement bits.
     *
     * @throws NumberFormatException if the value is not integral or does not fit
     */
    public long toUint64Bits() {
        if (!type.isIntegral()) {
            throw new NumberFormatException(String.format("%s is not an integral type", type));
        }
        String text = toText();
        if (type.isUnsigned()) {
            return Long.parseUnsignedLong(text);
        }
        return Long.parseLong(text);
    }

    /** @throws NumberFormatException if the value is not integral */
    public BigInteger toBigInteger() {
        if (!type.isIntegral()) {
            throw new NumberFormatException(String.format("%s is not an integral type", type));
        }
        return new BigInteger(toText());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        return type == other.type && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        if (isNull()) {
            return "NULL";
        }
        if (type.isBinary()) {
            return String.format("%s(%d bytes)", type, raw.length);
        }
        return String.format("%s(%s)", type, toText());
    }
}
