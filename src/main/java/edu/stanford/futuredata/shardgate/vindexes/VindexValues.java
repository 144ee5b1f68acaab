package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.sqltypes.Value;

import java.math.BigInteger;

/** Input conversions shared by the vindex variants. */
final class VindexValues {

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private VindexValues() {}

    // Raw bytes of a byte[] or a Value.
    static byte[] toBytes(Object id) throws MappingException {
        if (id instanceof byte[]) {
            return (byte[]) id;
        } else if (id instanceof Value) {
            return ((Value) id).raw();
        }
        throw new MappingException(String.format("unexpected data type for binary hash: %s", typeName(id)));
    }

    // The bits of an unsigned 64-bit integer.
    static long toUint64(Object id) throws MappingException {
        if (id instanceof Long || id instanceof Integer || id instanceof Short || id instanceof Byte) {
            return ((Number) id).longValue();
        } else if (id instanceof BigInteger) {
            BigInteger b = (BigInteger) id;
            if (b.signum() < 0 || b.compareTo(MAX_UINT64) > 0) {
                throw new MappingException(String.format("%s is out of range for uint64", b));
            }
            return b.longValue();
        } else if (id instanceof Value) {
            Value v = (Value) id;
            if (!v.isIntegral()) {
                throw new MappingException(String.format("unexpected value type for number: %s", v.getType()));
            }
            try {
                return v.toUint64Bits();
            } catch (NumberFormatException e) {
                throw new MappingException(String.format("could not parse %s as a number", v), e);
            }
        }
        throw new MappingException(String.format("unexpected data type for number: %s", typeName(id)));
    }

    static Value toValue(Object id) throws MappingException {
        try {
            return Value.of(id);
        } catch (IllegalArgumentException e) {
            throw new MappingException(e.getMessage(), e);
        }
    }

    static String typeName(Object o) {
        return o == null ? "null" : o.getClass().getName();
    }
}
