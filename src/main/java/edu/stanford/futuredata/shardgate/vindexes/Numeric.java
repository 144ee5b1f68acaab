package edu.stanford.futuredata.shardgate.vindexes;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Uses the big-endian bytes of an unsigned 64-bit id as its keyspace id. */
public class Numeric implements Reversible {

    public static final String TYPE = "numeric";

    private final String name;

    public Numeric(String name) {
        this.name = name;
    }

    public static Vindex create(String name, Map<String, Object> params) {
        return new Numeric(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getCost() {
        return 0;
    }

    @Override
    public List<KeyspaceId> map(List<?> ids) throws VindexException {
        List<KeyspaceId> out = new ArrayList<>(ids.size());
        for (Object id: ids) {
            try {
                out.add(toKeyspaceId(VindexValues.toUint64(id)));
            } catch (MappingException e) {
                throw new MappingException(String.format("Numeric.map: %s", e.getMessage()), e);
            }
        }
        return out;
    }

    @Override
    public boolean verify(Object id, KeyspaceId ksid) throws VindexException {
        try {
            return toKeyspaceId(VindexValues.toUint64(id)).equals(ksid);
        } catch (MappingException e) {
            throw new MappingException(String.format("Numeric.verify: %s", e.getMessage()), e);
        }
    }

    @Override
    public List<Object> reverseMap(List<KeyspaceId> ksids) throws VindexException {
        List<Object> out = new ArrayList<>(ksids.size());
        for (KeyspaceId ksid: ksids) {
            if (ksid.length() != 8) {
                throw new MappingException(String.format("Numeric.reverseMap: length of keyspace id is not 8: %d", ksid.length()));
            }
            out.add(ByteBuffer.wrap(ksid.bytes()).getLong());
        }
        return out;
    }

    static KeyspaceId toKeyspaceId(long unsignedBits) {
        return KeyspaceId.of(ByteBuffer.allocate(8).putLong(unsignedBits).array());
    }

    @Override
    public String toString() {
        return name;
    }
}
