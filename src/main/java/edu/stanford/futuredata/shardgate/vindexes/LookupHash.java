package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.utilities.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A lookup vindex whose table maps ids to unsigned 64-bit user ids; the keyspace id is the
 * {@link Hash} of the stored user id.  An id missing from the table maps to
 * {@link KeyspaceId#NONE} and never verifies.  Store failures raise
 * {@link BackingStoreException}.
 *
 * <p>Parameters: {@code table}, {@code from} and {@code to}, all required.
 */
public class LookupHash implements Lookup {

    public static final String TYPE = "lookup_hash";

    private final String name;
    private final String table;
    private final String fromColumn;
    private final String toColumn;
    private final LookupStore store;

    public LookupHash(String name, String table, String fromColumn, String toColumn, LookupStore store) {
        this.name = name;
        this.table = table;
        this.fromColumn = fromColumn;
        this.toColumn = toColumn;
        this.store = store;
    }

    /** A factory binding every lookup_hash vindex it creates to store. */
    public static VindexFactory factory(LookupStore store) {
        return (name, params) -> new LookupHash(name,
                requiredParam(name, params, "table"),
                requiredParam(name, params, "from"),
                requiredParam(name, params, "to"),
                store);
    }

    private static String requiredParam(String name, Map<String, Object> params, String key) {
        Object v = params == null ? null : params.get(key);
        if (v == null || v.toString().isEmpty()) {
            throw new ConfigurationException(String.format("vindex %s: missing required parameter %s", name, key));
        }
        return v.toString();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getCost() {
        return 20;
    }

    @Override
    public List<KeyspaceId> map(List<?> ids) throws VindexException {
        List<KeyspaceId> out = new ArrayList<>(ids.size());
        for (Object id: ids) {
            Optional<Value> to = store.get(table, fromColumn, toColumn, VindexValues.toValue(id));
            if (to.isEmpty()) {
                out.add(KeyspaceId.NONE);
            } else {
                out.add(KeyspaceId.of(Hash.vhash(storedNumber(to.get()))));
            }
        }
        return out;
    }

    @Override
    public boolean verify(Object id, KeyspaceId ksid) throws VindexException {
        Optional<Value> to = store.get(table, fromColumn, toColumn, VindexValues.toValue(id));
        if (to.isEmpty()) {
            return false;
        }
        return KeyspaceId.of(Hash.vhash(storedNumber(to.get()))).equals(ksid);
    }

    @Override
    public void create(Object id, KeyspaceId ksid) throws VindexException {
        store.put(table, fromColumn, toColumn, VindexValues.toValue(id), Value.newUint64(unhash(ksid)));
    }

    @Override
    public void delete(List<?> ids, KeyspaceId ksid) throws VindexException {
        List<Value> values = new ArrayList<>(ids.size());
        for (Object id: ids) {
            values.add(VindexValues.toValue(id));
        }
        store.delete(table, fromColumn, toColumn, values, Value.newUint64(unhash(ksid)));
    }

    private long unhash(KeyspaceId ksid) throws MappingException {
        if (ksid.length() != 8) {
            throw new MappingException(String.format("LookupHash: invalid keyspace id %s", ksid));
        }
        return Hash.vunhash(ksid.bytes());
    }

    private long storedNumber(Value to) throws BackingStoreException {
        try {
            return to.toUint64Bits();
        } catch (NumberFormatException e) {
            throw new BackingStoreException(String.format("LookupHash %s: %s.%s holds non-numeric value %s",
                    name, table, toColumn, to), e);
        }
    }

    public String getTable() {
        return table;
    }

    @Override
    public String toString() {
        return name;
    }
}
