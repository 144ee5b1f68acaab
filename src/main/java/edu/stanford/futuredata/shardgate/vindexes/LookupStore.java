package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.sqltypes.Value;

import java.util.List;
import java.util.Optional;

/**
 * The key-value table behind a lookup vindex.  Rows map a "from" column value to a "to"
 * column value.  Implementations must be safe for concurrent use.
 */
public interface LookupStore {
    // The "to" value stored for id, or empty if there is none.
    Optional<Value> get(String table, String fromColumn, String toColumn, Value id) throws BackingStoreException;
    // Store a row mapping id to value.
    void put(String table, String fromColumn, String toColumn, Value id, Value to) throws BackingStoreException;
    // Remove the rows mapping any of ids to value.
    void delete(String table, String fromColumn, String toColumn, List<Value> ids, Value to) throws BackingStoreException;
}
