package edu.stanford.futuredata.shardgate.vindexes;

import java.util.List;

/**
 * Maps column values to keyspace ids.  Implementations are immutable after construction and
 * safe for concurrent use; the same input always maps to the same keyspace id.
 */
public interface Vindex {
    // The name this vindex was declared under in the schema.
    String getName();
    // Planning weight.  Lower is cheaper; constant for the life of the instance.
    int getCost();
    // One keyspace id per id, in input order.  Fails as a whole if any id is unsupported.
    List<KeyspaceId> map(List<?> ids) throws VindexException;
    // Does id map to exactly ksid?
    boolean verify(Object id, KeyspaceId ksid) throws VindexException;
}
