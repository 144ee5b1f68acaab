package edu.stanford.futuredata.shardgate.vindexes;

import java.util.List;

/** A vindex backed by a lookup table whose rows it owns. */
public interface Lookup extends Vindex {
    // Record that id maps to ksid.
    void create(Object id, KeyspaceId ksid) throws VindexException;
    // Remove the rows mapping ids to ksid.
    void delete(List<?> ids, KeyspaceId ksid) throws VindexException;
}
