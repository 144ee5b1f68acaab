package edu.stanford.futuredata.shardgate.vindexes;

import java.util.List;

/** A vindex whose mapping can be inverted without a backing store. */
public interface Reversible extends Vindex {
    List<Object> reverseMap(List<KeyspaceId> ksids) throws VindexException;
}
