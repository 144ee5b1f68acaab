package edu.stanford.futuredata.shardgate.router;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.vindexes.KeyspaceId;

import java.util.List;
import java.util.Objects;

/** A query addressed by the keyspace ids of the rows it touches. */
public final class BoundKeyspaceIdQuery {
    private final String keyspace;
    private final BoundQuery query;
    private final List<KeyspaceId> keyspaceIds;

    public BoundKeyspaceIdQuery(String keyspace, BoundQuery query, List<KeyspaceId> keyspaceIds) {
        this.keyspace = Objects.requireNonNull(keyspace, "keyspace");
        this.query = Objects.requireNonNull(query, "query");
        this.keyspaceIds = List.copyOf(keyspaceIds);
    }

    public String getKeyspace() {
        return keyspace;
    }

    public BoundQuery getQuery() {
        return query;
    }

    public List<KeyspaceId> getKeyspaceIds() {
        return keyspaceIds;
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", keyspace, keyspaceIds, query);
    }
}
