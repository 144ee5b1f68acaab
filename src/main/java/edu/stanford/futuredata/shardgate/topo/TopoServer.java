package edu.stanford.futuredata.shardgate.topo;

import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.vindexes.KeyRange;

import java.util.List;
import java.util.Optional;

/**
 * Where shards and tablets are.  Implementations throw {@link TopoException} when the
 * topology cannot be read or written.
 */
public interface TopoServer extends AutoCloseable {
    // Shards of keyspace, in no particular order.  Empty for an unknown keyspace.
    List<ShardReference> getShardReferences(String keyspace);
    Optional<EndPoint> getEndPoint(String keyspace, String shard, TabletType tabletType);
    void registerShard(String keyspace, String shard, KeyRange keyRange);
    // The shard must already be registered.
    void registerEndPoint(String keyspace, String shard, TabletType tabletType, EndPoint endPoint);
    @Override
    void close();
}
