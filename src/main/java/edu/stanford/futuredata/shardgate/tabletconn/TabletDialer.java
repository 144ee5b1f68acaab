package edu.stanford.futuredata.shardgate.tabletconn;

import io.grpc.Context;

import java.time.Duration;

/** Opens connections to tablets over one wire protocol. */
@FunctionalInterface
public interface TabletDialer {
    /**
     * Connect to the tablet at endPoint, bound to the given target.
     *
     * @param timeout how long to wait for the connection; zero connects lazily
     */
    TabletConn dial(Context ctx, EndPoint endPoint, String keyspace, String shard, TabletType tabletType,
                    Duration timeout) throws TabletConnException;
}
