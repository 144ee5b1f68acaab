package edu.stanford.futuredata.shardgate.tabletserver;

import edu.stanford.futuredata.shardgate.tabletconn.ServerException;

/** Where a tablet writes the items of a server stream. */
@FunctionalInterface
public interface StreamSink<T> {
    /**
     * Send one item, waiting while the receiver is behind.
     *
     * @throws ServerException with code CANCELLED once the receiver went away; the producer
     *                         must stop
     */
    void send(T item) throws ServerException;
}
