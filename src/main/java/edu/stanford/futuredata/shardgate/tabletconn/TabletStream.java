package edu.stanford.futuredata.shardgate.tabletconn;

import java.util.Optional;

/**
 * A pull cursor over a server stream.  Items already received stay valid after later
 * failures.  Not thread-safe, except that {@link #close()} may be called from any thread.
 */
public interface TabletStream<T> extends AutoCloseable {
    /**
     * Block for the next item.
     *
     * @return the item, or empty once the stream has ended or been closed
     * @throws TabletConnException the error that ended the stream; repeated on later calls
     */
    Optional<T> recv() throws TabletConnException;

    /** Abandon the stream.  The server side is cancelled if it is still sending. */
    @Override
    void close();
}
