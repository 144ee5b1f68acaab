package edu.stanford.futuredata.shardgate.tabletconn;

import io.grpc.Context;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A bounded hand-off between a producer thread and a {@link TabletStream} reader.  The
 * producer blocks while the buffer is full.  Both sides observe the stream context, so
 * cancelling it or closing the stream unblocks them.
 */
public class BufferedStream<T> implements TabletStream<T> {

    public static final int DEFAULT_CAPACITY = 16;
    private static final long POLL_INTERVAL_MILLIS = 20;

    private final BlockingQueue<Item<T>> queue;
    private final Context.CancellableContext streamContext;
    private volatile boolean closed = false;
    // Terminal state seen by the reader.
    private boolean ended = false;
    private TabletConnException failure = null;

    public BufferedStream(Context.CancellableContext streamContext, int capacity) {
        this.streamContext = streamContext;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public Context.CancellableContext getStreamContext() {
        return streamContext;
    }

    /* PRODUCER */

    /**
     * Hand an item to the reader, waiting for room.
     *
     * @return false if the reader went away; the producer should stop
     */
    public boolean send(T item) throws InterruptedException {
        return put(new Item<>(item, null));
    }

    /** Hand an item to the reader if there is room right now. */
    public boolean offer(T item) {
        return !isAbandoned() && queue.offer(new Item<>(item, null));
    }

    public void finish() throws InterruptedException {
        put(new Item<>(null, null));
    }

    public void fail(TabletConnException e) throws InterruptedException {
        put(new Item<>(null, e));
    }

    public boolean isAbandoned() {
        return closed || streamContext.isCancelled();
    }

    private boolean put(Item<T> item) throws InterruptedException {
        while (!isAbandoned()) {
            if (queue.offer(item, POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /* READER */

    @Override
    public Optional<T> recv() throws TabletConnException {
        if (failure != null) {
            throw failure;
        }
        if (ended || closed) {
            return Optional.empty();
        }
        // Buffered items are not handed out once the context is cancelled.
        if (streamContext.isCancelled()) {
            throw cancelled();
        }
        while (true) {
            Item<T> item;
            try {
                item = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationalException(OperationalException.Kind.CANCELLED, "interrupted while receiving", e);
            }
            if (item != null) {
                if (item.error != null) {
                    failure = item.error;
                    streamContext.cancel(null);
                    throw failure;
                } else if (item.value == null) {
                    ended = true;
                    streamContext.cancel(null);
                    return Optional.empty();
                }
                return Optional.of(item.value);
            }
            if (closed) {
                return Optional.empty();
            }
            if (streamContext.isCancelled()) {
                throw cancelled();
            }
        }
    }

    private TabletConnException cancelled() {
        failure = new OperationalException(OperationalException.Kind.CANCELLED,
                "stream context cancelled", streamContext.cancellationCause());
        return failure;
    }

    @Override
    public void close() {
        closed = true;
        streamContext.cancel(null);
        queue.clear();
    }

    // A value, an error, or (both null) the end of the stream.
    private static final class Item<T> {
        final T value;
        final TabletConnException error;

        Item(T value, TabletConnException error) {
            this.value = value;
            this.error = error;
        }
    }
}
