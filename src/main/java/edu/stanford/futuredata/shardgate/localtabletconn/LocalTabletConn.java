package edu.stanford.futuredata.shardgate.localtabletconn;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.tabletconn.AbstractTabletConn;
import edu.stanford.futuredata.shardgate.tabletconn.BufferedStream;
import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.ResultStream;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.SplitQueryAlgorithm;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthReader;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import edu.stanford.futuredata.shardgate.tabletconn.Target;
import edu.stanford.futuredata.shardgate.tabletserver.TabletService;
import io.grpc.Context;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A tablet connection calling a {@link TabletService} in the same process.  Streams are
 * produced on their own thread into a bounded buffer.
 */
public class LocalTabletConn extends AbstractTabletConn {

    private static final Logger logger = LoggerFactory.getLogger(LocalTabletConn.class);

    private final TabletService tabletService;
    // Streams to cancel when the connection closes.
    private final Set<BufferedStream<?>> openStreams = ConcurrentHashMap.newKeySet();

    LocalTabletConn(EndPoint endPoint, Target target, TabletService tabletService) {
        super(endPoint, target);
        this.tabletService = tabletService;
    }

    /* PROTOCOL HOOKS */

    @Override
    protected Result doExecute(Context ctx, BoundQuery query, long transactionId) throws TabletConnException {
        return tabletService.execute(getTarget(), query, transactionId);
    }

    @Override
    protected List<Result> doExecuteBatch(Context ctx, List<BoundQuery> queries, boolean asTransaction,
                                          long transactionId) throws TabletConnException {
        return tabletService.executeBatch(getTarget(), queries, asTransaction, transactionId);
    }

    @Override
    protected ResultStream doStreamExecute(Context ctx, BoundQuery query) throws TabletConnException {
        BufferedResults stream = new BufferedResults(ctx.withCancellation());
        openStreams.add(stream);
        new StreamProducer(stream, getTarget(), query).start();
        return stream;
    }

    @Override
    protected long doBegin(Context ctx) throws TabletConnException {
        return tabletService.begin(getTarget());
    }

    @Override
    protected void doCommit(Context ctx, long transactionId) throws TabletConnException {
        tabletService.commit(getTarget(), transactionId);
    }

    @Override
    protected void doRollback(Context ctx, long transactionId) throws TabletConnException {
        tabletService.rollback(getTarget(), transactionId);
    }

    @Override
    protected Pair<Result, Long> doBeginExecute(Context ctx, BoundQuery query) throws TabletConnException {
        return tabletService.beginExecute(getTarget(), query);
    }

    @Override
    protected Pair<List<Result>, Long> doBeginExecuteBatch(Context ctx, List<BoundQuery> queries)
            throws TabletConnException {
        return tabletService.beginExecuteBatch(getTarget(), queries, false);
    }

    @Override
    protected List<QuerySplit> doSplitQuery(Context ctx, BoundQuery query, List<String> splitColumns,
                                            long splitCount, long numRowsPerQueryPart,
                                            SplitQueryAlgorithm algorithm) throws TabletConnException {
        return tabletService.splitQuery(getTarget(), query, splitColumns, splitCount, numRowsPerQueryPart, algorithm);
    }

    @Override
    protected StreamHealthReader doStreamHealth(Context ctx) throws TabletConnException {
        BufferedHealth stream = new BufferedHealth(ctx.withCancellation());
        openStreams.add(stream);
        long subscriptionId = tabletService.subscribeHealth(snapshot -> {
            // A full buffer drops the snapshot; a newer one follows.
            if (!stream.offer(snapshot) && stream.isAbandoned()) {
                throw new ServerException(ErrorCode.CANCELLED, "health stream closed");
            }
        });
        // Closing the reader or the connection cancels the stream context.
        stream.getStreamContext().addListener(context -> {
            tabletService.unsubscribeHealth(subscriptionId);
            openStreams.remove(stream);
        }, Runnable::run);
        return stream;
    }

    @Override
    protected void doClose() {
        for (BufferedStream<?> stream: openStreams) {
            stream.close();
        }
        openStreams.clear();
    }

    private static final class BufferedResults extends BufferedStream<Result> implements ResultStream {
        BufferedResults(Context.CancellableContext streamContext) {
            super(streamContext, DEFAULT_CAPACITY);
        }
    }

    private static final class BufferedHealth extends BufferedStream<StreamHealthResponse>
            implements StreamHealthReader {
        BufferedHealth(Context.CancellableContext streamContext) {
            super(streamContext, DEFAULT_CAPACITY);
        }
    }

    private class StreamProducer extends Thread {
        private final BufferedStream<Result> stream;
        private final Target target;
        private final BoundQuery query;

        StreamProducer(BufferedStream<Result> stream, Target target, BoundQuery query) {
            this.stream = stream;
            this.target = target;
            this.query = query;
            setDaemon(true);
        }

        @Override
        public void run() {
            try {
                tabletService.streamExecute(target, query, chunk -> {
                    try {
                        if (!stream.send(chunk)) {
                            throw new ServerException(ErrorCode.CANCELLED, "stream abandoned by reader");
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ServerException(ErrorCode.CANCELLED, "stream producer interrupted", e);
                    }
                });
                stream.finish();
            } catch (ServerException e) {
                if (stream.isAbandoned()) {
                    logger.debug("Stream on {} ended after the reader left: {}", target, e.getMessage());
                } else {
                    fail(e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                openStreams.remove(stream);
            }
        }

        private void fail(ServerException e) {
            try {
                stream.fail(e);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
