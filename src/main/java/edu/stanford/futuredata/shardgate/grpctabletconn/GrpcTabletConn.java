package edu.stanford.futuredata.shardgate.grpctabletconn;

import edu.stanford.futuredata.shardgate.*;
import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.tabletconn.AbstractTabletConn;
import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.OperationalException;
import edu.stanford.futuredata.shardgate.tabletconn.ResultStream;
import edu.stanford.futuredata.shardgate.tabletconn.SplitQueryAlgorithm;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthReader;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletDialer;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.tabletconn.Target;
import io.grpc.ConnectivityState;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** A tablet connection over the GateTablet gRPC service. */
public class GrpcTabletConn extends AbstractTabletConn {

    private static final Logger logger = LoggerFactory.getLogger(GrpcTabletConn.class);

    public static final String PROTOCOL = "grpc";
    public static final TabletDialer DIALER = GrpcTabletConn::dial;

    private static final long READY_POLL_MILLIS = 50;

    private final ManagedChannel channel;
    private final GateTabletGrpc.GateTabletBlockingStub stub;

    GrpcTabletConn(EndPoint endPoint, Target target, ManagedChannel channel) {
        super(endPoint, target);
        this.channel = channel;
        this.stub = GateTabletGrpc.newBlockingStub(channel);
    }

    /**
     * Open a channel to endPoint.  With a positive timeout, wait until the channel is ready;
     * otherwise connect on first use.
     */
    public static GrpcTabletConn dial(Context ctx, EndPoint endPoint, String keyspace, String shard,
                                      TabletType tabletType, Duration timeout) throws TabletConnException {
        ManagedChannel channel = ManagedChannelBuilder.forAddress(endPoint.host, endPoint.port).usePlaintext().build();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            try {
                awaitReady(ctx, channel, endPoint, timeout);
            } catch (TabletConnException e) {
                channel.shutdownNow();
                throw e;
            }
        }
        logger.debug("Dialed {} for {}/{} ({})", endPoint, keyspace, shard, tabletType);
        return new GrpcTabletConn(endPoint, new Target(keyspace, shard, tabletType), channel);
    }

    private static void awaitReady(Context ctx, ManagedChannel channel, EndPoint endPoint, Duration timeout)
            throws TabletConnException {
        long deadline = System.nanoTime() + timeout.toNanos();
        ConnectivityState state = channel.getState(true);
        while (state != ConnectivityState.READY) {
            if (ctx.isCancelled()) {
                throw new OperationalException(OperationalException.Kind.CANCELLED,
                        String.format("dial %s cancelled", endPoint), ctx.cancellationCause());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new OperationalException(OperationalException.Kind.NETWORK,
                        String.format("dial %s timed out after %s in state %s", endPoint, timeout, state));
            }
            if (state == ConnectivityState.IDLE) {
                channel.getState(true);
            }
            CountDownLatch changed = new CountDownLatch(1);
            channel.notifyWhenStateChanged(state, changed::countDown);
            try {
                // Wake up periodically to notice cancellation.
                changed.await(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(READY_POLL_MILLIS)),
                        TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationalException(OperationalException.Kind.CANCELLED,
                        String.format("dial %s interrupted", endPoint), e);
            }
            state = channel.getState(false);
        }
    }

    /* PROTOCOL HOOKS */

    @Override
    protected Result doExecute(Context ctx, BoundQuery query, long transactionId) throws TabletConnException {
        ExecuteMessage m = ExecuteMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .setQuery(ProtoConverter.toProto(query))
                .setTransactionId(transactionId)
                .build();
        ExecuteResponse r = call(ctx, () -> stub.execute(m));
        return ProtoConverter.fromProto(r.getResult());
    }

    @Override
    protected List<Result> doExecuteBatch(Context ctx, List<BoundQuery> queries, boolean asTransaction,
                                          long transactionId) throws TabletConnException {
        ExecuteBatchMessage m = ExecuteBatchMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .addAllQueries(ProtoConverter.queriesToProto(queries))
                .setAsTransaction(asTransaction)
                .setTransactionId(transactionId)
                .build();
        ExecuteBatchResponse r = call(ctx, () -> stub.executeBatch(m));
        return ProtoConverter.resultsFromProto(r.getResultsList());
    }

    @Override
    protected ResultStream doStreamExecute(Context ctx, BoundQuery query) throws TabletConnException {
        StreamExecuteMessage m = StreamExecuteMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .setQuery(ProtoConverter.toProto(query))
                .build();
        Context.CancellableContext callContext = ctx.withCancellation();
        try {
            Iterator<StreamExecuteResponse> responses = call(callContext, () -> stub.streamExecute(m));
            return new GrpcStream.Results(callContext, responses);
        } catch (TabletConnException e) {
            callContext.cancel(e);
            throw e;
        }
    }

    @Override
    protected long doBegin(Context ctx) throws TabletConnException {
        BeginMessage m = BeginMessage.newBuilder().setTarget(ProtoConverter.toProto(getTarget())).build();
        BeginResponse r = call(ctx, () -> stub.begin(m));
        return r.getTransactionId();
    }

    @Override
    protected void doCommit(Context ctx, long transactionId) throws TabletConnException {
        CommitMessage m = CommitMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .setTransactionId(transactionId)
                .build();
        call(ctx, () -> stub.commit(m));
    }

    @Override
    protected void doRollback(Context ctx, long transactionId) throws TabletConnException {
        RollbackMessage m = RollbackMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .setTransactionId(transactionId)
                .build();
        call(ctx, () -> stub.rollback(m));
    }

    @Override
    protected Pair<Result, Long> doBeginExecute(Context ctx, BoundQuery query) throws TabletConnException {
        BeginExecuteMessage m = BeginExecuteMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .setQuery(ProtoConverter.toProto(query))
                .build();
        BeginExecuteResponse r = call(ctx, () -> stub.beginExecute(m));
        if (r.hasError()) {
            throw ProtoConverter.fromProto(r.getError(), r.getTransactionId());
        }
        return new Pair<>(ProtoConverter.fromProto(r.getResult()), r.getTransactionId());
    }

    @Override
    protected Pair<List<Result>, Long> doBeginExecuteBatch(Context ctx, List<BoundQuery> queries)
            throws TabletConnException {
        BeginExecuteBatchMessage m = BeginExecuteBatchMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .addAllQueries(ProtoConverter.queriesToProto(queries))
                .setAsTransaction(false)
                .build();
        BeginExecuteBatchResponse r = call(ctx, () -> stub.beginExecuteBatch(m));
        if (r.hasError()) {
            throw ProtoConverter.fromProto(r.getError(), r.getTransactionId());
        }
        return new Pair<>(ProtoConverter.resultsFromProto(r.getResultsList()), r.getTransactionId());
    }

    @Override
    protected List<QuerySplit> doSplitQuery(Context ctx, BoundQuery query, List<String> splitColumns,
                                            long splitCount, long numRowsPerQueryPart,
                                            SplitQueryAlgorithm algorithm) throws TabletConnException {
        SplitQueryMessage m = SplitQueryMessage.newBuilder()
                .setTarget(ProtoConverter.toProto(getTarget()))
                .setQuery(ProtoConverter.toProto(query))
                .addAllSplitColumns(splitColumns)
                .setSplitCount(splitCount)
                .setNumRowsPerQueryPart(numRowsPerQueryPart)
                .setAlgorithm(algorithm.getNumber())
                .build();
        SplitQueryResponse r = call(ctx, () -> stub.splitQuery(m));
        List<QuerySplit> splits = new ArrayList<>(r.getQueriesCount());
        for (QuerySplitMessage s: r.getQueriesList()) {
            splits.add(ProtoConverter.fromProto(s));
        }
        return splits;
    }

    @Override
    protected StreamHealthReader doStreamHealth(Context ctx) throws TabletConnException {
        StreamHealthMessage m = StreamHealthMessage.newBuilder().build();
        Context.CancellableContext callContext = ctx.withCancellation();
        try {
            Iterator<HealthSnapshotMessage> responses = call(callContext, () -> stub.streamHealth(m));
            return new GrpcStream.Health(callContext, responses);
        } catch (TabletConnException e) {
            callContext.cancel(e);
            throw e;
        }
    }

    @Override
    protected void doClose() {
        channel.shutdownNow();
    }

    /* PRIVATE FUNCTIONS */

    // Run a stub call with ctx attached, so the call inherits its deadline and cancellation.
    private static <T> T call(Context ctx, Callable<T> rpc) throws TabletConnException {
        try {
            return ctx.call(rpc);
        } catch (StatusRuntimeException e) {
            throw GrpcErrors.fromStatusException(e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new OperationalException(OperationalException.Kind.NETWORK, e.getMessage(), e);
        }
    }
}
