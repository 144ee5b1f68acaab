package edu.stanford.futuredata.shardgate.tabletconn;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import io.grpc.Context;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The rules every protocol shares: closed-connection and cancellation checks before any
 * remote call, argument validation, and the transaction bookkeeping of a connection.
 * Protocols implement the {@code do*} hooks.
 */
public abstract class AbstractTabletConn implements TabletConn {

    private static final Logger logger = LoggerFactory.getLogger(AbstractTabletConn.class);

    private final EndPoint endPoint;
    private volatile Target target;
    private volatile boolean closed = false;
    // Zero when no transaction is open.
    private long activeTransactionId = 0;

    protected AbstractTabletConn(EndPoint endPoint, Target target) {
        this.endPoint = Objects.requireNonNull(endPoint, "endPoint");
        this.target = Objects.requireNonNull(target, "target");
    }

    /* PROTOCOL HOOKS */

    protected abstract Result doExecute(Context ctx, BoundQuery query, long transactionId) throws TabletConnException;

    protected abstract List<Result> doExecuteBatch(Context ctx, List<BoundQuery> queries, boolean asTransaction,
                                                   long transactionId) throws TabletConnException;

    protected abstract ResultStream doStreamExecute(Context ctx, BoundQuery query) throws TabletConnException;

    protected abstract long doBegin(Context ctx) throws TabletConnException;

    protected abstract void doCommit(Context ctx, long transactionId) throws TabletConnException;

    protected abstract void doRollback(Context ctx, long transactionId) throws TabletConnException;

    protected abstract Pair<Result, Long> doBeginExecute(Context ctx, BoundQuery query) throws TabletConnException;

    protected abstract Pair<List<Result>, Long> doBeginExecuteBatch(Context ctx, List<BoundQuery> queries)
            throws TabletConnException;

    protected abstract List<QuerySplit> doSplitQuery(Context ctx, BoundQuery query, List<String> splitColumns,
                                                     long splitCount, long numRowsPerQueryPart,
                                                     SplitQueryAlgorithm algorithm) throws TabletConnException;

    protected abstract StreamHealthReader doStreamHealth(Context ctx) throws TabletConnException;

    // Release protocol resources.  Called once.
    protected abstract void doClose();

    /* PUBLIC FUNCTIONS */

    @Override
    public final Result execute(Context ctx, BoundQuery query, long transactionId) throws TabletConnException {
        checkUsable(ctx);
        checkOwned(transactionId, true);
        return doExecute(ctx, query, transactionId);
    }

    @Override
    public final List<Result> executeBatch(Context ctx, List<BoundQuery> queries, boolean asTransaction,
                                           long transactionId) throws TabletConnException {
        if (asTransaction && transactionId != 0) {
            throw new IllegalArgumentException("executeBatch: asTransaction cannot be used inside transaction "
                    + transactionId);
        }
        checkUsable(ctx);
        checkOwned(transactionId, true);
        return doExecuteBatch(ctx, queries, asTransaction, transactionId);
    }

    @Override
    public final ResultStream streamExecute(Context ctx, BoundQuery query) throws TabletConnException {
        checkUsable(ctx);
        return doStreamExecute(ctx, query);
    }

    @Override
    public final long begin(Context ctx) throws TabletConnException {
        checkUsable(ctx);
        checkNoTransaction();
        long transactionId = doBegin(ctx);
        activeTransactionId = transactionId;
        return transactionId;
    }

    @Override
    public final void commit(Context ctx, long transactionId) throws TabletConnException {
        checkUsable(ctx);
        checkOwned(transactionId, false);
        try {
            doCommit(ctx, transactionId);
        } finally {
            activeTransactionId = 0;
        }
    }

    @Override
    public final void rollback(Context ctx, long transactionId) throws TabletConnException {
        checkUsable(ctx);
        checkOwned(transactionId, false);
        try {
            doRollback(ctx, transactionId);
        } finally {
            activeTransactionId = 0;
        }
    }

    @Override
    public final Pair<Result, Long> beginExecute(Context ctx, BoundQuery query) throws TabletConnException {
        checkUsable(ctx);
        checkNoTransaction();
        try {
            Pair<Result, Long> r = doBeginExecute(ctx, query);
            activeTransactionId = r.getValue1();
            return r;
        } catch (TabletConnException e) {
            activeTransactionId = e.getTransactionId();
            throw e;
        }
    }

    @Override
    public final Pair<List<Result>, Long> beginExecuteBatch(Context ctx, List<BoundQuery> queries,
                                                            boolean asTransaction) throws TabletConnException {
        if (asTransaction) {
            throw new IllegalArgumentException("beginExecuteBatch: the batch already runs in the begun transaction");
        }
        checkUsable(ctx);
        checkNoTransaction();
        try {
            Pair<List<Result>, Long> r = doBeginExecuteBatch(ctx, queries);
            activeTransactionId = r.getValue1();
            return r;
        } catch (TabletConnException e) {
            activeTransactionId = e.getTransactionId();
            throw e;
        }
    }

    @Override
    public final List<QuerySplit> splitQueryV2(Context ctx, BoundQuery query, List<String> splitColumns,
                                               long splitCount, long numRowsPerQueryPart,
                                               SplitQueryAlgorithm algorithm) throws TabletConnException {
        checkUsable(ctx);
        return doSplitQuery(ctx, query, splitColumns == null ? List.of() : splitColumns, splitCount,
                numRowsPerQueryPart, algorithm);
    }

    @Override
    public final StreamHealthReader streamHealth(Context ctx) throws TabletConnException {
        checkUsable(ctx);
        return doStreamHealth(ctx);
    }

    @Override
    public final void setTarget(String keyspace, String shard, TabletType tabletType) throws TabletConnException {
        checkOpen();
        Target t = new Target(keyspace, shard, tabletType);
        logger.debug("Connection to {} retargeted from {} to {}", endPoint, target, t);
        this.target = t;
    }

    @Override
    public final Target getTarget() {
        return target;
    }

    @Override
    public final EndPoint getEndPoint() {
        return endPoint;
    }

    // The open transaction, or zero.
    public final long getActiveTransactionId() {
        return activeTransactionId;
    }

    public final boolean isClosed() {
        return closed;
    }

    @Override
    public final void close() {
        if (closed) {
            return;
        }
        closed = true;
        doClose();
    }

    /* PRIVATE FUNCTIONS */

    private void checkOpen() throws OperationalException {
        if (closed) {
            throw new OperationalException(OperationalException.Kind.CONNECTION_CLOSED,
                    String.format("connection to %s is closed", endPoint));
        }
    }

    private void checkUsable(Context ctx) throws OperationalException {
        checkOpen();
        if (ctx.isCancelled()) {
            throw new OperationalException(OperationalException.Kind.CANCELLED,
                    "context cancelled before the call", ctx.cancellationCause());
        }
    }

    private void checkNoTransaction() {
        if (activeTransactionId != 0) {
            throw new IllegalStateException(String.format("transaction %d is already open on this connection",
                    activeTransactionId));
        }
    }

    // Zero is allowed only where the call may run outside a transaction.
    private void checkOwned(long transactionId, boolean zeroAllowed) {
        if (transactionId == 0 && zeroAllowed) {
            return;
        }
        if (transactionId == 0 || transactionId != activeTransactionId) {
            throw new IllegalArgumentException(String.format("transaction %d is not open on this connection",
                    transactionId));
        }
    }
}
