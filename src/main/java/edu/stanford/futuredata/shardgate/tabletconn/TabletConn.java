package edu.stanford.futuredata.shardgate.tabletconn;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import io.grpc.Context;
import org.javatuples.Pair;

import java.util.List;

/**
 * A connection to one tablet, bound to a target.  Every blocking call takes the caller's
 * {@link Context}, whose cancellation and deadline bound the call.
 *
 * <p>A connection is not thread-safe: use it from one thread at a time.  It tracks at most
 * one open transaction, the one its last begin call returned.
 */
public interface TabletConn extends AutoCloseable {

    /** Run one query, inside transactionId if it is non-zero. */
    Result execute(Context ctx, BoundQuery query, long transactionId) throws TabletConnException;

    /**
     * Run queries in order.  With asTransaction the tablet wraps the batch in its own
     * transaction and applies it all or nothing; asTransaction requires transactionId == 0.
     */
    List<Result> executeBatch(Context ctx, List<BoundQuery> queries, boolean asTransaction, long transactionId)
            throws TabletConnException;

    /** Start a streaming query.  Failures after the stream starts surface on recv. */
    ResultStream streamExecute(Context ctx, BoundQuery query) throws TabletConnException;

    /** @return the new, non-zero, transaction id */
    long begin(Context ctx) throws TabletConnException;

    void commit(Context ctx, long transactionId) throws TabletConnException;

    void rollback(Context ctx, long transactionId) throws TabletConnException;

    /**
     * Begin a transaction and run query inside it in one round trip.  If the query fails
     * after the transaction began, the exception carries the transaction id.
     */
    Pair<Result, Long> beginExecute(Context ctx, BoundQuery query) throws TabletConnException;

    /**
     * Begin a transaction and run queries inside it.  asTransaction must be false: the batch
     * already runs inside the begun transaction.
     */
    Pair<List<Result>, Long> beginExecuteBatch(Context ctx, List<BoundQuery> queries, boolean asTransaction)
            throws TabletConnException;

    /** @deprecated use {@link #splitQueryV2} */
    @Deprecated
    default List<QuerySplit> splitQuery(Context ctx, BoundQuery query, String splitColumn, long splitCount)
            throws TabletConnException {
        List<String> splitColumns = splitColumn == null || splitColumn.isEmpty() ? List.of() : List.of(splitColumn);
        return splitQueryV2(ctx, query, splitColumns, splitCount, 0, SplitQueryAlgorithm.EQUAL_SPLITS);
    }

    /**
     * Split a query into parts that together return exactly the rows of the original.
     * Exactly one of splitCount and numRowsPerQueryPart must be positive.
     *
     * @param splitColumns a prefix of the table's primary key; empty means the whole key
     */
    List<QuerySplit> splitQueryV2(Context ctx, BoundQuery query, List<String> splitColumns, long splitCount,
                                  long numRowsPerQueryPart, SplitQueryAlgorithm algorithm) throws TabletConnException;

    StreamHealthReader streamHealth(Context ctx) throws TabletConnException;

    /** Rebind the connection to another target on the same tablet without redialing. */
    void setTarget(String keyspace, String shard, TabletType tabletType) throws TabletConnException;

    Target getTarget();

    EndPoint getEndPoint();

    /** Release the connection.  Idempotent; later calls fail with CONNECTION_CLOSED. */
    @Override
    void close();
}
