package edu.stanford.futuredata.shardgate.tabletserver;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import org.javatuples.Pair;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The storage engine behind a tablet.  Implementations report failures as
 * {@link ServerException}s carrying the error code the client should see, and must be safe
 * for concurrent use.
 */
public interface QueryEngine {
    /*
      Transactions.  Ids are non-zero; an unknown id fails with NOT_IN_TX.
     */
    long begin() throws ServerException;
    void commit(long transactionId) throws ServerException;
    void rollback(long transactionId) throws ServerException;

    /*
      Queries.  transactionId zero runs the query on its own.
     */
    Result execute(BoundQuery query, long transactionId) throws ServerException;
    // Send the result in chunks, the first carrying the fields.  Stop when the sink throws.
    void streamExecute(BoundQuery query, StreamSink<Result> sink) throws ServerException;

    /*
      Table statistics used to split queries.
     */
    List<String> primaryKeyColumns(String table) throws ServerException;
    long rowCount(String table) throws ServerException;
    // Smallest and largest value of column, or empty if the table is empty.
    Optional<Pair<Value, Value>> minMax(String table, String column) throws ServerException;
    // The values of columns for every row, in ascending order of those columns.
    Iterator<List<Value>> scanKeyColumns(String table, List<String> columns) throws ServerException;

    StreamHealthResponse.RealtimeStats realtimeStats();
}
