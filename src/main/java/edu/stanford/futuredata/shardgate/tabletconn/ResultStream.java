package edu.stanford.futuredata.shardgate.tabletconn;

import edu.stanford.futuredata.shardgate.sqltypes.Result;

/** The chunks of a streamed query.  Only the first chunk carries fields. */
public interface ResultStream extends TabletStream<Result> {
}
