package edu.stanford.futuredata.shardgate.splitquery;

import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;

import java.util.List;

/** Chooses the boundary tuples that cut a table into query parts. */
interface SplitAlgorithm {
    /**
     * @return strictly ascending boundary tuples over a prefix of the split columns; m
     *         boundaries make m + 1 parts
     */
    List<List<Value>> generateBoundaries(SplitParams params) throws ServerException;
}
