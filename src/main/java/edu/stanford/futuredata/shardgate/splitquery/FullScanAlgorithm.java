package edu.stanford.futuredata.shardgate.splitquery;

import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletserver.QueryEngine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Walks the split columns in order and makes every numRowsPerQueryPart-th tuple a boundary,
 * so each part holds about numRowsPerQueryPart rows.  Works for any column type.
 */
class FullScanAlgorithm implements SplitAlgorithm {

    private final QueryEngine engine;

    FullScanAlgorithm(QueryEngine engine) {
        this.engine = engine;
    }

    @Override
    public List<List<Value>> generateBoundaries(SplitParams params) throws ServerException {
        Iterator<List<Value>> tuples = engine.scanKeyColumns(params.getTable(), params.getSplitColumns());
        long step = params.getNumRowsPerQueryPart();
        List<List<Value>> boundaries = new ArrayList<>();
        long i = 0;
        while (tuples.hasNext()) {
            List<Value> tuple = tuples.next();
            // Split columns that are a strict prefix of the key can repeat.
            if (i > 0 && i % step == 0
                    && (boundaries.isEmpty() || !boundaries.get(boundaries.size() - 1).equals(tuple))) {
                boundaries.add(List.copyOf(tuple));
            }
            i++;
        }
        return boundaries;
    }
}
