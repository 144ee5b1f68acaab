package edu.stanford.futuredata.shardgate.splitquery;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.SplitQueryAlgorithm;
import edu.stanford.futuredata.shardgate.tabletserver.QueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Splits a query into parts for parallel bulk reads, using the engine's table statistics. */
public class SplitQueryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(SplitQueryPlanner.class);

    private final QueryEngine engine;

    public SplitQueryPlanner(QueryEngine engine) {
        this.engine = engine;
    }

    /**
     * @throws ServerException BAD_INPUT if the query, columns or sizing cannot be split;
     *                         engine errors pass through
     */
    public List<QuerySplit> splitQuery(BoundQuery query, List<String> splitColumns, long splitCount,
                                       long numRowsPerQueryPart, SplitQueryAlgorithm algorithm)
            throws ServerException {
        SplitParams params = SplitParams.create(engine, query, splitColumns, splitCount, numRowsPerQueryPart);
        SplitAlgorithm splitAlgorithm;
        switch (algorithm) {
            case EQUAL_SPLITS:
                splitAlgorithm = new EqualSplitsAlgorithm(engine);
                break;
            case FULL_SCAN:
                splitAlgorithm = new FullScanAlgorithm(engine);
                break;
            default:
                throw SplitParams.badInput("unknown split algorithm %s", algorithm);
        }
        List<List<Value>> boundaries = splitAlgorithm.generateBoundaries(params);
        List<QuerySplit> splits = QuerySplitter.split(params, boundaries);
        logger.debug("Split query on {} into {} parts with {} (requested {})", params.getTable(), splits.size(),
                algorithm, params.getSplitCount());
        return splits;
    }
}
