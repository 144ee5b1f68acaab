package edu.stanford.futuredata.shardgate.splitquery;

import edu.stanford.futuredata.shardgate.kvmockinterface.KVQueryEngine;
import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Type;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.SplitQueryAlgorithm;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import edu.stanford.futuredata.shardgate.tabletserver.QueryEngine;
import edu.stanford.futuredata.shardgate.tabletserver.StreamSink;
import org.javatuples.Pair;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class SplitQueryPlannerTest {

    private static final Logger logger = LoggerFactory.getLogger(SplitQueryPlannerTest.class);

    /** A table "t" with primary key (a, b) and only the statistics needed for splitting. */
    private static class TupleEngine implements QueryEngine {
        private final List<List<Value>> rows = new ArrayList<>();

        TupleEngine(int as, int bs) {
            for (int a = 0; a < as; a++) {
                for (int b = 0; b < bs; b++) {
                    rows.add(List.of(Value.newInt64(a), Value.newVarChar("b" + b)));
                }
            }
        }

        @Override
        public long begin() throws ServerException {
            throw new ServerException(ErrorCode.BAD_INPUT, "read only");
        }

        @Override
        public void commit(long transactionId) throws ServerException {
            throw new ServerException(ErrorCode.NOT_IN_TX, "read only");
        }

        @Override
        public void rollback(long transactionId) throws ServerException {
            throw new ServerException(ErrorCode.NOT_IN_TX, "read only");
        }

        @Override
        public Result execute(BoundQuery query, long transactionId) throws ServerException {
            throw new ServerException(ErrorCode.BAD_INPUT, "statistics only");
        }

        @Override
        public void streamExecute(BoundQuery query, StreamSink<Result> sink) throws ServerException {
            throw new ServerException(ErrorCode.BAD_INPUT, "statistics only");
        }

        @Override
        public List<String> primaryKeyColumns(String table) {
            return List.of("a", "b");
        }

        @Override
        public long rowCount(String table) {
            return rows.size();
        }

        @Override
        public Optional<Pair<Value, Value>> minMax(String table, String column) {
            int i = column.equals("a") ? 0 : 1;
            return Optional.of(new Pair<>(rows.get(0).get(i), rows.get(rows.size() - 1).get(i)));
        }

        @Override
        public Iterator<List<Value>> scanKeyColumns(String table, List<String> columns) {
            List<List<Value>> out = new ArrayList<>();
            for (List<Value> row: rows) {
                out.add(row.subList(0, columns.size()));
            }
            return out.iterator();
        }

        @Override
        public StreamHealthResponse.RealtimeStats realtimeStats() {
            return StreamHealthResponse.RealtimeStats.HEALTHY;
        }
    }

    private static KVQueryEngine kvEngine(int rows) throws ServerException {
        KVQueryEngine engine = new KVQueryEngine().withTable("kv", "k", Type.INT64, "v", Type.VARCHAR);
        for (int i = 0; i < rows; i++) {
            engine.execute(BoundQuery.of("insert into kv (k, v) values (:k, :v)", Map.of("k", i * 10, "v", "x")), 0);
        }
        return engine;
    }

    private static int compare(Value a, Value b) {
        return KVQueryEngine.VALUE_ORDER.compare(a, b);
    }

    // Lexicographic comparison of a row prefix against a bound read back from the bind variables.
    private static int compareTuple(List<Value> row, List<Value> bound) {
        for (int i = 0; i < bound.size(); i++) {
            int c = compare(row.get(i), bound.get(i));
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    private static List<Value> bound(QuerySplit split, String prefix, List<String> columns) {
        List<Value> out = new ArrayList<>();
        for (String c: columns) {
            Value v = split.getQuery().getBindVariables().get(prefix + c);
            if (v != null) {
                out.add(v);
            }
        }
        return out;
    }

    // Every row must fall into exactly one split.
    private static void assertCovers(List<QuerySplit> splits, List<List<Value>> rows, List<String> columns) {
        for (List<Value> row: rows) {
            int matches = 0;
            for (QuerySplit split: splits) {
                List<Value> start = bound(split, QuerySplitter.START_PREFIX, columns);
                List<Value> end = bound(split, QuerySplitter.END_PREFIX, columns);
                boolean afterStart = start.isEmpty() || compareTuple(row, start) >= 0;
                boolean beforeEnd = end.isEmpty() || compareTuple(row, end) < 0;
                if (afterStart && beforeEnd) {
                    matches++;
                }
            }
            assertEquals(1, matches, String.format("row %s", row));
        }
    }

    @Test
    public void testEqualSplits() throws ServerException {
        logger.info("testEqualSplits");
        KVQueryEngine engine = kvEngine(10);
        SplitQueryPlanner planner = new SplitQueryPlanner(engine);
        List<QuerySplit> splits = planner.splitQuery(new BoundQuery("select k, v from kv"), List.of(), 3, 0,
                SplitQueryAlgorithm.EQUAL_SPLITS);
        assertEquals(3, splits.size());
        // min 0, max 90: boundaries at 30 and 60.
        assertEquals(Value.newInt64(30), splits.get(0).getQuery().getBindVariables().get("_splitquery_end_k"));
        assertEquals(Value.newInt64(60), splits.get(2).getQuery().getBindVariables().get("_splitquery_start_k"));
        assertEquals("select k, v from kv where k < :_splitquery_end_k", splits.get(0).getQuery().getSql());
        assertEquals("select k, v from kv where k >= :_splitquery_start_k and k < :_splitquery_end_k",
                splits.get(1).getQuery().getSql());
        for (QuerySplit split: splits) {
            assertEquals(3, split.getRowCount());
        }
        List<List<Value>> rows = engine.execute(new BoundQuery("select k from kv"), 0).getRows();
        assertCovers(splits, rows, List.of("k"));
    }

    @Test
    public void testEqualSplitsNarrowRange() throws ServerException {
        logger.info("testEqualSplitsNarrowRange");
        KVQueryEngine engine = kvEngine(2);
        List<QuerySplit> splits = new SplitQueryPlanner(engine).splitQuery(new BoundQuery("select k from kv"),
                List.of("k"), 100, 0, SplitQueryAlgorithm.EQUAL_SPLITS);
        // Only ten distinct boundaries fit between 0 and 10.
        assertTrue(splits.size() <= 11);
        assertCovers(splits, engine.execute(new BoundQuery("select k from kv"), 0).getRows(), List.of("k"));
    }

    @Test
    public void testEqualSplitsHugeSplitCount() throws ServerException {
        logger.info("testEqualSplitsHugeSplitCount");
        KVQueryEngine engine = kvEngine(3);
        List<QuerySplit> splits = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> new SplitQueryPlanner(engine).splitQuery(new BoundQuery("select k from kv"),
                        List.of("k"), 1_000_000_000_000L, 0, SplitQueryAlgorithm.EQUAL_SPLITS));
        // Keys 0, 10, 20: one boundary per key in [0, 20).
        assertEquals(21, splits.size());
        assertCovers(splits, engine.execute(new BoundQuery("select k from kv"), 0).getRows(), List.of("k"));
    }

    @Test
    public void testEmptyTable() throws ServerException {
        logger.info("testEmptyTable");
        BoundQuery query = new BoundQuery("select k from kv");
        List<QuerySplit> splits = new SplitQueryPlanner(kvEngine(0)).splitQuery(query, List.of(), 4, 0,
                SplitQueryAlgorithm.EQUAL_SPLITS);
        assertEquals(List.of(new QuerySplit(query, 0)), splits);
    }

    @Test
    public void testFullScanCompositeKey() throws ServerException {
        logger.info("testFullScanCompositeKey");
        TupleEngine engine = new TupleEngine(4, 5);
        SplitQueryPlanner planner = new SplitQueryPlanner(engine);
        BoundQuery query = BoundQuery.of("select a, b from t where a != :skip", Map.of("skip", 99));
        List<QuerySplit> splits = planner.splitQuery(query, List.of("a", "b"), 0, 6, SplitQueryAlgorithm.FULL_SCAN);
        // 20 rows, a boundary at rows 6, 12 and 18.
        assertEquals(4, splits.size());
        assertCovers(splits, engine.rows, List.of("a", "b"));
        QuerySplit middle = splits.get(1);
        assertEquals(Value.newInt64(99), middle.getQuery().getBindVariables().get("skip"));
        assertTrue(middle.getQuery().getSql().startsWith("select a, b from t where (a != :skip) and "));
        assertTrue(middle.getQuery().getSql().contains(
                "(a > :_splitquery_start_a or (a = :_splitquery_start_a and b >= :_splitquery_start_b))"));
    }

    @Test
    public void testFullScanPrefixColumns() throws ServerException {
        logger.info("testFullScanPrefixColumns");
        TupleEngine engine = new TupleEngine(4, 5);
        List<QuerySplit> splits = new SplitQueryPlanner(engine).splitQuery(new BoundQuery("select * from t"),
                List.of("a"), 3, 0, SplitQueryAlgorithm.FULL_SCAN);
        assertCovers(splits, engine.rows, List.of("a"));
        // Repeated prefixes never produce the same boundary twice.
        Set<Value> starts = new HashSet<>();
        for (QuerySplit split: splits) {
            Value start = split.getQuery().getBindVariables().get("_splitquery_start_a");
            if (start != null) {
                assertTrue(starts.add(start));
            }
        }
    }

    @Test
    public void testBadInput() throws ServerException {
        logger.info("testBadInput");
        SplitQueryPlanner planner = new SplitQueryPlanner(new TupleEngine(2, 2));
        List<BoundQuery> unsupported = List.of(
                new BoundQuery("select a from t group by a"),
                new BoundQuery("select a from t order by a"),
                new BoundQuery("select a from t limit 10"),
                new BoundQuery("select distinct a from t"),
                new BoundQuery("select a from t join u"),
                new BoundQuery("update t set a = 1"));
        for (BoundQuery q: unsupported) {
            ServerException e = assertThrows(ServerException.class,
                    () -> planner.splitQuery(q, List.of(), 2, 0, SplitQueryAlgorithm.FULL_SCAN));
            assertEquals(ErrorCode.BAD_INPUT, e.getCode(), q.getSql());
        }
        BoundQuery ok = new BoundQuery("select a from t");
        assertBadInput(() -> planner.splitQuery(ok, List.of(), 2, 5, SplitQueryAlgorithm.FULL_SCAN));
        assertBadInput(() -> planner.splitQuery(ok, List.of(), 0, 0, SplitQueryAlgorithm.FULL_SCAN));
        assertBadInput(() -> planner.splitQuery(ok, List.of("b"), 2, 0, SplitQueryAlgorithm.FULL_SCAN));
        assertBadInput(() -> planner.splitQuery(ok, List.of("a", "b", "c"), 2, 0, SplitQueryAlgorithm.FULL_SCAN));
        assertBadInput(() -> planner.splitQuery(
                BoundQuery.of("select a from t where a = :_splitquery_x", Map.of("_splitquery_x", 1)),
                List.of(), 2, 0, SplitQueryAlgorithm.FULL_SCAN));
        // EQUAL_SPLITS needs a number to cut.
        TupleEngine engine = new TupleEngine(2, 2);
        SplitQueryPlanner textPlanner = new SplitQueryPlanner(new TupleEngine(2, 2) {
            @Override
            public List<String> primaryKeyColumns(String table) {
                return List.of("b", "a");
            }
        });
        assertBadInput(() -> textPlanner.splitQuery(ok, List.of(), 2, 0, SplitQueryAlgorithm.EQUAL_SPLITS));
        assertEquals(2, new SplitQueryPlanner(engine).splitQuery(ok, List.of(), 2, 0,
                SplitQueryAlgorithm.EQUAL_SPLITS).size());
    }

    private interface Split {
        List<QuerySplit> run() throws ServerException;
    }

    private static void assertBadInput(Split split) {
        ServerException e = assertThrows(ServerException.class, split::run);
        assertEquals(ErrorCode.BAD_INPUT, e.getCode());
    }
}
