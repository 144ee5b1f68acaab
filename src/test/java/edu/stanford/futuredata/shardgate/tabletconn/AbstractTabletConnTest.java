package edu.stanford.futuredata.shardgate.tabletconn;

import edu.stanford.futuredata.shardgate.kvmockinterface.KVQueryEngine;
import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.Field;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Type;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletserver.TabletService;
import edu.stanford.futuredata.shardgate.utilities.Utilities;
import io.grpc.Context;
import org.javatuples.Pair;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior every {@link TabletConn} implementation must show, run against a tablet backed by
 * {@link KVQueryEngine}.  Subclasses publish the tablet over their transport.
 */
public abstract class AbstractTabletConnTest {

    private static final Logger logger = LoggerFactory.getLogger(AbstractTabletConnTest.class);

    protected static final String KEYSPACE = "test_keyspace";
    protected static final String SHARD = "-";
    protected static final Duration DIAL_TIMEOUT = Duration.ofSeconds(5);

    protected static final BoundQuery INSERT = new BoundQuery("insert into kv (k, v) values (:k, :v)");
    protected static final BoundQuery SELECT_ALL = new BoundQuery("select k, v from kv");

    protected KVQueryEngine engine;
    protected TabletService tabletService;
    protected TabletConn conn;

    /** Publish the tablet and return where it can be dialed. */
    protected abstract EndPoint startTablet(TabletService tabletService);

    protected abstract TabletDialer dialer();

    protected abstract void stopTablet();

    @BeforeEach
    public void setUp() throws TabletConnException {
        engine = new KVQueryEngine().withTable("kv", "k", Type.INT64, "v", Type.VARCHAR);
        tabletService = new TabletService(new Target(KEYSPACE, SHARD, TabletType.MASTER), engine);
        EndPoint endPoint = startTablet(tabletService);
        conn = dialer().dial(Context.ROOT, endPoint, KEYSPACE, SHARD, TabletType.MASTER, DIAL_TIMEOUT);
    }

    @AfterEach
    public void tearDown() {
        conn.close();
        stopTablet();
    }

    protected static BoundQuery insert(long k, String v) {
        return BoundQuery.of(INSERT.getSql(), Map.of("k", k, "v", v));
    }

    protected static BoundQuery selectByKey(long k) {
        return BoundQuery.of("select k, v from kv where k = :k", Map.of("k", k));
    }

    private void insertRows(int n) throws TabletConnException {
        for (int i = 1; i <= n; i++) {
            conn.execute(Context.ROOT, insert(i, "value" + i), 0);
        }
    }

    @Test
    public void testExecute() throws TabletConnException {
        logger.info("testExecute");
        Result inserted = conn.execute(Context.ROOT, insert(1, "one"), 0);
        assertEquals(1, inserted.getRowsAffected());
        Result r = conn.execute(Context.ROOT, selectByKey(1), 0);
        assertEquals(List.of(new Field("k", Type.INT64), new Field("v", Type.VARCHAR)), r.getFields());
        assertEquals(List.of(List.of(Value.newInt64(1), Value.newVarChar("one"))), r.getRows());
        assertTrue(conn.execute(Context.ROOT, selectByKey(2), 0).getRows().isEmpty());
    }

    @Test
    public void testServerErrorCode() {
        logger.info("testServerErrorCode");
        ServerException e = assertThrows(ServerException.class,
                () -> conn.execute(Context.ROOT, new BoundQuery("fail INTEGRITY_ERROR"), 0));
        assertEquals(ErrorCode.INTEGRITY_ERROR, e.getCode());
        assertFalse(e.isRetriable());
        ServerException retry = assertThrows(ServerException.class,
                () -> conn.execute(Context.ROOT, new BoundQuery("fail TRANSIENT_ERROR"), 0));
        assertTrue(retry.isRetriable());
    }

    @Test
    public void testExecuteBatch() throws TabletConnException {
        logger.info("testExecuteBatch");
        List<Result> results = conn.executeBatch(Context.ROOT,
                List.of(insert(1, "one"), insert(2, "two"), SELECT_ALL), false, 0);
        assertEquals(3, results.size());
        assertEquals(1, results.get(0).getRowsAffected());
        assertEquals(1, results.get(1).getRowsAffected());
        assertEquals(2, results.get(2).getRows().size());
    }

    @Test
    public void testExecuteBatchAsTransactionIsAllOrNothing() throws TabletConnException {
        logger.info("testExecuteBatchAsTransactionIsAllOrNothing");
        ServerException e = assertThrows(ServerException.class, () -> conn.executeBatch(Context.ROOT,
                List.of(insert(1, "one"), new BoundQuery("fail INTERNAL_ERROR")), true, 0));
        assertEquals(ErrorCode.INTERNAL_ERROR, e.getCode());
        assertTrue(conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().isEmpty());
        assertEquals(0, engine.openTransactions());

        conn.executeBatch(Context.ROOT, List.of(insert(1, "one"), insert(2, "two")), true, 0);
        assertEquals(2, conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().size());
    }

    @Test
    public void testExecuteBatchAsTransactionInsideTransaction() throws TabletConnException {
        logger.info("testExecuteBatchAsTransactionInsideTransaction");
        long txId = conn.begin(Context.ROOT);
        assertThrows(IllegalArgumentException.class,
                () -> conn.executeBatch(Context.ROOT, List.of(insert(1, "one")), true, txId));
        conn.rollback(Context.ROOT, txId);
    }

    @Test
    public void testCommit() throws TabletConnException {
        logger.info("testCommit");
        long txId = conn.begin(Context.ROOT);
        assertNotEquals(0, txId);
        conn.execute(Context.ROOT, insert(1, "one"), txId);
        assertEquals(1, conn.execute(Context.ROOT, SELECT_ALL, txId).getRows().size());
        assertTrue(conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().isEmpty());
        conn.commit(Context.ROOT, txId);
        assertEquals(1, conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().size());
        // The connection is free for a new transaction.
        long next = conn.begin(Context.ROOT);
        assertNotEquals(txId, next);
        conn.rollback(Context.ROOT, next);
    }

    @Test
    public void testRollback() throws TabletConnException {
        logger.info("testRollback");
        long txId = conn.begin(Context.ROOT);
        conn.execute(Context.ROOT, insert(1, "one"), txId);
        conn.rollback(Context.ROOT, txId);
        assertTrue(conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().isEmpty());
        assertEquals(0, engine.openTransactions());
    }

    @Test
    public void testOneTransactionPerConnection() throws TabletConnException {
        logger.info("testOneTransactionPerConnection");
        long txId = conn.begin(Context.ROOT);
        assertThrows(IllegalStateException.class, () -> conn.begin(Context.ROOT));
        assertThrows(IllegalStateException.class, () -> conn.beginExecute(Context.ROOT, insert(1, "one")));
        assertThrows(IllegalArgumentException.class, () -> conn.commit(Context.ROOT, txId + 1));
        assertThrows(IllegalArgumentException.class, () -> conn.execute(Context.ROOT, SELECT_ALL, txId + 1));
        conn.commit(Context.ROOT, txId);
    }

    @Test
    public void testCommitUnknownTransaction() throws TabletConnException {
        logger.info("testCommitUnknownTransaction");
        long txId = conn.begin(Context.ROOT);
        // The tablet forgets the transaction behind the connection's back.
        tabletService.rollback(tabletService.getTarget(), txId);
        ServerException e = assertThrows(ServerException.class, () -> conn.commit(Context.ROOT, txId));
        assertEquals(ErrorCode.NOT_IN_TX, e.getCode());
        // Commit is terminal even when it fails.
        long next = conn.begin(Context.ROOT);
        conn.rollback(Context.ROOT, next);
    }

    @Test
    public void testBeginExecute() throws TabletConnException {
        logger.info("testBeginExecute");
        Pair<Result, Long> r = conn.beginExecute(Context.ROOT, insert(1, "one"));
        assertEquals(1, r.getValue0().getRowsAffected());
        long txId = r.getValue1();
        assertNotEquals(0, txId);
        conn.commit(Context.ROOT, txId);
        assertEquals(1, conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().size());
    }

    @Test
    public void testBeginExecuteFailureKeepsTransaction() throws TabletConnException {
        logger.info("testBeginExecuteFailureKeepsTransaction");
        ServerException e = assertThrows(ServerException.class,
                () -> conn.beginExecute(Context.ROOT, new BoundQuery("fail INTEGRITY_ERROR")));
        assertEquals(ErrorCode.INTEGRITY_ERROR, e.getCode());
        long txId = e.getTransactionId();
        assertNotEquals(0, txId);
        assertEquals(1, engine.openTransactions());
        conn.rollback(Context.ROOT, txId);
        assertEquals(0, engine.openTransactions());
    }

    @Test
    public void testBeginExecuteBatch() throws TabletConnException {
        logger.info("testBeginExecuteBatch");
        Pair<List<Result>, Long> r = conn.beginExecuteBatch(Context.ROOT,
                List.of(insert(1, "one"), insert(2, "two")), false);
        assertEquals(2, r.getValue0().size());
        conn.rollback(Context.ROOT, r.getValue1());
        assertTrue(conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().isEmpty());

        assertThrows(IllegalArgumentException.class,
                () -> conn.beginExecuteBatch(Context.ROOT, List.of(insert(1, "one")), true));

        ServerException e = assertThrows(ServerException.class, () -> conn.beginExecuteBatch(Context.ROOT,
                List.of(insert(1, "one"), new BoundQuery("fail INTERNAL_ERROR")), false));
        assertNotEquals(0, e.getTransactionId());
        conn.rollback(Context.ROOT, e.getTransactionId());
    }

    @Test
    public void testStreamExecute() throws TabletConnException {
        logger.info("testStreamExecute");
        insertRows(5);
        List<Result> chunks = new ArrayList<>();
        try (ResultStream stream = conn.streamExecute(Context.ROOT, SELECT_ALL)) {
            Optional<Result> r;
            while ((r = stream.recv()).isPresent()) {
                chunks.add(r.get());
            }
            // End of stream is sticky.
            assertTrue(stream.recv().isEmpty());
        }
        assertFalse(chunks.isEmpty());
        assertEquals(2, chunks.get(0).getFields().size());
        int rows = 0;
        for (Result chunk: chunks) {
            rows += chunk.getRows().size();
        }
        assertEquals(5, rows);
        assertEquals(Value.newInt64(1), chunks.get(0).getRows().get(0).get(0));
    }

    @Test
    public void testStreamExecuteFailure() throws TabletConnException {
        logger.info("testStreamExecuteFailure");
        try (ResultStream stream = conn.streamExecute(Context.ROOT, new BoundQuery("fail QUERY_NOT_SERVED"))) {
            ServerException e = assertThrows(ServerException.class, stream::recv);
            assertEquals(ErrorCode.QUERY_NOT_SERVED, e.getCode());
        }
    }

    @Test
    public void testStreamClose() throws TabletConnException {
        logger.info("testStreamClose");
        ResultStream stream = conn.streamExecute(Context.ROOT, new BoundQuery("stream forever"));
        assertTrue(stream.recv().isPresent());
        stream.close();
        assertTrue(stream.recv().isEmpty());
        stream.close();
        // The connection stays usable.
        assertTrue(conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().isEmpty());
    }

    @Test
    public void testStreamCancel() throws Exception {
        logger.info("testStreamCancel");
        Context.CancellableContext ctx = Context.current().withCancellation();
        ResultStream stream = conn.streamExecute(ctx, new BoundQuery("stream forever"));
        assertTrue(stream.recv().isPresent());
        // Let chunks pile up in the buffer before cancelling.
        Thread.sleep(100);
        ctx.cancel(null);
        OperationalException e = assertThrows(OperationalException.class, stream::recv);
        assertEquals(OperationalException.Kind.CANCELLED, e.getKind());
        assertSame(e, assertThrows(OperationalException.class, stream::recv));
        stream.close();
    }

    @Test
    public void testCancelledContext() throws Exception {
        logger.info("testCancelledContext");
        Context.CancellableContext cancelled = Context.current().withCancellation();
        cancelled.cancel(null);
        OperationalException e = assertThrows(OperationalException.class,
                () -> conn.execute(cancelled, SELECT_ALL, 0));
        assertEquals(OperationalException.Kind.CANCELLED, e.getKind());

        Context.CancellableContext expired = Utilities.withTimeout(Context.current(), Duration.ofMillis(1));
        Thread.sleep(20);
        e = assertThrows(OperationalException.class, () -> conn.begin(expired));
        assertEquals(OperationalException.Kind.CANCELLED, e.getKind());
        assertEquals(0, engine.openTransactions());
        expired.close();
    }

    @Test
    public void testClosedConnection() {
        logger.info("testClosedConnection");
        conn.close();
        OperationalException e = assertThrows(OperationalException.class,
                () -> conn.execute(Context.ROOT, SELECT_ALL, 0));
        assertEquals(OperationalException.Kind.CONNECTION_CLOSED, e.getKind());
        e = assertThrows(OperationalException.class, () -> conn.streamExecute(Context.ROOT, SELECT_ALL));
        assertEquals(OperationalException.Kind.CONNECTION_CLOSED, e.getKind());
        // Idempotent.
        conn.close();
    }

    @Test
    public void testTargetMismatch() throws TabletConnException {
        logger.info("testTargetMismatch");
        conn.setTarget("other_keyspace", SHARD, TabletType.MASTER);
        assertEquals(new Target("other_keyspace", SHARD, TabletType.MASTER), conn.getTarget());
        ServerException e = assertThrows(ServerException.class, () -> conn.execute(Context.ROOT, SELECT_ALL, 0));
        assertEquals(ErrorCode.QUERY_NOT_SERVED, e.getCode());
        assertTrue(e.isRetriable());

        conn.setTarget(KEYSPACE, SHARD, TabletType.MASTER);
        assertTrue(conn.execute(Context.ROOT, SELECT_ALL, 0).getRows().isEmpty());

        tabletService.setServing(false);
        e = assertThrows(ServerException.class, () -> conn.execute(Context.ROOT, SELECT_ALL, 0));
        assertEquals(ErrorCode.QUERY_NOT_SERVED, e.getCode());
    }

    @Test
    public void testSplitQuery() throws TabletConnException {
        logger.info("testSplitQuery");
        insertRows(10);
        List<QuerySplit> scan = conn.splitQueryV2(Context.ROOT, SELECT_ALL, List.of("k"), 0, 3,
                SplitQueryAlgorithm.FULL_SCAN);
        assertEquals(4, scan.size());
        int rows = 0;
        for (QuerySplit split: scan) {
            assertTrue(split.getQuery().getSql().startsWith("select k, v from kv where "));
            rows += split.getRowCount();
        }
        assertTrue(rows > 0);

        List<QuerySplit> equal = conn.splitQueryV2(Context.ROOT, SELECT_ALL, List.of(), 2, 0,
                SplitQueryAlgorithm.EQUAL_SPLITS);
        assertEquals(2, equal.size());
        @SuppressWarnings("deprecation")
        List<QuerySplit> legacy = conn.splitQuery(Context.ROOT, SELECT_ALL, "k", 2);
        assertEquals(equal, legacy);

        ServerException e = assertThrows(ServerException.class, () -> conn.splitQueryV2(Context.ROOT,
                new BoundQuery("select k from kv order by k"), List.of(), 2, 0, SplitQueryAlgorithm.EQUAL_SPLITS));
        assertEquals(ErrorCode.BAD_INPUT, e.getCode());
    }

    @Test
    public void testStreamHealth() throws TabletConnException {
        logger.info("testStreamHealth");
        tabletService.setTabletExternallyReparentedTimestamp(42);
        try (StreamHealthReader health = conn.streamHealth(Context.ROOT)) {
            StreamHealthResponse first = health.recv().orElseThrow();
            assertEquals(tabletService.getTarget(), first.getTarget());
            assertTrue(first.isServing());
            assertEquals(42, first.getTabletExternallyReparentedTimestamp());
            assertEquals(StreamHealthResponse.RealtimeStats.HEALTHY, first.getRealtimeStats());

            tabletService.setServing(false);
            tabletService.broadcastHealth();
            // The health daemon may have sent a snapshot in between.
            StreamHealthResponse next = health.recv().orElseThrow();
            for (int i = 0; i < 10 && next.isServing(); i++) {
                next = health.recv().orElseThrow();
            }
            assertFalse(next.isServing());
        }
    }
}
