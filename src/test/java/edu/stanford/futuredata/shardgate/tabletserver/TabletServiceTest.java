package edu.stanford.futuredata.shardgate.tabletserver;

import edu.stanford.futuredata.shardgate.kvmockinterface.KVQueryEngine;
import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Type;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.tabletconn.Target;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TabletServiceTest {

    private static final Logger logger = LoggerFactory.getLogger(TabletServiceTest.class);

    private final Target target = new Target("test_keyspace", "-80", TabletType.MASTER);
    private KVQueryEngine engine;
    private TabletService service;

    @BeforeEach
    public void setUp() {
        engine = new KVQueryEngine().withTable("kv", "k", Type.INT64, "v", Type.VARCHAR);
        service = new TabletService(target, engine);
    }

    private static BoundQuery insert(long k) {
        return BoundQuery.of("insert into kv (k, v) values (:k, :v)", Map.of("k", k, "v", "x"));
    }

    private int rows() throws ServerException {
        return service.execute(target, new BoundQuery("select k from kv"), 0).getRows().size();
    }

    @Test
    public void testBatchAllOrNothing() throws ServerException {
        logger.info("testBatchAllOrNothing");
        // The duplicate insert fails after the first one ran.
        ServerException e = assertThrows(ServerException.class,
                () -> service.executeBatch(target, List.of(insert(1), insert(1)), true, 0));
        assertEquals(ErrorCode.INTEGRITY_ERROR, e.getCode());
        assertEquals(0, rows());
        assertEquals(0, engine.openTransactions());

        // Without asTransaction the first insert sticks.
        assertThrows(ServerException.class, () -> service.executeBatch(target, List.of(insert(1), insert(1)), false, 0));
        assertEquals(1, rows());
    }

    @Test
    public void testBatchInsideTransaction() throws ServerException {
        logger.info("testBatchInsideTransaction");
        long txId = service.begin(target);
        ServerException e = assertThrows(ServerException.class,
                () -> service.executeBatch(target, List.of(insert(1)), true, txId));
        assertEquals(ErrorCode.BAD_INPUT, e.getCode());
        List<Result> results = service.executeBatch(target, List.of(insert(1), insert(2)), false, txId);
        assertEquals(2, results.size());
        assertEquals(0, rows());
        service.commit(target, txId);
        assertEquals(2, rows());
    }

    @Test
    public void testBeginExecuteBatch() throws ServerException {
        logger.info("testBeginExecuteBatch");
        ServerException e = assertThrows(ServerException.class,
                () -> service.beginExecuteBatch(target, List.of(insert(1)), true));
        assertEquals(ErrorCode.BAD_INPUT, e.getCode());
        assertEquals(0, engine.openTransactions());

        e = assertThrows(ServerException.class,
                () -> service.beginExecuteBatch(target, List.of(insert(1), insert(1)), false));
        assertEquals(ErrorCode.INTEGRITY_ERROR, e.getCode());
        assertNotEquals(0, e.getTransactionId());
        service.rollback(target, e.getTransactionId());
        assertEquals(0, rows());
    }

    @Test
    public void testQueryNotServed() {
        logger.info("testQueryNotServed");
        List<Target> wrong = List.of(
                new Target("other", "-80", TabletType.MASTER),
                new Target("test_keyspace", "80-", TabletType.MASTER),
                new Target("test_keyspace", "-80", TabletType.REPLICA));
        for (Target t: wrong) {
            ServerException e = assertThrows(ServerException.class, () -> service.begin(t));
            assertEquals(ErrorCode.QUERY_NOT_SERVED, e.getCode());
        }
        service.setServing(false);
        assertFalse(service.isServing());
        ServerException e = assertThrows(ServerException.class,
                () -> service.beginExecute(target, insert(1)));
        assertEquals(ErrorCode.QUERY_NOT_SERVED, e.getCode());
        assertEquals(0, engine.openTransactions());
    }

    @Test
    public void testHealthSubscribers() {
        logger.info("testHealthSubscribers");
        List<StreamHealthResponse> received = Collections.synchronizedList(new ArrayList<>());
        long id = service.subscribeHealth(received::add);
        List<StreamHealthResponse> gone = new ArrayList<>();
        service.subscribeHealth(snapshot -> {
            gone.add(snapshot);
            if (gone.size() > 1) {
                throw new ServerException(ErrorCode.CANCELLED, "receiver gone");
            }
        });
        assertEquals(1, received.size());
        assertEquals(service.healthSnapshot(), received.get(0));

        engine.setRealtimeStats(new StreamHealthResponse.RealtimeStats("replication stopped", 30, 0.5));
        service.broadcastHealth();
        service.broadcastHealth();
        assertEquals(3, received.size());
        assertEquals("replication stopped", received.get(2).getRealtimeStats().getHealthError());
        // The failing subscriber was dropped after its second delivery.
        assertEquals(2, gone.size());

        service.unsubscribeHealth(id);
        service.broadcastHealth();
        assertEquals(3, received.size());
    }

    @Test
    public void testHealthDaemon() throws InterruptedException {
        logger.info("testHealthDaemon");
        long saved = TabletService.healthDaemonSleepDurationMillis;
        TabletService.healthDaemonSleepDurationMillis = 10;
        try {
            List<StreamHealthResponse> received = Collections.synchronizedList(new ArrayList<>());
            service.subscribeHealth(received::add);
            service.startHealthDaemon();
            Thread.sleep(200);
            service.stopHealthDaemon();
            int count = received.size();
            assertTrue(count > 2, String.format("only %d snapshots", count));
            Thread.sleep(50);
            assertEquals(count, received.size());
        } finally {
            TabletService.healthDaemonSleepDurationMillis = saved;
        }
    }
}
