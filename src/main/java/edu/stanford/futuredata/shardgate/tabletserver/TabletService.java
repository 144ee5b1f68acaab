package edu.stanford.futuredata.shardgate.tabletserver;

import edu.stanford.futuredata.shardgate.splitquery.SplitQueryPlanner;
import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.SplitQueryAlgorithm;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import edu.stanford.futuredata.shardgate.tabletconn.Target;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The query service of one tablet, shared by every wire protocol.  Checks that requests are
 * addressed to this tablet, runs them on the {@link QueryEngine}, and publishes health.
 */
public class TabletService {

    private static final Logger logger = LoggerFactory.getLogger(TabletService.class);

    private final Target target;
    private final QueryEngine engine;
    private final SplitQueryPlanner splitQueryPlanner;

    private volatile boolean serving = true;
    private volatile long tabletExternallyReparentedTimestamp = 0;

    // Map from subscription id to health stream.
    private final Map<Long, StreamSink<StreamHealthResponse>> healthSinks = new ConcurrentHashMap<>();
    private final AtomicLong healthSubscriptionIds = new AtomicLong(0);

    private HealthDaemon healthDaemon = null;
    private volatile boolean runHealthDaemon = false;
    public static long healthDaemonSleepDurationMillis = 1000;

    public TabletService(Target target, QueryEngine engine) {
        this.target = target;
        this.engine = engine;
        this.splitQueryPlanner = new SplitQueryPlanner(engine);
    }

    /* PUBLIC FUNCTIONS */

    public Result execute(Target target, BoundQuery query, long transactionId) throws ServerException {
        checkTarget(target);
        return engine.execute(query, transactionId);
    }

    /**
     * With asTransaction the batch runs in its own transaction: committed if every query
     * succeeds, rolled back otherwise.
     */
    public List<Result> executeBatch(Target target, List<BoundQuery> queries, boolean asTransaction,
                                     long transactionId) throws ServerException {
        checkTarget(target);
        if (asTransaction && transactionId != 0) {
            throw new ServerException(ErrorCode.BAD_INPUT,
                    String.format("asTransaction cannot be used inside transaction %d", transactionId));
        }
        if (!asTransaction) {
            return runBatch(queries, transactionId);
        }
        long batchTransactionId = engine.begin();
        List<Result> results;
        try {
            results = runBatch(queries, batchTransactionId);
        } catch (ServerException e) {
            rollbackQuietly(batchTransactionId, e);
            throw e;
        }
        engine.commit(batchTransactionId);
        return results;
    }

    public void streamExecute(Target target, BoundQuery query, StreamSink<Result> sink) throws ServerException {
        checkTarget(target);
        engine.streamExecute(query, sink);
    }

    public long begin(Target target) throws ServerException {
        checkTarget(target);
        return engine.begin();
    }

    public void commit(Target target, long transactionId) throws ServerException {
        checkTarget(target);
        engine.commit(transactionId);
    }

    public void rollback(Target target, long transactionId) throws ServerException {
        checkTarget(target);
        engine.rollback(transactionId);
    }

    /** @throws ServerException carrying the transaction id if the query failed after begin */
    public Pair<Result, Long> beginExecute(Target target, BoundQuery query) throws ServerException {
        long transactionId = begin(target);
        try {
            return new Pair<>(engine.execute(query, transactionId), transactionId);
        } catch (ServerException e) {
            throw e.withTransactionId(transactionId);
        }
    }

    /** @throws ServerException carrying the transaction id if a query failed after begin */
    public Pair<List<Result>, Long> beginExecuteBatch(Target target, List<BoundQuery> queries, boolean asTransaction)
            throws ServerException {
        if (asTransaction) {
            checkTarget(target);
            throw new ServerException(ErrorCode.BAD_INPUT, "beginExecuteBatch cannot use asTransaction");
        }
        long transactionId = begin(target);
        try {
            return new Pair<>(runBatch(queries, transactionId), transactionId);
        } catch (ServerException e) {
            throw e.withTransactionId(transactionId);
        }
    }

    public List<QuerySplit> splitQuery(Target target, BoundQuery query, List<String> splitColumns, long splitCount,
                                       long numRowsPerQueryPart, SplitQueryAlgorithm algorithm)
            throws ServerException {
        checkTarget(target);
        return splitQueryPlanner.splitQuery(query, splitColumns, splitCount, numRowsPerQueryPart, algorithm);
    }

    /**
     * Subscribe to health snapshots.  The current snapshot is sent right away, later ones as
     * the health daemon produces them.  A sink that throws is unsubscribed.
     *
     * @return the subscription id, for {@link #unsubscribeHealth}
     */
    public long subscribeHealth(StreamSink<StreamHealthResponse> sink) {
        long id = healthSubscriptionIds.incrementAndGet();
        healthSinks.put(id, sink);
        deliver(id, sink, healthSnapshot());
        return id;
    }

    public void unsubscribeHealth(long subscriptionId) {
        healthSinks.remove(subscriptionId);
    }

    public int healthSubscriberCount() {
        return healthSinks.size();
    }

    public StreamHealthResponse healthSnapshot() {
        return new StreamHealthResponse(target, serving, tabletExternallyReparentedTimestamp, engine.realtimeStats());
    }

    /** Send the current snapshot to every subscriber. */
    public void broadcastHealth() {
        StreamHealthResponse snapshot = healthSnapshot();
        for (Map.Entry<Long, StreamSink<StreamHealthResponse>> entry: healthSinks.entrySet()) {
            deliver(entry.getKey(), entry.getValue(), snapshot);
        }
    }

    /** A tablet that is not serving rejects queries with QUERY_NOT_SERVED. */
    public void setServing(boolean serving) {
        if (this.serving != serving) {
            logger.info("Tablet {} serving: {}", target, serving);
        }
        this.serving = serving;
    }

    public boolean isServing() {
        return serving;
    }

    public void setTabletExternallyReparentedTimestamp(long timestamp) {
        this.tabletExternallyReparentedTimestamp = timestamp;
    }

    public Target getTarget() {
        return target;
    }

    public synchronized void startHealthDaemon() {
        if (healthDaemon != null) {
            return;
        }
        runHealthDaemon = true;
        healthDaemon = new HealthDaemon();
        healthDaemon.start();
    }

    public synchronized void stopHealthDaemon() {
        if (healthDaemon == null) {
            return;
        }
        runHealthDaemon = false;
        healthDaemon.interrupt();
        try {
            healthDaemon.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        healthDaemon = null;
    }

    /* PRIVATE FUNCTIONS */

    private void checkTarget(Target requested) throws ServerException {
        if (!target.equals(requested)) {
            throw new ServerException(ErrorCode.QUERY_NOT_SERVED,
                    String.format("tablet serves %s, not %s", target, requested));
        }
        if (!serving) {
            throw new ServerException(ErrorCode.QUERY_NOT_SERVED, String.format("tablet %s is not serving", target));
        }
    }

    private List<Result> runBatch(List<BoundQuery> queries, long transactionId) throws ServerException {
        List<Result> results = new ArrayList<>(queries.size());
        for (BoundQuery query: queries) {
            results.add(engine.execute(query, transactionId));
        }
        return results;
    }

    private void rollbackQuietly(long transactionId, ServerException cause) {
        try {
            engine.rollback(transactionId);
        } catch (ServerException e) {
            cause.addSuppressed(e);
            logger.warn("Rollback of batch transaction {} failed: {}", transactionId, e.getMessage());
        }
    }

    private void deliver(long id, StreamSink<StreamHealthResponse> sink, StreamHealthResponse snapshot) {
        try {
            sink.send(snapshot);
        } catch (ServerException e) {
            logger.debug("Health subscriber {} went away: {}", id, e.getMessage());
            healthSinks.remove(id);
        }
    }

    private class HealthDaemon extends Thread {
        HealthDaemon() {
            setDaemon(true);
            setName("health-" + target.getKeyspace() + "-" + target.getShard());
        }

        @Override
        public void run() {
            while (runHealthDaemon) {
                broadcastHealth();
                try {
                    Thread.sleep(healthDaemonSleepDurationMillis);
                } catch (InterruptedException e) {
                    return;
                }
            }
        }
    }
}
