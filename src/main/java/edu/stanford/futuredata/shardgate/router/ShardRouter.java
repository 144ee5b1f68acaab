package edu.stanford.futuredata.shardgate.router;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.Field;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.OperationalException;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConn;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletDialerRegistry;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.topo.ShardReference;
import edu.stanford.futuredata.shardgate.topo.TopoException;
import edu.stanford.futuredata.shardgate.topo.TopoServer;
import edu.stanford.futuredata.shardgate.vindexes.KeyspaceId;
import edu.stanford.futuredata.shardgate.vindexes.Vindex;
import edu.stanford.futuredata.shardgate.vindexes.VindexException;
import io.grpc.Context;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resolves ids to shards through a vindex and the topology, and fans keyspace-id-addressed
 * batches out to the owning shards.
 */
public class ShardRouter {

    private static final Logger logger = LoggerFactory.getLogger(ShardRouter.class);

    private final TopoServer topoServer;
    private final TabletDialerRegistry dialers;
    private final Duration dialTimeout;

    private final ExecutorService shardQueryThreadPool;

    public ShardRouter(TopoServer topoServer, TabletDialerRegistry dialers, Duration dialTimeout, int numThreads) {
        this.topoServer = topoServer;
        this.dialers = dialers;
        this.dialTimeout = dialTimeout;
        this.shardQueryThreadPool = Executors.newFixedThreadPool(numThreads);
    }

    public void shutdown() {
        shardQueryThreadPool.shutdown();
    }

    /* PUBLIC FUNCTIONS */

    /**
     * The shard owning each id, in input order.  Ids the vindex maps to no keyspace id have
     * no shard.
     */
    public List<Optional<String>> mapToShards(String keyspace, Vindex vindex, List<?> ids) throws VindexException {
        List<KeyspaceId> ksids = vindex.map(ids);
        List<ShardReference> shards = topoServer.getShardReferences(keyspace);
        List<Optional<String>> out = new ArrayList<>(ksids.size());
        for (KeyspaceId ksid: ksids) {
            out.add(ksid.isEmpty() ? Optional.empty() : findShard(shards, ksid));
        }
        return out;
    }

    public Optional<String> shardForKeyspaceId(String keyspace, KeyspaceId ksid) {
        if (ksid.isEmpty()) {
            return Optional.empty();
        }
        return findShard(topoServer.getShardReferences(keyspace), ksid);
    }

    /**
     * Connect to the tablet of the given type serving keyspace/shard, over the configured
     * protocol.
     *
     * @throws ServerException QUERY_NOT_SERVED if no such tablet is registered
     */
    public TabletConn dial(Context ctx, String keyspace, String shard, TabletType tabletType)
            throws TabletConnException {
        Optional<EndPoint> endPoint = topoServer.getEndPoint(keyspace, shard, tabletType);
        if (endPoint.isEmpty()) {
            throw new ServerException(ErrorCode.QUERY_NOT_SERVED,
                    String.format("no %s tablet registered for %s/%s", tabletType, keyspace, shard));
        }
        return dialers.getDialer().dial(ctx, endPoint.get(), keyspace, shard, tabletType, dialTimeout);
    }

    /**
     * Run each query on every shard owning one of its keyspace ids.  Each shard gets one batch
     * on its own connection, and shards run in parallel.  A query that spans shards gets the
     * concatenation of their results.  asTransaction applies per shard: there is no atomicity
     * across shards.
     *
     * @return one result per query, in input order
     * @throws TopoException if a keyspace id belongs to no shard
     */
    public List<Result> executeBatchKeyspaceIds(Context ctx, List<BoundKeyspaceIdQuery> queries,
                                                TabletType tabletType, boolean asTransaction)
            throws TabletConnException {
        // Map from (keyspace, shard) to the indices and queries of its batch.
        Map<Pair<String, String>, List<Pair<Integer, BoundQuery>>> shardBatches = new LinkedHashMap<>();
        Map<String, List<ShardReference>> shardsByKeyspace = new HashMap<>();
        for (int i = 0; i < queries.size(); i++) {
            BoundKeyspaceIdQuery q = queries.get(i);
            List<ShardReference> shards =
                    shardsByKeyspace.computeIfAbsent(q.getKeyspace(), topoServer::getShardReferences);
            Set<String> queryShards = new LinkedHashSet<>();
            for (KeyspaceId ksid: q.getKeyspaceIds()) {
                Optional<String> shard = ksid.isEmpty() ? Optional.empty() : findShard(shards, ksid);
                if (shard.isEmpty()) {
                    throw new TopoException(String.format("no shard of %s owns keyspace id %s", q.getKeyspace(), ksid));
                }
                queryShards.add(shard.get());
            }
            for (String shard: queryShards) {
                shardBatches.computeIfAbsent(new Pair<>(q.getKeyspace(), shard), k -> new ArrayList<>())
                        .add(new Pair<>(i, q.getQuery()));
            }
        }

        List<Pair<List<Pair<Integer, BoundQuery>>, Future<List<Result>>>> pending = new ArrayList<>();
        for (Map.Entry<Pair<String, String>, List<Pair<Integer, BoundQuery>>> e: shardBatches.entrySet()) {
            String keyspace = e.getKey().getValue0();
            String shard = e.getKey().getValue1();
            List<BoundQuery> batch = new ArrayList<>();
            for (Pair<Integer, BoundQuery> p: e.getValue()) {
                batch.add(p.getValue1());
            }
            Future<List<Result>> f = shardQueryThreadPool.submit(ctx.wrap(() -> {
                try (TabletConn conn = dial(ctx, keyspace, shard, tabletType)) {
                    return conn.executeBatch(ctx, batch, asTransaction, 0);
                }
            }));
            pending.add(new Pair<>(e.getValue(), f));
        }

        Result[] results = new Result[queries.size()];
        TabletConnException failure = null;
        for (Pair<List<Pair<Integer, BoundQuery>>, Future<List<Result>>> p: pending) {
            List<Result> shardResults;
            try {
                shardResults = p.getValue1().get();
            } catch (ExecutionException e) {
                failure = firstFailure(failure, e.getCause());
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationalException(OperationalException.Kind.CANCELLED, "interrupted waiting for shards", e);
            }
            List<Pair<Integer, BoundQuery>> indices = p.getValue0();
            for (int j = 0; j < indices.size(); j++) {
                int i = indices.get(j).getValue0();
                results[i] = results[i] == null ? shardResults.get(j) : append(results[i], shardResults.get(j));
            }
        }
        if (failure != null) {
            throw failure;
        }
        List<Result> out = new ArrayList<>(results.length);
        for (Result r: results) {
            out.add(r == null ? Result.EMPTY : r);
        }
        return out;
    }

    /* PRIVATE FUNCTIONS */

    private static Optional<String> findShard(List<ShardReference> shards, KeyspaceId ksid) {
        for (ShardReference shard: shards) {
            if (shard.getKeyRange().contains(ksid)) {
                return Optional.of(shard.getName());
            }
        }
        return Optional.empty();
    }

    private static TabletConnException firstFailure(TabletConnException failure, Throwable cause) {
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        TabletConnException e = cause instanceof TabletConnException ? (TabletConnException) cause
                : new OperationalException(OperationalException.Kind.NETWORK, String.valueOf(cause.getMessage()), cause);
        if (failure == null) {
            return e;
        }
        logger.warn("Additional shard failure: {}", e.getMessage());
        failure.addSuppressed(e);
        return failure;
    }

    // Rows of both, fields of the first that has them.
    private static Result append(Result a, Result b) {
        List<Field> fields = a.getFields().isEmpty() ? b.getFields() : a.getFields();
        List<List<Value>> rows = new ArrayList<>(a.getRows());
        rows.addAll(b.getRows());
        long insertId = a.getInsertId() != 0 ? a.getInsertId() : b.getInsertId();
        return new Result(fields, a.getRowsAffected() + b.getRowsAffected(), insertId, rows);
    }
}
