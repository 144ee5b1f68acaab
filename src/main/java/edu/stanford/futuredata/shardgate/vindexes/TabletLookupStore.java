package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConn;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import edu.stanford.futuredata.shardgate.utilities.Utilities;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A lookup store whose tables live on a tablet.  Each operation opens its own connection,
 * since connections are not thread-safe, and is bounded by a timeout.  Any tablet failure
 * is reported as {@link BackingStoreException}.
 */
public class TabletLookupStore implements LookupStore {

    private static final Logger logger = LoggerFactory.getLogger(TabletLookupStore.class);

    /** Opens a connection to the tablet holding the lookup tables. */
    @FunctionalInterface
    public interface Connector {
        TabletConn connect(Context ctx) throws TabletConnException;
    }

    private final Connector connector;
    private final Duration timeout;

    public TabletLookupStore(Connector connector, Duration timeout) {
        this.connector = connector;
        this.timeout = timeout;
    }

    @Override
    public Optional<Value> get(String table, String fromColumn, String toColumn, Value id)
            throws BackingStoreException {
        BoundQuery query = new BoundQuery(
                String.format("select %s from %s where %s = :%s", toColumn, table, fromColumn, fromColumn),
                Map.of(fromColumn, id));
        Result r = run(table, (ctx, conn) -> List.of(conn.execute(ctx, query, 0))).get(0);
        if (r.getRows().isEmpty() || r.getRows().get(0).isEmpty() || r.getRows().get(0).get(0).isNull()) {
            return Optional.empty();
        }
        return Optional.of(r.getRows().get(0).get(0));
    }

    @Override
    public void put(String table, String fromColumn, String toColumn, Value id, Value to)
            throws BackingStoreException {
        BoundQuery query = new BoundQuery(
                String.format("insert into %s (%s, %s) values (:%s, :%s)", table, fromColumn, toColumn,
                        fromColumn, toColumn),
                Map.of(fromColumn, id, toColumn, to));
        run(table, (ctx, conn) -> List.of(conn.execute(ctx, query, 0)));
    }

    @Override
    public void delete(String table, String fromColumn, String toColumn, List<Value> ids, Value to)
            throws BackingStoreException {
        if (ids.isEmpty()) {
            return;
        }
        List<BoundQuery> queries = new ArrayList<>(ids.size());
        for (Value id: ids) {
            queries.add(new BoundQuery(
                    String.format("delete from %s where %s = :%s and %s = :%s", table, fromColumn, fromColumn,
                            toColumn, toColumn),
                    Map.of(fromColumn, id, toColumn, to)));
        }
        run(table, (ctx, conn) -> conn.executeBatch(ctx, queries, true, 0));
    }

    private interface Operation {
        List<Result> apply(Context ctx, TabletConn conn) throws TabletConnException;
    }

    private List<Result> run(String table, Operation operation) throws BackingStoreException {
        Context.CancellableContext ctx = Utilities.withTimeout(Context.current(), timeout);
        try (TabletConn conn = connector.connect(ctx)) {
            return operation.apply(ctx, conn);
        } catch (TabletConnException e) {
            logger.warn("Lookup table {} unavailable: {}", table, e.getMessage());
            throw new BackingStoreException(String.format("lookup table %s: %s", table, e.getMessage()), e);
        } finally {
            ctx.cancel(null);
        }
    }
}
