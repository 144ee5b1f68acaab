package edu.stanford.futuredata.shardgate.executable;

import edu.stanford.futuredata.shardgate.grpctabletconn.GrpcTabletConn;
import edu.stanford.futuredata.shardgate.router.ShardRouter;
import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConn;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletDialerRegistry;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.topo.TopoException;
import edu.stanford.futuredata.shardgate.topo.TopoServer;
import edu.stanford.futuredata.shardgate.topo.ZKTopoServer;
import edu.stanford.futuredata.shardgate.utilities.ConfigurationException;
import edu.stanford.futuredata.shardgate.utilities.Utilities;
import edu.stanford.futuredata.shardgate.vindexes.Vindex;
import edu.stanford.futuredata.shardgate.vindexes.VindexException;
import edu.stanford.futuredata.shardgate.vindexes.VindexRegistry;
import io.grpc.Context;
import org.apache.commons.cli.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes one query by the id of the row it touches: maps the id through a vindex, finds the
 * owning shard in the topology, and runs the query on that shard's tablet with the id bound
 * as {@code :id}.
 */
public class ShardGateMain {

    private static final Logger logger = LoggerFactory.getLogger(ShardGateMain.class);

    public static void main(String[] args) throws Exception {
        Options options = new Options();
        options.addOption("zh", true, "ZooKeeper Host Address");
        options.addOption("zp", true, "ZooKeeper Port");
        options.addOption("tablet_protocol", true, "Tablet protocol (default grpc)");
        options.addOption("keyspace", true, "Keyspace");
        options.addOption("tablet_type", true, "Tablet type (default master)");
        options.addOption("vindex", true, "Vindex type used to map the id (default hash)");
        options.addOption("id", true, "Id of the row the query touches");
        options.addOption("query", true, "Query to run");
        options.addOption("dial_timeout", true, "Dial and query timeout in milliseconds (default 5000)");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            logger.error("{}", e.getMessage());
            new HelpFormatter().printHelp("shardgate", options);
            System.exit(1);
            return;
        }
        for (String required: List.of("zh", "zp", "keyspace", "id", "query")) {
            if (!cmd.hasOption(required)) {
                logger.error("Missing required option -{}", required);
                new HelpFormatter().printHelp("shardgate", options);
                System.exit(1);
                return;
            }
        }

        String protocol = cmd.getOptionValue("tablet_protocol", TabletDialerRegistry.DEFAULT_PROTOCOL);
        TabletType tabletType = TabletType.valueOf(cmd.getOptionValue("tablet_type", "master").toUpperCase());
        Duration timeout = Duration.ofMillis(Long.parseLong(cmd.getOptionValue("dial_timeout", "5000")));
        TabletDialerRegistry dialers = TabletDialerRegistry.builder()
                .register(GrpcTabletConn.PROTOCOL, GrpcTabletConn.DIALER)
                .build(protocol);
        VindexRegistry vindexes = VindexRegistry.builder().withBuiltins().build();

        TopoServer topoServer = new ZKTopoServer(cmd.getOptionValue("zh"), Integer.parseInt(cmd.getOptionValue("zp")));
        ShardRouter router = new ShardRouter(topoServer, dialers, timeout, 1);
        try {
            Result r = route(router, vindexes, cmd.getOptionValue("keyspace"), cmd.getOptionValue("vindex", "hash"),
                    parseId(cmd.getOptionValue("id")), cmd.getOptionValue("query"), tabletType, timeout);
            logger.info("Fields: {}", r.getFields());
            for (List<Value> row: r.getRows()) {
                logger.info("{}", row);
            }
            logger.info("Rows affected: {}", r.getRowsAffected());
        } catch (VindexException | TabletConnException | ConfigurationException | TopoException e) {
            logger.error("Query failed: {}", e.getMessage());
            System.exit(2);
        } finally {
            router.shutdown();
            topoServer.close();
        }
    }

    static Result route(ShardRouter router, VindexRegistry vindexes, String keyspace, String vindexType, Object id,
                        String sql, TabletType tabletType, Duration timeout)
            throws VindexException, TabletConnException {
        Vindex vindex = vindexes.create(vindexType, vindexType, Map.of());
        Optional<String> shard = router.mapToShards(keyspace, vindex, List.of(id)).get(0);
        if (shard.isEmpty()) {
            throw new TopoException(String.format("no shard of %s owns id %s", keyspace, id));
        }
        logger.info("Id {} maps to shard {}/{}", id, keyspace, shard.get());
        Context.CancellableContext ctx = Utilities.withTimeout(Context.current(), timeout);
        try (TabletConn conn = router.dial(ctx, keyspace, shard.get(), tabletType)) {
            return conn.execute(ctx, BoundQuery.of(sql, Map.of("id", id)), 0);
        } finally {
            ctx.cancel(null);
        }
    }

    // Numbers bind as integers, anything else as text.
    static Object parseId(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return Value.newVarChar(id);
        }
    }
}
