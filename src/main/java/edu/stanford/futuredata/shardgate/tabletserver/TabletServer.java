package edu.stanford.futuredata.shardgate.tabletserver;

import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.Target;
import edu.stanford.futuredata.shardgate.topo.TopoException;
import edu.stanford.futuredata.shardgate.topo.TopoServer;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Serves one {@link TabletService} over gRPC, runs its health daemon, and optionally
 * publishes its endpoint in the topology.
 */
public class TabletServer {

    private static final Logger logger = LoggerFactory.getLogger(TabletServer.class);

    private final TabletService tabletService;
    private final Server server;
    private final String host;
    private final int uid;
    // Null if the tablet does not register itself.
    private final TopoServer topoServer;
    private boolean serving = false;

    private static final long shutdownGraceMillis = 1000;

    /** @param port the port to listen on; 0 picks a free one */
    public TabletServer(TabletService tabletService, String host, int port, int uid, TopoServer topoServer) {
        this.tabletService = tabletService;
        this.host = host;
        this.uid = uid;
        this.topoServer = topoServer;
        this.server = ServerBuilder.forPort(port)
                .addService(new ServiceGateTablet(tabletService))
                .build();
    }

    public TabletServer(TabletService tabletService, String host, int port) {
        this(tabletService, host, port, 0, null);
    }

    /** Start serving requests. */
    public synchronized boolean startServing() {
        if (serving) {
            return true;
        }
        try {
            server.start();
        } catch (IOException e) {
            logger.warn("TabletServer startup failed: {}", e.getMessage());
            return false;
        }
        serving = true;
        Target target = tabletService.getTarget();
        logger.info("TabletServer for {} started, listening on {}", target, server.getPort());
        if (topoServer != null) {
            try {
                topoServer.registerEndPoint(target.getKeyspace(), target.getShard(), target.getTabletType(),
                        getEndPoint());
            } catch (TopoException e) {
                logger.error("TabletServer registration failed: {}", e.getMessage());
                shutDown();
                return false;
            }
        }
        tabletService.startHealthDaemon();
        Runtime.getRuntime().addShutdownHook(new Thread(TabletServer.this::shutDown));
        return true;
    }

    /** Stop serving requests and shutdown resources. */
    public synchronized void shutDown() {
        if (!serving) {
            return;
        }
        serving = false;
        tabletService.stopHealthDaemon();
        server.shutdown();
        try {
            if (!server.awaitTermination(shutdownGraceMillis, TimeUnit.MILLISECONDS)) {
                // Open streams never end on their own.
                server.shutdownNow();
            }
        } catch (InterruptedException e) {
            server.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("TabletServer for {} stopped", tabletService.getTarget());
    }

    public int getPort() {
        return server.getPort();
    }

    public EndPoint getEndPoint() {
        return new EndPoint(uid, host, getPort());
    }

    public TabletService getTabletService() {
        return tabletService;
    }
}
