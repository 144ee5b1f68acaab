package edu.stanford.futuredata.shardgate.grpctabletconn;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.tabletconn.AbstractTabletConnTest;
import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.OperationalException;
import edu.stanford.futuredata.shardgate.tabletconn.ResultStream;
import edu.stanford.futuredata.shardgate.tabletconn.TabletDialer;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.tabletserver.TabletServer;
import edu.stanford.futuredata.shardgate.tabletserver.TabletService;
import edu.stanford.futuredata.shardgate.utilities.Utilities;
import io.grpc.Context;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class GrpcTabletConnTest extends AbstractTabletConnTest {

    private static final Logger logger = LoggerFactory.getLogger(GrpcTabletConnTest.class);

    private TabletServer tabletServer;

    @Override
    protected EndPoint startTablet(TabletService tabletService) {
        tabletServer = new TabletServer(tabletService, "127.0.0.1", 0, 1, null);
        assertTrue(tabletServer.startServing());
        return tabletServer.getEndPoint();
    }

    @Override
    protected TabletDialer dialer() {
        return GrpcTabletConn.DIALER;
    }

    @Override
    protected void stopTablet() {
        tabletServer.shutDown();
    }

    @Test
    public void testDialUnreachable() {
        logger.info("testDialUnreachable");
        // Nothing listens on the port of a stopped server.
        TabletServer stopped = new TabletServer(tabletService, "127.0.0.1", 0, 2, null);
        assertTrue(stopped.startServing());
        EndPoint endPoint = stopped.getEndPoint();
        stopped.shutDown();
        OperationalException e = assertThrows(OperationalException.class, () -> GrpcTabletConn.dial(Context.ROOT,
                endPoint, KEYSPACE, SHARD, TabletType.MASTER, Duration.ofMillis(300)));
        assertEquals(OperationalException.Kind.NETWORK, e.getKind());
    }

    @Test
    public void testServerGone() {
        logger.info("testServerGone");
        tabletServer.shutDown();
        OperationalException e = assertThrows(OperationalException.class,
                () -> conn.execute(Context.ROOT, SELECT_ALL, 0));
        assertEquals(OperationalException.Kind.NETWORK, e.getKind());
    }

    @Test
    public void testDeadlineDuringCall() throws Exception {
        logger.info("testDeadlineDuringCall");
        Context.CancellableContext ctx = Utilities.withTimeout(Context.current(), Duration.ofMillis(200));
        try (ResultStream stream = conn.streamExecute(ctx, new BoundQuery("stream forever"))) {
            OperationalException e = assertThrows(OperationalException.class, () -> {
                for (int i = 0; i < 1000000; i++) {
                    stream.recv();
                }
            });
            assertEquals(OperationalException.Kind.CANCELLED, e.getKind());
        } finally {
            ctx.close();
        }
    }
}
