package edu.stanford.futuredata.shardgate.localtabletconn;

import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.OperationalException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletDialer;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.tabletconn.Target;
import edu.stanford.futuredata.shardgate.tabletserver.TabletService;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dials tablets living in this process.  Tablets are published under the address of an
 * endpoint, which need not be a real socket.
 */
public class LocalTabletDialer implements TabletDialer {

    private static final Logger logger = LoggerFactory.getLogger(LocalTabletDialer.class);

    public static final String PROTOCOL = "local";

    // Map from host:port to tablet.
    private final Map<String, TabletService> tablets = new ConcurrentHashMap<>();

    public void register(EndPoint endPoint, TabletService tabletService) {
        tablets.put(endPoint.getAddress(), tabletService);
        logger.debug("Local tablet {} published at {}", tabletService.getTarget(), endPoint.getAddress());
    }

    public void unregister(EndPoint endPoint) {
        tablets.remove(endPoint.getAddress());
    }

    @Override
    public LocalTabletConn dial(Context ctx, EndPoint endPoint, String keyspace, String shard, TabletType tabletType,
                                Duration timeout) throws TabletConnException {
        if (ctx.isCancelled()) {
            throw new OperationalException(OperationalException.Kind.CANCELLED,
                    String.format("dial %s cancelled", endPoint), ctx.cancellationCause());
        }
        TabletService tabletService = tablets.get(endPoint.getAddress());
        if (tabletService == null) {
            throw new OperationalException(OperationalException.Kind.NETWORK,
                    String.format("no local tablet at %s", endPoint.getAddress()));
        }
        return new LocalTabletConn(endPoint, new Target(keyspace, shard, tabletType), tabletService);
    }
}
