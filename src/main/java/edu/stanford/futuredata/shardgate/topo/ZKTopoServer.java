package edu.stanford.futuredata.shardgate.topo;

import edu.stanford.futuredata.shardgate.tabletconn.EndPoint;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.vindexes.KeyRange;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Topology kept in ZooKeeper.  {@code /keyspaces/<keyspace>/shards/<shard>} holds the key
 * range of the shard, and its child {@code <tabletType>} holds the endpoint serving it.
 */
public class ZKTopoServer implements TopoServer {

    private static final Logger logger = LoggerFactory.getLogger(ZKTopoServer.class);
    private final CuratorFramework cf;

    public ZKTopoServer(String zkHost, int zkPort) {
        String connectString = String.format("%s:%d", zkHost, zkPort);
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        this.cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
    }

    @Override
    public void close() {
        cf.close();
    }

    @Override
    public List<ShardReference> getShardReferences(String keyspace) {
        String shardsPath = shardsPath(keyspace);
        try {
            if (cf.checkExists().forPath(shardsPath) == null) {
                return List.of();
            }
            List<ShardReference> shards = new ArrayList<>();
            for (String shard: cf.getChildren().forPath(shardsPath)) {
                byte[] b = cf.getData().forPath(shardPath(keyspace, shard));
                shards.add(new ShardReference(shard, KeyRange.parseShardName(new String(b, StandardCharsets.UTF_8))));
            }
            return shards;
        } catch (Exception e) {
            logger.error("getShardReferences Keyspace {} ZK Error: {}", keyspace, e.getMessage());
            throw new TopoException(String.format("cannot read shards of %s", keyspace), e);
        }
    }

    @Override
    public Optional<EndPoint> getEndPoint(String keyspace, String shard, TabletType tabletType) {
        String path = endPointPath(keyspace, shard, tabletType);
        try {
            if (cf.checkExists().forPath(path) == null) {
                return Optional.empty();
            }
            byte[] b = cf.getData().forPath(path);
            return Optional.of(new EndPoint(new String(b, StandardCharsets.UTF_8)));
        } catch (Exception e) {
            logger.error("getEndPoint {} ZK Error: {}", path, e.getMessage());
            throw new TopoException(String.format("cannot read endpoint %s", path), e);
        }
    }

    @Override
    public void registerShard(String keyspace, String shard, KeyRange keyRange) {
        setData(shardPath(keyspace, shard), keyRange.toShardName().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void registerEndPoint(String keyspace, String shard, TabletType tabletType, EndPoint endPoint) {
        try {
            if (cf.checkExists().forPath(shardPath(keyspace, shard)) == null) {
                throw new TopoException(String.format("shard %s/%s is not registered", keyspace, shard));
            }
        } catch (TopoException e) {
            throw e;
        } catch (Exception e) {
            logger.error("registerEndPoint {}/{} ZK Error: {}", keyspace, shard, e.getMessage());
            throw new TopoException(String.format("cannot read shard %s/%s", keyspace, shard), e);
        }
        setData(endPointPath(keyspace, shard, tabletType), endPoint.summaryString.getBytes(StandardCharsets.UTF_8));
    }

    private void setData(String path, byte[] data) {
        try {
            if (cf.checkExists().forPath(path) != null) {
                cf.setData().forPath(path, data);
            } else {
                cf.create().creatingParentsIfNeeded().forPath(path, data);
            }
        } catch (Exception e) {
            logger.error("setData {} ZK Error: {}", path, e.getMessage());
            throw new TopoException(String.format("cannot write %s", path), e);
        }
    }

    private static String shardsPath(String keyspace) {
        return String.format("/keyspaces/%s/shards", keyspace);
    }

    private static String shardPath(String keyspace, String shard) {
        return String.format("/keyspaces/%s/shards/%s", keyspace, shard);
    }

    private static String endPointPath(String keyspace, String shard, TabletType tabletType) {
        return String.format("/keyspaces/%s/shards/%s/%s", keyspace, shard, tabletType.name().toLowerCase());
    }
}
