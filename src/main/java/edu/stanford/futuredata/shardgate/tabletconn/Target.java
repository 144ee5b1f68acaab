package edu.stanford.futuredata.shardgate.tabletconn;

import java.util.Objects;

/** The (keyspace, shard, tablet type) a request is addressed to. */
public final class Target {
    private final String keyspace;
    private final String shard;
    private final TabletType tabletType;

    public Target(String keyspace, String shard, TabletType tabletType) {
        this.keyspace = Objects.requireNonNull(keyspace, "keyspace");
        this.shard = Objects.requireNonNull(shard, "shard");
        this.tabletType = Objects.requireNonNull(tabletType, "tabletType");
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getShard() {
        return shard;
    }

    public TabletType getTabletType() {
        return tabletType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Target)) {
            return false;
        }
        Target other = (Target) o;
        return keyspace.equals(other.keyspace) && shard.equals(other.shard) && tabletType == other.tabletType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyspace, shard, tabletType);
    }

    @Override
    public String toString() {
        return String.format("%s/%s (%s)", keyspace, shard, tabletType);
    }
}
