package edu.stanford.futuredata.shardgate.topo;

import edu.stanford.futuredata.shardgate.vindexes.KeyRange;

import java.util.Objects;

/** A shard of a keyspace and the keyspace ids it owns. */
public final class ShardReference {
    private final String name;
    private final KeyRange keyRange;

    public ShardReference(String name, KeyRange keyRange) {
        this.name = Objects.requireNonNull(name, "name");
        this.keyRange = Objects.requireNonNull(keyRange, "keyRange");
    }

    public String getName() {
        return name;
    }

    public KeyRange getKeyRange() {
        return keyRange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShardReference)) {
            return false;
        }
        ShardReference other = (ShardReference) o;
        return name.equals(other.name) && keyRange.equals(other.keyRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keyRange);
    }

    @Override
    public String toString() {
        return String.format("%s [%s]", name, keyRange);
    }
}
