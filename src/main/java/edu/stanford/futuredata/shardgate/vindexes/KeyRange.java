package edu.stanford.futuredata.shardgate.vindexes;

import java.util.Objects;

/**
 * A half-open interval [start, end) of keyspace ids owned by one shard.  An empty start is
 * unbounded below and an empty end is unbounded above.
 */
public final class KeyRange {

    public static final KeyRange FULL = new KeyRange(KeyspaceId.NONE, KeyspaceId.NONE);

    private final KeyspaceId start;
    private final KeyspaceId end;

    public KeyRange(KeyspaceId start, KeyspaceId end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (!start.isEmpty() && !end.isEmpty() && start.compareTo(end) >= 0) {
            throw new IllegalArgumentException(String.format("empty key range %s-%s", start, end));
        }
    }

    /** Parse a shard name such as "-80", "80-c0", "c0-" or "-". */
    public static KeyRange parseShardName(String shardName) {
        int dash = shardName.indexOf('-');
        if (dash < 0 || dash != shardName.lastIndexOf('-')) {
            throw new IllegalArgumentException(String.format("malformed shard name %s", shardName));
        }
        KeyspaceId start = KeyspaceId.fromHex(shardName.substring(0, dash));
        KeyspaceId end = KeyspaceId.fromHex(shardName.substring(dash + 1));
        return new KeyRange(start, end);
    }

    public KeyspaceId getStart() {
        return start;
    }

    public KeyspaceId getEnd() {
        return end;
    }

    public boolean contains(KeyspaceId ksid) {
        return (start.isEmpty() || ksid.compareTo(start) >= 0)
                && (end.isEmpty() || ksid.compareTo(end) < 0);
    }

    public String toShardName() {
        return start.toHex() + "-" + end.toHex();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyRange)) {
            return false;
        }
        KeyRange other = (KeyRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return toShardName();
    }
}
