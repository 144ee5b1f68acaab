package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.utilities.Utilities;

import java.util.Arrays;
import java.util.Objects;

/**
 * The sharding key of a row.  Keyspace ids are compared byte by byte as unsigned values,
 * and a shorter id sorts before any longer id it is a prefix of.
 */
public final class KeyspaceId implements Comparable<KeyspaceId> {

    // No keyspace id.  Also the unbounded end of a key range.
    public static final KeyspaceId NONE = new KeyspaceId(new byte[0]);

    private final byte[] id;

    private KeyspaceId(byte[] id) {
        this.id = id;
    }

    public static KeyspaceId of(byte[] id) {
        Objects.requireNonNull(id, "id");
        return id.length == 0 ? NONE : new KeyspaceId(id.clone());
    }

    public static KeyspaceId fromHex(String hex) {
        return of(Utilities.fromHex(hex));
    }

    /** A copy of the id bytes. */
    public byte[] bytes() {
        return id.clone();
    }

    public int length() {
        return id.length;
    }

    public boolean isEmpty() {
        return id.length == 0;
    }

    public String toHex() {
        return Utilities.toHex(id);
    }

    @Override
    public int compareTo(KeyspaceId o) {
        return Arrays.compareUnsigned(id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyspaceId)) {
            return false;
        }
        return Arrays.equals(id, ((KeyspaceId) o).id);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(id);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
