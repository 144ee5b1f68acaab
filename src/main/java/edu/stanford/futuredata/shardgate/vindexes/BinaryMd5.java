package edu.stanford.futuredata.shardgate.vindexes;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hashes the raw bytes of an id to a 16-byte MD5 keyspace id.  MD5 spreads ids evenly; it
 * is not used for security.
 */
public class BinaryMd5 implements Vindex {

    public static final String TYPE = "binary_md5";

    private final String name;

    public BinaryMd5(String name) {
        this.name = name;
    }

    public static Vindex create(String name, Map<String, Object> params) {
        return new BinaryMd5(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getCost() {
        return 1;
    }

    @Override
    public List<KeyspaceId> map(List<?> ids) throws VindexException {
        List<KeyspaceId> out = new ArrayList<>(ids.size());
        for (Object id: ids) {
            try {
                out.add(KeyspaceId.of(binHash(VindexValues.toBytes(id))));
            } catch (MappingException e) {
                throw new MappingException(String.format("BinaryMd5.map: %s", e.getMessage()), e);
            }
        }
        return out;
    }

    @Override
    public boolean verify(Object id, KeyspaceId ksid) throws VindexException {
        try {
            return KeyspaceId.of(binHash(VindexValues.toBytes(id))).equals(ksid);
        } catch (MappingException e) {
            throw new MappingException(String.format("BinaryMd5.verify: %s", e.getMessage()), e);
        }
    }

    static byte[] binHash(byte[] source) {
        try {
            // MessageDigest is not thread-safe, so each call gets its own.
            return MessageDigest.getInstance("MD5").digest(source);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
