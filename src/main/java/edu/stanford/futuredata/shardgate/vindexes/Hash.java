package edu.stanford.futuredata.shardgate.vindexes;

import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps an unsigned 64-bit id to the 8-byte triple DES encryption (all-zero key) of its
 * big-endian bytes.  The mapping is a bijection, so keyspace ids can be mapped back to ids.
 */
public class Hash implements Reversible {

    public static final String TYPE = "hash";

    private static final SecretKeySpec ZERO_KEY = new SecretKeySpec(new byte[24], "DESede");

    // Ciphers are not thread-safe.
    private static final ThreadLocal<Cipher> encrypter = ThreadLocal.withInitial(() -> newCipher(Cipher.ENCRYPT_MODE));
    private static final ThreadLocal<Cipher> decrypter = ThreadLocal.withInitial(() -> newCipher(Cipher.DECRYPT_MODE));

    private final String name;

    public Hash(String name) {
        this.name = name;
    }

    public static Vindex create(String name, Map<String, Object> params) {
        return new Hash(name);
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
                out.add(KeyspaceId.of(vhash(VindexValues.toUint64(id))));
            } catch (MappingException e) {
                throw new MappingException(String.format("Hash.map: %s", e.getMessage()), e);
            }
        }
        return out;
    }

    @Override
    public boolean verify(Object id, KeyspaceId ksid) throws VindexException {
        try {
            return KeyspaceId.of(vhash(VindexValues.toUint64(id))).equals(ksid);
        } catch (MappingException e) {
            throw new MappingException(String.format("Hash.verify: %s", e.getMessage()), e);
        }
    }

    /** Ids come back as Longs holding the unsigned 64-bit bits. */
    @Override
    public List<Object> reverseMap(List<KeyspaceId> ksids) throws VindexException {
        List<Object> out = new ArrayList<>(ksids.size());
        for (KeyspaceId ksid: ksids) {
            if (ksid.length() != 8) {
                throw new MappingException(String.format("Hash.reverseMap: invalid keyspace id %s", ksid));
            }
            out.add(vunhash(ksid.bytes()));
        }
        return out;
    }

    static byte[] vhash(long shardKey) {
        byte[] keyBytes = ByteBuffer.allocate(8).putLong(shardKey).array();
        return crypt(encrypter.get(), keyBytes);
    }

    static long vunhash(byte[] ksid) {
        return ByteBuffer.wrap(crypt(decrypter.get(), ksid)).getLong();
    }

    private static byte[] crypt(Cipher cipher, byte[] block) {
        try {
            return cipher.doFinal(block);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("triple DES block operation failed", e);
        }
    }

    private static Cipher newCipher(int mode) {
        try {
            Cipher cipher = Cipher.getInstance("DESede/ECB/NoPadding");
            cipher.init(mode, ZERO_KEY);
            return cipher;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("triple DES is not available", e);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
