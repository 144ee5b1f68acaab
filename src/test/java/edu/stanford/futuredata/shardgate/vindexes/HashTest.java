package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.sqltypes.Value;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HashTest {

    private static final Logger logger = LoggerFactory.getLogger(HashTest.class);

    private final Hash hash = new Hash("user_index");

    @Test
    public void testMap() throws VindexException {
        logger.info("testMap");
        List<KeyspaceId> ksids = hash.map(List.of(1L, 1, Value.newUint64(1), BigInteger.ONE));
        KeyspaceId one = KeyspaceId.fromHex("166b40b44aba4bd6");
        assertEquals(List.of(one, one, one, one), ksids);
        assertNotEquals(one, hash.map(List.of(2L)).get(0));
    }

    @Test
    public void testVerify() throws VindexException {
        logger.info("testVerify");
        assertTrue(hash.verify(1L, KeyspaceId.fromHex("166b40b44aba4bd6")));
        assertFalse(hash.verify(2L, KeyspaceId.fromHex("166b40b44aba4bd6")));
    }

    @Test
    public void testReverseMap() throws VindexException {
        logger.info("testReverseMap");
        List<Object> ids = List.of(0L, 1L, 42L, -1L, Long.MIN_VALUE);
        List<KeyspaceId> ksids = hash.map(ids);
        assertEquals(ids, hash.reverseMap(ksids));
        assertThrows(MappingException.class, () -> hash.reverseMap(List.of(KeyspaceId.fromHex("0102"))));
    }

    @Test
    public void testBadInput() {
        logger.info("testBadInput");
        assertThrows(MappingException.class, () -> hash.map(List.of("abc")));
        assertThrows(MappingException.class, () -> hash.map(List.of(Value.newVarChar("1"))));
        assertThrows(MappingException.class, () -> hash.map(List.of(BigInteger.ONE.shiftLeft(64))));
    }
}
