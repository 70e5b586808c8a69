package gitclone.utils.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class HashUtilsTest {

    @Test
    void testSha1OfEmptyInput() {
        assertEquals("da39a3ee5e6b4b0d3255bfef95601890afd80709", HashUtils.sha1Hex(new byte[0]));
    }

    @Test
    void testHexRoundTripKeepsBinaryBytes() {
        String sha = "00ff20100a0d7f80fe0102030405060708090a0b";
        byte[] raw = HashUtils.toBytes(sha);
        assertEquals(20, raw.length);
        assertEquals(0x00, raw[0]);
        assertEquals((byte) 0xff, raw[1]);
        assertEquals(0x20, raw[2]);
        assertEquals(sha, HashUtils.toHex(raw));
    }

    @Test
    void testToBytesAcceptsUpperCase() {
        assertArrayEquals(HashUtils.toBytes("ce013625030ba8dba906f756967f9e9ca394464a"),
                HashUtils.toBytes("CE013625030BA8DBA906F756967F9E9CA394464A"));
    }

    @Test
    void testRejectsInvalidIds() {
        assertFalse(HashUtils.isValidSha(null));
        assertFalse(HashUtils.isValidSha("abc"));
        assertFalse(HashUtils.isValidSha("zz013625030ba8dba906f756967f9e9ca394464a"));
        assertTrue(HashUtils.isValidSha("ce013625030ba8dba906f756967f9e9ca394464a"));
        assertThrows(IllegalArgumentException.class, () -> HashUtils.toBytes("not-a-sha"));
    }

    @Test
    void testCompressionRoundTrip() throws Exception {
        byte[] data = "some text that compresses, some text that compresses".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(data, CompressionUtils.decompress(CompressionUtils.compress(data)));
    }

    @Test
    void testDecompressRejectsTruncatedStream() {
        byte[] compressed = CompressionUtils.compress(new byte[1000]);
        byte[] truncated = new byte[compressed.length / 2];
        System.arraycopy(compressed, 0, truncated, 0, truncated.length);
        assertThrows(java.util.zip.DataFormatException.class, () -> CompressionUtils.decompress(truncated));
    }
}
