package gitclone.core.objects;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import gitclone.exceptions.CorruptObjectException;

public class RawObjectTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testSerializePrefixesHeader() {
        RawObject raw = new RawObject(ObjectType.BLOB, bytes("hello\n"));

        assertArrayEquals(bytes("blob 6\0hello\n"), raw.serialize());
        assertEquals("ce013625030ba8dba906f756967f9e9ca394464a", raw.getSha());
    }

    @Test
    void testParseSplitsHeader() throws Exception {
        RawObject raw = RawObject.parse(bytes("tree 0\0"));

        assertEquals(ObjectType.TREE, raw.getType());
        assertEquals(0, raw.getSize());
    }

    @Test
    void testPayloadMayContainNul() throws Exception {
        RawObject raw = RawObject.parse(bytes("blob 3\0a\0b"));

        assertArrayEquals(bytes("a\0b"), raw.getContent());
    }

    @Test
    void testMalformedHeaders() {
        assertThrows(CorruptObjectException.class, () -> RawObject.parse(bytes("blob 6 hello")));
        assertThrows(CorruptObjectException.class, () -> RawObject.parse(bytes("blob\0")));
        assertThrows(CorruptObjectException.class, () -> RawObject.parse(bytes("blob x\0")));
        assertThrows(CorruptObjectException.class, () -> RawObject.parse(bytes("blob -1\0")));
        assertThrows(CorruptObjectException.class, () -> RawObject.parse(bytes("tag 0\0")));
        assertThrows(CorruptObjectException.class, () -> RawObject.parse(bytes("blob 2\0abc")));
    }
}
