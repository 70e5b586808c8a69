package gitclone.core.pack;

import static gitclone.testing.PackBuilder.copy;
import static gitclone.testing.PackBuilder.delta;
import static gitclone.testing.PackBuilder.insert;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import gitclone.exceptions.CorruptDeltaException;

public class DeltaApplierTest {

    private static final byte[] BASE = "hello world".getBytes(StandardCharsets.UTF_8);

    private static String text(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Test
    void testCopyThenInsert() throws Exception {
        byte[] d = delta(11, 11, new byte[] { (byte) 0x90, 0x05 }, insert(" there"));

        assertEquals("hello there", text(DeltaApplier.apply(BASE, d)));
    }

    @Test
    void testCopyWithOffset() throws Exception {
        byte[] d = delta(11, 10, copy(6, 5), insert(" "), copy(0, 4));

        assertEquals("world hell", text(DeltaApplier.apply(BASE, d)));
    }

    @Test
    void testMultiByteOffsetAndSize() throws Exception {
        byte[] base = new byte[0x20000];
        for (int i = 0; i < base.length; i++) {
            base[i] = (byte) (i * 7);
        }
        byte[] d = delta(base.length, 0x1234, copy(0x10203, 0x1234));

        assertArrayEquals(Arrays.copyOfRange(base, 0x10203, 0x10203 + 0x1234), DeltaApplier.apply(base, d));
    }

    @Test
    void testZeroSizeMeans64k() throws Exception {
        byte[] base = new byte[0x10000 + 10];
        Arrays.fill(base, (byte) 'x');
        base[10] = 'y';
        // offset 10, no size bytes
        byte[] d = delta(base.length, 0x10000, new byte[] { (byte) 0x81, 10 });

        byte[] out = DeltaApplier.apply(base, d);
        assertEquals(0x10000, out.length);
        assertEquals('y', out[0]);
    }

    @Test
    void testInsertOnlyDelta() throws Exception {
        byte[] d = delta(0, 3, insert("abc"));

        assertEquals("abc", text(DeltaApplier.apply(new byte[0], d)));
    }

    @Test
    void testSourceLengthMismatch() {
        byte[] d = delta(10, 5, copy(0, 5));

        assertThrows(CorruptDeltaException.class, () -> DeltaApplier.apply(BASE, d));
    }

    @Test
    void testTargetLengthMismatch() {
        assertThrows(CorruptDeltaException.class,
                () -> DeltaApplier.apply(BASE, delta(11, 6, copy(0, 5))));
        assertThrows(CorruptDeltaException.class,
                () -> DeltaApplier.apply(BASE, delta(11, 4, copy(0, 5))));
    }

    @Test
    void testCopyOutsideBase() {
        byte[] d = delta(11, 5, copy(8, 5));

        assertThrows(CorruptDeltaException.class, () -> DeltaApplier.apply(BASE, d));
    }

    @Test
    void testInsertRunningPastDelta() {
        byte[] d = delta(11, 5, new byte[] { 5, 'a', 'b' });

        assertThrows(CorruptDeltaException.class, () -> DeltaApplier.apply(BASE, d));
    }

    @Test
    void testReservedInstruction() {
        byte[] d = delta(11, 1, new byte[] { 0x00 }, insert("a"));

        assertThrows(CorruptDeltaException.class, () -> DeltaApplier.apply(BASE, d));
    }

    @Test
    void testTruncatedHeader() {
        assertThrows(CorruptDeltaException.class, () -> DeltaApplier.apply(BASE, new byte[] { (byte) 0x8b }));
    }
}
