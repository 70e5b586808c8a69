package gitclone.core.pack;

import gitclone.exceptions.ProtocolException;

/**
 * The two little-endian base-128 integer encodings used by packs.
 *
 * <p>
 * Both use bit 7 of each byte as a continuation flag. They differ only in the
 * first byte: a pack entry header spends bits 4..6 of it on the entry type,
 * leaving 4 size bits, while a delta length prefix uses all 7 low bits.
 */
public final class VarInt {
    private static final int MAX_SHIFT = 63;

    private VarInt() {
    }

    /**
     * A decoded value and the number of bytes it occupied.
     */
    public static final class Result {
        private final long value;
        private final int consumed;

        public Result(long value, int consumed) {
            this.value = value;
            this.consumed = consumed;
        }

        public long getValue() {
            return value;
        }

        public int getConsumed() {
            return consumed;
        }

        @Override
        public String toString() {
            return "VarInt.Result{value=" + value + ", consumed=" + consumed + "}";
        }
    }

    /**
     * Reads a pack entry header: type in bits 4..6 of the first byte, size in
     * its low 4 bits, then 7 more size bits per continuation byte.
     */
    public static PackEntryHeader readPackEntryHeader(PackReader in) throws ProtocolException {
        int start = in.position();
        int c = in.readByte();
        int consumed = 1;

        PackEntryType type;
        try {
            type = PackEntryType.fromCode((c >> 4) & 0x07);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(e.getMessage() + " at offset " + start, e);
        }

        long size = c & 0x0f;
        int shift = 4;
        while ((c & 0x80) != 0) {
            if (shift + 7 > MAX_SHIFT) {
                throw new ProtocolException("Entry size overflows at offset " + start);
            }
            c = in.readByte();
            consumed++;
            size |= (long) (c & 0x7f) << shift;
            shift += 7;
        }
        return new PackEntryHeader(type, size, consumed);
    }

    /**
     * Reads a delta source or target length: 7 bits per byte, least
     * significant group first.
     */
    public static Result readDeltaLength(PackReader in) throws ProtocolException {
        int start = in.position();
        long value = 0;
        int shift = 0;
        int consumed = 0;
        int c;
        do {
            if (shift + 7 > MAX_SHIFT) {
                throw new ProtocolException("Length overflows at offset " + start);
            }
            c = in.readByte();
            consumed++;
            value |= (long) (c & 0x7f) << shift;
            shift += 7;
        } while ((c & 0x80) != 0);
        return new Result(value, consumed);
    }
}
