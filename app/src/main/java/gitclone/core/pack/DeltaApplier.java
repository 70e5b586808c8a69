package gitclone.core.pack;

import gitclone.exceptions.CorruptDeltaException;
import gitclone.exceptions.ProtocolException;

// @formatter:off
/**
 * Rebuilds an object from a base payload and a delta instruction stream.
 *
 * Delta layout:
 * ┌──────────────┬──────────────┬──────────────────────────────────┐
 * │ source length│ target length│ instructions...                  │
 * │ (varint)     │ (varint)     │                                  │
 * └──────────────┴──────────────┴──────────────────────────────────┘
 *
 * Copy instruction, high bit set:
 * ┌──────────┬─────────┬─────────┬─────────┬─────────┬───────┬───────┬───────┐
 * │ 1xxxxxxx │ offset1 │ offset2 │ offset3 │ offset4 │ size1 │ size2 │ size3 │
 * └──────────┴─────────┴─────────┴─────────┴─────────┴───────┴───────┴───────┘
 * Bit n of the instruction byte says whether the n-th following byte is
 * present; absent bytes are zero. A size of zero means 0x10000.
 *
 * Insert instruction, high bit clear: the low 7 bits give the number of
 * literal bytes that follow. 0x00 is reserved.
 */
// @formatter:on
public final class DeltaApplier {
    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;
    private static final int DEFAULT_COPY_SIZE = 0x10000;

    private DeltaApplier() {
    }

    /**
     * Applies {@code delta} to {@code base}.
     *
     * @throws CorruptDeltaException if the declared source length differs from
     *                               the base, an instruction reaches outside
     *                               the base or the delta, or the output does
     *                               not come out at the declared target length
     */
    public static byte[] apply(byte[] base, byte[] delta) throws CorruptDeltaException {
        PackReader in = new PackReader(delta);

        long sourceLength;
        long targetLength;
        try {
            sourceLength = VarInt.readDeltaLength(in).getValue();
            targetLength = VarInt.readDeltaLength(in).getValue();
        } catch (ProtocolException e) {
            throw new CorruptDeltaException("Truncated delta header: " + e.getMessage(), e);
        }

        if (sourceLength != base.length) {
            throw new CorruptDeltaException("Delta expects a base of " + sourceLength
                    + " bytes, base has " + base.length);
        }
        if (targetLength > MAX_ARRAY_SIZE) {
            throw new CorruptDeltaException("Unsupported delta target length " + targetLength);
        }

        byte[] out = new byte[(int) targetLength];
        int written = 0;

        try {
            while (in.hasRemaining()) {
                int instructionOffset = in.position();
                int cmd = in.readByte();

                if ((cmd & 0x80) != 0) {
                    long offset = 0;
                    for (int i = 0; i < 4; i++) {
                        if ((cmd & (1 << i)) != 0) {
                            offset |= (long) in.readByte() << (8 * i);
                        }
                    }
                    int size = 0;
                    for (int i = 0; i < 3; i++) {
                        if ((cmd & (0x10 << i)) != 0) {
                            size |= in.readByte() << (8 * i);
                        }
                    }
                    if (size == 0) {
                        size = DEFAULT_COPY_SIZE;
                    }

                    if (offset + size > base.length) {
                        throw new CorruptDeltaException("Copy of " + size + " bytes at base offset " + offset
                                + " exceeds base length " + base.length + " (instruction at " + instructionOffset + ")");
                    }
                    if (written + size > out.length) {
                        throw new CorruptDeltaException("Copy at " + instructionOffset
                                + " overruns target length " + targetLength);
                    }
                    System.arraycopy(base, (int) offset, out, written, size);
                    written += size;
                } else if (cmd != 0) {
                    if (written + cmd > out.length) {
                        throw new CorruptDeltaException("Insert at " + instructionOffset
                                + " overruns target length " + targetLength);
                    }
                    in.readBytes(out, written, cmd);
                    written += cmd;
                } else {
                    throw new CorruptDeltaException("Reserved delta instruction 0x00 at " + instructionOffset);
                }
            }
        } catch (ProtocolException e) {
            throw new CorruptDeltaException("Truncated delta instruction: " + e.getMessage(), e);
        }

        if (written != targetLength) {
            throw new CorruptDeltaException("Delta produced " + written + " bytes, expected " + targetLength);
        }
        return out;
    }
}
