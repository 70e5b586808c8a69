package gitclone.core.pack;

import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import gitclone.exceptions.ProtocolException;

/**
 * Cursor over an in-memory pack or delta buffer.
 *
 * All reads advance the cursor. {@link #inflate(long)} consumes exactly the
 * compressed bytes of one zlib stream, which is the only way to find where
 * the next pack entry starts: entries carry no compressed length of their
 * own.
 */
public class PackReader {
    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    private final byte[] buffer;
    private final int limit;
    private int position;
    private long lastInflateConsumed = -1;

    public PackReader(byte[] buffer) {
        this(buffer, 0, buffer.length);
    }

    public PackReader(byte[] buffer, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > buffer.length) {
            throw new IndexOutOfBoundsException("Invalid range " + offset + "+" + length + " of " + buffer.length);
        }
        this.buffer = buffer;
        this.position = offset;
        this.limit = offset + length;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return limit - position;
    }

    public boolean hasRemaining() {
        return position < limit;
    }

    /**
     * Reads one unsigned byte.
     */
    public int readByte() throws ProtocolException {
        require(1);
        return buffer[position++] & 0xff;
    }

    public byte[] readBytes(int count) throws ProtocolException {
        require(count);
        byte[] result = Arrays.copyOfRange(buffer, position, position + count);
        position += count;
        return result;
    }

    public void readBytes(byte[] target, int offset, int count) throws ProtocolException {
        require(count);
        System.arraycopy(buffer, position, target, offset, count);
        position += count;
    }

    /**
     * Reads a 4-byte big-endian integer.
     */
    public int readInt() throws ProtocolException {
        require(4);
        int value = ((buffer[position] & 0xff) << 24)
                | ((buffer[position + 1] & 0xff) << 16)
                | ((buffer[position + 2] & 0xff) << 8)
                | (buffer[position + 3] & 0xff);
        position += 4;
        return value;
    }

    /**
     * Inflates one zlib stream starting at the cursor and advances the cursor
     * past exactly the compressed bytes the stream occupied.
     *
     * @param expectedSize the inflated size declared by the entry header
     * @throws ProtocolException if the stream is corrupt, truncated, or
     *                           inflates to a size other than declared
     */
    public byte[] inflate(long expectedSize) throws ProtocolException {
        if (expectedSize < 0 || expectedSize > MAX_ARRAY_SIZE) {
            throw new ProtocolException("Unsupported inflated size " + expectedSize + " at offset " + position);
        }

        int start = position;
        byte[] out = new byte[(int) expectedSize];
        int written = 0;
        byte[] overflow = new byte[1];

        Inflater inflater = new Inflater();
        try {
            inflater.setInput(buffer, start, limit - start);
            while (!inflater.finished()) {
                int count;
                if (written < out.length) {
                    count = inflater.inflate(out, written, out.length - written);
                    written += count;
                } else {
                    count = inflater.inflate(overflow);
                    if (count > 0) {
                        throw new ProtocolException("Entry at offset " + start
                                + " inflates to more than its declared size " + expectedSize);
                    }
                }
                if (count == 0 && !inflater.finished()
                        && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new ProtocolException("Unexpected end of stream inside compressed entry at offset " + start);
                }
            }
            lastInflateConsumed = inflater.getBytesRead();
        } catch (DataFormatException e) {
            throw new ProtocolException("Corrupt compressed data at offset " + start + ": " + e.getMessage(), e);
        } finally {
            inflater.end();
        }

        if (written != expectedSize) {
            throw new ProtocolException("Entry at offset " + start + " inflated to " + written
                    + " bytes, header declared " + expectedSize);
        }

        position = start + (int) lastInflateConsumed;
        return out;
    }

    /**
     * Number of compressed input bytes the last {@link #inflate(long)} call
     * consumed, or -1 before the first call.
     */
    public long bytesConsumedByLastInflate() {
        return lastInflateConsumed;
    }

    private void require(int count) throws ProtocolException {
        if (count < 0 || count > limit - position) {
            throw new ProtocolException("Unexpected end of stream at offset " + position
                    + ": needed " + count + " bytes, " + (limit - position) + " left");
        }
    }
}
