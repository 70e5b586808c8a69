package gitclone.core.transport;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gitclone.exceptions.ProtocolException;

// @formatter:off
/**
 * pkt-line framing used by the smart protocol.
 *
 * ┌──────────────────────┬──────────────────────────────┐
 * │ 4 hex digits length  │ payload (length - 4 bytes)   │
 * └──────────────────────┴──────────────────────────────┘
 *
 * The length counts its own four digits. "0000" is a flush packet that
 * carries no payload and ends a section of the conversation.
 * Example: "want <40 hex>\n" is 50 bytes long, framed as "0032want ...\n".
 */
// @formatter:on
public final class PktLine {
    public static final String FLUSH = "0000";
    public static final int MAX_LENGTH = 65520;

    private static final int LENGTH_DIGITS = 4;

    private PktLine() {
    }

    /**
     * One decoded packet: either a data line or a flush.
     */
    public static final class Packet {
        private static final Packet FLUSH_PACKET = new Packet(null);

        private final byte[] payload;

        private Packet(byte[] payload) {
            this.payload = payload;
        }

        public boolean isFlush() {
            return payload == null;
        }

        public byte[] getPayload() {
            return payload == null ? new byte[0] : payload.clone();
        }

        /**
         * The payload as text with one trailing newline removed.
         */
        public String asLine() {
            if (payload == null) {
                return "";
            }
            int end = payload.length;
            if (end > 0 && payload[end - 1] == '\n') {
                end--;
            }
            return new String(payload, 0, end, StandardCharsets.UTF_8);
        }

        @Override
        public String toString() {
            return isFlush() ? "flush" : "data(" + asLine() + ")";
        }
    }

    public static byte[] encode(String line) {
        return encode(line.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] encode(byte[] payload) {
        int length = payload.length + LENGTH_DIGITS;
        if (length > MAX_LENGTH) {
            throw new IllegalArgumentException("pkt-line payload too long: " + payload.length);
        }
        byte[] prefix = String.format("%04x", length).getBytes(StandardCharsets.US_ASCII);
        byte[] result = new byte[length];
        System.arraycopy(prefix, 0, result, 0, LENGTH_DIGITS);
        System.arraycopy(payload, 0, result, LENGTH_DIGITS, payload.length);
        return result;
    }

    public static byte[] flush() {
        return FLUSH.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Decodes a complete pkt-line stream.
     *
     * @throws ProtocolException on a non-hex length, a length of 1 to 3, or a
     *                           payload running past the end of the data
     */
    public static List<Packet> decode(byte[] data) throws ProtocolException {
        List<Packet> packets = new ArrayList<>();
        int offset = 0;
        while (offset < data.length) {
            int length = readLength(data, offset);
            if (length == 0) {
                packets.add(Packet.FLUSH_PACKET);
                offset += LENGTH_DIGITS;
                continue;
            }
            if (offset + length > data.length) {
                throw new ProtocolException("pkt-line at offset " + offset + " declares " + length
                        + " bytes, only " + (data.length - offset) + " available");
            }
            packets.add(new Packet(Arrays.copyOfRange(data, offset + LENGTH_DIGITS, offset + length)));
            offset += length;
        }
        return packets;
    }

    /**
     * Reads the length prefix at {@code offset}, validating it.
     */
    static int readLength(byte[] data, int offset) throws ProtocolException {
        if (offset + LENGTH_DIGITS > data.length) {
            throw new ProtocolException("Truncated pkt-line length at offset " + offset);
        }
        int length = 0;
        for (int i = 0; i < LENGTH_DIGITS; i++) {
            int digit = Character.digit(data[offset + i], 16);
            if (digit < 0) {
                throw new ProtocolException("Invalid pkt-line length '"
                        + new String(data, offset, LENGTH_DIGITS, StandardCharsets.ISO_8859_1)
                        + "' at offset " + offset);
            }
            length = (length << 4) | digit;
        }
        if (length > 0 && length < LENGTH_DIGITS) {
            throw new ProtocolException("Invalid pkt-line length " + length + " at offset " + offset);
        }
        return length;
    }

    /**
     * Helper for building request bodies.
     */
    public static final class Writer {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        public Writer line(String line) {
            out.writeBytes(encode(line));
            return this;
        }

        public Writer flush() {
            out.writeBytes(PktLine.flush());
            return this;
        }

        public byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
