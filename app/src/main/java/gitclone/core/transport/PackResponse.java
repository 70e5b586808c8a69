package gitclone.core.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import gitclone.exceptions.ProtocolException;

/**
 * Splits the upload-pack response into the acknowledgement section and the
 * raw pack that follows it.
 */
public final class PackResponse {
    private static final byte[] PACK_MAGIC = "PACK".getBytes(StandardCharsets.US_ASCII);

    private PackResponse() {
    }

    /**
     * Returns the pack bytes, skipping a leading {@code 0008NAK\n} if present.
     *
     * @throws ProtocolException if the response carries an error line or
     *                           anything other than NAK before the pack
     */
    public static byte[] extractPack(byte[] body) throws ProtocolException {
        int offset = 0;
        while (!startsWithMagic(body, offset)) {
            if (offset >= body.length) {
                throw new ProtocolException("Response ended before the pack started");
            }
            int length = PktLine.readLength(body, offset);
            if (length == 0) {
                offset += 4;
                continue;
            }
            if (offset + length > body.length) {
                throw new ProtocolException("Truncated pkt-line in upload-pack response at offset " + offset);
            }
            String line = new String(body, offset + 4, length - 4, StandardCharsets.UTF_8).trim();
            if (line.startsWith("ERR ")) {
                throw new ProtocolException("Remote error: " + line.substring(4));
            }
            if (!line.equals("NAK")) {
                throw new ProtocolException("Unexpected line before pack: '" + line + "'");
            }
            offset += length;
        }
        return offset == 0 ? body : Arrays.copyOfRange(body, offset, body.length);
    }

    private static boolean startsWithMagic(byte[] body, int offset) {
        if (body.length - offset < PACK_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PACK_MAGIC.length; i++) {
            if (body[offset + i] != PACK_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
