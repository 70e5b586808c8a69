package gitclone.utils.crypto;

import java.util.zip.Deflater;
import java.util.zip.Inflater;
import java.util.zip.DataFormatException;
import java.io.ByteArrayOutputStream;

/**
 * Utility class for compressing and decompressing data with the zlib format
 * used by loose objects and pack entries.
 */
public class CompressionUtils {

    /**
     * Compresses the given byte array using the DEFLATE compression algorithm
     * with a zlib wrapper, the same encoding git uses for loose objects.
     */
    public static byte[] compress(byte[] data) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(data);
            deflater.finish();

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            byte[] buffer = new byte[4096];

            while (!deflater.finished()) {
                int count = deflater.deflate(buffer);
                outputStream.write(buffer, 0, count);
            }
            return outputStream.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * Decompresses a complete zlib stream.
     *
     * @throws DataFormatException if the data is not a valid zlib stream or
     *                             ends before the stream is finished
     */
    public static byte[] decompress(byte[] compressedData) throws DataFormatException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressedData);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream(compressedData.length * 2);
            byte[] buffer = new byte[4096];

            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Truncated zlib stream");
                }
                outputStream.write(buffer, 0, count);
            }
            return outputStream.toByteArray();
        } finally {
            inflater.end();
        }
    }
}
