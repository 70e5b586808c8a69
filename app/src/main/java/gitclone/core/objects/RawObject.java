package gitclone.core.objects;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import gitclone.exceptions.CorruptObjectException;
import gitclone.utils.crypto.HashUtils;

// @formatter:off
/**
 * An object as the store sees it: a kind and an opaque payload.
 *
 * Serialized form, which is what gets hashed and deflated on disk:
 * ┌──────────────────────────────────────────────────────┐
 * │ kind │ SPACE │ decimal length │ NULL │ payload...    │
 * └──────────────────────────────────────────────────────┘
 */
// @formatter:on
public final class RawObject {
    private final ObjectType type;
    private final byte[] content;

    public RawObject(ObjectType type, byte[] content) {
        this.type = Objects.requireNonNull(type, "Object type cannot be null");
        this.content = Objects.requireNonNull(content, "Content cannot be null").clone();
    }

    public ObjectType getType() {
        return type;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }

    public String getSha() {
        return HashUtils.sha1Hex(serialize());
    }

    public byte[] serialize() {
        byte[] header = (type.getTypeName() + " " + content.length + "\0").getBytes(StandardCharsets.US_ASCII);
        byte[] result = new byte[header.length + content.length];
        System.arraycopy(header, 0, result, 0, header.length);
        System.arraycopy(content, 0, result, header.length, content.length);
        return result;
    }

    /**
     * Splits off and validates the {@code "<kind> <len>\0"} header.
     *
     * @throws CorruptObjectException if the header is missing, names an
     *                                unknown kind, or its length does not
     *                                match the payload
     */
    public static RawObject parse(byte[] data) throws CorruptObjectException {
        int nullIndex = -1;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == 0) {
                nullIndex = i;
                break;
            }
        }

        if (nullIndex == -1) {
            throw new CorruptObjectException("Invalid object format: no null terminator");
        }

        String header = new String(data, 0, nullIndex, StandardCharsets.US_ASCII);
        int space = header.indexOf(' ');
        if (space <= 0 || space != header.lastIndexOf(' ')) {
            throw new CorruptObjectException("Invalid object header format: '" + header + "'");
        }

        ObjectType type;
        try {
            type = ObjectType.fromString(header.substring(0, space));
        } catch (IllegalArgumentException e) {
            throw new CorruptObjectException(e.getMessage(), e);
        }

        String sizeText = header.substring(space + 1);
        int size;
        try {
            size = Integer.parseInt(sizeText);
        } catch (NumberFormatException e) {
            throw new CorruptObjectException("Invalid size in object header: '" + sizeText + "'", e);
        }

        int contentLength = data.length - nullIndex - 1;
        if (size < 0 || contentLength != size) {
            throw new CorruptObjectException("Content size mismatch: expected " + size + ", got " + contentLength);
        }

        return new RawObject(type, Arrays.copyOfRange(data, nullIndex + 1, data.length));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        RawObject that = (RawObject) obj;
        return type == that.type && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "RawObject{type=" + type.getTypeName() + ", size=" + content.length + "}";
    }
}
