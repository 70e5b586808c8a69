package gitclone.core.objects;

import gitclone.exceptions.ObjectException;
import gitclone.utils.crypto.HashUtils;

public interface GitObject {
    /**
     * Get the object type (blob, tree, commit)
     */
    ObjectType getType();

    /**
     * Get the raw object content (without header)
     */
    byte[] getContent();

    /**
     * Get the SHA-1 hash of this object, computed over header and content
     */
    default String getSha() {
        return HashUtils.sha1Hex(serialize());
    }

    /**
     * Get the size of the object content in bytes
     */
    default long getSize() {
        return getContent().length;
    }

    /**
     * Deserialize object from raw data (header included)
     */
    void deserialize(byte[] data) throws ObjectException;

    /**
     * Serialize object to byte array for storage (with header)
     */
    default byte[] serialize() {
        return new RawObject(getType(), getContent()).serialize();
    }
}
