package gitclone.core.objects.tree;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import gitclone.exceptions.CorruptObjectException;
import gitclone.utils.crypto.HashUtils;

/**
 * Represents a single entry in a tree object.
 *
 * Each entry contains:
 * - mode: File permissions and type (octal)
 * - name: Filename or directory name, a single path segment
 * - sha: SHA-1 of the referenced object (40 character hex string)
 *
 * Entry types by mode:
 * - 040000: Directory (tree object)
 * - 100644: Regular file (blob object)
 * - 100755: Executable file (blob object)
 * - 120000: Symbolic link (blob object)
 * - 160000: Submodule (commit object, never present locally)
 *
 * Serialized format in tree object:
 * [mode] [space] [filename] [null byte] [20-byte SHA-1 binary]
 *
 * Directories are written as "40000" on the wire, without the leading zero.
 */
public final class GitTreeEntry implements Comparable<GitTreeEntry> {

    /**
     * Represents the type of entry in a tree object.
     */
    public enum EntryType {
        DIRECTORY("040000", "tree"),
        REGULAR_FILE("100644", "blob"),
        EXECUTABLE_FILE("100755", "blob"),
        SYMBOLIC_LINK("120000", "blob"),
        SUBMODULE("160000", "commit");

        private final String mode;
        private final String objectType;

        EntryType(String mode, String objectType) {
            this.mode = mode;
            this.objectType = objectType;
        }

        public String getMode() {
            return mode;
        }

        /**
         * The mode as written inside tree payloads (no zero padding).
         */
        public String getWireMode() {
            return mode.startsWith("0") ? mode.substring(1) : mode;
        }

        public String getObjectType() {
            return objectType;
        }

        public static EntryType fromMode(String mode) {
            String normalized = mode != null && mode.length() == 5 ? "0" + mode : mode;
            for (EntryType type : values()) {
                if (type.mode.equals(normalized)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown mode: " + mode);
        }

        public boolean isDirectory() {
            return this == DIRECTORY;
        }

        public boolean isExecutable() {
            return this == EXECUTABLE_FILE;
        }
    }

    /**
     * An entry decoded from a tree payload plus the offset just past it.
     */
    public static final class ParseResult {
        public final GitTreeEntry entry;
        public final int nextOffset;

        ParseResult(GitTreeEntry entry, int nextOffset) {
            this.entry = entry;
            this.nextOffset = nextOffset;
        }
    }

    private final EntryType type;
    private final String name;
    private final String sha;

    public GitTreeEntry(String mode, String name, String sha) {
        this(EntryType.fromMode(validateMode(mode)), name, sha);
    }

    public GitTreeEntry(EntryType type, String name, String sha) {
        this.type = Objects.requireNonNull(type, "Entry type cannot be null");
        this.name = validateName(name);
        this.sha = validateSha(sha);
    }

    public EntryType getType() {
        return type;
    }

    public String getMode() {
        return type.getMode();
    }

    public String getName() {
        return name;
    }

    public String getSha() {
        return sha;
    }

    public boolean isDirectory() {
        return type.isDirectory();
    }

    /**
     * Serializes this entry to the binary format used in tree objects.
     * Format: [mode] [space] [name] [null] [20-byte binary SHA]
     */
    public byte[] serialize() {
        byte[] modeBytes = type.getWireMode().getBytes(StandardCharsets.US_ASCII);
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        byte[] shaBytes = HashUtils.toBytes(sha);

        byte[] result = new byte[modeBytes.length + 1 + nameBytes.length + 1 + shaBytes.length];
        int offset = 0;

        System.arraycopy(modeBytes, 0, result, offset, modeBytes.length);
        offset += modeBytes.length;

        result[offset++] = ' ';

        System.arraycopy(nameBytes, 0, result, offset, nameBytes.length);
        offset += nameBytes.length;

        result[offset++] = 0;
        System.arraycopy(shaBytes, 0, result, offset, shaBytes.length);

        return result;
    }

    /**
     * Decodes one entry starting at {@code offset}. The hash is read as exactly
     * 20 raw bytes; it is binary and may contain NUL or space bytes.
     *
     * @param end exclusive end of the tree payload within {@code data}
     */
    public static ParseResult parseFrom(byte[] data, int offset, int end) throws CorruptObjectException {
        int space = indexOf(data, (byte) ' ', offset, end);
        if (space < 0) {
            throw new CorruptObjectException("Truncated tree entry at offset " + offset + ": missing mode separator");
        }
        int nul = indexOf(data, (byte) 0, space + 1, end);
        if (nul < 0) {
            throw new CorruptObjectException("Truncated tree entry at offset " + offset + ": missing name terminator");
        }
        if (nul + 1 + HashUtils.RAW_LENGTH > end) {
            throw new CorruptObjectException("Truncated tree entry at offset " + offset + ": short object id");
        }

        String mode = new String(data, offset, space - offset, StandardCharsets.US_ASCII);
        String name = new String(data, space + 1, nul - space - 1, StandardCharsets.UTF_8);
        String sha = HashUtils.toHex(data, nul + 1, HashUtils.RAW_LENGTH);

        try {
            return new ParseResult(new GitTreeEntry(mode, name, sha), nul + 1 + HashUtils.RAW_LENGTH);
        } catch (IllegalArgumentException e) {
            throw new CorruptObjectException("Invalid tree entry at offset " + offset + ": " + e.getMessage(), e);
        }
    }

    /**
     * Canonical tree order: byte-wise by name, with directories compared as if
     * they had a trailing slash.
     */
    @Override
    public int compareTo(GitTreeEntry other) {
        byte[] thisKey = sortKey();
        byte[] otherKey = other.sortKey();
        int length = Math.min(thisKey.length, otherKey.length);
        for (int i = 0; i < length; i++) {
            int cmp = (thisKey[i] & 0xff) - (otherKey[i] & 0xff);
            if (cmp != 0) {
                return cmp;
            }
        }
        return thisKey.length - otherKey.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        GitTreeEntry that = (GitTreeEntry) obj;
        return type == that.type &&
                Objects.equals(name, that.name) &&
                Objects.equals(sha, that.sha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, sha);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s\t%s", type.getMode(), type.getObjectType(), sha, name);
    }

    private byte[] sortKey() {
        return (isDirectory() ? name + "/" : name).getBytes(StandardCharsets.UTF_8);
    }

    private static int indexOf(byte[] data, byte value, int from, int end) {
        for (int i = from; i < end; i++) {
            if (data[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static String validateMode(String mode) {
        if (mode == null || mode.isEmpty()) {
            throw new IllegalArgumentException("Mode cannot be null or empty");
        }
        if (mode.length() != 5 && mode.length() != 6) {
            throw new IllegalArgumentException("Invalid mode length: " + mode);
        }
        return mode;
    }

    private static String validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Name cannot be null or empty");
        }

        if (name.contains("/") || name.contains("\0")) {
            throw new IllegalArgumentException("Invalid characters in name: " + name);
        }

        return name;
    }

    private static String validateSha(String sha) {
        if (!HashUtils.isValidSha(sha)) {
            throw new IllegalArgumentException("SHA must be 40 hex characters: " + sha);
        }
        return sha.toLowerCase();
    }
}
