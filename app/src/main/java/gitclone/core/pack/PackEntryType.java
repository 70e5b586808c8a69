package gitclone.core.pack;

import gitclone.core.objects.ObjectType;

/**
 * Type codes carried in bits 4..6 of a pack entry's first header byte.
 * Codes 0 and 5 are reserved and never valid.
 */
public enum PackEntryType {
    COMMIT(1, ObjectType.COMMIT),
    TREE(2, ObjectType.TREE),
    BLOB(3, ObjectType.BLOB),
    TAG(4, null),
    OFS_DELTA(6, null),
    REF_DELTA(7, null);

    private final int code;
    private final ObjectType objectType;

    PackEntryType(int code, ObjectType objectType) {
        this.code = code;
        this.objectType = objectType;
    }

    public int getCode() {
        return code;
    }

    /**
     * The stored object kind for whole-object entries; null for deltas and
     * tags.
     */
    public ObjectType getObjectType() {
        return objectType;
    }

    public static PackEntryType fromCode(int code) {
        for (PackEntryType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid pack entry type code: " + code);
    }
}
