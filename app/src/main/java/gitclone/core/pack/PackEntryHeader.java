package gitclone.core.pack;

/**
 * Decoded entry header: the entry kind, the inflated size it declares, and
 * how many header bytes were consumed to read them.
 */
public final class PackEntryHeader {
    private final PackEntryType type;
    private final long size;
    private final int consumed;

    public PackEntryHeader(PackEntryType type, long size, int consumed) {
        this.type = type;
        this.size = size;
        this.consumed = consumed;
    }

    public PackEntryType getType() {
        return type;
    }

    public long getSize() {
        return size;
    }

    public int getConsumed() {
        return consumed;
    }

    @Override
    public String toString() {
        return "PackEntryHeader{type=" + type + ", size=" + size + ", consumed=" + consumed + "}";
    }
}
