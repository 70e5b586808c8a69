package gitclone.core.pack;

import java.util.Collections;
import java.util.List;

/**
 * Summary of a decoded pack: how many entries it carried, how many of them
 * were deltas, and the ids written to the object store in pack order.
 */
public final class PackParseResult {
    private final int version;
    private final int entryCount;
    private final int deltaCount;
    private final List<String> writtenShas;

    public PackParseResult(int version, int entryCount, int deltaCount, List<String> writtenShas) {
        this.version = version;
        this.entryCount = entryCount;
        this.deltaCount = deltaCount;
        this.writtenShas = Collections.unmodifiableList(writtenShas);
    }

    public int getVersion() {
        return version;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public int getDeltaCount() {
        return deltaCount;
    }

    public List<String> getWrittenShas() {
        return writtenShas;
    }

    @Override
    public String toString() {
        return "PackParseResult{version=" + version + ", entries=" + entryCount + ", deltas=" + deltaCount + "}";
    }
}
