package gitclone.exceptions;

import gitclone.core.pack.PackEntryType;

/**
 * Thrown when a pack contains an entry kind this client cannot decode
 * (offset deltas and annotated tags).
 */
public class UnsupportedPackEntryException extends PackException {
    private final PackEntryType entryType;

    public UnsupportedPackEntryException(PackEntryType entryType, String message) {
        super(message);
        this.entryType = entryType;
    }

    public PackEntryType getEntryType() {
        return entryType;
    }
}
