package gitclone.exceptions;

/**
 * Thrown when a ref-delta's instruction stream does not match its base or
 * declared target length.
 */
public class CorruptDeltaException extends PackException {
    public CorruptDeltaException(String message) {
        super(message);
    }

    public CorruptDeltaException(String message, Throwable cause) {
        super(message, cause);
    }
}
