package gitclone.exceptions;

/**
 * Thrown when a stored object cannot be inflated or its header is malformed.
 */
public class CorruptObjectException extends ObjectException {
    public CorruptObjectException(String message) {
        super(message);
    }

    public CorruptObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
