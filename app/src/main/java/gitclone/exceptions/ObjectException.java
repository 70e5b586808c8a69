package gitclone.exceptions;

/**
 * Failure reading or writing an object in the loose object store.
 */
public class ObjectException extends GitException {
    public ObjectException(String message) {
        super(message);
    }

    public ObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
