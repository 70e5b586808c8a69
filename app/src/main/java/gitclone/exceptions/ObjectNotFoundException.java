package gitclone.exceptions;

/**
 * Thrown when an object or ref path does not exist in the repository.
 */
public class ObjectNotFoundException extends ObjectException {
    public ObjectNotFoundException(String message) {
        super(message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
