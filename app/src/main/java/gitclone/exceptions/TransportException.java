package gitclone.exceptions;

/**
 * Thrown when the remote cannot be reached or answers with an error status.
 */
public class TransportException extends GitException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
