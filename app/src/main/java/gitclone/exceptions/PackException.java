package gitclone.exceptions;

/**
 * Base class for failures while decoding a pack stream.
 */
public class PackException extends GitException {
    public PackException(String message) {
        super(message);
    }

    public PackException(String message, Throwable cause) {
        super(message, cause);
    }
}
