package gitclone.exceptions;

/**
 * Thrown when a ref file is missing or a symbolic ref points at a ref that
 * does not exist.
 */
public class RefNotFoundException extends RepositoryException {
    public RefNotFoundException(String message) {
        super(message);
    }

    public RefNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
