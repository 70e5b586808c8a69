package gitclone.exceptions;

/**
 * Root of every checked failure raised by the object store, pack decoder,
 * transport and checkout. Callers that only need to report an error and stop
 * can catch this type alone.
 */
public class GitException extends Exception {
    public GitException(String message) {
        super(message);
    }

    public GitException(String message, Throwable cause) {
        super(message, cause);
    }
}
