package gitclone.exceptions;

/**
 * Thrown for malformed wire data: bad pkt-line framing, missing pack magic,
 * or a stream that ends early.
 */
public class ProtocolException extends PackException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
