package in.mesbridge.infrastructure.broker.data;

/**
 * Exception thrown when an inbound frame cannot be decoded.
 */
public class MessageDecodeException extends RuntimeException {

    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
