package in.mesbridge.infrastructure.broker.transport;

/**
 * Receives everything the read loop pulls off one connection.
 * {@link #onClosed} and {@link #onError} are mutually exclusive and fire at most once.
 */
public interface TransportListener {

    void onFrame(String frame);

    void onPong();

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
