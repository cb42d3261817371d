package in.mesbridge.infrastructure.broker.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * One physical broker connection.
 *
 * A transport is opened once and never reused; reconnecting means creating a new one.
 * Callers must not invoke {@link #send} or {@link #sendPing} concurrently; the owning
 * client serializes writes. {@link #close} is idempotent and safe from any thread.
 * The transport reports failures to its listener and never retries on its own.
 */
public interface BrokerTransport {

    /**
     * Open the connection and start the read loop.
     *
     * @return future completing when the handshake succeeds, exceptionally otherwise
     */
    CompletableFuture<Void> open(URI endpoint, TransportListener listener);

    /**
     * Write one text frame.
     *
     * @return future completing when the frame is written; fails if not connected
     */
    CompletableFuture<Void> send(String frame);

    CompletableFuture<Void> sendPing();

    void close();

    boolean isOpen();
}
