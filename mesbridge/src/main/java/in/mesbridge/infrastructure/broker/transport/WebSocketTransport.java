package in.mesbridge.infrastructure.broker.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link BrokerTransport} over the JDK {@link java.net.http.WebSocket} client.
 */
public final class WebSocketTransport implements BrokerTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private static final ByteBuffer PING_PAYLOAD =
        ByteBuffer.wrap("ping".getBytes(StandardCharsets.US_ASCII)).asReadOnlyBuffer();

    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Duration closeTimeout;

    private final AtomicReference<WebSocket> wsRef = new AtomicReference<>(null);
    private final AtomicBoolean opened = new AtomicBoolean(false);
    private final AtomicBoolean closedLocally = new AtomicBoolean(false);
    private final AtomicBoolean closedRemotely = new AtomicBoolean(false);

    public WebSocketTransport(HttpClient httpClient, Duration connectTimeout, Duration closeTimeout) {
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
        this.closeTimeout = closeTimeout;
    }

    @Override
    public CompletableFuture<Void> open(URI endpoint, TransportListener listener) {
        if (!opened.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transport already opened"));
        }

        return httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(endpoint, new WebSocketReadLoop(new StateTrackingListener(listener)))
            .thenAccept(ws -> {
                wsRef.set(ws);
                // close() or a remote close may have raced with the handshake
                if (closedLocally.get() || closedRemotely.get()) {
                    wsRef.set(null);
                    ws.abort();
                    throw new IllegalStateException("Transport closed during handshake");
                }
            });
    }

    @Override
    public CompletableFuture<Void> send(String frame) {
        WebSocket ws = wsRef.get();
        if (ws == null || ws.isOutputClosed()) {
            return CompletableFuture.failedFuture(new IllegalStateException("WebSocket not connected"));
        }
        return ws.sendText(frame, true).thenApply(w -> null);
    }

    @Override
    public CompletableFuture<Void> sendPing() {
        WebSocket ws = wsRef.get();
        if (ws == null || ws.isOutputClosed()) {
            return CompletableFuture.failedFuture(new IllegalStateException("WebSocket not connected"));
        }
        return ws.sendPing(PING_PAYLOAD.duplicate()).thenApply(w -> null);
    }

    @Override
    public void close() {
        if (!closedLocally.compareAndSet(false, true)) {
            return;
        }
        WebSocket ws = wsRef.getAndSet(null);
        if (ws == null) {
            return;
        }
        // abort() also fails any write still in flight
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "Disconnect")
            .orTimeout(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((w, error) -> {
                if (error != null) {
                    log.debug("[TRANSPORT] Close handshake did not complete: {}", error.getMessage());
                }
                ws.abort();
            });
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = wsRef.get();
        return ws != null && !closedLocally.get() && !closedRemotely.get() && !ws.isOutputClosed();
    }

    /**
     * Clears the socket reference on remote close/error and suppresses the
     * notification when the close was requested locally.
     */
    private final class StateTrackingListener implements TransportListener {
        private final TransportListener delegate;

        private StateTrackingListener(TransportListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onFrame(String frame) {
            delegate.onFrame(frame);
        }

        @Override
        public void onPong() {
            delegate.onPong();
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            closedRemotely.set(true);
            WebSocket ws = wsRef.getAndSet(null);
            if (ws != null) {
                ws.abort();
            }
            if (!closedLocally.get()) {
                delegate.onClosed(statusCode, reason);
            }
        }

        @Override
        public void onError(Throwable error) {
            closedRemotely.set(true);
            WebSocket ws = wsRef.getAndSet(null);
            if (ws != null) {
                ws.abort();
            }
            if (!closedLocally.get()) {
                delegate.onError(error);
            }
        }
    }
}
