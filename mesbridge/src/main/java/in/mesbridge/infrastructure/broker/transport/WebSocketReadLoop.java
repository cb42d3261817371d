package in.mesbridge.infrastructure.broker.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link WebSocket.Listener} that reassembles fragmented text messages and feeds
 * whole frames to a {@link TransportListener}, one at a time and in arrival order.
 * Only one message is requested from the socket at a time.
 */
final class WebSocketReadLoop implements WebSocket.Listener {
    private static final Logger log = LoggerFactory.getLogger(WebSocketReadLoop.class);

    private final TransportListener listener;
    private final StringBuilder buf = new StringBuilder();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    WebSocketReadLoop(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        buf.append(data);
        if (last) {
            String frame = buf.toString();
            buf.setLength(0);
            try {
                listener.onFrame(frame);
            } catch (RuntimeException e) {
                // Keep reading; one bad frame must not stall the connection
                log.error("[TRANSPORT] Frame handler failed", e);
            }
        }
        webSocket.request(1);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
        log.debug("[TRANSPORT] Ignoring {} byte binary fragment", data.remaining());
        webSocket.request(1);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
        listener.onPong();
        webSocket.request(1);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        if (terminated.compareAndSet(false, true)) {
            listener.onClosed(statusCode, reason);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        if (terminated.compareAndSet(false, true)) {
            listener.onError(error);
        }
    }
}
