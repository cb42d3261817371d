package in.mesbridge.infrastructure.broker.ironbeam;

import in.mesbridge.domain.order.OrderRequest;
import in.mesbridge.infrastructure.broker.event.InboundEvent;
import in.mesbridge.infrastructure.broker.transport.InboundMessage;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Broker session as seen by the owning process.
 *
 * Error Handling:
 * - All request operations return CompletableFuture and never throw
 * - Request-local failures (timeout, broker rejection) fail only that future
 * - Session-wide failures fail every pending future and reach the error and state listeners
 *
 * Lifecycle:
 * 1. connect() - open, authenticate, become READY
 * 2. subscribe() / placeOrder() / queries
 * 3. [receive push events via handlers]
 * 4. disconnect() - fail pending requests, close the socket
 */
public interface BrokerClient {

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE MANAGEMENT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Connect and authenticate. Idempotent: returns the in-progress attempt, or a
     * completed future when already READY. Restarts a FAILED session.
     *
     * @return future completing on READY; fails with BrokerConnectionException once the
     *         retry budget is exhausted or disconnect() is called first
     */
    CompletableFuture<Void> connect();

    /**
     * Stop reconnecting, fail pending requests with "shutting down", close the socket.
     * Idempotent.
     */
    CompletableFuture<Void> disconnect();

    boolean isConnected();

    ConnectionState getState();

    ConnectionStats getConnectionStats();

    // ═══════════════════════════════════════════════════════════════════════
    // SUBSCRIPTIONS
    // ═══════════════════════════════════════════════════════════════════════

    CompletableFuture<SubscriptionResult> subscribe(String symbol);

    CompletableFuture<SubscriptionResult> subscribe(String symbol, List<String> dataTypes);

    CompletableFuture<SubscriptionResult> unsubscribe(String symbol);

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS AND QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    CompletableFuture<InboundMessage> placeOrder(OrderRequest order);

    CompletableFuture<InboundMessage> cancelOrder(String orderId);

    CompletableFuture<InboundMessage> queryPositions();

    CompletableFuture<InboundMessage> queryAccountInfo();

    // ═══════════════════════════════════════════════════════════════════════
    // PUSH EVENTS AND LISTENERS
    // ═══════════════════════════════════════════════════════════════════════

    void onMarketData(Consumer<InboundEvent> handler);

    void onOrderUpdate(Consumer<InboundEvent> handler);

    void onPositionUpdate(Consumer<InboundEvent> handler);

    void onBrokerError(Consumer<InboundEvent> handler);

    /**
     * Register callback for connection state changes.
     */
    void onConnectionStateChange(Consumer<ConnectionState> listener);

    /**
     * Register callback for session-wide failures (authentication failure, retry exhaustion).
     */
    void onError(Consumer<Throwable> listener);
}
