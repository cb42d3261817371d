package in.mesbridge.infrastructure.broker.ironbeam;

import in.mesbridge.domain.order.OrderRequest;
import in.mesbridge.infrastructure.broker.common.HeartbeatManager;
import in.mesbridge.infrastructure.broker.common.ReconnectionPolicy;
import in.mesbridge.infrastructure.broker.correlation.CorrelationIdGenerator;
import in.mesbridge.infrastructure.broker.correlation.CorrelationTable;
import in.mesbridge.infrastructure.broker.correlation.PendingRequest;
import in.mesbridge.infrastructure.broker.data.BrokerAuthenticationException;
import in.mesbridge.infrastructure.broker.data.BrokerConnectionException;
import in.mesbridge.infrastructure.broker.data.BrokerConnectionException.Reason;
import in.mesbridge.infrastructure.broker.data.BrokerRejectionException;
import in.mesbridge.infrastructure.broker.data.BrokerRequestTimeoutException;
import in.mesbridge.infrastructure.broker.data.BrokerSubscriptionException;
import in.mesbridge.infrastructure.broker.data.MessageDecodeException;
import in.mesbridge.infrastructure.broker.event.EventDispatcher;
import in.mesbridge.infrastructure.broker.event.EventKind;
import in.mesbridge.infrastructure.broker.event.InboundEvent;
import in.mesbridge.infrastructure.broker.subscription.Subscription;
import in.mesbridge.infrastructure.broker.subscription.SubscriptionRegistry;
import in.mesbridge.infrastructure.broker.transport.BrokerMessageCodec;
import in.mesbridge.infrastructure.broker.transport.BrokerTransport;
import in.mesbridge.infrastructure.broker.transport.InboundMessage;
import in.mesbridge.infrastructure.broker.transport.OutboundRequest;
import in.mesbridge.infrastructure.broker.transport.TransportListener;
import in.mesbridge.infrastructure.broker.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ironbeam WebSocket session: authentication, request/response correlation,
 * subscription tracking, reconnection with backoff and push-event fan-out.
 *
 * Threads:
 * - Lifecycle thread: runs every connection attempt (open, authenticate, READY) and
 *   schedules reconnects. Only one attempt can ever be in flight.
 * - Writer thread: the single writer of the socket; requests and pings are queued here.
 * - Read loop: the transport's callback thread. Resolves replies and runs event handlers.
 * - Listener thread: delivers state and error notifications in order, outside the state lock.
 *
 * All session state is guarded by {@code stateLock}. A request checks READY and registers its
 * correlation entry under that lock, and every transition out of READY detaches all entries under
 * it, so no request can outlive the connection that was supposed to answer it. Detached entries
 * and the ready future are completed only after the lock is released: caller callbacks run on the
 * completing thread and may call back into the client.
 *
 * Each connection attempt gets a new epoch. Callbacks from a transport whose epoch is no
 * longer current are ignored, which keeps a single reconnect loop no matter how many loss
 * signals (close, error, failed write, heartbeat timeout) one dead socket produces.
 *
 * Futures returned by request operations may complete on the read loop or lifecycle thread;
 * callbacks attached to them must not block.
 */
public class IronbeamClient implements BrokerClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IronbeamClient.class);

    private static final String BROKER = IronbeamConfig.BROKER_CODE;

    private final IronbeamConfig config;
    private final Supplier<BrokerTransport> transportFactory;
    private final BrokerMessageCodec codec;
    private final CorrelationIdGenerator idGenerator;
    private final CorrelationTable correlationTable;
    private final SubscriptionRegistry subscriptions = new SubscriptionRegistry();
    private final EventDispatcher dispatcher = new EventDispatcher();
    private final ReconnectionPolicy reconnectionPolicy;

    private final List<Consumer<ConnectionState>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService lifecycleExecutor;
    private final ExecutorService writer;
    private final ExecutorService listenerExecutor;

    private final Object stateLock = new Object();

    // Guarded by stateLock; connectionEpoch is also read without it by transport callbacks
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private BrokerTransport transport;
    private volatile HeartbeatManager heartbeat;
    private volatile int connectionEpoch = 0;
    private boolean shutdownRequested = true;
    private boolean closed = false;
    private CompletableFuture<Void> readyFuture;
    private ScheduledFuture<?> pendingAttempt;

    public IronbeamClient(IronbeamConfig config) {
        this(config, webSocketTransports(config));
    }

    public IronbeamClient(IronbeamConfig config, Supplier<BrokerTransport> transportFactory) {
        this(config, transportFactory, new BrokerMessageCodec(), new CorrelationIdGenerator());
    }

    public IronbeamClient(IronbeamConfig config, Supplier<BrokerTransport> transportFactory,
                          BrokerMessageCodec codec, CorrelationIdGenerator idGenerator) {
        this.config = config;
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.idGenerator = idGenerator;
        this.correlationTable = new CorrelationTable(BROKER);
        this.reconnectionPolicy = config.newReconnectionPolicy();
        this.lifecycleExecutor = Executors.newSingleThreadScheduledExecutor(daemon("Ironbeam-Lifecycle"));
        this.writer = Executors.newSingleThreadExecutor(daemon("Ironbeam-Writer"));
        this.listenerExecutor = Executors.newSingleThreadExecutor(daemon("Ironbeam-Listeners"));

        log.info("[IRONBEAM] Client created for {} (apiKey={})",
            config.endpoint(), IronbeamConfig.maskKey(config.apiKey()));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<Void> connect() {
        synchronized (stateLock) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("Client is closed"));
            }
            if (state == ConnectionState.READY) {
                return CompletableFuture.completedFuture(null);
            }
            if (!shutdownRequested && isAttemptInProgress()) {
                if (readyFuture == null || readyFuture.isDone()) {
                    readyFuture = new CompletableFuture<>();
                }
                return readyFuture.copy();
            }

            log.info("[IRONBEAM] Connecting to Ironbeam WebSocket: {}", config.endpoint());
            shutdownRequested = false;
            reconnectionPolicy.recordSuccess();
            readyFuture = new CompletableFuture<>();
            scheduleAttempt(Duration.ZERO);
            return readyFuture.copy();
        }
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        BrokerTransport toClose;
        List<PendingRequest> orphaned;
        CompletableFuture<Void> abandoned;
        synchronized (stateLock) {
            if (shutdownRequested && transport == null && state != ConnectionState.FAILED) {
                return CompletableFuture.completedFuture(null);
            }
            shutdownRequested = true;
            connectionEpoch++;
            if (pendingAttempt != null) {
                pendingAttempt.cancel(false);
                pendingAttempt = null;
            }
            stopHeartbeat();
            toClose = transport;
            transport = null;
            setState(ConnectionState.DISCONNECTED);
            orphaned = correlationTable.detachAll();
            abandoned = readyFuture;
        }
        if (toClose != null) {
            toClose.close();
        }
        BrokerConnectionException shuttingDown =
            new BrokerConnectionException(BROKER, Reason.SHUTTING_DOWN, "Client shutting down");
        correlationTable.failDetached(orphaned, shuttingDown);
        if (abandoned != null) {
            abandoned.completeExceptionally(shuttingDown);
        }
        log.info("[IRONBEAM] WebSocket connection closed gracefully");
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Disconnect and release all threads. The client cannot be reconnected afterwards.
     */
    @Override
    public void close() {
        disconnect();
        synchronized (stateLock) {
            closed = true;
        }
        lifecycleExecutor.shutdownNow();
        writer.shutdownNow();
        listenerExecutor.shutdown();
        correlationTable.shutdown();
    }

    @Override
    public boolean isConnected() {
        return getState() == ConnectionState.READY;
    }

    @Override
    public ConnectionState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    @Override
    public ConnectionStats getConnectionStats() {
        synchronized (stateLock) {
            return new ConnectionStats(
                state == ConnectionState.READY,
                state,
                reconnectionPolicy.getAttemptCount(),
                subscriptions.size(),
                correlationTable.size(),
                List.copyOf(subscriptions.current())
            );
        }
    }

    public Set<String> getSubscribedSymbols() {
        return subscriptions.current();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SUBSCRIPTIONS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<SubscriptionResult> subscribe(String symbol) {
        return subscribe(symbol, config.defaultDataTypes());
    }

    @Override
    public CompletableFuture<SubscriptionResult> subscribe(String symbol, List<String> dataTypes) {
        String normalized;
        try {
            normalized = Subscription.normalize(symbol);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (subscriptions.contains(normalized)) {
            return CompletableFuture.completedFuture(
                new SubscriptionResult(normalized, SubscriptionResult.Status.ALREADY_SUBSCRIBED, null));
        }

        List<String> types = dataTypes == null || dataTypes.isEmpty() ? config.defaultDataTypes() : dataTypes;
        CompletableFuture<SubscriptionResult> result =
            request(id -> IronbeamProtocol.subscribe(id, normalized, types), config.subscribeTimeout())
                .thenApply(reply -> {
                    subscriptions.add(new Subscription(normalized, types));
                    log.info("[IRONBEAM] Subscribed to market data: {}", normalized);
                    return new SubscriptionResult(normalized, SubscriptionResult.Status.SUBSCRIBED, reply);
                });
        return asSubscriptionFailure(result, normalized, "subscribe to");
    }

    @Override
    public CompletableFuture<SubscriptionResult> unsubscribe(String symbol) {
        String normalized;
        try {
            normalized = Subscription.normalize(symbol);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (!subscriptions.contains(normalized)) {
            return CompletableFuture.completedFuture(
                new SubscriptionResult(normalized, SubscriptionResult.Status.NOT_SUBSCRIBED, null));
        }

        CompletableFuture<SubscriptionResult> result =
            request(id -> IronbeamProtocol.unsubscribe(id, normalized), config.subscribeTimeout())
                .thenApply(reply -> {
                    subscriptions.remove(normalized);
                    log.info("[IRONBEAM] Unsubscribed from: {}", normalized);
                    return new SubscriptionResult(normalized, SubscriptionResult.Status.UNSUBSCRIBED, reply);
                });
        return asSubscriptionFailure(result, normalized, "unsubscribe from");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS AND QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<InboundMessage> placeOrder(OrderRequest order) {
        if (order == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Order cannot be null"));
        }
        return request(id -> IronbeamProtocol.placeOrder(id, order), config.requestTimeout())
            .whenComplete((reply, error) -> {
                if (error == null) {
                    log.info("[IRONBEAM] Placed order: {} {} {} @ {}", order.symbol(), order.side(),
                        order.quantity(), order.price() != null ? order.price() : "market");
                } else {
                    log.error("[IRONBEAM] Failed to place order {} {} {}: {}", order.symbol(), order.side(),
                        order.quantity(), rootCause(error).getMessage());
                }
            });
    }

    @Override
    public CompletableFuture<InboundMessage> cancelOrder(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Order ID cannot be empty"));
        }
        String id = orderId.trim();
        return request(requestId -> IronbeamProtocol.cancelOrder(requestId, id), config.requestTimeout())
            .whenComplete((reply, error) -> {
                if (error == null) {
                    log.info("[IRONBEAM] Cancelled order: {}", id);
                } else {
                    log.error("[IRONBEAM] Failed to cancel order {}: {}", id, rootCause(error).getMessage());
                }
            });
    }

    @Override
    public CompletableFuture<InboundMessage> queryPositions() {
        return request(IronbeamProtocol::getPositions, config.requestTimeout())
            .whenComplete((reply, error) -> {
                if (error != null) {
                    log.error("[IRONBEAM] Failed to get positions: {}", rootCause(error).getMessage());
                }
            });
    }

    @Override
    public CompletableFuture<InboundMessage> queryAccountInfo() {
        return request(IronbeamProtocol::getAccountInfo, config.requestTimeout())
            .whenComplete((reply, error) -> {
                if (error != null) {
                    log.error("[IRONBEAM] Failed to get account info: {}", rootCause(error).getMessage());
                }
            });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PUSH EVENTS AND LISTENERS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void onMarketData(Consumer<InboundEvent> handler) {
        dispatcher.register(EventKind.MARKET_DATA, handler);
    }

    @Override
    public void onOrderUpdate(Consumer<InboundEvent> handler) {
        dispatcher.register(EventKind.ORDER_UPDATE, handler);
    }

    @Override
    public void onPositionUpdate(Consumer<InboundEvent> handler) {
        dispatcher.register(EventKind.POSITION_UPDATE, handler);
    }

    @Override
    public void onBrokerError(Consumer<InboundEvent> handler) {
        dispatcher.register(EventKind.ERROR, handler);
    }

    @Override
    public void onConnectionStateChange(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    @Override
    public void onError(Consumer<Throwable> listener) {
        errorListeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // REQUEST PATH
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Register, write and return the reply future of one request. Only allowed while READY.
     * A reply with an error status fails the future with {@link BrokerRejectionException}.
     */
    private CompletableFuture<InboundMessage> request(Function<String, OutboundRequest> builder, Duration timeout) {
        String requestId = idGenerator.next();
        String frame;
        try {
            frame = codec.encode(builder.apply(requestId));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        PendingRequest pending;
        BrokerTransport target;
        int epoch;
        synchronized (stateLock) {
            if (state != ConnectionState.READY) {
                return CompletableFuture.failedFuture(new BrokerConnectionException(
                    BROKER, Reason.NOT_READY, "WebSocket not connected (state=" + state + ")"));
            }
            pending = correlationTable.register(requestId, timeout);
            target = transport;
            epoch = connectionEpoch;
        }

        write(target, epoch, frame, pending);
        return pending.future().thenApply(reply -> {
            if (reply.isError()) {
                throw new BrokerRejectionException(requestId, reply.errorCode(),
                    reply.message() != null ? reply.message() : "Unknown error");
            }
            return reply;
        });
    }

    /**
     * Queue a frame on the writer thread. A failed write fails its request and
     * counts as a lost connection.
     */
    private void write(BrokerTransport target, int epoch, String frame, PendingRequest pending) {
        try {
            writer.execute(() -> {
                if (pending != null && pending.isDone()) {
                    return;  // Timed out or failed while queued
                }
                try {
                    target.send(frame).get(config.writeTimeout().toMillis(), TimeUnit.MILLISECONDS);
                    log.debug("[IRONBEAM] Sent message {}", pending != null ? pending.getRequestId() : "");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failWrite(pending, e);
                } catch (Exception e) {
                    log.error("[IRONBEAM] Failed to send message: {}", rootCause(e).getMessage());
                    failWrite(pending, e);
                    handleConnectionLost(epoch, rootCause(e));
                }
            });
        } catch (RejectedExecutionException e) {
            failWrite(pending, e);
        }
    }

    private void writePing(BrokerTransport target, int epoch) {
        try {
            writer.execute(() -> {
                try {
                    target.sendPing().get(config.writeTimeout().toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    log.warn("[IRONBEAM] Ping failed: {}", rootCause(e).getMessage());
                    handleConnectionLost(epoch, rootCause(e));
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[IRONBEAM] Writer stopped, ping skipped");
        }
    }

    private void failWrite(PendingRequest pending, Throwable cause) {
        if (pending != null) {
            correlationTable.fail(pending.getRequestId(),
                new BrokerConnectionException(BROKER, Reason.CONNECTION_LOST, "Send failed", rootCause(cause)));
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION ATTEMPTS (lifecycle thread)
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Caller holds stateLock. Replaces any attempt still waiting to run.
     */
    private void scheduleAttempt(Duration delay) {
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
        }
        try {
            pendingAttempt = lifecycleExecutor.schedule(this::attemptConnect, delay.toMillis(), TimeUnit.MILLISECONDS);
            if (!delay.isZero()) {
                log.info("[IRONBEAM] Retrying in {} ms...", delay.toMillis());
            }
        } catch (RejectedExecutionException e) {
            log.warn("[IRONBEAM] Lifecycle executor stopped, connection attempt dropped");
        }
    }

    private void attemptConnect() {
        BrokerTransport candidate;
        BrokerTransport stale;
        int epoch;
        synchronized (stateLock) {
            pendingAttempt = null;
            if (shutdownRequested) {
                return;
            }
            if (state == ConnectionState.READY) {
                log.debug("[IRONBEAM] Session already READY, connection attempt skipped");
                return;
            }
            stale = transport;
            epoch = ++connectionEpoch;
            candidate = transportFactory.get();
            transport = candidate;
            setState(ConnectionState.CONNECTING);
        }
        if (stale != null) {
            stale.close();
        }

        try {
            candidate.open(config.endpoint(), new SessionListener(epoch))
                .get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);

            synchronized (stateLock) {
                if (!isCurrent(epoch)) {
                    candidate.close();
                    return;
                }
                setState(ConnectionState.AUTHENTICATING);
            }

            authenticate(candidate, epoch);
            enterReady(candidate, epoch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            candidate.close();
        } catch (Exception e) {
            onAttemptFailed(candidate, epoch, rootCause(e));
        }
    }

    private void authenticate(BrokerTransport target, int epoch) throws InterruptedException {
        String requestId = idGenerator.next();
        PendingRequest pending = correlationTable.register(requestId, config.authTimeout());
        write(target, epoch,
            codec.encode(IronbeamProtocol.authenticate(requestId, config.apiKey(), config.apiSecret())), pending);
        log.info("[IRONBEAM] Sent authentication message to Ironbeam");

        InboundMessage reply;
        try {
            reply = correlationTable.await(pending, config.authTimeout());
        } catch (BrokerRequestTimeoutException e) {
            throw new BrokerAuthenticationException(BROKER,
                "No authentication reply within " + config.authTimeout().toMillis() + "ms", e);
        }
        if (reply.isError()) {
            throw new BrokerAuthenticationException(BROKER,
                "Authentication rejected: " + (reply.message() != null ? reply.message() : "Unknown error"));
        }
    }

    private void enterReady(BrokerTransport target, int epoch) {
        List<Subscription> toRestore;
        CompletableFuture<Void> ready;
        synchronized (stateLock) {
            if (!isCurrent(epoch)) {
                target.close();
                return;
            }
            reconnectionPolicy.recordSuccess();
            setState(ConnectionState.READY);
            startHeartbeat(target, epoch);
            ready = readyFuture;
            toRestore = subscriptions.snapshot();
        }
        log.info("[IRONBEAM] ✅ Successfully connected to Ironbeam");
        if (ready != null) {
            ready.complete(null);
        }
        resubscribe(toRestore);
    }

    private void onAttemptFailed(BrokerTransport candidate, int epoch, Throwable cause) {
        candidate.close();
        List<PendingRequest> orphaned;
        BrokerConnectionException exhausted = null;
        CompletableFuture<Void> abandoned = null;
        synchronized (stateLock) {
            if (!isCurrent(epoch)) {
                return;
            }
            transport = null;
            stopHeartbeat();
            orphaned = correlationTable.detachAll();
            reconnectionPolicy.recordFailure();

            if (cause instanceof BrokerAuthenticationException) {
                log.error("[IRONBEAM] Authentication failed (attempt {}): {}",
                    reconnectionPolicy.getAttemptCount(), cause.getMessage());
                notifyError(cause);
            } else {
                log.error("[IRONBEAM] WebSocket connection failed (attempt {}): {}",
                    reconnectionPolicy.getAttemptCount(), cause.getMessage());
            }

            if (reconnectionPolicy.isExhausted()) {
                exhausted = enterFailed(cause);
                abandoned = readyFuture;
            } else {
                setState(ConnectionState.RECONNECTING);
                scheduleAttempt(reconnectionPolicy.getNextDelay());
            }
        }

        correlationTable.failDetached(orphaned, new BrokerConnectionException(
            BROKER, Reason.CONNECT_FAILED, "Connection attempt failed", cause));
        if (abandoned != null) {
            abandoned.completeExceptionally(exhausted);
        }
    }

    /**
     * Terminal until the owner calls {@link #connect()} again. Caller holds stateLock and
     * completes the ready future with the returned failure once the lock is released.
     */
    private BrokerConnectionException enterFailed(Throwable cause) {
        log.error("[IRONBEAM] Max reconnection attempts ({}) reached. Unable to connect to Ironbeam.",
            reconnectionPolicy.getMaxAttempts());
        BrokerConnectionException failure = new BrokerConnectionException(BROKER, Reason.RETRIES_EXHAUSTED,
            "Reconnect budget exhausted after " + reconnectionPolicy.getAttemptCount() + " attempts", cause);
        setState(ConnectionState.FAILED);
        subscriptions.clear();
        notifyError(failure);
        return failure;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION LOSS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Single entry point for every loss signal of connection {@code epoch}. The first
     * signal tears the connection down; later or stale ones are ignored.
     */
    private void handleConnectionLost(int epoch, Throwable cause) {
        BrokerTransport lost;
        List<PendingRequest> orphaned;
        BrokerConnectionException failure = new BrokerConnectionException(BROKER, Reason.CONNECTION_LOST,
            "Connection lost: " + (cause != null ? cause.getMessage() : "unknown"), cause);
        synchronized (stateLock) {
            if (!isCurrent(epoch) || transport == null) {
                return;
            }
            lost = transport;
            transport = null;
            stopHeartbeat();
            // Outside READY an attempt is in flight on the lifecycle thread; failing its
            // authentication request makes it report the failure itself
            orphaned = correlationTable.detachAll();

            if (state == ConnectionState.READY) {
                log.warn("[IRONBEAM] Connection lost: {}", failure.getMessage());
                setState(ConnectionState.DISCONNECTED);
                // The previous ready future belongs to the lost session
                readyFuture = new CompletableFuture<>();
                log.info("[IRONBEAM] Attempting to reconnect...");
                setState(ConnectionState.RECONNECTING);
                scheduleAttempt(reconnectionPolicy.getNextDelay());
            }
        }
        lost.close();
        correlationTable.failDetached(orphaned, failure);
    }

    private void resubscribe(List<Subscription> toRestore) {
        if (toRestore.isEmpty()) {
            return;
        }
        log.info("[IRONBEAM] Restoring {} subscriptions", toRestore.size());
        for (Subscription subscription : toRestore) {
            request(id -> IronbeamProtocol.subscribe(id, subscription.symbol(), subscription.dataTypes()),
                config.subscribeTimeout())
                .whenComplete((reply, error) -> {
                    if (error != null) {
                        log.warn("[IRONBEAM] Resubscribe to {} failed: {}",
                            subscription.symbol(), rootCause(error).getMessage());
                    } else {
                        log.debug("[IRONBEAM] Resubscribed to {}", subscription.symbol());
                    }
                });
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // READ LOOP
    // ═══════════════════════════════════════════════════════════════════════

    private void handleFrame(String frame) {
        InboundMessage message;
        try {
            message = codec.decode(frame);
        } catch (MessageDecodeException e) {
            log.error("[IRONBEAM] Failed to decode message: {}", e.getMessage());
            return;
        }

        if (message.hasRequestId() && correlationTable.resolve(message.requestId(), message)) {
            return;
        }

        Optional<EventKind> kind = EventKind.fromWireType(message.type());
        if (kind.isEmpty()) {
            log.debug("[IRONBEAM] Unhandled message type '{}': {}", message.type(), frame);
            return;
        }
        if (kind.get() == EventKind.ERROR) {
            log.error("[IRONBEAM] Ironbeam error: {}",
                message.message() != null ? message.message() : "Unknown error");
        }
        dispatcher.dispatch(new InboundEvent(kind.get(), message.symbol(), message.data(),
            message.message(), Instant.now()));
    }

    /**
     * Transport callbacks of one connection epoch.
     */
    private final class SessionListener implements TransportListener {
        private final int epoch;

        private SessionListener(int epoch) {
            this.epoch = epoch;
        }

        @Override
        public void onFrame(String frame) {
            if (epoch != connectionEpoch) {
                return;
            }
            handleFrame(frame);
        }

        @Override
        public void onPong() {
            HeartbeatManager current = heartbeat;
            if (current != null && epoch == connectionEpoch) {
                current.recordPong();
            }
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            log.warn("[IRONBEAM] WebSocket connection closed by server: {} {}", statusCode, reason);
            handleConnectionLost(epoch, new BrokerConnectionException(BROKER, Reason.CONNECTION_LOST,
                "Closed by server (" + statusCode + " " + reason + ")"));
        }

        @Override
        public void onError(Throwable error) {
            log.error("[IRONBEAM] WebSocket listen error: {}", error.getMessage());
            handleConnectionLost(epoch, error);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Caller holds stateLock.
     */
    private boolean isCurrent(int epoch) {
        return !shutdownRequested && epoch == connectionEpoch;
    }

    /**
     * Caller holds stateLock.
     */
    private boolean isAttemptInProgress() {
        return pendingAttempt != null
            || state == ConnectionState.CONNECTING
            || state == ConnectionState.AUTHENTICATING
            || state == ConnectionState.RECONNECTING;
    }

    /**
     * Caller holds stateLock.
     */
    private void startHeartbeat(BrokerTransport target, int epoch) {
        if (!config.isHeartbeatEnabled()) {
            return;
        }
        heartbeat = new HeartbeatManager(BROKER + "#" + epoch, config.pingInterval(), config.pongTimeout(),
            () -> writePing(target, epoch),
            () -> handleConnectionLost(epoch, new BrokerConnectionException(BROKER, Reason.CONNECTION_LOST,
                "Heartbeat timeout")));
        heartbeat.start();
    }

    /**
     * Caller holds stateLock.
     */
    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.stop();
            heartbeat = null;
        }
    }

    /**
     * Caller holds stateLock.
     */
    private void setState(ConnectionState next) {
        if (state == next) {
            return;
        }
        ConnectionState previous = state;
        state = next;
        log.info("[IRONBEAM] State {} -> {}", previous, next);
        notifyListeners(stateListeners, next);
    }

    private void notifyError(Throwable error) {
        notifyListeners(errorListeners, error);
    }

    private <T> void notifyListeners(List<Consumer<T>> listeners, T value) {
        if (listeners.isEmpty()) {
            return;
        }
        try {
            listenerExecutor.execute(() -> {
                for (Consumer<T> listener : listeners) {
                    try {
                        listener.accept(value);
                    } catch (Exception e) {
                        log.error("[IRONBEAM] Listener threw exception", e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[IRONBEAM] Listener executor stopped, dropped notification {}", value);
        }
    }

    private <T> CompletableFuture<T> asSubscriptionFailure(CompletableFuture<T> future, String symbol, String action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = rootCause(error);
            log.error("[IRONBEAM] Failed to {} {}: {}", action, symbol, cause.getMessage());
            result.completeExceptionally(new BrokerSubscriptionException(BROKER, symbol, cause.getMessage(), cause));
        });
        return result;
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private static Supplier<BrokerTransport> webSocketTransports(IronbeamConfig config) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .build();
        return () -> new WebSocketTransport(httpClient, config.connectTimeout(), config.closeTimeout());
    }

    CorrelationTable correlationTable() {
        return correlationTable;
    }
}
