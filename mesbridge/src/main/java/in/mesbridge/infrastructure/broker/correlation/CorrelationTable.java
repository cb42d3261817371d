package in.mesbridge.infrastructure.broker.correlation;

import in.mesbridge.infrastructure.broker.data.BrokerRequestTimeoutException;
import in.mesbridge.infrastructure.broker.transport.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps correlation ids to {@link PendingRequest} slots.
 *
 * Guarantees:
 * - An id is unique among live entries; registering a live id again is rejected.
 * - resolve / fail / timeout race on removal from the map; whichever removes the
 *   entry first completes it, every later attempt is a no-op.
 * - The deadline is measured from registration and enforced by an internal scheduler,
 *   so an entry never outlives its timeout even if no reply and no error ever arrive.
 * - An expired entry is removed, so a late reply for it is ignored.
 *
 * Usage:
 * <pre>
 * PendingRequest pending = table.register(id, Duration.ofSeconds(10));
 * transport.send(frame);
 * // read loop: table.resolve(id, reply);
 * InboundMessage reply = table.await(pending, Duration.ofSeconds(10));
 * </pre>
 */
public class CorrelationTable {
    private static final Logger log = LoggerFactory.getLogger(CorrelationTable.class);

    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timeoutScheduler;
    private final Clock clock;

    public CorrelationTable(String name) {
        this(name, Clock.systemUTC());
    }

    public CorrelationTable(String name, Clock clock) {
        this.clock = clock;
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Correlation-Timeouts-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a new pending request whose deadline is {@code timeout} from now.
     *
     * @throws IllegalStateException if {@code requestId} is already live
     */
    public PendingRequest register(String requestId, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        PendingRequest request = new PendingRequest(requestId, Instant.now(clock), timeout);
        if (pending.putIfAbsent(requestId, request) != null) {
            throw new IllegalStateException("Correlation id already in use: " + requestId);
        }
        request.setTimeoutTask(timeoutScheduler.schedule(
            () -> expire(request), timeout.toMillis(), TimeUnit.MILLISECONDS));
        return request;
    }

    /**
     * Complete the matching entry with a reply.
     *
     * @return true if a live entry was resolved; false for late or unknown ids
     */
    public boolean resolve(String requestId, InboundMessage reply) {
        PendingRequest request = pending.remove(requestId);
        if (request == null) {
            log.debug("Late or unexpected response for {} ignored", requestId);
            return false;
        }
        return request.complete(reply);
    }

    /**
     * Fail the matching entry.
     *
     * @return true if a live entry was failed
     */
    public boolean fail(String requestId, Throwable reason) {
        PendingRequest request = pending.remove(requestId);
        return request != null && request.fail(reason);
    }

    /**
     * Fail every live entry with the same reason.
     *
     * @return number of entries failed by this call
     */
    public int failAll(Throwable reason) {
        return failDetached(detachAll(), reason);
    }

    /**
     * Remove every live entry without completing it. The caller owns the returned entries
     * and must complete them with {@link #failDetached}; their deadlines no longer fire.
     */
    public List<PendingRequest> detachAll() {
        List<PendingRequest> detached = new ArrayList<>();
        for (Map.Entry<String, PendingRequest> entry : pending.entrySet()) {
            if (pending.remove(entry.getKey(), entry.getValue())) {
                detached.add(entry.getValue());
            }
        }
        return detached;
    }

    /**
     * Fail entries previously removed by {@link #detachAll}.
     *
     * @return number of entries failed by this call
     */
    public int failDetached(List<PendingRequest> detached, Throwable reason) {
        int failed = 0;
        for (PendingRequest request : detached) {
            if (request.fail(reason)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.info("Failed {} pending requests: {}", failed, reason.getMessage());
        }
        return failed;
    }

    /**
     * Block until the entry completes or {@code timeout} elapses, whichever is first.
     * On local timeout the entry is expired exactly as if its own deadline had passed.
     *
     * @return the reply
     * @throws BrokerRequestTimeoutException if no reply arrived in time
     * @throws RuntimeException the failure the entry was completed with
     */
    public InboundMessage await(PendingRequest request, Duration timeout) throws InterruptedException {
        try {
            return request.result().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            expire(request);
            return rethrowOutcome(request);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new IllegalStateException("Request " + request.getRequestId() + " was cancelled", e);
        }
    }

    public boolean contains(String requestId) {
        return pending.containsKey(requestId);
    }

    public int size() {
        return pending.size();
    }

    /**
     * @return ids of live entries, for diagnostics
     */
    public List<String> pendingIds() {
        return new ArrayList<>(pending.keySet());
    }

    /**
     * Stop the timeout scheduler. Live entries are not failed; call {@link #failAll} first.
     */
    public void shutdown() {
        timeoutScheduler.shutdownNow();
    }

    private void expire(PendingRequest request) {
        if (pending.remove(request.getRequestId(), request)) {
            if (request.fail(new BrokerRequestTimeoutException(request.getRequestId(), request.getTimeout()))) {
                log.warn("Request {} timed out after {}ms", request.getRequestId(), request.getTimeout().toMillis());
            }
        }
    }

    private static InboundMessage rethrowOutcome(PendingRequest request) {
        // Either expire() won, or whoever removed the entry first is completing it now
        try {
            return request.result().join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException(cause);
    }
}
