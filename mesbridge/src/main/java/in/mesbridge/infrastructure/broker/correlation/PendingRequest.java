package in.mesbridge.infrastructure.broker.correlation;

import in.mesbridge.infrastructure.broker.transport.InboundMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Result slot of one in-flight request. Written exactly once: by a reply,
 * by a failure, or by its deadline passing.
 */
public final class PendingRequest {

    private final String requestId;
    private final Instant registeredAt;
    private final Duration timeout;
    private final CompletableFuture<InboundMessage> result = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timeoutTask;

    PendingRequest(String requestId, Instant registeredAt, Duration timeout) {
        this.requestId = requestId;
        this.registeredAt = registeredAt;
        this.timeout = timeout;
    }

    public String getRequestId() {
        return requestId;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Instant getDeadline() {
        return registeredAt.plus(timeout);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Future view of the result. Completing the returned future does not affect this slot.
     */
    public CompletableFuture<InboundMessage> future() {
        return result.copy();
    }

    void setTimeoutTask(ScheduledFuture<?> timeoutTask) {
        this.timeoutTask = timeoutTask;
        if (result.isDone()) {
            timeoutTask.cancel(false);
        }
    }

    boolean complete(InboundMessage reply) {
        boolean won = result.complete(reply);
        cancelTimeout();
        return won;
    }

    boolean fail(Throwable reason) {
        boolean won = result.completeExceptionally(reason);
        cancelTimeout();
        return won;
    }

    CompletableFuture<InboundMessage> result() {
        return result;
    }

    private void cancelTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
