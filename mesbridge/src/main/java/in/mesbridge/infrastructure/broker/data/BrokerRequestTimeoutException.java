package in.mesbridge.infrastructure.broker.data;

import java.time.Duration;

/**
 * Exception thrown when a correlated request gets no reply before its deadline.
 * Only the issuing caller sees it; the connection state is unaffected.
 */
public class BrokerRequestTimeoutException extends RuntimeException {

    private final String requestId;
    private final Duration timeout;

    public BrokerRequestTimeoutException(String requestId, Duration timeout) {
        super(String.format("Request %s timed out after %dms", requestId, timeout.toMillis()));
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
