package in.mesbridge.infrastructure.broker.data;

/**
 * Exception thrown when the broker session is unavailable, lost or shut down.
 * Every request still pending when the session leaves READY fails with this exception.
 */
public class BrokerConnectionException extends RuntimeException {

    /**
     * Why the session could not serve the request.
     */
    public enum Reason {
        NOT_READY,
        CONNECT_FAILED,
        CONNECTION_LOST,
        SHUTTING_DOWN,
        RETRIES_EXHAUSTED
    }

    private final String brokerCode;
    private final Reason reason;

    public BrokerConnectionException(String brokerCode, Reason reason, String message) {
        super(String.format("[%s] %s", brokerCode, message));
        this.brokerCode = brokerCode;
        this.reason = reason;
    }

    public BrokerConnectionException(String brokerCode, Reason reason, String message, Throwable cause) {
        super(String.format("[%s] %s", brokerCode, message), cause);
        this.brokerCode = brokerCode;
        this.reason = reason;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public Reason getReason() {
        return reason;
    }
}
