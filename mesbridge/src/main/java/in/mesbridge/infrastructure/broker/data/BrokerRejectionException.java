package in.mesbridge.infrastructure.broker.data;

/**
 * Exception thrown when the broker answers a request with an error status.
 */
public class BrokerRejectionException extends RuntimeException {

    private final String requestId;
    private final String errorCode;

    public BrokerRejectionException(String requestId, String errorCode, String message) {
        super(String.format("Request %s rejected%s: %s",
            requestId, errorCode != null ? " (" + errorCode + ")" : "", message));
        this.requestId = requestId;
        this.errorCode = errorCode;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * @return broker error code, or null if the reply carried none
     */
    public String getErrorCode() {
        return errorCode;
    }
}
