package in.mesbridge.infrastructure.broker.data;

/**
 * Exception thrown when the broker rejects or never answers the authentication request.
 */
public class BrokerAuthenticationException extends RuntimeException {

    private final String brokerCode;

    public BrokerAuthenticationException(String brokerCode, String message) {
        super(String.format("[%s] %s", brokerCode, message));
        this.brokerCode = brokerCode;
    }

    public BrokerAuthenticationException(String brokerCode, String message, Throwable cause) {
        super(String.format("[%s] %s", brokerCode, message), cause);
        this.brokerCode = brokerCode;
    }

    public String getBrokerCode() {
        return brokerCode;
    }
}
