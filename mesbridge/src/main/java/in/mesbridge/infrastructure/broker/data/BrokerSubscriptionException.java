package in.mesbridge.infrastructure.broker.data;

/**
 * Exception thrown when symbol subscription/unsubscription fails.
 */
public class BrokerSubscriptionException extends RuntimeException {

    private final String brokerCode;
    private final String symbol;

    public BrokerSubscriptionException(String brokerCode, String symbol, String message, Throwable cause) {
        super(String.format("[%s] Subscription change failed for %s: %s", brokerCode, symbol, message), cause);
        this.brokerCode = brokerCode;
        this.symbol = symbol;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getSymbol() {
        return symbol;
    }
}
