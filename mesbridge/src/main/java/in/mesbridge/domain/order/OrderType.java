package in.mesbridge.domain.order;

/**
 * Order types accepted by the broker.
 */
public enum OrderType {
    MARKET("market"),        // Execute at best available price
    LIMIT("limit"),          // Execute at price or better
    STOP("stop"),            // Market order once stop price trades
    STOP_LIMIT("stop_limit"); // Limit order once stop price trades

    private final String wireValue;

    OrderType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean requiresPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresStopPrice() {
        return this == STOP || this == STOP_LIMIT;
    }
}
