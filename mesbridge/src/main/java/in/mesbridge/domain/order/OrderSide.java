package in.mesbridge.domain.order;

/**
 * Order side.
 */
public enum OrderSide {
    BUY("buy"),
    SELL("sell");

    private final String wireValue;

    OrderSide(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Value sent to the broker in the {@code side} field.
     */
    public String wireValue() {
        return wireValue;
    }
}
