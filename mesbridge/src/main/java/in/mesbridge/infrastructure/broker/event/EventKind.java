package in.mesbridge.infrastructure.broker.event;

import java.util.Optional;

/**
 * Kinds of broker push events, keyed by the wire {@code type} field.
 */
public enum EventKind {
    MARKET_DATA("market_data"),
    ORDER_UPDATE("order_update"),
    POSITION_UPDATE("position_update"),
    ERROR("error");

    private final String wireType;

    EventKind(String wireType) {
        this.wireType = wireType;
    }

    public String wireType() {
        return wireType;
    }

    public static Optional<EventKind> fromWireType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        for (EventKind kind : values()) {
            if (kind.wireType.equalsIgnoreCase(type)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
