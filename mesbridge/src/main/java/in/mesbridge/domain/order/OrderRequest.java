package in.mesbridge.domain.order;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Order placement request sent to the broker.
 * {@code price} and {@code stopPrice} are optional and only serialized when present.
 */
public record OrderRequest(
    String symbol,
    OrderSide side,
    OrderType orderType,
    int quantity,
    BigDecimal price,
    BigDecimal stopPrice
) {
    public OrderRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (orderType == null) {
            throw new IllegalArgumentException("Order type cannot be null");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (orderType.requiresPrice() && price == null) {
            throw new IllegalArgumentException(orderType + " order requires a price");
        }
        if (orderType.requiresStopPrice() && stopPrice == null) {
            throw new IllegalArgumentException(orderType + " order requires a stop price");
        }
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static OrderRequest market(String symbol, OrderSide side, int quantity) {
        return new OrderRequest(symbol, side, OrderType.MARKET, quantity, null, null);
    }

    public static OrderRequest limit(String symbol, OrderSide side, int quantity, BigDecimal price) {
        return new OrderRequest(symbol, side, OrderType.LIMIT, quantity, price, null);
    }
}
