package in.mesbridge.infrastructure.broker.ironbeam;

import in.mesbridge.domain.order.OrderRequest;
import in.mesbridge.infrastructure.broker.transport.OutboundRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ironbeam request actions and their payload fields.
 */
final class IronbeamProtocol {

    static final String AUTHENTICATE = "authenticate";
    static final String SUBSCRIBE = "subscribe";
    static final String UNSUBSCRIBE = "unsubscribe";
    static final String PLACE_ORDER = "place_order";
    static final String CANCEL_ORDER = "cancel_order";
    static final String GET_POSITIONS = "get_positions";
    static final String GET_ACCOUNT_INFO = "get_account_info";

    static OutboundRequest authenticate(String requestId, String apiKey, String apiSecret) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("api_key", apiKey);
        fields.put("secret", apiSecret);
        return new OutboundRequest(AUTHENTICATE, requestId, fields);
    }

    static OutboundRequest subscribe(String requestId, String symbol, List<String> dataTypes) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("symbol", symbol);
        fields.put("data_types", dataTypes);
        return new OutboundRequest(SUBSCRIBE, requestId, fields);
    }

    static OutboundRequest unsubscribe(String requestId, String symbol) {
        return new OutboundRequest(UNSUBSCRIBE, requestId, Map.of("symbol", symbol));
    }

    static OutboundRequest placeOrder(String requestId, OrderRequest order) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("symbol", order.symbol());
        fields.put("side", order.side().wireValue());
        fields.put("order_type", order.orderType().wireValue());
        fields.put("quantity", order.quantity());
        if (order.price() != null) {
            fields.put("price", order.price());
        }
        if (order.stopPrice() != null) {
            fields.put("stop_price", order.stopPrice());
        }
        return new OutboundRequest(PLACE_ORDER, requestId, fields);
    }

    static OutboundRequest cancelOrder(String requestId, String orderId) {
        return new OutboundRequest(CANCEL_ORDER, requestId, Map.of("order_id", orderId));
    }

    static OutboundRequest getPositions(String requestId) {
        return new OutboundRequest(GET_POSITIONS, requestId, Map.of());
    }

    static OutboundRequest getAccountInfo(String requestId) {
        return new OutboundRequest(GET_ACCOUNT_INFO, requestId, Map.of());
    }

    private IronbeamProtocol() {}
}
