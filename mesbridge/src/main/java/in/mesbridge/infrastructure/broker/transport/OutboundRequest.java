package in.mesbridge.infrastructure.broker.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request frame to be written to the broker.
 *
 * @param action action discriminator ({@code subscribe}, {@code place_order}, ...)
 * @param requestId correlation id echoed back by the broker
 * @param fields action-specific payload fields, in insertion order
 */
public record OutboundRequest(String action, String requestId, Map<String, Object> fields) {

    public OutboundRequest {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action cannot be null or empty");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("Request id cannot be null or empty");
        }
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
