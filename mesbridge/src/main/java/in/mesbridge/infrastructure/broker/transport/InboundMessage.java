package in.mesbridge.infrastructure.broker.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded inbound frame. A message carrying a request id that matches an
 * outstanding request is a reply; anything else is a push event.
 */
public record InboundMessage(
    String type,
    String requestId,
    String status,
    String message,
    String errorCode,
    JsonNode data,
    JsonNode raw
) {

    public boolean hasRequestId() {
        return requestId != null && !requestId.isEmpty();
    }

    /**
     * True when the broker reports a failure, either through {@code status} or an {@code error} type.
     */
    public boolean isError() {
        return "error".equalsIgnoreCase(status) || "error".equalsIgnoreCase(type);
    }

    /**
     * Symbol from the payload, falling back to the envelope.
     */
    public String symbol() {
        if (data != null && data.hasNonNull("symbol")) {
            return data.get("symbol").asText();
        }
        if (raw != null && raw.hasNonNull("symbol")) {
            return raw.get("symbol").asText();
        }
        return null;
    }
}
