package in.mesbridge.infrastructure.broker.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.mesbridge.infrastructure.broker.data.MessageDecodeException;

import java.time.Clock;
import java.time.Instant;

/**
 * JSON text-frame codec for the Ironbeam WebSocket protocol.
 *
 * Outbound: {@code {"action": ..., "request_id": ..., <fields>, "timestamp": <ISO-8601>}}
 * Inbound:  {@code {"type": ..., "request_id": ..., "status": ..., "message": ..., "data": {...}}}
 */
public final class BrokerMessageCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BrokerMessageCodec() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public BrokerMessageCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String encode(OutboundRequest request) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("action", request.action());
        node.put("request_id", request.requestId());
        request.fields().forEach((key, value) -> {
            if (value != null) {
                node.set(key, objectMapper.valueToTree(value));
            }
        });
        node.put("timestamp", Instant.now(clock).toString());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + request.action() + " request", e);
        }
    }

    /**
     * Decode one text frame.
     *
     * @throws MessageDecodeException if the frame is not a JSON object
     */
    public InboundMessage decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MessageDecodeException("Malformed JSON frame: " + abbreviate(frame), e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageDecodeException("Frame is not a JSON object: " + abbreviate(frame));
        }

        JsonNode data = root.get("data");
        return new InboundMessage(
            text(root, "type"),
            text(root, "request_id"),
            text(root, "status"),
            text(root, "message"),
            text(root, "error_code"),
            data != null && !data.isNull() ? data : objectMapper.createObjectNode(),
            root
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String abbreviate(String frame) {
        if (frame == null) return "null";
        return frame.length() <= 200 ? frame : frame.substring(0, 200) + "...";
    }
}
