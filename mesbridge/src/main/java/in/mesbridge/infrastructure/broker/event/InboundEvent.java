package in.mesbridge.infrastructure.broker.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A push event as handed to handlers. Lives only for the duration of the dispatch.
 *
 * @param symbol symbol the event refers to, or null when the broker sent none
 * @param data event payload ({@code data} object of the frame)
 * @param message human readable text, set for error notices
 */
public record InboundEvent(
    EventKind kind,
    String symbol,
    JsonNode data,
    String message,
    Instant receivedAt
) {}
