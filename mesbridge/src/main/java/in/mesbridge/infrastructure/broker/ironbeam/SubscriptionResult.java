package in.mesbridge.infrastructure.broker.ironbeam;

import in.mesbridge.infrastructure.broker.transport.InboundMessage;

/**
 * Outcome of a subscribe or unsubscribe call.
 *
 * @param reply broker acknowledgment, or null when no request was needed
 */
public record SubscriptionResult(String symbol, Status status, InboundMessage reply) {

    public enum Status {
        SUBSCRIBED,
        ALREADY_SUBSCRIBED,
        UNSUBSCRIBED,
        NOT_SUBSCRIBED
    }
}
