package in.mesbridge.infrastructure.broker.ironbeam;

import java.util.List;

/**
 * Point-in-time session statistics for health checks and metrics.
 */
public record ConnectionStats(
    boolean connected,
    ConnectionState state,
    int reconnectAttempts,
    int activeSubscriptionCount,
    int pendingRequestCount,
    List<String> subscriptions
) {}
