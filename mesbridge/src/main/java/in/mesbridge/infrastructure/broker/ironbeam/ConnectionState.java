package in.mesbridge.infrastructure.broker.ironbeam;

/**
 * Session lifecycle states.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> AUTHENTICATING -> READY
 * READY -> DISCONNECTED (loss) -> RECONNECTING -> CONNECTING -> ...
 * RECONNECTING -> FAILED (retry budget exhausted)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    READY,
    RECONNECTING,
    FAILED;

    public boolean isConnecting() {
        return this == CONNECTING || this == AUTHENTICATING || this == RECONNECTING;
    }
}
