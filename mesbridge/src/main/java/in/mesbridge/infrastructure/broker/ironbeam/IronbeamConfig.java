package in.mesbridge.infrastructure.broker.ironbeam;

import in.mesbridge.infrastructure.broker.common.ReconnectionPolicy;
import in.mesbridge.util.Env;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Immutable settings for one Ironbeam session.
 *
 * Environment variables read by {@link #fromEnv()}:
 * <pre>
 * BASE_URL, API_KEY, API_SECRET                       endpoint and credentials
 * IRONBEAM_SUBSCRIBE_TIMEOUT_MS (5000)                subscribe/unsubscribe reply timeout
 * IRONBEAM_REQUEST_TIMEOUT_MS (10000)                 order/query reply timeout
 * IRONBEAM_AUTH_TIMEOUT_MS (10000)                    authentication reply timeout
 * IRONBEAM_CONNECT_TIMEOUT_MS (10000)                 WebSocket handshake timeout
 * IRONBEAM_CLOSE_TIMEOUT_MS (10000)                   close handshake timeout
 * IRONBEAM_WRITE_TIMEOUT_MS (10000)                   single frame write timeout
 * IRONBEAM_PING_INTERVAL_MS (20000, 0 disables)       heartbeat ping interval
 * IRONBEAM_PONG_TIMEOUT_MS (10000)                    heartbeat pong timeout
 * IRONBEAM_RECONNECT_INITIAL_DELAY_MS (5000)          delay after the first failed attempt
 * IRONBEAM_RECONNECT_INCREMENT_MS (5000)              added per further failed attempt
 * IRONBEAM_RECONNECT_MAX_DELAY_MS (60000)             backoff cap
 * IRONBEAM_RECONNECT_MAX_ATTEMPTS (10)                failed attempts before FAILED
 * IRONBEAM_DATA_TYPES (quotes,trades)                 default subscription data types
 * </pre>
 */
public final class IronbeamConfig {

    public static final String BROKER_CODE = "IRONBEAM";

    private final URI endpoint;
    private final String apiKey;
    private final String apiSecret;
    private final Duration subscribeTimeout;
    private final Duration requestTimeout;
    private final Duration authTimeout;
    private final Duration connectTimeout;
    private final Duration closeTimeout;
    private final Duration writeTimeout;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Duration reconnectInitialDelay;
    private final Duration reconnectIncrement;
    private final Duration reconnectMaxDelay;
    private final int reconnectMaxAttempts;
    private final List<String> defaultDataTypes;

    private IronbeamConfig(Builder b) {
        this.endpoint = b.endpoint;
        this.apiKey = b.apiKey;
        this.apiSecret = b.apiSecret;
        this.subscribeTimeout = b.subscribeTimeout;
        this.requestTimeout = b.requestTimeout;
        this.authTimeout = b.authTimeout;
        this.connectTimeout = b.connectTimeout;
        this.closeTimeout = b.closeTimeout;
        this.writeTimeout = b.writeTimeout;
        this.pingInterval = b.pingInterval;
        this.pongTimeout = b.pongTimeout;
        this.reconnectInitialDelay = b.reconnectInitialDelay;
        this.reconnectIncrement = b.reconnectIncrement;
        this.reconnectMaxDelay = b.reconnectMaxDelay;
        this.reconnectMaxAttempts = b.reconnectMaxAttempts;
        this.defaultDataTypes = List.copyOf(b.defaultDataTypes);
    }

    public static IronbeamConfig fromEnv() {
        return builder()
            .endpoint(URI.create(Env.get("BASE_URL", "wss://demo.ironbeam.com/socket")))
            .credentials(Env.get("API_KEY", "demo-key"), Env.get("API_SECRET", "demo-secret"))
            .subscribeTimeout(Env.getMillis("IRONBEAM_SUBSCRIBE_TIMEOUT_MS", Duration.ofSeconds(5)))
            .requestTimeout(Env.getMillis("IRONBEAM_REQUEST_TIMEOUT_MS", Duration.ofSeconds(10)))
            .authTimeout(Env.getMillis("IRONBEAM_AUTH_TIMEOUT_MS", Duration.ofSeconds(10)))
            .connectTimeout(Env.getMillis("IRONBEAM_CONNECT_TIMEOUT_MS", Duration.ofSeconds(10)))
            .closeTimeout(Env.getMillis("IRONBEAM_CLOSE_TIMEOUT_MS", Duration.ofSeconds(10)))
            .writeTimeout(Env.getMillis("IRONBEAM_WRITE_TIMEOUT_MS", Duration.ofSeconds(10)))
            .pingInterval(Env.getMillis("IRONBEAM_PING_INTERVAL_MS", Duration.ofSeconds(20)))
            .pongTimeout(Env.getMillis("IRONBEAM_PONG_TIMEOUT_MS", Duration.ofSeconds(10)))
            .reconnectInitialDelay(Env.getMillis("IRONBEAM_RECONNECT_INITIAL_DELAY_MS", Duration.ofSeconds(5)))
            .reconnectIncrement(Env.getMillis("IRONBEAM_RECONNECT_INCREMENT_MS", Duration.ofSeconds(5)))
            .reconnectMaxDelay(Env.getMillis("IRONBEAM_RECONNECT_MAX_DELAY_MS", Duration.ofSeconds(60)))
            .reconnectMaxAttempts(Env.getInt("IRONBEAM_RECONNECT_MAX_ATTEMPTS", 10))
            .defaultDataTypes(Env.getList("IRONBEAM_DATA_TYPES", List.of("quotes", "trades")))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * New policy instance built from the reconnect settings.
     */
    public ReconnectionPolicy newReconnectionPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectInitialDelay)
            .increment(reconnectIncrement)
            .maxDelay(reconnectMaxDelay)
            .maxAttempts(reconnectMaxAttempts)
            .build();
    }

    public boolean isHeartbeatEnabled() {
        return !pingInterval.isZero();
    }

    public URI endpoint() { return endpoint; }
    public String apiKey() { return apiKey; }
    public String apiSecret() { return apiSecret; }
    public Duration subscribeTimeout() { return subscribeTimeout; }
    public Duration requestTimeout() { return requestTimeout; }
    public Duration authTimeout() { return authTimeout; }
    public Duration connectTimeout() { return connectTimeout; }
    public Duration closeTimeout() { return closeTimeout; }
    public Duration writeTimeout() { return writeTimeout; }
    public Duration pingInterval() { return pingInterval; }
    public Duration pongTimeout() { return pongTimeout; }
    public int reconnectMaxAttempts() { return reconnectMaxAttempts; }
    public List<String> defaultDataTypes() { return defaultDataTypes; }

    @Override
    public String toString() {
        return "IronbeamConfig{endpoint=" + endpoint
            + ", apiKey=" + maskKey(apiKey)
            + ", requestTimeout=" + requestTimeout.toMillis() + "ms"
            + ", reconnectMaxAttempts=" + reconnectMaxAttempts + "}";
    }

    static String maskKey(String key) {
        if (key == null || key.length() <= 4) return "****";
        return key.substring(0, 4) + "****";
    }

    public static final class Builder {
        private URI endpoint;
        private String apiKey;
        private String apiSecret;
        private Duration subscribeTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration authTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration closeTimeout = Duration.ofSeconds(10);
        private Duration writeTimeout = Duration.ofSeconds(10);
        private Duration pingInterval = Duration.ofSeconds(20);
        private Duration pongTimeout = Duration.ofSeconds(10);
        private Duration reconnectInitialDelay = Duration.ofSeconds(5);
        private Duration reconnectIncrement = Duration.ofSeconds(5);
        private Duration reconnectMaxDelay = Duration.ofSeconds(60);
        private int reconnectMaxAttempts = 10;
        private List<String> defaultDataTypes = List.of("quotes", "trades");

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder credentials(String apiKey, String apiSecret) {
            this.apiKey = apiKey;
            this.apiSecret = apiSecret;
            return this;
        }

        public Builder subscribeTimeout(Duration subscribeTimeout) {
            this.subscribeTimeout = positive(subscribeTimeout, "Subscribe timeout");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = positive(requestTimeout, "Request timeout");
            return this;
        }

        public Builder authTimeout(Duration authTimeout) {
            this.authTimeout = positive(authTimeout, "Auth timeout");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "Connect timeout");
            return this;
        }

        public Builder closeTimeout(Duration closeTimeout) {
            this.closeTimeout = positive(closeTimeout, "Close timeout");
            return this;
        }

        public Builder writeTimeout(Duration writeTimeout) {
            this.writeTimeout = positive(writeTimeout, "Write timeout");
            return this;
        }

        /**
         * Heartbeat ping interval; {@link Duration#ZERO} disables the heartbeat.
         */
        public Builder pingInterval(Duration pingInterval) {
            if (pingInterval == null || pingInterval.isNegative()) {
                throw new IllegalArgumentException("Ping interval cannot be negative");
            }
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder pongTimeout(Duration pongTimeout) {
            this.pongTimeout = positive(pongTimeout, "Pong timeout");
            return this;
        }

        public Builder reconnectInitialDelay(Duration delay) {
            this.reconnectInitialDelay = positive(delay, "Reconnect initial delay");
            return this;
        }

        public Builder reconnectIncrement(Duration increment) {
            if (increment == null || increment.isNegative()) {
                throw new IllegalArgumentException("Reconnect increment cannot be negative");
            }
            this.reconnectIncrement = increment;
            return this;
        }

        public Builder reconnectMaxDelay(Duration delay) {
            this.reconnectMaxDelay = positive(delay, "Reconnect max delay");
            return this;
        }

        public Builder reconnectMaxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Reconnect max attempts must be positive");
            }
            this.reconnectMaxAttempts = maxAttempts;
            return this;
        }

        public Builder defaultDataTypes(List<String> dataTypes) {
            if (dataTypes == null || dataTypes.isEmpty()) {
                throw new IllegalArgumentException("At least one data type is required");
            }
            this.defaultDataTypes = dataTypes;
            return this;
        }

        public IronbeamConfig build() {
            if (endpoint == null) {
                throw new IllegalArgumentException("Endpoint is required");
            }
            if (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank()) {
                throw new IllegalArgumentException("API key and secret are required");
            }
            if (reconnectInitialDelay.compareTo(reconnectMaxDelay) > 0) {
                throw new IllegalArgumentException("Reconnect initial delay cannot exceed max delay");
            }
            return new IronbeamConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
