package in.mesbridge.infrastructure.broker.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket ping/pong supervision for one connection.
 *
 * Sends a ping every {@code pingInterval}; if no pong arrives within {@code pongTimeout}
 * of a ping being sent, the connection is declared dead: {@code onTimeout} runs once and
 * pinging stops. A pong answers every ping sent before it. A manager is bound to one connection and is not restartable.
 *
 * Usage:
 * <pre>
 * HeartbeatManager heartbeat = new HeartbeatManager(
 *     "IRONBEAM#3",
 *     Duration.ofSeconds(20),
 *     Duration.ofSeconds(10),
 *     () -> writer.submit(transport::sendPing),
 *     () -> connectionLost(epoch, "heartbeat timeout"));
 * heartbeat.start();
 * // read loop, on pong:
 * heartbeat.recordPong();
 * </pre>
 */
public class HeartbeatManager {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String name;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Runnable pingSender;
    private final Runnable onTimeout;

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pingTask;
    private ScheduledFuture<?> timeoutTask;
    private volatile Instant lastPongTime;
    private volatile Instant lastPingTime;
    private volatile boolean running = false;
    private volatile boolean timedOut = false;

    public HeartbeatManager(String name, Duration pingInterval, Duration pongTimeout,
                            Runnable pingSender, Runnable onTimeout) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        if (pongTimeout.isNegative() || pongTimeout.isZero()) {
            throw new IllegalArgumentException("Pong timeout must be positive");
        }
        this.name = name;
        this.pingInterval = pingInterval;
        this.pongTimeout = pongTimeout;
        this.pingSender = pingSender;
        this.onTimeout = onTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running || scheduler.isShutdown()) {
            log.warn("[{}] Heartbeat already started", name);
            return;
        }
        log.debug("[{}] Starting heartbeat (ping every {}ms, pong timeout {}ms)",
            name, pingInterval.toMillis(), pongTimeout.toMillis());

        running = true;
        lastPongTime = Instant.now();
        pingTask = scheduler.scheduleAtFixedRate(this::ping,
            pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler.isShutdown()) {
            return;
        }
        running = false;
        if (pingTask != null) {
            pingTask.cancel(false);
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        scheduler.shutdownNow();
    }

    /**
     * Record a pong from the broker.
     */
    public void recordPong() {
        lastPongTime = Instant.now();
    }

    /**
     * @return true while running and no ping has gone unanswered past the timeout
     */
    public boolean isHealthy() {
        return running && !timedOut && !isPingOverdue();
    }

    /**
     * @return time since the last pong (or since start), or null if never started
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        return lastPong == null ? null : Duration.between(lastPong, Instant.now());
    }

    private void ping() {
        if (!running) {
            return;
        }
        Instant sentAt = Instant.now();
        lastPingTime = sentAt;
        try {
            pingSender.run();
        } catch (Exception e) {
            log.warn("[{}] Ping failed: {}", name, e.getMessage());
        }
        synchronized (this) {
            if (running && (timeoutTask == null || timeoutTask.isDone())) {
                timeoutTask = scheduler.schedule(() -> checkTimeout(sentAt),
                    pongTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        }
    }

    private void checkTimeout(Instant sentAt) {
        if (!running || isAnswered(sentAt)) {
            return;
        }
        log.warn("[{}] Heartbeat timeout - no pong for {}ms", name, getTimeSinceLastPong().toMillis());
        timedOut = true;
        running = false;
        if (pingTask != null) {
            pingTask.cancel(false);
        }
        try {
            onTimeout.run();
        } catch (Exception e) {
            log.error("[{}] Heartbeat timeout callback failed", name, e);
        }
    }

    private boolean isAnswered(Instant sentAt) {
        Instant lastPong = lastPongTime;
        return lastPong != null && !lastPong.isBefore(sentAt);
    }

    private boolean isPingOverdue() {
        Instant sentAt = lastPingTime;
        return sentAt != null && !isAnswered(sentAt)
            && Duration.between(sentAt, Instant.now()).compareTo(pongTimeout) >= 0;
    }
}
