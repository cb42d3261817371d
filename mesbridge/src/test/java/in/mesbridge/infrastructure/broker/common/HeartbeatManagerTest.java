package in.mesbridge.infrastructure.broker.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HeartbeatManager.
 *
 * Tests:
 * - Periodic ping sending
 * - Pong receipt keeps the connection healthy
 * - Timeout detection fires exactly once
 * - Prompt pong is never a timeout, whatever the interval
 * - Lifecycle management
 */
class HeartbeatManagerTest {

    private HeartbeatManager heartbeat;

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
    }

    @Test
    void testInitialState() {
        AtomicInteger pingCount = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("IRONBEAM", Duration.ofSeconds(1), Duration.ofSeconds(2),
            pingCount::incrementAndGet, () -> {});

        assertEquals(0, pingCount.get(), "No pings sent before start");
        assertNull(heartbeat.getTimeSinceLastPong(), "No pongs received yet");
        assertFalse(heartbeat.isHealthy(), "Not healthy before start");
    }

    @Test
    void testPeriodicPingSending() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);

        heartbeat = new HeartbeatManager("IRONBEAM", Duration.ofMillis(100), Duration.ofSeconds(5),
            pingLatch::countDown, () -> {});
        heartbeat.start();

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS), "Should send 3 pings within 2 seconds");
    }

    @Test
    void testPongKeepsConnectionHealthy() throws InterruptedException {
        AtomicInteger timeouts = new AtomicInteger(0);
        ScheduledExecutorService ponger = Executors.newSingleThreadScheduledExecutor();
        try {
            heartbeat = new HeartbeatManager("IRONBEAM", Duration.ofMillis(50), Duration.ofMillis(150),
                () -> ponger.schedule(() -> heartbeat.recordPong(), 5, TimeUnit.MILLISECONDS),
                timeouts::incrementAndGet);
            heartbeat.start();

            Thread.sleep(500);

            assertTrue(heartbeat.isHealthy(), "Should stay healthy while pongs arrive");
            assertEquals(0, timeouts.get(), "No timeout expected");
        } finally {
            ponger.shutdownNow();
        }
    }

    @Test
    void testImmediatePongWithIntervalLongerThanTimeout() throws InterruptedException {
        AtomicInteger timeouts = new AtomicInteger(0);
        AtomicInteger pings = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("IRONBEAM", Duration.ofMillis(200), Duration.ofMillis(100),
            () -> {
                pings.incrementAndGet();
                heartbeat.recordPong();
            },
            timeouts::incrementAndGet);
        heartbeat.start();

        Thread.sleep(700);

        assertTrue(pings.get() >= 2, "Should have pinged at least twice");
        assertEquals(0, timeouts.get(), "A pong right after the ping is not a timeout");
        assertTrue(heartbeat.isHealthy(), "Idle time between pings is not unhealthy");
    }

    @Test
    void testTimeoutDetectedOnce() throws InterruptedException {
        AtomicInteger timeouts = new AtomicInteger(0);
        CountDownLatch timeoutLatch = new CountDownLatch(1);

        heartbeat = new HeartbeatManager("IRONBEAM", Duration.ofMillis(50), Duration.ofMillis(100),
            () -> {}, () -> {
                timeouts.incrementAndGet();
                timeoutLatch.countDown();
            });
        heartbeat.start();

        assertTrue(timeoutLatch.await(2, TimeUnit.SECONDS), "Timeout should be detected");
        Thread.sleep(300);

        assertEquals(1, timeouts.get(), "Timeout callback should fire exactly once");
        assertFalse(heartbeat.isHealthy(), "Should be unhealthy after timeout");
    }

    @Test
    void testPingFailureDoesNotStopHeartbeat() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);

        heartbeat = new HeartbeatManager("IRONBEAM", Duration.ofMillis(50), Duration.ofSeconds(5),
            () -> {
                pingLatch.countDown();
                throw new IllegalStateException("socket closed");
            }, () -> {});
        heartbeat.start();

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS), "Pings should continue after a failure");
    }

    @Test
    void testStopHaltsPings() throws InterruptedException {
        AtomicInteger pingCount = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("IRONBEAM", Duration.ofMillis(50), Duration.ofSeconds(5),
            pingCount::incrementAndGet, () -> {});
        heartbeat.start();
        Thread.sleep(200);
        heartbeat.stop();

        int countAfterStop = pingCount.get();
        Thread.sleep(200);

        assertEquals(countAfterStop, pingCount.get(), "No pings after stop");
        assertFalse(heartbeat.isHealthy(), "Stopped heartbeat is not healthy");
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () ->
            new HeartbeatManager("IRONBEAM", Duration.ZERO, Duration.ofSeconds(1), () -> {}, () -> {}));
        assertThrows(IllegalArgumentException.class, () ->
            new HeartbeatManager("IRONBEAM", Duration.ofSeconds(1), Duration.ofSeconds(-1), () -> {}, () -> {}));
    }
}
