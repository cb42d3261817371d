package in.mesbridge.infrastructure.broker.correlation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.mesbridge.infrastructure.broker.data.BrokerConnectionException;
import in.mesbridge.infrastructure.broker.data.BrokerRequestTimeoutException;
import in.mesbridge.infrastructure.broker.transport.InboundMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CorrelationTable.
 *
 * Tests:
 * - Reply resolves the matching entry and removes it
 * - Unknown and late replies are no-ops
 * - Deadline enforced without any reply or error
 * - Exactly-once completion when reply, failure and timeout race
 * - failAll fails every live entry
 * - Detached entries complete only when the caller fails them
 * - Duplicate ids rejected
 */
class CorrelationTableTest {

    private CorrelationTable table;

    @BeforeEach
    void setUp() {
        table = new CorrelationTable("TEST");
    }

    @AfterEach
    void tearDown() {
        table.shutdown();
    }

    @Test
    void testResolveCompletesAndRemoves() throws Exception {
        PendingRequest pending = table.register("req_1_1", Duration.ofSeconds(5));
        assertTrue(table.contains("req_1_1"));

        InboundMessage reply = reply("req_1_1");
        assertTrue(table.resolve("req_1_1", reply), "Live entry should resolve");

        assertSame(reply, pending.future().get(1, TimeUnit.SECONDS));
        assertFalse(table.contains("req_1_1"), "Resolved entry should be removed");
        assertEquals(0, table.size());
    }

    @Test
    void testUnknownIdIsNoOp() {
        table.register("req_1_1", Duration.ofSeconds(5));

        assertFalse(table.resolve("req_999_1", reply("req_999_1")), "Unknown id should be ignored");
        assertEquals(1, table.size(), "Unrelated entry untouched");
    }

    @Test
    void testTimeoutRemovesEntryAndIgnoresLateReply() {
        PendingRequest pending = table.register("req_1_1", Duration.ofMillis(100));

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> pending.future().get(2, TimeUnit.SECONDS));
        assertInstanceOf(BrokerRequestTimeoutException.class, e.getCause());
        assertFalse(table.contains("req_1_1"), "Timed out entry should be removed");

        assertFalse(table.resolve("req_1_1", reply("req_1_1")), "Late reply should be a no-op");
    }

    @Test
    void testAwaitNeverHangsPastTimeout() {
        PendingRequest pending = table.register("req_1_1", Duration.ofSeconds(30));

        long start = System.nanoTime();
        BrokerRequestTimeoutException e = assertThrows(BrokerRequestTimeoutException.class,
            () -> table.await(pending, Duration.ofMillis(150)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals("req_1_1", e.getRequestId());
        assertTrue(elapsedMs < 2000, "Await should return shortly after its timeout, took " + elapsedMs + "ms");
        assertFalse(table.contains("req_1_1"), "Expired entry should be removed");
    }

    @Test
    void testAwaitReturnsReply() throws Exception {
        PendingRequest pending = table.register("req_1_1", Duration.ofSeconds(5));
        InboundMessage reply = reply("req_1_1");

        CompletableFuture.runAsync(() -> table.resolve("req_1_1", reply));

        assertSame(reply, table.await(pending, Duration.ofSeconds(2)));
    }

    @Test
    void testAwaitRethrowsFailure() {
        PendingRequest pending = table.register("req_1_1", Duration.ofSeconds(5));
        table.fail("req_1_1", new BrokerConnectionException("TEST",
            BrokerConnectionException.Reason.CONNECTION_LOST, "gone"));

        BrokerConnectionException e = assertThrows(BrokerConnectionException.class,
            () -> table.await(pending, Duration.ofSeconds(1)));
        assertEquals(BrokerConnectionException.Reason.CONNECTION_LOST, e.getReason());
    }

    @Test
    void testExactlyOnceUnderRace() throws Exception {
        int rounds = 200;
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            for (int i = 0; i < rounds; i++) {
                String id = "req_" + i + "_1";
                PendingRequest pending = table.register(id, Duration.ofMillis(5));
                AtomicInteger winners = new AtomicInteger(0);
                CountDownLatch go = new CountDownLatch(1);

                List<Future<?>> racers = new ArrayList<>();
                racers.add(pool.submit(() -> {
                    go.await();
                    if (table.resolve(id, reply(id))) winners.incrementAndGet();
                    return null;
                }));
                racers.add(pool.submit(() -> {
                    go.await();
                    if (table.fail(id, new IllegalStateException("failed"))) winners.incrementAndGet();
                    return null;
                }));
                racers.add(pool.submit(() -> {
                    go.await();
                    if (table.failAll(new IllegalStateException("all")) > 0) winners.incrementAndGet();
                    return null;
                }));
                go.countDown();
                for (Future<?> racer : racers) {
                    racer.get(2, TimeUnit.SECONDS);
                }

                Throwable failure = pending.future()
                    .handle((reply, error) -> error instanceof CompletionException ? error.getCause() : error)
                    .get(2, TimeUnit.SECONDS);
                assertTrue(winners.get() <= 1, "At most one completer may win, round " + i);
                if (winners.get() == 0) {
                    assertInstanceOf(BrokerRequestTimeoutException.class, failure,
                        "Without a winning racer the deadline must have completed the entry");
                }
            }
            assertEquals(0, table.size(), "No entry may leak");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testFailAllFailsEveryEntry() {
        int n = 25;
        List<PendingRequest> requests = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            requests.add(table.register("req_" + i + "_1", Duration.ofSeconds(30)));
        }

        int failed = table.failAll(new BrokerConnectionException("TEST",
            BrokerConnectionException.Reason.SHUTTING_DOWN, "Client shutting down"));

        assertEquals(n, failed, "Every live entry should be failed");
        assertEquals(0, table.size());
        for (PendingRequest request : requests) {
            ExecutionException e = assertThrows(ExecutionException.class,
                () -> request.future().get(1, TimeUnit.SECONDS));
            assertInstanceOf(BrokerConnectionException.class, e.getCause());
        }
        assertEquals(0, table.failAll(new IllegalStateException("again")), "Second failAll is a no-op");
    }

    @Test
    void testDetachedEntriesFailOnlyWhenCallerFailsThem() {
        PendingRequest pending = table.register("req_1_1", Duration.ofMillis(100));

        List<PendingRequest> detached = table.detachAll();

        assertEquals(1, detached.size());
        assertEquals(0, table.size(), "Detached entries leave the table");
        assertFalse(pending.isDone(), "Detaching does not complete the entry");
        assertFalse(table.resolve("req_1_1", reply("req_1_1")), "Detached entry cannot be resolved");

        assertEquals(1, table.failDetached(detached, new IllegalStateException("lost")));
        ExecutionException e = assertThrows(ExecutionException.class,
            () -> pending.future().get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause(), "Caller's reason wins over the deadline");
    }

    @Test
    void testDuplicateIdRejected() {
        table.register("req_1_1", Duration.ofSeconds(5));

        assertThrows(IllegalStateException.class, () -> table.register("req_1_1", Duration.ofSeconds(5)));
    }

    @Test
    void testNonPositiveTimeoutRejected() {
        assertThrows(IllegalArgumentException.class, () -> table.register("req_1_1", Duration.ZERO));
        assertEquals(0, table.size());
    }

    @Test
    void testCallerFutureIsIsolated() {
        PendingRequest pending = table.register("req_1_1", Duration.ofSeconds(5));

        pending.future().cancel(true);

        assertFalse(pending.isDone(), "Cancelling a view must not complete the slot");
        assertTrue(table.resolve("req_1_1", reply("req_1_1")));
    }

    @Test
    void testDeadlineMeasuredFromRegistration() {
        PendingRequest pending = table.register("req_1_1", Duration.ofSeconds(10));

        assertEquals(pending.getRegisteredAt().plusSeconds(10), pending.getDeadline());
    }

    private static InboundMessage reply(String requestId) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        return new InboundMessage("order_response", requestId, "success", null, null,
            nodes.objectNode(), nodes.objectNode());
    }
}
