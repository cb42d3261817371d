package in.mesbridge.infrastructure.broker.correlation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates correlation ids of the form {@code req_<sequence>_<epochMillis>}.
 *
 * The sequence is strictly increasing within one generator; the epoch is fixed when
 * the generator is created so ids from an earlier process cannot collide with ours.
 */
public final class CorrelationIdGenerator {

    private final long epochMillis;
    private final AtomicLong sequence = new AtomicLong(0);

    public CorrelationIdGenerator() {
        this(System.currentTimeMillis());
    }

    public CorrelationIdGenerator(long epochMillis) {
        this.epochMillis = epochMillis;
    }

    public String next() {
        return "req_" + sequence.incrementAndGet() + "_" + epochMillis;
    }

    public long getEpochMillis() {
        return epochMillis;
    }

    /**
     * @return number of ids handed out so far
     */
    public long getIssuedCount() {
        return sequence.get();
    }
}
