package in.nextopen.infrastructure.broker.common;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum spacing between consecutive outbound calls by sleeping before the call.
 */
public class CallThrottle {

    private final Duration minInterval;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    private long lastCallNanos;
    private boolean called = false;

    public CallThrottle(Duration minInterval, Sleeper sleeper) {
        this(minInterval, sleeper, System::nanoTime);
    }

    public CallThrottle(Duration minInterval, Sleeper sleeper, LongSupplier nanoClock) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("Min interval cannot be negative");
        }
        this.minInterval = minInterval;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    /**
     * Block until at least minInterval has passed since the previous call, then mark a new call.
     *
     * @return how long this call waited
     */
    public synchronized Duration acquire() {
        Duration waited = Duration.ZERO;
        if (called) {
            long elapsed = nanoClock.getAsLong() - lastCallNanos;
            long remaining = minInterval.toNanos() - elapsed;
            if (remaining > 0) {
                waited = Duration.ofNanos(remaining);
                sleeper.sleep(waited);
            }
        }
        lastCallNanos = nanoClock.getAsLong();
        called = true;
        return waited;
    }
}
