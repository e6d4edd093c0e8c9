package in.nextopen.infrastructure.broker.common;

import java.time.Duration;

/**
 * Blocking pause used by throttling and backoff. Replaced in tests so nothing actually sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper system() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while sleeping " + duration, e);
            }
        };
    }
}
