package in.nextopen.infrastructure.lease;

import java.util.Optional;

/**
 * Non-blocking, process-exclusive lease. At most one holder at a time.
 */
public interface ExclusiveLease {

    /**
     * Try to take the lease without waiting.
     *
     * @return the held lease, or empty if another holder has it
     */
    Optional<Lease> tryAcquire();

    /**
     * A held lease. Closing releases it.
     */
    interface Lease extends AutoCloseable {
        @Override
        void close();
    }
}
