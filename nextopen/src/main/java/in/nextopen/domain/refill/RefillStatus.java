package in.nextopen.domain.refill;

/**
 * Backfill state of one instrument. A missing status means the instrument has never
 * been picked up by a refill run.
 */
public enum RefillStatus {
    IN_PROGRESS,
    DONE
}
