package in.nextopen.domain.refill;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-instrument backfill progress. {@code coveredThroughDate} only moves forward.
 */
public record RefillProgress(
    String code,
    RefillStatus status,
    LocalDate coveredThroughDate,
    int attempts,
    String lastError,
    Instant updatedAt
) {

    public boolean isDone() {
        return status == RefillStatus.DONE;
    }
}
