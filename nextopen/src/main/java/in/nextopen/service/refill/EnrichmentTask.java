package in.nextopen.service.refill;

import java.time.LocalDate;

/**
 * Best-effort preparation run before the refill loop. Failures are logged, never escalated.
 */
public interface EnrichmentTask {

    String name();

    void run(LocalDate runDate);
}
