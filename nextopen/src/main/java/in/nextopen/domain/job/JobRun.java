package in.nextopen.domain.job;

import java.time.Instant;

/**
 * Audit trail row for one step invocation.
 */
public record JobRun(
    long id,
    String jobName,
    Instant startedAt,
    Instant finishedAt,
    JobStatus status,
    String message
) {}
