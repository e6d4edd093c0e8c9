package in.nextopen.infrastructure.notify;

import in.nextopen.domain.job.JobStatus;

/**
 * One-line step summaries for operators.
 */
public interface Notifier {

    void notify(String jobName, JobStatus status, String message);
}
