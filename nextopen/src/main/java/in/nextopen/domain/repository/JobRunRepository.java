package in.nextopen.domain.repository;

import in.nextopen.domain.job.JobRun;
import in.nextopen.domain.job.JobStatus;

import java.util.List;

/**
 * Append-only audit of step invocations.
 */
public interface JobRunRepository {

    /**
     * Insert a RUNNING row and return its id.
     */
    long start(String jobName);

    void finish(long id, JobStatus status, String message);

    List<JobRun> findRecent(int limit);
}
