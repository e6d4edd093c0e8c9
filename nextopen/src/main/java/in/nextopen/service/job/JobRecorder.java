package in.nextopen.service.job;

import in.nextopen.domain.job.JobStatus;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.repository.JobRunRepository;
import in.nextopen.infrastructure.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Wraps a step invocation in a {@code job_run} row and reports the outcome to the notifier.
 *
 * A RUNNING row is written before the step starts. The row is finished with the step's
 * status, or FAILED when the step throws; the exception is rethrown after recording.
 */
public final class JobRecorder {
    private static final Logger log = LoggerFactory.getLogger(JobRecorder.class);

    private final JobRunRepository jobRunRepository;
    private final Notifier notifier;

    public JobRecorder(JobRunRepository jobRunRepository, Notifier notifier) {
        this.jobRunRepository = jobRunRepository;
        this.notifier = notifier;
    }

    public StepResult record(String jobName, Supplier<StepResult> step) {
        long runId = jobRunRepository.start(jobName);
        log.info("[JOB] {} started (run {})", jobName, runId);

        StepResult result;
        try {
            result = step.get();
        } catch (RuntimeException e) {
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("[JOB] {} failed (run {})", jobName, runId, e);
            try {
                jobRunRepository.finish(runId, JobStatus.FAILED, message);
            } catch (RuntimeException finishError) {
                e.addSuppressed(finishError);
            }
            notifier.notify(jobName, JobStatus.FAILED, message);
            throw e;
        }

        jobRunRepository.finish(runId, result.status(), result.message());
        log.info("[JOB] {} {} (run {}): {}", jobName, result.status(), runId, result.message());
        notifier.notify(jobName, result.status(), result.message());
        return result;
    }
}
