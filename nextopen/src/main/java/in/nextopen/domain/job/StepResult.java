package in.nextopen.domain.job;

/**
 * Outcome of one step invocation, recorded into {@code job_run}.
 */
public record StepResult(JobStatus status, String message) {

    public static StepResult success(String message) {
        return new StepResult(JobStatus.SUCCESS, message);
    }

    public static StepResult skipped(String message) {
        return new StepResult(JobStatus.SKIPPED, message);
    }

    public static StepResult failed(String message) {
        return new StepResult(JobStatus.FAILED, message);
    }

    public boolean isFailure() {
        return status == JobStatus.FAILED;
    }
}
