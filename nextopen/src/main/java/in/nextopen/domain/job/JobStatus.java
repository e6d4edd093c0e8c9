package in.nextopen.domain.job;

public enum JobStatus {
    RUNNING,
    SUCCESS,
    SKIPPED,
    FAILED
}
