package in.nextopen.infrastructure.notify;

import in.nextopen.domain.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifier that writes to the log only.
 */
public final class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(String jobName, JobStatus status, String message) {
        switch (status) {
            case FAILED:
                log.error("[NOTIFY-FAILED] {} - {}", jobName, message);
                break;
            case SKIPPED:
                log.info("[NOTIFY-SKIPPED] {} - {}", jobName, message);
                break;
            default:
                log.info("[NOTIFY-{}] {} - {}", status, jobName, message);
                break;
        }
    }
}
