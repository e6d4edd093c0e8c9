package in.nextopen.infrastructure.broker;

/**
 * Transient failures persisted through every allowed attempt.
 */
public class BrokerRetryExhaustedException extends BrokerTransientException {

    private final int attempts;

    public BrokerRetryExhaustedException(String brokerCode, String operation, int attempts, Throwable lastFailure) {
        super(brokerCode, operation,
            "Gave up after " + attempts + " attempts: " + (lastFailure != null ? lastFailure.getMessage() : "unknown"),
            lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
