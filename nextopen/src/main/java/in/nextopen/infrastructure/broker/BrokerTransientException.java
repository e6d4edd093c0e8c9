package in.nextopen.infrastructure.broker;

/**
 * Retryable failure: HTTP 429, 5xx, timeouts, connection errors, broker rate-limit codes.
 */
public class BrokerTransientException extends BrokerException {

    private final int httpStatus;

    public BrokerTransientException(String brokerCode, String operation, int httpStatus, String message) {
        super(brokerCode, operation, message);
        this.httpStatus = httpStatus;
    }

    public BrokerTransientException(String brokerCode, String operation, String message, Throwable cause) {
        super(brokerCode, operation, message, cause);
        this.httpStatus = 0;
    }

    /**
     * @return HTTP status, or 0 when no response was received
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
