package in.nextopen.infrastructure.broker;

/**
 * Base class for brokerage failures.
 */
public class BrokerException extends RuntimeException {

    private final String brokerCode;
    private final String operation;

    public BrokerException(String brokerCode, String operation, String message) {
        super(String.format("[%s:%s] %s", brokerCode, operation, message));
        this.brokerCode = brokerCode;
        this.operation = operation;
    }

    public BrokerException(String brokerCode, String operation, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", brokerCode, operation, message), cause);
        this.brokerCode = brokerCode;
        this.operation = operation;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getOperation() {
        return operation;
    }
}
