package in.nextopen.infrastructure.broker;

/**
 * Terminal rejection by the brokerage. Never retried.
 */
public class BrokerRejectionException extends BrokerException {

    private final String errorCode;
    private final String brokerMessage;
    private final int httpStatus;

    public BrokerRejectionException(String brokerCode, String operation, int httpStatus,
                                    String errorCode, String brokerMessage) {
        super(brokerCode, operation, String.format("Rejected (http=%d, code=%s): %s",
            httpStatus, errorCode, brokerMessage));
        this.errorCode = errorCode;
        this.brokerMessage = brokerMessage;
        this.httpStatus = httpStatus;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getBrokerMessage() {
        return brokerMessage;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
