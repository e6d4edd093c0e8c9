package in.nextopen.infrastructure.broker;

/**
 * Credentials were refused, or no token could be issued.
 */
public class BrokerAuthenticationException extends BrokerException {

    public BrokerAuthenticationException(String brokerCode, String operation, String message) {
        super(brokerCode, operation, message);
    }

    public BrokerAuthenticationException(String brokerCode, String operation, String message, Throwable cause) {
        super(brokerCode, operation, message, cause);
    }
}
