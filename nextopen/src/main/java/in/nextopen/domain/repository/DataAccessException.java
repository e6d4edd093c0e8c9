package in.nextopen.domain.repository;

/**
 * Unchecked wrapper for store failures. Aborts the running step.
 */
public class DataAccessException extends RuntimeException {

    private final String operation;

    public DataAccessException(String operation, Throwable cause) {
        super(String.format("[STORE:%s] %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
