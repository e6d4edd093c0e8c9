package in.nextopen.infrastructure.broker.common;

/**
 * Maps a raw response to a retry decision. Brokerage-specific error codes live in implementations.
 */
@FunctionalInterface
public interface ResponseClassifier {

    Verdict classify(BrokerHttpResponse response);

    enum Outcome {
        OK,
        TRANSIENT,
        AUTH,
        REJECTED
    }

    record Verdict(Outcome outcome, String errorCode, String message) {

        public static Verdict ok() {
            return new Verdict(Outcome.OK, null, null);
        }

        public static Verdict transientError(String errorCode, String message) {
            return new Verdict(Outcome.TRANSIENT, errorCode, message);
        }

        public static Verdict auth(String errorCode, String message) {
            return new Verdict(Outcome.AUTH, errorCode, message);
        }

        public static Verdict rejected(String errorCode, String message) {
            return new Verdict(Outcome.REJECTED, errorCode, message);
        }
    }

    /**
     * HTTP-status-only classification: 401/403 auth, 429 and 5xx transient, other 4xx rejected.
     */
    static Verdict byHttpStatus(BrokerHttpResponse response) {
        int status = response.status();
        if (status == 401 || status == 403) {
            return Verdict.auth(String.valueOf(status), "HTTP " + status);
        }
        if (status == 429 || status >= 500) {
            return Verdict.transientError(String.valueOf(status), "HTTP " + status);
        }
        if (status >= 400) {
            return Verdict.rejected(String.valueOf(status), "HTTP " + status);
        }
        return Verdict.ok();
    }
}
