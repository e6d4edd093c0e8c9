package in.nextopen.infrastructure.broker.kis;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.nextopen.infrastructure.broker.common.BrokerHttpResponse;
import in.nextopen.infrastructure.broker.common.ResponseClassifier.Outcome;
import in.nextopen.infrastructure.broker.common.ResponseClassifier.Verdict;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KisResponseClassifierTest {

    private final KisResponseClassifier classifier = new KisResponseClassifier(new ObjectMapper());

    private Verdict classify(int status, String body) {
        return classifier.classify(new BrokerHttpResponse(status, body, Map.of()));
    }

    @Test
    void successfulResponse() {
        assertEquals(Outcome.OK, classify(200, "{\"rt_cd\":\"0\",\"msg_cd\":\"MCA00000\",\"msg1\":\"ok\"}").outcome());
    }

    @Test
    void rateLimitCodeIsTransientEvenOnServerError() {
        Verdict verdict = classify(500, "{\"rt_cd\":\"1\",\"msg_cd\":\"EGW00201\",\"msg1\":\"too many calls\"}");

        assertEquals(Outcome.TRANSIENT, verdict.outcome());
        assertEquals("EGW00201", verdict.errorCode());
    }

    @Test
    void expiredTokenCodeIsAuth() {
        assertEquals(Outcome.AUTH, classify(500, "{\"rt_cd\":\"1\",\"msg_cd\":\"EGW00123\",\"msg1\":\"expired\"}").outcome());
        assertEquals(Outcome.AUTH, classify(403, "").outcome());
    }

    @Test
    void businessRejectionOnHttp200() {
        Verdict verdict = classify(200, "{\"rt_cd\":\"1\",\"msg_cd\":\"APBK0919\",\"msg1\":\"insufficient balance\"}");

        assertEquals(Outcome.REJECTED, verdict.outcome());
        assertEquals("APBK0919", verdict.errorCode());
        assertEquals("insufficient balance", verdict.message());
    }

    @Test
    void httpStatusFallback() {
        assertEquals(Outcome.TRANSIENT, classify(502, "<html>bad gateway</html>").outcome());
        assertEquals(Outcome.TRANSIENT, classify(429, "").outcome());
        assertEquals(Outcome.REJECTED, classify(404, "").outcome());
    }

    @Test
    void unparseableSuccessBodyIsRejected() {
        Verdict verdict = classify(200, "not json");

        assertEquals(Outcome.REJECTED, verdict.outcome());
        assertEquals("UNPARSEABLE", verdict.errorCode());
    }
}
