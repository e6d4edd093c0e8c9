package in.nextopen.infrastructure.broker.kis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.nextopen.infrastructure.broker.common.BrokerHttpResponse;
import in.nextopen.infrastructure.broker.common.ResponseClassifier;

import java.io.IOException;
import java.util.Set;

/**
 * KIS response classification.
 *
 * KIS reports business errors in the body ({@code rt_cd != "0"}, {@code msg_cd}, {@code msg1})
 * and sometimes wraps gateway errors in HTTP 500. The gateway codes decide before the HTTP status.
 */
public class KisResponseClassifier implements ResponseClassifier {

    /** Per-second call limit exceeded. */
    static final String RATE_LIMIT_CODE = "EGW00201";

    static final Set<String> TOKEN_CODES = Set.of("EGW00121", "EGW00123");

    private final ObjectMapper mapper;

    public KisResponseClassifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Verdict classify(BrokerHttpResponse response) {
        JsonNode body = parse(response.body());
        String msgCode = body != null ? KisPayloads.text(body, "msg_cd") : "";
        String message = body != null ? KisPayloads.text(body, "msg1") : "";

        if (RATE_LIMIT_CODE.equals(msgCode)) {
            return Verdict.transientError(msgCode, message);
        }
        if (TOKEN_CODES.contains(msgCode)) {
            return Verdict.auth(msgCode, message);
        }

        Verdict byStatus = ResponseClassifier.byHttpStatus(response);
        if (byStatus.outcome() != Outcome.OK) {
            return msgCode.isEmpty()
                ? byStatus
                : new Verdict(byStatus.outcome(), msgCode, message);
        }

        if (body == null) {
            return Verdict.rejected("UNPARSEABLE", "Response body is not JSON");
        }
        String rtCode = KisPayloads.text(body, "rt_cd");
        if (!rtCode.isEmpty() && !"0".equals(rtCode)) {
            return Verdict.rejected(msgCode.isEmpty() ? "rt_cd=" + rtCode : msgCode, message);
        }
        return Verdict.ok();
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            return null;
        }
    }
}
