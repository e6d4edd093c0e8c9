package in.nextopen.infrastructure.broker.common;

import java.util.Map;

/**
 * Raw HTTP response. Header names are lower-cased.
 */
public record BrokerHttpResponse(int status, String body, Map<String, String> headers) {

    public String header(String name) {
        return headers.get(name.toLowerCase());
    }
}
