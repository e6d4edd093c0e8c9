package in.nextopen.infrastructure.broker.common;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Description of one logical brokerage call, before auth headers are attached.
 *
 * @param operation name used in logs, metrics and exceptions
 * @param path path relative to the broker base URL
 * @param headers extra headers (transaction ids, continuation flags)
 * @param query query parameters, in order
 * @param body JSON body for POST, null for GET
 */
public record BrokerCall(
    String operation,
    String method,
    String path,
    Map<String, String> headers,
    Map<String, String> query,
    String body
) {

    public static BrokerCall get(String operation, String path, Map<String, String> headers,
                                 Map<String, String> query) {
        return new BrokerCall(operation, "GET", path, headers, new LinkedHashMap<>(query), null);
    }

    public static BrokerCall post(String operation, String path, Map<String, String> headers, String body) {
        return new BrokerCall(operation, "POST", path, headers, Map.of(), body);
    }
}
