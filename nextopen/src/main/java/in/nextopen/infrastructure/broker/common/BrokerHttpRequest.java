package in.nextopen.infrastructure.broker.common;

import java.net.URI;
import java.util.Map;

/**
 * Fully built outbound HTTP request. {@code body} is null for GET.
 */
public record BrokerHttpRequest(String method, URI uri, Map<String, String> headers, String body) {}
