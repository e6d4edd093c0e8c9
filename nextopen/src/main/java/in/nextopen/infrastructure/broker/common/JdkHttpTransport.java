package in.nextopen.infrastructure.broker.common;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * BrokerTransport over {@link HttpClient} with connect and request timeouts.
 */
public class JdkHttpTransport implements BrokerTransport {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpTransport(Duration connectTimeout, Duration requestTimeout) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public BrokerHttpResponse send(BrokerHttpRequest request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(request.uri())
            .timeout(requestTimeout);
        request.headers().forEach(builder::header);
        if ("GET".equals(request.method())) {
            builder.GET();
        } else {
            builder.method(request.method(), request.body() != null
                ? HttpRequest.BodyPublishers.ofString(request.body())
                : HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during " + request.method() + " " + request.uri().getPath());
        }

        Map<String, String> headers = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                headers.put(entry.getKey().toLowerCase(), entry.getValue().get(0));
            }
        }
        return new BrokerHttpResponse(response.statusCode(), response.body(), headers);
    }
}
