package in.nextopen.infrastructure.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.nextopen.domain.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts step summaries to a chat webhook as {@code {"content": "..."}}.
 *
 * Delivery failures are logged and never fail the step. Every summary is also logged
 * through the delegate.
 */
public final class WebhookNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private static final int MAX_CONTENT = 1900;

    private final URI webhookUrl;
    private final ObjectMapper mapper;
    private final Notifier delegate;
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .build();

    public WebhookNotifier(URI webhookUrl, ObjectMapper mapper, Notifier delegate) {
        this.webhookUrl = webhookUrl;
        this.mapper = mapper;
        this.delegate = delegate;
    }

    @Override
    public void notify(String jobName, JobStatus status, String message) {
        delegate.notify(jobName, status, message);

        String content = String.format("[nextopen] %s %s: %s", jobName, status, message);
        if (content.length() > MAX_CONTENT) {
            content = content.substring(0, MAX_CONTENT);
        }
        ObjectNode payload = mapper.createObjectNode();
        payload.put("content", content);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(webhookUrl)
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 300) {
                log.warn("[NOTIFY] Webhook returned HTTP {} for {}", response.statusCode(), jobName);
            }
        } catch (IOException e) {
            log.warn("[NOTIFY] Webhook delivery failed for {}: {}", jobName, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[NOTIFY] Webhook delivery interrupted for {}", jobName);
        }
    }
}
