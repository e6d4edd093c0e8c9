package in.nextopen.infrastructure.broker.metrics;

import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PrometheusGatewayMetrics and the textfile export.
 */
class PrometheusGatewayMetricsTest {

    @TempDir
    Path tempDir;

    @Test
    void testCountersRecorded() {
        CollectorRegistry registry = new CollectorRegistry();
        PrometheusGatewayMetrics metrics = new PrometheusGatewayMetrics("KIS", registry);

        metrics.recordCall("createOrder", "OK", Duration.ofMillis(120));
        metrics.recordCall("createOrder", "REJECTED", Duration.ofMillis(80));
        metrics.recordRetry("getFills", "503");
        metrics.recordRetry("getFills", "503");
        metrics.recordCooldown("getFills");
        metrics.recordTokenRefresh(true);

        assertEquals(1.0, registry.getSampleValue("broker_calls_total",
            new String[]{"broker", "operation", "outcome"}, new String[]{"KIS", "createOrder", "REJECTED"}));
        assertEquals(2.0, registry.getSampleValue("broker_retries_total",
            new String[]{"broker", "operation", "reason"}, new String[]{"KIS", "getFills", "503"}));
        assertEquals(1.0, registry.getSampleValue("broker_cooldowns_total",
            new String[]{"broker", "operation"}, new String[]{"KIS", "getFills"}));
        assertEquals(1.0, registry.getSampleValue("broker_token_refreshes_total",
            new String[]{"broker", "status"}, new String[]{"KIS", "success"}));
        assertEquals(2.0, registry.getSampleValue("broker_call_latency_seconds_count",
            new String[]{"broker", "operation"}, new String[]{"KIS", "createOrder"}));
    }

    @Test
    void testTextfileExport() throws Exception {
        CollectorRegistry registry = new CollectorRegistry();
        new PrometheusGatewayMetrics("KIS", registry).recordRetry("getHistory", "io");

        Path dir = tempDir.resolve("textfile");
        assertTrue(new MetricsTextfileWriter(registry).write(dir, "refill"));

        String content = Files.readString(dir.resolve("refill.prom"));
        assertTrue(content.contains("broker_retries_total{broker=\"KIS\",operation=\"getHistory\",reason=\"io\",} 1.0"),
            content);
        assertFalse(Files.exists(dir.resolve("refill.prom.tmp")));
    }
}
