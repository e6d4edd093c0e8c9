package in.nextopen.infrastructure.broker.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of GatewayMetrics.
 *
 * Key Metrics:
 * - broker_calls_total{broker, operation, outcome}
 * - broker_call_latency_seconds{broker, operation}
 * - broker_retries_total{broker, operation, reason}
 * - broker_cooldowns_total{broker, operation}
 * - broker_token_refreshes_total{broker, status}
 */
public class PrometheusGatewayMetrics implements GatewayMetrics {

    private final String brokerCode;
    private final CollectorRegistry registry;

    private final Counter callCounter;
    private final Histogram callLatency;
    private final Counter retryCounter;
    private final Counter cooldownCounter;
    private final Counter tokenRefreshCounter;

    public PrometheusGatewayMetrics(String brokerCode) {
        this(brokerCode, CollectorRegistry.defaultRegistry);
    }

    public PrometheusGatewayMetrics(String brokerCode, CollectorRegistry registry) {
        this.brokerCode = brokerCode;
        this.registry = registry;

        this.callCounter = Counter.build()
            .name("broker_calls_total")
            .help("Total number of brokerage HTTP exchanges")
            .labelNames("broker", "operation", "outcome")
            .register(registry);

        this.callLatency = Histogram.build()
            .name("broker_call_latency_seconds")
            .help("Brokerage call latency in seconds")
            .labelNames("broker", "operation")
            .buckets(0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0, 10.0, 20.0)
            .register(registry);

        this.retryCounter = Counter.build()
            .name("broker_retries_total")
            .help("Total number of retry attempts")
            .labelNames("broker", "operation", "reason")
            .register(registry);

        this.cooldownCounter = Counter.build()
            .name("broker_cooldowns_total")
            .help("Total number of consecutive-error cooldowns")
            .labelNames("broker", "operation")
            .register(registry);

        this.tokenRefreshCounter = Counter.build()
            .name("broker_token_refreshes_total")
            .help("Total number of access token refreshes")
            .labelNames("broker", "status")
            .register(registry);
    }

    @Override
    public void recordCall(String operation, String outcome, Duration latency) {
        callCounter.labels(brokerCode, operation, outcome).inc();
        callLatency.labels(brokerCode, operation).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordRetry(String operation, String reason) {
        retryCounter.labels(brokerCode, operation, reason).inc();
    }

    @Override
    public void recordCooldown(String operation) {
        cooldownCounter.labels(brokerCode, operation).inc();
    }

    @Override
    public void recordTokenRefresh(boolean success) {
        tokenRefreshCounter.labels(brokerCode, success ? "success" : "failure").inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
