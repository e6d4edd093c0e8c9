package in.nextopen.infrastructure.broker.metrics;

import java.time.Duration;

/**
 * Gateway metrics for monitoring.
 *
 * Key metrics:
 * - Call outcomes per operation
 * - Call latency
 * - Retries and cooldowns
 * - Token refreshes
 */
public interface GatewayMetrics {

    /**
     * Record a finished HTTP exchange.
     *
     * @param operation Gateway operation (createOrder, getFills, ...)
     * @param outcome OK, TRANSIENT, AUTH or REJECTED
     * @param latency Time spent in the exchange
     */
    void recordCall(String operation, String outcome, Duration latency);

    void recordRetry(String operation, String reason);

    void recordCooldown(String operation);

    void recordTokenRefresh(boolean success);

    GatewayMetrics NOOP = new GatewayMetrics() {
        @Override
        public void recordCall(String operation, String outcome, Duration latency) {}

        @Override
        public void recordRetry(String operation, String reason) {}

        @Override
        public void recordCooldown(String operation) {}

        @Override
        public void recordTokenRefresh(boolean success) {}
    };
}
