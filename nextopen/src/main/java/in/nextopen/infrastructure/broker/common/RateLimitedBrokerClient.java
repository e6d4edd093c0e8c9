package in.nextopen.infrastructure.broker.common;

import in.nextopen.config.NextOpenConfig.GatewayConfig;
import in.nextopen.infrastructure.broker.BrokerAuthenticationException;
import in.nextopen.infrastructure.broker.BrokerRejectionException;
import in.nextopen.infrastructure.broker.BrokerRetryExhaustedException;
import in.nextopen.infrastructure.broker.BrokerTransientException;
import in.nextopen.infrastructure.broker.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Executes every outbound brokerage call with token caching, call spacing and bounded retries.
 *
 * Per attempt: token, throttle, send, classify.
 * <ul>
 *   <li>OK: returned</li>
 *   <li>AUTH: token invalidated and the call repeated once; a second refusal throws
 *       {@link BrokerAuthenticationException}</li>
 *   <li>TRANSIENT (429, 5xx, I/O, broker rate-limit codes): backoff and retry until the policy
 *       is exhausted, then {@link BrokerRetryExhaustedException}</li>
 *   <li>REJECTED: {@link BrokerRejectionException} immediately</li>
 * </ul>
 * After {@code errorCooldownAfter} consecutive transient failures (counted across calls)
 * a single long cooldown is taken before the next attempt.
 */
public class RateLimitedBrokerClient {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedBrokerClient.class);

    private final String brokerCode;
    private final URI baseUrl;
    private final Map<String, String> defaultHeaders;
    private final BrokerTransport transport;
    private final TokenCache tokenCache;
    private final CallThrottle throttle;
    private final Supplier<BackoffPolicy> backoffFactory;
    private final ResponseClassifier classifier;
    private final Sleeper sleeper;
    private final GatewayMetrics metrics;
    private final int errorCooldownAfter;
    private final Duration errorCooldown;

    private int consecutiveErrors = 0;

    public RateLimitedBrokerClient(String brokerCode, URI baseUrl, Map<String, String> defaultHeaders,
                                   BrokerTransport transport, TokenCache tokenCache, CallThrottle throttle,
                                   Supplier<BackoffPolicy> backoffFactory, ResponseClassifier classifier,
                                   Sleeper sleeper, GatewayMetrics metrics,
                                   int errorCooldownAfter, Duration errorCooldown) {
        this.brokerCode = brokerCode;
        this.baseUrl = baseUrl;
        this.defaultHeaders = Map.copyOf(defaultHeaders);
        this.transport = transport;
        this.tokenCache = tokenCache;
        this.throttle = throttle;
        this.backoffFactory = backoffFactory;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.errorCooldownAfter = errorCooldownAfter;
        this.errorCooldown = errorCooldown;
    }

    public static RateLimitedBrokerClient create(String brokerCode, URI baseUrl, Map<String, String> defaultHeaders,
                                                 BrokerTransport transport, TokenCache tokenCache,
                                                 ResponseClassifier classifier, Sleeper sleeper,
                                                 GatewayMetrics metrics, GatewayConfig config) {
        return new RateLimitedBrokerClient(brokerCode, baseUrl, defaultHeaders, transport, tokenCache,
            new CallThrottle(config.minInterval(), sleeper),
            () -> BackoffPolicy.fromConfig(config),
            classifier, sleeper, metrics, config.errorCooldownAfter(), config.errorCooldown());
    }

    /**
     * Execute {@code call} and return the successful response.
     */
    public synchronized BrokerHttpResponse execute(BrokerCall call) {
        BackoffPolicy policy = backoffFactory.get();
        boolean tokenRefreshed = false;

        while (true) {
            String token = tokenCache.getToken();
            throttle.acquire();
            BrokerHttpRequest request = buildRequest(call, token);

            long startNanos = System.nanoTime();
            BrokerHttpResponse response;
            try {
                response = transport.send(request);
            } catch (IOException e) {
                metrics.recordCall(call.operation(), ResponseClassifier.Outcome.TRANSIENT.name(), elapsed(startNanos));
                BrokerTransientException failure = new BrokerTransientException(brokerCode, call.operation(),
                    "I/O failure: " + e.getMessage(), e);
                backOff(call, policy, failure);
                continue;
            }

            ResponseClassifier.Verdict verdict = classifier.classify(response);
            metrics.recordCall(call.operation(), verdict.outcome().name(), elapsed(startNanos));

            switch (verdict.outcome()) {
                case OK -> {
                    consecutiveErrors = 0;
                    return response;
                }
                case AUTH -> {
                    if (tokenRefreshed) {
                        throw new BrokerAuthenticationException(brokerCode, call.operation(),
                            "Credentials refused after token refresh: " + verdict.message());
                    }
                    log.warn("[{}] {} refused token ({}), refreshing once", brokerCode, call.operation(),
                        verdict.errorCode());
                    tokenRefreshed = true;
                    tokenCache.invalidate();
                }
                case REJECTED -> {
                    consecutiveErrors = 0;
                    throw new BrokerRejectionException(brokerCode, call.operation(), response.status(),
                        verdict.errorCode(), verdict.message());
                }
                case TRANSIENT -> {
                    BrokerTransientException failure = new BrokerTransientException(brokerCode, call.operation(), response.status(),
                        verdict.errorCode() + ": " + verdict.message());
                    backOff(call, policy, failure);
                }
            }
        }
    }

    private void backOff(BrokerCall call, BackoffPolicy policy, BrokerTransientException failure) {
        consecutiveErrors++;
        if (errorCooldownAfter > 0 && consecutiveErrors >= errorCooldownAfter) {
            log.warn("[{}] {} consecutive errors, cooling down for {}", brokerCode, consecutiveErrors, errorCooldown);
            metrics.recordCooldown(call.operation());
            sleeper.sleep(errorCooldown);
            consecutiveErrors = 0;
        }

        Duration delay = policy.getNextDelay();
        policy.recordFailure();
        if (!policy.shouldRetry()) {
            log.error("[{}] {} failed after {} attempts: {}", brokerCode, call.operation(),
                policy.getAttemptCount(), failure.getMessage());
            throw new BrokerRetryExhaustedException(brokerCode, call.operation(), policy.getAttemptCount(), failure);
        }
        log.warn("[{}] {} retry {}/{} in {}ms ({})", brokerCode, call.operation(),
            policy.getAttemptCount(), policy.getMaxAttempts(), delay.toMillis(), failure.getMessage());
        metrics.recordRetry(call.operation(), failure.getHttpStatus() > 0
            ? String.valueOf(failure.getHttpStatus()) : "io");
        sleeper.sleep(delay);
    }

    private BrokerHttpRequest buildRequest(BrokerCall call, String token) {
        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders);
        headers.put("authorization", "Bearer " + token);
        headers.putAll(call.headers());

        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        StringBuilder uri = new StringBuilder(base).append(call.path());
        if (!call.query().isEmpty()) {
            uri.append('?').append(call.query().entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&")));
        }
        return new BrokerHttpRequest(call.method(), URI.create(uri.toString()), headers, call.body());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    int getConsecutiveErrors() {
        return consecutiveErrors;
    }
}
