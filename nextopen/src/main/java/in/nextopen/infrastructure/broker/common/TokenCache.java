package in.nextopen.infrastructure.broker.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.nextopen.infrastructure.broker.BrokerAuthenticationException;
import in.nextopen.infrastructure.broker.BrokerException;
import in.nextopen.infrastructure.broker.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Lazily refreshed access token with an on-disk cache.
 *
 * Features:
 * - Token is issued only when missing, expiring within the refresh window, or invalidated
 * - Cache file survives process restarts (one short-lived process per step)
 * - Cache entries are scoped so a paper token is never used against production
 *
 * There is no background refresh: each step is a short process and asks for the token
 * right before every call.
 */
public class TokenCache {

    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);

    private final String brokerCode;
    private final String scope;
    private final TokenIssuer issuer;
    private final Duration refreshWindow;
    private final Path cacheFile;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final GatewayMetrics metrics;

    private TokenInfo currentToken;
    private boolean fileChecked = false;

    public TokenCache(String brokerCode, String scope, TokenIssuer issuer, Duration refreshWindow,
                      Path cacheFile, ObjectMapper mapper, Clock clock, GatewayMetrics metrics) {
        this.brokerCode = brokerCode;
        this.scope = scope;
        this.issuer = issuer;
        this.refreshWindow = refreshWindow;
        this.cacheFile = cacheFile;
        this.mapper = mapper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Get a token valid for at least the refresh window, issuing a new one if needed.
     *
     * @throws BrokerException if no token can be issued
     */
    public synchronized String getToken() {
        if (currentToken == null && !fileChecked) {
            fileChecked = true;
            currentToken = loadFromFile();
        }
        if (currentToken == null || isExpiring(currentToken)) {
            currentToken = refresh();
        }
        return currentToken.accessToken();
    }

    /**
     * Drop the current token after the brokerage refused it. The next {@link #getToken()} issues a new one.
     */
    public synchronized void invalidate() {
        log.info("[{}] Invalidating cached token", brokerCode);
        currentToken = null;
        fileChecked = true;
        if (cacheFile != null) {
            try {
                Files.deleteIfExists(cacheFile);
            } catch (IOException e) {
                log.warn("[{}] Failed to delete token cache {}: {}", brokerCode, cacheFile, e.getMessage());
            }
        }
    }

    public synchronized TokenInfo getTokenInfo() {
        return currentToken;
    }

    private boolean isExpiring(TokenInfo token) {
        return !clock.instant().isBefore(token.expiresAt().minus(refreshWindow));
    }

    private TokenInfo refresh() {
        log.debug("[{}] Issuing access token", brokerCode);
        TokenInfo token;
        try {
            token = issuer.issue();
        } catch (BrokerException e) {
            metrics.recordTokenRefresh(false);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordTokenRefresh(false);
            throw new BrokerAuthenticationException(brokerCode, "token", "Token issue failed: " + e.getMessage(), e);
        }
        if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
            metrics.recordTokenRefresh(false);
            throw new BrokerAuthenticationException(brokerCode, "token", "Token issuer returned no token");
        }
        metrics.recordTokenRefresh(true);
        log.info("[{}] Token issued, expires at {}", brokerCode, token.expiresAt());
        saveToFile(token);
        return token;
    }

    private TokenInfo loadFromFile() {
        if (cacheFile == null || !Files.exists(cacheFile)) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(cacheFile.toFile());
            if (!scope.equals(node.path("scope").asText())) {
                log.info("[{}] Token cache {} belongs to another scope, ignoring", brokerCode, cacheFile);
                return null;
            }
            String accessToken = node.path("access_token").asText(null);
            long expiresAtEpoch = node.path("expires_at_epoch").asLong(0);
            if (accessToken == null || expiresAtEpoch <= 0) {
                return null;
            }
            TokenInfo token = new TokenInfo(accessToken, Instant.ofEpochSecond(expiresAtEpoch));
            if (isExpiring(token)) {
                log.info("[{}] Cached token expires at {}, refreshing", brokerCode, token.expiresAt());
                return null;
            }
            log.debug("[{}] Using cached token valid until {}", brokerCode, token.expiresAt());
            return token;
        } catch (IOException e) {
            log.warn("[{}] Unreadable token cache {}: {}", brokerCode, cacheFile, e.getMessage());
            return null;
        }
    }

    private void saveToFile(TokenInfo token) {
        if (cacheFile == null) {
            return;
        }
        ObjectNode node = mapper.createObjectNode();
        node.put("scope", scope);
        node.put("access_token", token.accessToken());
        node.put("expires_at_epoch", token.expiresAt().getEpochSecond());
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(cacheFile.toFile(), node);
        } catch (IOException e) {
            log.warn("[{}] Failed to write token cache {}: {}", brokerCode, cacheFile, e.getMessage());
        }
    }

    /**
     * Issues a fresh token from the brokerage.
     */
    @FunctionalInterface
    public interface TokenIssuer {
        TokenInfo issue();
    }

    public record TokenInfo(String accessToken, Instant expiresAt) {}
}
