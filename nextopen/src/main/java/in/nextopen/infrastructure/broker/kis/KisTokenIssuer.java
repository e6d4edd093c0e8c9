package in.nextopen.infrastructure.broker.kis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.nextopen.config.NextOpenConfig.KisConfig;
import in.nextopen.infrastructure.broker.BrokerAuthenticationException;
import in.nextopen.infrastructure.broker.BrokerTransientException;
import in.nextopen.infrastructure.broker.common.BrokerHttpRequest;
import in.nextopen.infrastructure.broker.common.BrokerHttpResponse;
import in.nextopen.infrastructure.broker.common.BrokerTransport;
import in.nextopen.infrastructure.broker.common.TokenCache.TokenInfo;
import in.nextopen.infrastructure.broker.common.TokenCache.TokenIssuer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Map;

/**
 * Issues client-credentials access tokens from {@code /oauth2/tokenP}.
 */
public class KisTokenIssuer implements TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(KisTokenIssuer.class);

    private final KisConfig config;
    private final BrokerTransport transport;
    private final ObjectMapper mapper;
    private final Clock clock;

    public KisTokenIssuer(KisConfig config, BrokerTransport transport, ObjectMapper mapper, Clock clock) {
        this.config = config;
        this.transport = transport;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public TokenInfo issue() {
        ObjectNode body = mapper.createObjectNode();
        body.put("grant_type", "client_credentials");
        body.put("appkey", config.appKey());
        body.put("appsecret", config.appSecret());

        String base = config.baseUrl().toString().replaceAll("/+$", "");
        BrokerHttpRequest request = new BrokerHttpRequest("POST", URI.create(base + "/oauth2/tokenP"),
            Map.of("content-type", "application/json; charset=utf-8"), body.toString());

        BrokerHttpResponse response;
        try {
            response = transport.send(request);
        } catch (IOException e) {
            throw new BrokerTransientException(KisBrokerGateway.BROKER_CODE, "token",
                "Token request failed: " + e.getMessage(), e);
        }

        if (response.status() == 429 || response.status() >= 500) {
            throw new BrokerTransientException(KisBrokerGateway.BROKER_CODE, "token", response.status(),
                "Token endpoint unavailable: " + response.body());
        }
        if (response.status() >= 400) {
            log.error("[KIS] Token request refused: HTTP {} {}", response.status(), response.body());
            throw new BrokerAuthenticationException(KisBrokerGateway.BROKER_CODE, "token",
                "Token request refused: HTTP " + response.status());
        }

        try {
            JsonNode node = mapper.readTree(response.body());
            String accessToken = KisPayloads.text(node, "access_token");
            if (accessToken.isEmpty()) {
                throw new BrokerAuthenticationException(KisBrokerGateway.BROKER_CODE, "token",
                    "Token response has no access_token");
            }
            long expiresIn = node.path("expires_in").asLong(86400);
            return new TokenInfo(accessToken, clock.instant().plusSeconds(expiresIn));
        } catch (IOException e) {
            throw new BrokerAuthenticationException(KisBrokerGateway.BROKER_CODE, "token",
                "Unreadable token response", e);
        }
    }
}
