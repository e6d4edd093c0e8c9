package in.nextopen.bootstrap;

import in.nextopen.config.NextOpenConfig;
import in.nextopen.config.NextOpenConfig.DatabaseConfig;
import in.nextopen.config.NextOpenConfig.GatewayConfig;
import in.nextopen.config.NextOpenConfig.KisConfig;
import in.nextopen.config.NextOpenConfig.NotifyConfig;
import in.nextopen.config.NextOpenConfig.RefillConfig;
import in.nextopen.testsupport.TestConfigs;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StartupConfigValidator.
 *
 * Tests:
 * - Valid configuration passes
 * - Credentials are required only for broker commands
 * - Every problem is reported at once
 */
class StartupConfigValidatorTest {

    private static final GatewayConfig GATEWAY = new GatewayConfig(Duration.ofMillis(500), 8,
        Duration.ofSeconds(2), Duration.ofSeconds(60), 2.0, Duration.ofSeconds(5), Duration.ofSeconds(20),
        10, Duration.ofSeconds(180), Duration.ofMinutes(5));

    private static KisConfig kis(String env, String appKey) {
        return new KisConfig(env, URI.create("https://kis.test:29443"), appKey, "secret", "12345678",
            "01", "P", Path.of("token.json"));
    }

    private static NextOpenConfig config(DatabaseConfig database, KisConfig kis, RefillConfig refill) {
        return new NextOpenConfig(ZoneId.of("Asia/Seoul"), database, kis, GATEWAY, TestConfigs.strategy(),
            refill, new NotifyConfig(null), null);
    }

    private static NextOpenConfig valid(KisConfig kis) {
        return config(new DatabaseConfig("jdbc:postgresql://localhost/nextopen", "u", "p", 4), kis,
            TestConfigs.refill(90, 3650, 0, Path.of("refill.lock")));
    }

    @Test
    void validConfigPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(valid(kis("paper", "key")), true));
    }

    @Test
    void credentialsOnlyRequiredForBrokerCommands() {
        NextOpenConfig noKey = valid(kis("paper", null));

        assertDoesNotThrow(() -> StartupConfigValidator.validate(noKey, false));
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(noKey, true));
        assertTrue(e.getMessage().contains("KIS_APP_KEY"), e.getMessage());
    }

    @Test
    void reportsEveryProblem() {
        NextOpenConfig broken = config(new DatabaseConfig(" ", "u", "p", 0), kis("live", "key"),
            TestConfigs.refill(0, 3650, -1, Path.of("refill.lock")));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(broken, false));

        String message = e.getMessage();
        assertTrue(message.startsWith("INVALID CONFIG"), message);
        assertTrue(message.contains("DB_URL"), message);
        assertTrue(message.contains("DB_POOL_SIZE"), message);
        assertTrue(message.contains("KIS_ENV"), message);
        assertTrue(message.contains("REFILL_CHUNK_DAYS"), message);
        assertTrue(message.contains("REFILL_MAX_CODES"), message);
    }

    @Test
    void refillChunkMustFitOneHistoryResponse() {
        NextOpenConfig wide = config(new DatabaseConfig("jdbc:postgresql://localhost/nextopen", "u", "p", 4),
            kis("paper", "key"), TestConfigs.refill(150, 3650, 0, Path.of("refill.lock")));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(wide, false));
        assertTrue(e.getMessage().contains("REFILL_CHUNK_DAYS must be between 1 and 140"), e.getMessage());
    }
}
