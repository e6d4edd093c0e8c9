package in.nextopen.bootstrap;

import in.nextopen.config.NextOpenConfig;
import in.nextopen.config.NextOpenConfig.GatewayConfig;
import in.nextopen.config.NextOpenConfig.KisConfig;
import in.nextopen.config.NextOpenConfig.RefillConfig;
import in.nextopen.config.NextOpenConfig.StrategyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before any connection is opened. Throws IllegalStateException listing every
 * problem found so the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * About 100 trading days, the most one KIS daily-chart inquiry returns.
     */
    static final int MAX_REFILL_CHUNK_DAYS = 140;

    private StartupConfigValidator() {}

    /**
     * @param requiresBroker whether the command talks to the brokerage (credentials become mandatory)
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(NextOpenConfig config, boolean requiresBroker) {
        List<String> problems = new ArrayList<>();

        if (isBlank(config.database().url())) {
            problems.add("DB_URL must be set");
        }
        if (config.database().poolSize() < 1) {
            problems.add("DB_POOL_SIZE must be at least 1");
        }

        KisConfig kis = config.kis();
        if (!KisConfig.PAPER.equals(kis.env()) && !KisConfig.PROD.equals(kis.env())) {
            problems.add("KIS_ENV must be 'paper' or 'prod', got '" + kis.env() + "'");
        }
        if (requiresBroker) {
            if (isBlank(kis.appKey())) {
                problems.add("KIS_APP_KEY must be set");
            }
            if (isBlank(kis.appSecret())) {
                problems.add("KIS_APP_SECRET must be set");
            }
            if (isBlank(kis.accountNo())) {
                problems.add("KIS_ACCOUNT_NO must be set");
            }
        }

        validateGateway(config.gateway(), problems);
        validateStrategy(config.strategy(), problems);
        validateRefill(config.refill(), problems);

        if (!problems.isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG:\n  - " + String.join("\n  - ", problems));
        }
        log.info("Startup config validation passed (kis_env={}, broker={})", kis.env(), requiresBroker);
    }

    private static void validateGateway(GatewayConfig gateway, List<String> problems) {
        if (gateway.minInterval().isNegative()) {
            problems.add("GATEWAY_MIN_INTERVAL_MS must not be negative");
        }
        if (gateway.maxAttempts() < 1) {
            problems.add("GATEWAY_MAX_ATTEMPTS must be at least 1");
        }
        if (gateway.backoffBase().isNegative() || gateway.backoffMax().compareTo(gateway.backoffBase()) < 0) {
            problems.add("GATEWAY_BACKOFF_MAX_MS must be >= GATEWAY_BACKOFF_BASE_MS >= 0");
        }
        if (gateway.errorCooldownAfter() < 1) {
            problems.add("GATEWAY_ERROR_COOLDOWN_AFTER must be at least 1");
        }
    }

    private static void validateStrategy(StrategyConfig strategy, List<String> problems) {
        if (strategy.maWindow() < 1 || strategy.minMaBars() < 1 || strategy.minMaBars() > strategy.maWindow()) {
            problems.add("TRADING_MIN_MA_BARS must be between 1 and TRADING_MA_WINDOW");
        }
        if (strategy.liquidityRank() < 1) {
            problems.add("TRADING_LIQUIDITY_RANK must be at least 1");
        }
        if (strategy.orderValue().signum() <= 0) {
            problems.add("TRADING_ORDER_VALUE must be positive");
        }
        if (strategy.maxPositions() < 0) {
            problems.add("TRADING_MAX_POSITIONS must not be negative");
        }
        if (strategy.maxHoldDays() < 1) {
            problems.add("TRADING_MAX_HOLD_DAYS must be at least 1");
        }
        if (strategy.stopLossPct().signum() < 0 || strategy.takeProfitPct().signum() < 0) {
            problems.add("TRADING_STOP_LOSS_PCT and TRADING_TAKE_PROFIT_PCT must not be negative");
        }
        if (strategy.buyThresholdKospi().compareTo(BigDecimal.ZERO) > 0
                || strategy.buyThresholdKosdaq().compareTo(BigDecimal.ZERO) > 0) {
            log.warn("Positive buy thresholds buy above the moving average (kospi={}, kosdaq={})",
                strategy.buyThresholdKospi(), strategy.buyThresholdKosdaq());
        }
    }

    private static void validateRefill(RefillConfig refill, List<String> problems) {
        if (refill.chunkDays() < 1 || refill.chunkDays() > MAX_REFILL_CHUNK_DAYS) {
            problems.add("REFILL_CHUNK_DAYS must be between 1 and " + MAX_REFILL_CHUNK_DAYS);
        }
        if (refill.horizonDays() < 1) {
            problems.add("REFILL_HORIZON_DAYS must be at least 1");
        }
        if (refill.maxCodes() < 0) {
            problems.add("REFILL_MAX_CODES must not be negative");
        }
        if (refill.cooldown().isNegative()) {
            problems.add("REFILL_COOLDOWN_MS must not be negative");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
