package in.nextopen.config;

import in.nextopen.domain.order.OrderType;
import in.nextopen.util.Env;

import java.math.BigDecimal;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Immutable runtime configuration, read once from the environment and handed to
 * every component.
 */
public record NextOpenConfig(
    ZoneId marketZone,
    DatabaseConfig database,
    KisConfig kis,
    GatewayConfig gateway,
    StrategyConfig strategy,
    RefillConfig refill,
    NotifyConfig notifications,
    Path metricsTextfileDir
) {

    public static NextOpenConfig fromEnv() {
        String metricsDir = Env.get("METRICS_TEXTFILE_DIR", null);
        return new NextOpenConfig(
            ZoneId.of(Env.get("MARKET_ZONE", "Asia/Seoul")),
            DatabaseConfig.fromEnv(),
            KisConfig.fromEnv(),
            GatewayConfig.fromEnv(),
            StrategyConfig.fromEnv(),
            RefillConfig.fromEnv(),
            NotifyConfig.fromEnv(),
            metricsDir != null ? Path.of(metricsDir) : null
        );
    }

    public record DatabaseConfig(String url, String user, String password, int poolSize) {
        static DatabaseConfig fromEnv() {
            return new DatabaseConfig(
                Env.get("DB_URL", "jdbc:postgresql://localhost:5432/nextopen"),
                Env.get("DB_USER", "postgres"),
                Env.get("DB_PASS", "postgres"),
                Env.getInt("DB_POOL_SIZE", 4)
            );
        }
    }

    /**
     * Brokerage account and endpoint settings.
     */
    public record KisConfig(
        String env,
        URI baseUrl,
        String appKey,
        String appSecret,
        String accountNo,
        String accountProduct,
        String custType,
        Path tokenCachePath
    ) {
        public static final String PAPER = "paper";
        public static final String PROD = "prod";

        static KisConfig fromEnv() {
            String env = Env.get("KIS_ENV", PAPER).toLowerCase();
            String defaultUrl = PROD.equals(env)
                ? "https://openapi.koreainvestment.com:9443"
                : "https://openapivts.koreainvestment.com:29443";
            return new KisConfig(
                env,
                URI.create(Env.get("KIS_BASE_URL", defaultUrl)),
                Env.get("KIS_APP_KEY", null),
                Env.get("KIS_APP_SECRET", null),
                Env.get("KIS_ACCOUNT_NO", null),
                Env.get("KIS_ACNT_PRDT_CD", "01"),
                Env.get("KIS_CUSTTYPE", "P"),
                Path.of(Env.get("KIS_TOKEN_CACHE_PATH", ".cache/kis_token.json"))
            );
        }

        public boolean isPaper() {
            return !PROD.equals(env);
        }
    }

    /**
     * Pacing and retry settings for outbound brokerage calls.
     */
    public record GatewayConfig(
        Duration minInterval,
        int maxAttempts,
        Duration backoffBase,
        Duration backoffMax,
        double backoffMultiplier,
        Duration connectTimeout,
        Duration readTimeout,
        int errorCooldownAfter,
        Duration errorCooldown,
        Duration tokenRefreshWindow
    ) {
        static GatewayConfig fromEnv() {
            return new GatewayConfig(
                Duration.ofMillis(Env.getLong("GATEWAY_MIN_INTERVAL_MS", 500)),
                Env.getInt("GATEWAY_MAX_ATTEMPTS", 8),
                Duration.ofMillis(Env.getLong("GATEWAY_BACKOFF_BASE_MS", 2000)),
                Duration.ofMillis(Env.getLong("GATEWAY_BACKOFF_MAX_MS", 60000)),
                2.0,
                Duration.ofSeconds(Env.getLong("GATEWAY_CONNECT_TIMEOUT_SEC", 5)),
                Duration.ofSeconds(Env.getLong("GATEWAY_READ_TIMEOUT_SEC", 20)),
                Env.getInt("GATEWAY_ERROR_COOLDOWN_AFTER", 10),
                Duration.ofSeconds(Env.getLong("GATEWAY_ERROR_COOLDOWN_SEC", 180)),
                Duration.ofMinutes(Env.getLong("GATEWAY_TOKEN_REFRESH_WINDOW_MIN", 5))
            );
        }
    }

    /**
     * Signal thresholds and sizing rules for the close step.
     */
    public record StrategyConfig(
        BigDecimal minAmount,
        int liquidityRank,
        int maWindow,
        int minMaBars,
        BigDecimal buyThresholdKospi,
        BigDecimal buyThresholdKosdaq,
        BigDecimal orderValue,
        int maxPositions,
        OrderType orderType,
        int maxHoldDays,
        BigDecimal stopLossPct,
        BigDecimal takeProfitPct
    ) {
        static StrategyConfig fromEnv() {
            return new StrategyConfig(
                Env.getDecimal("TRADING_MIN_AMOUNT", "1000000000"),
                Env.getInt("TRADING_LIQUIDITY_RANK", 300),
                Env.getInt("TRADING_MA_WINDOW", 25),
                Env.getInt("TRADING_MIN_MA_BARS", 5),
                Env.getDecimal("TRADING_BUY_KOSPI", "-0.15"),
                Env.getDecimal("TRADING_BUY_KOSDAQ", "-0.20"),
                Env.getDecimal("TRADING_ORDER_VALUE", "1000000"),
                Env.getInt("TRADING_MAX_POSITIONS", 10),
                OrderType.parse(Env.get("TRADING_ORD_DVSN", "MARKET")),
                Env.getInt("TRADING_MAX_HOLD_DAYS", 3),
                Env.getDecimal("TRADING_STOP_LOSS_PCT", "0.05"),
                Env.getDecimal("TRADING_TAKE_PROFIT_PCT", "0.10")
            );
        }
    }

    /**
     * Historical backfill settings.
     */
    public record RefillConfig(
        int chunkDays,
        Duration cooldown,
        int horizonDays,
        int maxCodes,
        Path lockPath
    ) {
        static RefillConfig fromEnv() {
            return new RefillConfig(
                Env.getInt("REFILL_CHUNK_DAYS", 90),
                Duration.ofMillis(Env.getLong("REFILL_COOLDOWN_MS", 100)),
                Env.getInt("REFILL_HORIZON_DAYS", 3650),
                Env.getInt("REFILL_MAX_CODES", 0),
                Path.of(Env.get("REFILL_LOCK_PATH", "data/locks/refill.lock"))
            );
        }
    }

    public record NotifyConfig(URI webhookUrl) {
        static NotifyConfig fromEnv() {
            String url = Env.get("NOTIFY_WEBHOOK_URL", null);
            return new NotifyConfig(url != null ? URI.create(url) : null);
        }
    }
}
