package in.nextopen.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.nextopen.config.NextOpenConfig;
import in.nextopen.config.NextOpenConfig.DatabaseConfig;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.repository.DailyBarRepository;
import in.nextopen.domain.repository.DataAccessException;
import in.nextopen.domain.repository.InstrumentRepository;
import in.nextopen.domain.repository.OrderRepository;
import in.nextopen.domain.repository.PositionRepository;
import in.nextopen.domain.repository.RefillProgressRepository;
import in.nextopen.infrastructure.broker.common.Sleeper;
import in.nextopen.infrastructure.broker.kis.KisBrokerGateway;
import in.nextopen.infrastructure.broker.metrics.MetricsTextfileWriter;
import in.nextopen.infrastructure.broker.metrics.PrometheusGatewayMetrics;
import in.nextopen.infrastructure.lease.FileExclusiveLease;
import in.nextopen.infrastructure.notify.LoggingNotifier;
import in.nextopen.infrastructure.notify.Notifier;
import in.nextopen.infrastructure.notify.WebhookNotifier;
import in.nextopen.infrastructure.persistence.PostgresDailyBarRepository;
import in.nextopen.infrastructure.persistence.PostgresInstrumentRepository;
import in.nextopen.infrastructure.persistence.PostgresJobRunRepository;
import in.nextopen.infrastructure.persistence.PostgresOrderRepository;
import in.nextopen.infrastructure.persistence.PostgresPositionRepository;
import in.nextopen.infrastructure.persistence.PostgresRefillProgressRepository;
import in.nextopen.infrastructure.persistence.StatusQueries;
import in.nextopen.migration.SchemaMigration;
import in.nextopen.service.calendar.SessionCalendar;
import in.nextopen.service.execution.OrderCancellationService;
import in.nextopen.service.execution.OrderDispatchService;
import in.nextopen.service.execution.OrderGenerationService;
import in.nextopen.service.execution.OrderReconciliationService;
import in.nextopen.service.job.JobRecorder;
import in.nextopen.service.refill.IncrementalBarLoader;
import in.nextopen.service.refill.ListingDateEnrichment;
import in.nextopen.service.refill.RefillAudit;
import in.nextopen.service.refill.RefillCoordinator;
import in.nextopen.service.signal.SignalGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Command-line entry point. One invocation runs one step and exits.
 *
 * Exit codes: 0 on SUCCESS or SKIPPED, 1 on FAILED or any error, 2 on usage error.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final int LISTING_LOOKUPS_PER_RUN = 50;
    private static final int STATUS_RECENT_JOBS = 20;

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Invocation invocation;
        try {
            invocation = Invocation.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(Invocation.USAGE);
            return EXIT_USAGE;
        }

        NextOpenConfig config = NextOpenConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config, invocation.command().requiresBroker());
        } catch (IllegalStateException e) {
            log.error("STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            return EXIT_FAILED;
        }

        try (HikariDataSource dataSource = createDataSource(config.database())) {
            new SchemaMigration(dataSource).migrate();
            return execute(invocation, config, dataSource);
        } catch (RuntimeException e) {
            log.error("{} aborted", invocation.command().jobName(), e);
            return EXIT_FAILED;
        }
    }

    static int execute(Invocation invocation, NextOpenConfig config, DataSource dataSource) {
        ObjectMapper mapper = createObjectMapper();
        Clock clock = Clock.systemUTC();
        LocalDate today = invocation.date().orElseGet(() -> SessionCalendar.today(clock, config.marketZone()));
        Command command = invocation.command();

        if (command == Command.STATUS) {
            printStatus(dataSource, today, mapper);
            return EXIT_OK;
        }

        OrderRepository orderRepo = new PostgresOrderRepository(dataSource);
        PositionRepository positionRepo = new PostgresPositionRepository(dataSource);
        DailyBarRepository dailyBarRepo = new PostgresDailyBarRepository(dataSource);
        InstrumentRepository instrumentRepo = new PostgresInstrumentRepository(dataSource);
        JobRecorder recorder = new JobRecorder(new PostgresJobRunRepository(dataSource), createNotifier(config, mapper));

        PrometheusGatewayMetrics metrics = command.requiresBroker()
            ? new PrometheusGatewayMetrics(KisBrokerGateway.BROKER_CODE)
            : null;
        KisBrokerGateway gateway = command.requiresBroker()
            ? KisBrokerGateway.create(config, mapper, Sleeper.system(), metrics, clock)
            : null;

        Supplier<StepResult> step = switch (command) {
            case CLOSE -> {
                SignalGenerator signals = new SignalGenerator(dailyBarRepo, instrumentRepo, config.strategy());
                OrderGenerationService service = new OrderGenerationService(orderRepo, positionRepo, dailyBarRepo, signals);
                yield () -> service.run(invocation.date());
            }
            case OPEN -> {
                OrderDispatchService service = new OrderDispatchService(orderRepo, gateway);
                yield () -> service.run(today);
            }
            case SYNC -> {
                OrderReconciliationService service = new OrderReconciliationService(orderRepo, positionRepo, gateway);
                yield () -> service.run(today);
            }
            case CANCEL -> {
                OrderCancellationService service = new OrderCancellationService(orderRepo, gateway);
                yield () -> service.run(today);
            }
            case REFILL -> {
                RefillProgressRepository progressRepo = new PostgresRefillProgressRepository(dataSource);
                RefillCoordinator coordinator = new RefillCoordinator(config.refill(),
                    new FileExclusiveLease(config.refill().lockPath()), instrumentRepo, progressRepo, dailyBarRepo,
                    gateway, new RefillAudit(instrumentRepo, progressRepo),
                    List.of(new ListingDateEnrichment(instrumentRepo, gateway, LISTING_LOOKUPS_PER_RUN)),
                    Sleeper.system());
                yield () -> coordinator.run(today);
            }
            case DAILY -> {
                IncrementalBarLoader loader = new IncrementalBarLoader(config.refill(),
                    new FileExclusiveLease(config.refill().lockPath()), instrumentRepo,
                    new PostgresRefillProgressRepository(dataSource), dailyBarRepo, gateway, Sleeper.system());
                yield () -> loader.run(today);
            }
            default -> throw new IllegalArgumentException("Not a step: " + command);
        };

        try {
            StepResult result = recorder.record(command.jobName(), step);
            return result.isFailure() ? EXIT_FAILED : EXIT_OK;
        } finally {
            if (metrics != null && config.metricsTextfileDir() != null) {
                new MetricsTextfileWriter(metrics.getRegistry()).write(config.metricsTextfileDir(), command.jobName());
            }
        }
    }

    /**
     * Read-only snapshot of orders for {@code execDate}, refill coverage and recent job runs.
     */
    static Map<String, Object> buildStatus(DataSource dataSource, LocalDate execDate) {
        try (Connection conn = dataSource.getConnection()) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("exec_date", execDate);
            status.put("orders", StatusQueries.orderStatusCounts(conn, execDate));
            status.put("refill", StatusQueries.refillSummary(conn));
            status.put("recent_jobs", StatusQueries.recentJobRuns(conn, STATUS_RECENT_JOBS));
            return status;
        } catch (SQLException e) {
            throw new DataAccessException("status", e);
        }
    }

    private static void printStatus(DataSource dataSource, LocalDate execDate, ObjectMapper mapper) {
        try {
            System.out.println(mapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(buildStatus(dataSource, execDate)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render status", e);
        }
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static Notifier createNotifier(NextOpenConfig config, ObjectMapper mapper) {
        Notifier logging = new LoggingNotifier();
        if (config.notifications().webhookUrl() == null) {
            return logging;
        }
        return new WebhookNotifier(config.notifications().webhookUrl(), mapper, logging);
    }

    private static HikariDataSource createDataSource(DatabaseConfig db) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(db.url());
        config.setUsername(db.user());
        config.setPassword(db.password());
        config.setMaximumPoolSize(db.poolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("nextopen-hikari");

        log.info("DB: url={}, user={}, pool={}", db.url(), db.user(), db.poolSize());
        return new HikariDataSource(config);
    }
}
