package in.nextopen.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema Migration - creates the store tables on startup.
 *
 * Tables:
 * - orders: one row per order, natural key (exec_date, code, side)
 * - positions: broker-authoritative holdings
 * - refill_progress: per-instrument backfill cursor
 * - job_run: append-only step audit
 * - daily_price: daily bars
 * - universe_members: instruments the generator scans and the refill covers
 *
 * All DDL is idempotent and portable between PostgreSQL and H2 (PostgreSQL mode).
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private static final Map<String, String> TABLES = new LinkedHashMap<>();

    static {
        TABLES.put("orders", """
            CREATE TABLE IF NOT EXISTS orders (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                exec_date DATE NOT NULL,
                signal_date DATE,
                code VARCHAR(20) NOT NULL,
                side VARCHAR(8) NOT NULL,
                qty INT NOT NULL,
                planned_price NUMERIC(20,4),
                ord_dvsn VARCHAR(10) NOT NULL,
                status VARCHAR(16) NOT NULL,
                broker_order_id VARCHAR(40),
                broker_org_id VARCHAR(40),
                filled_qty INT NOT NULL DEFAULT 0,
                avg_fill_price NUMERIC(20,4),
                message VARCHAR(500),
                signal_rank INT NOT NULL DEFAULT 0,
                sent_at TIMESTAMP,
                created_at TIMESTAMP NOT NULL,
                updated_at TIMESTAMP NOT NULL
            )
            """);
        TABLES.put("positions", """
            CREATE TABLE IF NOT EXISTS positions (
                code VARCHAR(20) PRIMARY KEY,
                name VARCHAR(100),
                qty INT NOT NULL,
                avg_price NUMERIC(20,4),
                entry_date DATE,
                updated_at TIMESTAMP NOT NULL
            )
            """);
        TABLES.put("refill_progress", """
            CREATE TABLE IF NOT EXISTS refill_progress (
                code VARCHAR(20) PRIMARY KEY,
                status VARCHAR(16),
                covered_through_date DATE,
                attempts INT NOT NULL DEFAULT 0,
                last_error VARCHAR(1000),
                updated_at TIMESTAMP NOT NULL
            )
            """);
        TABLES.put("job_run", """
            CREATE TABLE IF NOT EXISTS job_run (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                job_name VARCHAR(40) NOT NULL,
                started_at TIMESTAMP NOT NULL,
                finished_at TIMESTAMP,
                status VARCHAR(16) NOT NULL,
                message VARCHAR(2000)
            )
            """);
        TABLES.put("daily_price", """
            CREATE TABLE IF NOT EXISTS daily_price (
                code VARCHAR(20) NOT NULL,
                trade_date DATE NOT NULL,
                open_price NUMERIC(20,4),
                high_price NUMERIC(20,4),
                low_price NUMERIC(20,4),
                close_price NUMERIC(20,4) NOT NULL,
                volume BIGINT NOT NULL DEFAULT 0,
                amount NUMERIC(24,2) NOT NULL DEFAULT 0,
                PRIMARY KEY (code, trade_date)
            )
            """);
        TABLES.put("universe_members", """
            CREATE TABLE IF NOT EXISTS universe_members (
                code VARCHAR(20) PRIMARY KEY,
                name VARCHAR(100),
                market VARCHAR(20),
                listed_date DATE,
                active BOOLEAN NOT NULL DEFAULT TRUE
            )
            """);
    }

    private static final List<String> INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_orders_exec_status ON orders (exec_date, status)",
        "CREATE INDEX IF NOT EXISTS idx_orders_key ON orders (exec_date, code, side)",
        "CREATE INDEX IF NOT EXISTS idx_daily_price_date ON daily_price (trade_date)",
        "CREATE INDEX IF NOT EXISTS idx_job_run_started ON job_run (started_at)"
    );

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables and indexes.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting schema migration");

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {

            for (Map.Entry<String, String> table : TABLES.entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.debug("[MIGRATION] {} table already exists", table.getKey());
                    continue;
                }
                stmt.execute(table.getValue());
                log.info("[MIGRATION] Created {} table", table.getKey());
            }
            for (String index : INDEXES) {
                stmt.execute(index);
            }

            log.info("[MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            if (rs.next()) {
                return true;
            }
        }
        try (ResultSet rs = metadata.getTables(null, null, tableName.toUpperCase(), new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
