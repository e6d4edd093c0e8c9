package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.refill.RefillProgress;
import in.nextopen.domain.refill.RefillStatus;
import in.nextopen.domain.repository.DataAccessException;
import in.nextopen.domain.repository.RefillProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static in.nextopen.infrastructure.persistence.JdbcSupport.*;

/**
 * JDBC implementation of RefillProgressRepository.
 */
public final class PostgresRefillProgressRepository implements RefillProgressRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresRefillProgressRepository.class);

    private final DataSource dataSource;

    public PostgresRefillProgressRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<RefillProgress> findByCode(String code) {
        String sql = "SELECT * FROM refill_progress WHERE code = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find refill progress for {}: {}", code, e.getMessage());
            throw new DataAccessException("refill_progress.findByCode", e);
        }
        return Optional.empty();
    }

    @Override
    public List<RefillProgress> findIncomplete() {
        String sql = """
            SELECT * FROM refill_progress
            WHERE status IS NULL OR status <> 'DONE'
            ORDER BY code
            """;

        List<RefillProgress> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                rows.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to find incomplete refill progress: {}", e.getMessage());
            throw new DataAccessException("refill_progress.findIncomplete", e);
        }
        return rows;
    }

    @Override
    public int insertMissing(Collection<String> codes) {
        String insertSql = """
            INSERT INTO refill_progress (code, status, covered_through_date, attempts, updated_at)
            VALUES (?, NULL, NULL, 0, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            Set<String> existing = new HashSet<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT code FROM refill_progress")) {
                while (rs.next()) {
                    existing.add(rs.getString("code"));
                }
            }

            int inserted = 0;
            Timestamp now = Timestamp.from(Instant.now());
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                for (String code : codes) {
                    if (!existing.add(code)) {
                        continue;
                    }
                    ps.setString(1, code);
                    ps.setTimestamp(2, now);
                    ps.addBatch();
                    inserted++;
                }
                if (inserted > 0) {
                    ps.executeBatch();
                }
            }
            return inserted;

        } catch (SQLException e) {
            log.error("Failed to insert missing refill progress rows: {}", e.getMessage());
            throw new DataAccessException("refill_progress.insertMissing", e);
        }
    }

    @Override
    public void markInProgress(String code) {
        String sql = """
            UPDATE refill_progress
            SET status = 'IN_PROGRESS', attempts = attempts + 1, updated_at = ?
            WHERE code = ? AND (status IS NULL OR status <> 'DONE')
            """;
        executeUpdate("refill_progress.markInProgress", sql, code, ps -> {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, code);
        });
    }

    @Override
    public boolean advance(String code, LocalDate coveredThrough) {
        String sql = """
            UPDATE refill_progress
            SET covered_through_date = ?, updated_at = ?
            WHERE code = ? AND (covered_through_date IS NULL OR covered_through_date < ?)
            """;
        return executeUpdate("refill_progress.advance", sql, code, ps -> {
            ps.setObject(1, coveredThrough);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, code);
            ps.setObject(4, coveredThrough);
        }) == 1;
    }

    @Override
    public void markDone(String code) {
        String sql = """
            UPDATE refill_progress
            SET status = 'DONE', last_error = NULL, updated_at = ?
            WHERE code = ?
            """;
        executeUpdate("refill_progress.markDone", sql, code, ps -> {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, code);
        });
    }

    @Override
    public void recordError(String code, String error) {
        String sql = """
            UPDATE refill_progress
            SET last_error = ?, updated_at = ?
            WHERE code = ?
            """;
        executeUpdate("refill_progress.recordError", sql, code, ps -> {
            ps.setString(1, truncate(error, 1000));
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, code);
        });
    }

    private int executeUpdate(String operation, String sql, String code, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed {} for {}: {}", operation, code, e.getMessage());
            throw new DataAccessException(operation, e);
        }
    }

    private RefillProgress mapRow(ResultSet rs) throws SQLException {
        String status = rs.getString("status");
        return new RefillProgress(
            rs.getString("code"),
            status != null ? RefillStatus.valueOf(status) : null,
            getDate(rs, "covered_through_date"),
            rs.getInt("attempts"),
            rs.getString("last_error"),
            getInstant(rs, "updated_at")
        );
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
