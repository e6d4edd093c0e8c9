package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.job.JobRun;
import in.nextopen.domain.job.JobStatus;
import in.nextopen.domain.repository.DataAccessException;
import in.nextopen.domain.repository.JobRunRepository;
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
import java.util.ArrayList;
import java.util.List;

import static in.nextopen.infrastructure.persistence.JdbcSupport.*;

/**
 * JDBC implementation of JobRunRepository. Rows are inserted once and finished once.
 */
public final class PostgresJobRunRepository implements JobRunRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresJobRunRepository.class);

    private final DataSource dataSource;

    public PostgresJobRunRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public long start(String jobName) {
        String sql = """
            INSERT INTO job_run (job_name, started_at, status)
            VALUES (?, ?, 'RUNNING')
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, jobName);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for job_run");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            log.error("Failed to start job run {}: {}", jobName, e.getMessage());
            throw new DataAccessException("job_run.start", e);
        }
    }

    @Override
    public void finish(long id, JobStatus status, String message) {
        String sql = """
            UPDATE job_run
            SET status = ?, message = ?, finished_at = ?
            WHERE id = ? AND status = 'RUNNING'
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, truncate(message, 2000));
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setLong(4, id);
            if (ps.executeUpdate() == 0) {
                log.warn("Job run {} was not RUNNING, status {} not recorded", id, status);
            }
        } catch (SQLException e) {
            log.error("Failed to finish job run {}: {}", id, e.getMessage());
            throw new DataAccessException("job_run.finish", e);
        }
    }

    @Override
    public List<JobRun> findRecent(int limit) {
        String sql = "SELECT * FROM job_run ORDER BY id DESC LIMIT ?";

        List<JobRun> runs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find recent job runs: {}", e.getMessage());
            throw new DataAccessException("job_run.findRecent", e);
        }
        return runs;
    }

    static JobRun mapRow(ResultSet rs) throws SQLException {
        return new JobRun(
            rs.getLong("id"),
            rs.getString("job_name"),
            getInstant(rs, "started_at"),
            getInstant(rs, "finished_at"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getString("message")
        );
    }
}
