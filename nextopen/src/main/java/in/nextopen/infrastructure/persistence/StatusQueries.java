package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.job.JobRun;
import in.nextopen.domain.order.OrderStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static in.nextopen.infrastructure.persistence.JdbcSupport.getDate;

/**
 * Read-only status queries. Each function takes an open connection and returns plain records.
 */
public final class StatusQueries {

    private StatusQueries() {}

    public record OrderStatusCount(LocalDate execDate, OrderStatus status, int count) {}

    public record RefillSummary(
        int total,
        int done,
        int inProgress,
        int unset,
        int withErrors,
        LocalDate minCoveredThrough,
        LocalDate maxCoveredThrough
    ) {}

    /**
     * Order counts per status for {@code execDate}.
     */
    public static List<OrderStatusCount> orderStatusCounts(Connection conn, LocalDate execDate) throws SQLException {
        String sql = """
            SELECT status, COUNT(*) AS cnt FROM orders
            WHERE exec_date = ?
            GROUP BY status
            ORDER BY status
            """;

        List<OrderStatusCount> counts = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, execDate);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.add(new OrderStatusCount(execDate,
                        OrderStatus.valueOf(rs.getString("status")), rs.getInt("cnt")));
                }
            }
        }
        return counts;
    }

    public static RefillSummary refillSummary(Connection conn) throws SQLException {
        String sql = """
            SELECT
                COUNT(*) AS total,
                SUM(CASE WHEN status = 'DONE' THEN 1 ELSE 0 END) AS done_cnt,
                SUM(CASE WHEN status = 'IN_PROGRESS' THEN 1 ELSE 0 END) AS in_progress_cnt,
                SUM(CASE WHEN status IS NULL THEN 1 ELSE 0 END) AS unset_cnt,
                SUM(CASE WHEN last_error IS NOT NULL THEN 1 ELSE 0 END) AS error_cnt,
                MIN(covered_through_date) AS min_covered,
                MAX(covered_through_date) AS max_covered
            FROM refill_progress
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return new RefillSummary(0, 0, 0, 0, 0, null, null);
            }
            return new RefillSummary(
                rs.getInt("total"),
                rs.getInt("done_cnt"),
                rs.getInt("in_progress_cnt"),
                rs.getInt("unset_cnt"),
                rs.getInt("error_cnt"),
                getDate(rs, "min_covered"),
                getDate(rs, "max_covered")
            );
        }
    }

    public static List<JobRun> recentJobRuns(Connection conn, int limit) throws SQLException {
        String sql = "SELECT * FROM job_run ORDER BY id DESC LIMIT ?";

        List<JobRun> runs = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(PostgresJobRunRepository.mapRow(rs));
                }
            }
        }
        return runs;
    }
}
