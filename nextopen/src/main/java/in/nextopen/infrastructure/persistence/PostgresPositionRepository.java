package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.position.Position;
import in.nextopen.domain.repository.DataAccessException;
import in.nextopen.domain.repository.PositionRepository;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static in.nextopen.infrastructure.persistence.JdbcSupport.*;

/**
 * JDBC implementation of PositionRepository.
 */
public final class PostgresPositionRepository implements PositionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresPositionRepository.class);

    private final DataSource dataSource;

    public PostgresPositionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Position> findAll() {
        String sql = "SELECT * FROM positions ORDER BY code";

        List<Position> positions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                positions.add(new Position(
                    rs.getString("code"),
                    rs.getString("name"),
                    rs.getInt("qty"),
                    rs.getBigDecimal("avg_price"),
                    getDate(rs, "entry_date"),
                    getInstant(rs, "updated_at")
                ));
            }
        } catch (SQLException e) {
            log.error("Failed to find positions: {}", e.getMessage());
            throw new DataAccessException("positions.findAll", e);
        }
        return positions;
    }

    @Override
    public void replaceAll(List<Position> positions) {
        String insertSql = """
            INSERT INTO positions (code, name, qty, avg_price, entry_date, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Map<String, LocalDate> entryDates = new HashMap<>();
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery("SELECT code, entry_date FROM positions")) {
                    while (rs.next()) {
                        LocalDate entryDate = getDate(rs, "entry_date");
                        if (entryDate != null) {
                            entryDates.put(rs.getString("code"), entryDate);
                        }
                    }
                }

                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate("DELETE FROM positions");
                }

                Timestamp now = Timestamp.from(Instant.now());
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    for (Position position : positions) {
                        ps.setString(1, position.code());
                        ps.setString(2, position.name());
                        ps.setInt(3, position.qty());
                        setBigDecimalOrNull(ps, 4, position.avgPrice());
                        setDateOrNull(ps, 5, entryDates.getOrDefault(position.code(), position.entryDate()));
                        ps.setTimestamp(6, now);
                        ps.addBatch();
                    }
                    if (!positions.isEmpty()) {
                        ps.executeBatch();
                    }
                }

                conn.commit();
                log.info("Positions replaced: {} holdings (previously {})", positions.size(), entryDates.size());

            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to replace positions: {}", e.getMessage());
            throw new DataAccessException("positions.replaceAll", e);
        }
    }
}
