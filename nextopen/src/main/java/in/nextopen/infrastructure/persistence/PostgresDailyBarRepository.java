package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.data.DailyBar;
import in.nextopen.domain.repository.DailyBarRepository;
import in.nextopen.domain.repository.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static in.nextopen.infrastructure.persistence.JdbcSupport.*;

/**
 * JDBC implementation of DailyBarRepository.
 */
public final class PostgresDailyBarRepository implements DailyBarRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDailyBarRepository.class);

    private final DataSource dataSource;

    public PostgresDailyBarRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public int upsertAll(List<DailyBar> bars) {
        if (bars.isEmpty()) {
            return 0;
        }
        String updateSql = """
            UPDATE daily_price
            SET open_price = ?, high_price = ?, low_price = ?, close_price = ?, volume = ?, amount = ?
            WHERE code = ? AND trade_date = ?
            """;
        String insertSql = """
            INSERT INTO daily_price (open_price, high_price, low_price, close_price, volume, amount, code, trade_date)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement update = conn.prepareStatement(updateSql);
                 PreparedStatement insert = conn.prepareStatement(insertSql)) {

                int written = 0;
                for (DailyBar bar : bars) {
                    bind(update, bar);
                    if (update.executeUpdate() == 0) {
                        bind(insert, bar);
                        insert.executeUpdate();
                    }
                    written++;
                }
                conn.commit();
                return written;

            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to upsert {} bars for {}: {}", bars.size(), bars.get(0).code(), e.getMessage());
            throw new DataAccessException("daily_price.upsertAll", e);
        }
    }

    @Override
    public List<DailyBar> findRecent(String code, LocalDate asOf, int limit) {
        String sql = """
            SELECT * FROM daily_price
            WHERE code = ? AND trade_date <= ?
            ORDER BY trade_date DESC
            LIMIT ?
            """;

        List<DailyBar> bars = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, code);
            ps.setObject(2, asOf);
            ps.setInt(3, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    bars.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find recent bars for {}: {}", code, e.getMessage());
            throw new DataAccessException("daily_price.findRecent", e);
        }
        Collections.reverse(bars);
        return bars;
    }

    @Override
    public List<DailyBar> findByDate(LocalDate tradeDate) {
        String sql = "SELECT * FROM daily_price WHERE trade_date = ? ORDER BY code";

        List<DailyBar> bars = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, tradeDate);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    bars.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find bars for {}: {}", tradeDate, e.getMessage());
            throw new DataAccessException("daily_price.findByDate", e);
        }
        return bars;
    }

    @Override
    public List<DailyBar> findRange(String code, LocalDate from, LocalDate to) {
        String sql = """
            SELECT * FROM daily_price
            WHERE code = ? AND trade_date BETWEEN ? AND ?
            ORDER BY trade_date
            """;

        List<DailyBar> bars = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, code);
            ps.setObject(2, from);
            ps.setObject(3, to);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    bars.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find bars for {} {}..{}: {}", code, from, to, e.getMessage());
            throw new DataAccessException("daily_price.findRange", e);
        }
        return bars;
    }

    @Override
    public Optional<LocalDate> latestTradeDate() {
        String sql = "SELECT MAX(trade_date) AS latest FROM daily_price";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            if (rs.next()) {
                return Optional.ofNullable(getDate(rs, "latest"));
            }
        } catch (SQLException e) {
            log.error("Failed to find latest trade date: {}", e.getMessage());
            throw new DataAccessException("daily_price.latestTradeDate", e);
        }
        return Optional.empty();
    }

    @Override
    public Optional<LocalDate> latestTradeDate(String code) {
        String sql = "SELECT MAX(trade_date) AS latest FROM daily_price WHERE code = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(getDate(rs, "latest"));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find latest trade date for {}: {}", code, e.getMessage());
            throw new DataAccessException("daily_price.latestTradeDate", e);
        }
        return Optional.empty();
    }

    private static void bind(PreparedStatement ps, DailyBar bar) throws SQLException {
        setBigDecimalOrNull(ps, 1, bar.open());
        setBigDecimalOrNull(ps, 2, bar.high());
        setBigDecimalOrNull(ps, 3, bar.low());
        ps.setBigDecimal(4, bar.close());
        ps.setLong(5, bar.volume());
        ps.setBigDecimal(6, bar.amount() != null ? bar.amount() : BigDecimal.ZERO);
        ps.setString(7, bar.code());
        ps.setObject(8, bar.tradeDate());
    }

    private static DailyBar mapRow(ResultSet rs) throws SQLException {
        return new DailyBar(
            rs.getString("code"),
            getDate(rs, "trade_date"),
            rs.getBigDecimal("open_price"),
            rs.getBigDecimal("high_price"),
            rs.getBigDecimal("low_price"),
            rs.getBigDecimal("close_price"),
            rs.getLong("volume"),
            rs.getBigDecimal("amount")
        );
    }
}
