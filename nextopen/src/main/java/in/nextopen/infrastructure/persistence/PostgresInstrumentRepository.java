package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.repository.DataAccessException;
import in.nextopen.domain.repository.InstrumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static in.nextopen.infrastructure.persistence.JdbcSupport.*;

/**
 * JDBC implementation of InstrumentRepository over {@code universe_members}.
 */
public final class PostgresInstrumentRepository implements InstrumentRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresInstrumentRepository.class);

    private final DataSource dataSource;

    public PostgresInstrumentRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Instrument> findActive() {
        String sql = "SELECT * FROM universe_members WHERE active = TRUE ORDER BY code";

        List<Instrument> instruments = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                instruments.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to find active instruments: {}", e.getMessage());
            throw new DataAccessException("universe_members.findActive", e);
        }
        return instruments;
    }

    @Override
    public Optional<Instrument> findByCode(String code) {
        String sql = "SELECT * FROM universe_members WHERE code = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find instrument {}: {}", code, e.getMessage());
            throw new DataAccessException("universe_members.findByCode", e);
        }
        return Optional.empty();
    }

    @Override
    public void save(Instrument instrument) {
        String updateSql = """
            UPDATE universe_members
            SET name = ?, market = ?, listed_date = ?, active = ?
            WHERE code = ?
            """;
        String insertSql = """
            INSERT INTO universe_members (name, market, listed_date, active, code)
            VALUES (?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                bind(ps, instrument);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    bind(ps, instrument);
                    ps.executeUpdate();
                }
            }
        } catch (SQLException e) {
            log.error("Failed to save instrument {}: {}", instrument.code(), e.getMessage());
            throw new DataAccessException("universe_members.save", e);
        }
    }

    @Override
    public void updateListedDate(String code, LocalDate listedDate) {
        String sql = "UPDATE universe_members SET listed_date = ? WHERE code = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, listedDate);
            ps.setString(2, code);
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to update listed date for {}: {}", code, e.getMessage());
            throw new DataAccessException("universe_members.updateListedDate", e);
        }
    }

    private static void bind(PreparedStatement ps, Instrument instrument) throws SQLException {
        ps.setString(1, instrument.name());
        ps.setString(2, instrument.market());
        setDateOrNull(ps, 3, instrument.listedDate());
        ps.setBoolean(4, instrument.active());
        ps.setString(5, instrument.code());
    }

    private static Instrument mapRow(ResultSet rs) throws SQLException {
        return new Instrument(
            rs.getString("code"),
            rs.getString("name"),
            rs.getString("market"),
            getDate(rs, "listed_date"),
            rs.getBoolean("active")
        );
    }
}
