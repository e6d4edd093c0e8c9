package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.broker.BrokerOrderRef;
import in.nextopen.domain.order.Order;
import in.nextopen.domain.order.OrderKey;
import in.nextopen.domain.order.OrderSide;
import in.nextopen.domain.order.OrderStatus;
import in.nextopen.domain.order.OrderType;
import in.nextopen.domain.repository.DataAccessException;
import in.nextopen.domain.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static in.nextopen.infrastructure.persistence.JdbcSupport.*;

/**
 * JDBC implementation of OrderRepository.
 */
public final class PostgresOrderRepository implements OrderRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresOrderRepository.class);

    private final DataSource dataSource;

    public PostgresOrderRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Order> findById(long id) {
        String sql = "SELECT * FROM orders WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find order {}: {}", id, e.getMessage());
            throw new DataAccessException("orders.findById", e);
        }
        return Optional.empty();
    }

    @Override
    public List<Order> findByExecDate(LocalDate execDate) {
        String sql = """
            SELECT * FROM orders
            WHERE exec_date = ?
            ORDER BY id
            """;

        List<Order> orders = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, execDate);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    orders.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find orders for {}: {}", execDate, e.getMessage());
            throw new DataAccessException("orders.findByExecDate", e);
        }
        return orders;
    }

    @Override
    public List<Order> findByExecDateAndStatuses(LocalDate execDate, Collection<OrderStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT * FROM orders WHERE exec_date = ? AND status IN (" + placeholders + ")"
            + " ORDER BY side DESC, signal_rank, id";

        List<Order> orders = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, execDate);
            int index = 2;
            for (OrderStatus status : statuses) {
                ps.setString(index++, status.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    orders.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find orders for {} in {}: {}", execDate, statuses, e.getMessage());
            throw new DataAccessException("orders.findByExecDateAndStatuses", e);
        }
        return orders;
    }

    @Override
    public MaterializeResult replacePendingOrders(LocalDate execDate, List<Order> pending) {
        String deleteSql = "DELETE FROM orders WHERE exec_date = ? AND status = 'PENDING'";
        String activeSql = """
            SELECT code, side FROM orders
            WHERE exec_date = ? AND status NOT IN ('PENDING', 'CANCELLED')
            """;
        String insertSql = """
            INSERT INTO orders (
                exec_date, signal_date, code, side, qty, planned_price, ord_dvsn, status,
                filled_qty, message, signal_rank, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, 'PENDING', 0, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int deleted;
                try (PreparedStatement ps = conn.prepareStatement(deleteSql)) {
                    ps.setObject(1, execDate);
                    deleted = ps.executeUpdate();
                }

                Set<OrderKey> active = new HashSet<>();
                try (PreparedStatement ps = conn.prepareStatement(activeSql)) {
                    ps.setObject(1, execDate);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            active.add(new OrderKey(execDate, rs.getString("code"),
                                OrderSide.valueOf(rs.getString("side"))));
                        }
                    }
                }

                int inserted = 0;
                int skipped = 0;
                Set<OrderKey> seen = new HashSet<>();
                Timestamp now = Timestamp.from(Instant.now());
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    for (Order order : pending) {
                        OrderKey key = new OrderKey(execDate, order.code(), order.side());
                        if (active.contains(key) || !seen.add(key)) {
                            log.info("[CLOSE] Skipping {} {} for {}: order already dispatched",
                                order.side(), order.code(), execDate);
                            skipped++;
                            continue;
                        }
                        ps.setObject(1, execDate);
                        setDateOrNull(ps, 2, order.signalDate());
                        ps.setString(3, order.code());
                        ps.setString(4, order.side().name());
                        ps.setInt(5, order.qty());
                        setBigDecimalOrNull(ps, 6, order.plannedPrice());
                        ps.setString(7, order.orderType().name());
                        ps.setString(8, truncate(order.message(), 500));
                        ps.setInt(9, order.signalRank());
                        ps.setTimestamp(10, now);
                        ps.setTimestamp(11, now);
                        ps.addBatch();
                        inserted++;
                    }
                    if (inserted > 0) {
                        ps.executeBatch();
                    }
                }

                conn.commit();
                log.info("Pending orders replaced for {}: deleted={}, inserted={}, skipped={}",
                    execDate, deleted, inserted, skipped);
                return new MaterializeResult(deleted, inserted, skipped);

            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to replace pending orders for {}: {}", execDate, e.getMessage());
            throw new DataAccessException("orders.replacePendingOrders", e);
        }
    }

    @Override
    public boolean markSent(long id, BrokerOrderRef ref, String message) {
        String sql = """
            UPDATE orders
            SET status = 'SENT', broker_order_id = ?, broker_org_id = ?, message = ?,
                sent_at = ?, updated_at = ?
            WHERE id = ? AND status = 'PENDING'
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setString(1, ref.orderId());
            ps.setString(2, ref.orgId());
            ps.setString(3, truncate(message, 500));
            ps.setTimestamp(4, now);
            ps.setTimestamp(5, now);
            ps.setLong(6, id);
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            log.error("Failed to mark order {} sent: {}", id, e.getMessage());
            throw new DataAccessException("orders.markSent", e);
        }
    }

    @Override
    public boolean compareAndSetStatus(long id, OrderStatus expected, OrderStatus next, String message) {
        requireTransition(id, expected, next);
        String sql = """
            UPDATE orders
            SET status = ?, message = COALESCE(?, message), updated_at = ?
            WHERE id = ? AND status = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.name());
            ps.setString(2, truncate(message, 500));
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setLong(4, id);
            ps.setString(5, expected.name());
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            log.error("Failed to move order {} {} -> {}: {}", id, expected, next, e.getMessage());
            throw new DataAccessException("orders.compareAndSetStatus", e);
        }
    }

    @Override
    public boolean applyFill(long id, OrderStatus expected, OrderStatus next, int filledQty, BigDecimal avgFillPrice) {
        requireTransition(id, expected, next);
        String sql = """
            UPDATE orders
            SET status = ?, filled_qty = ?, avg_fill_price = ?, updated_at = ?
            WHERE id = ? AND status = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.name());
            ps.setInt(2, filledQty);
            setBigDecimalOrNull(ps, 3, avgFillPrice);
            ps.setTimestamp(4, Timestamp.from(Instant.now()));
            ps.setLong(5, id);
            ps.setString(6, expected.name());
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            log.error("Failed to apply fill to order {}: {}", id, e.getMessage());
            throw new DataAccessException("orders.applyFill", e);
        }
    }

    private static void requireTransition(long id, OrderStatus expected, OrderStatus next) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Illegal order transition %s -> %s for order %d", expected, next, id));
        }
    }

    private Order mapRow(ResultSet rs) throws SQLException {
        return new Order(
            rs.getLong("id"),
            getDate(rs, "exec_date"),
            getDate(rs, "signal_date"),
            rs.getString("code"),
            OrderSide.valueOf(rs.getString("side")),
            rs.getInt("qty"),
            rs.getBigDecimal("planned_price"),
            OrderType.valueOf(rs.getString("ord_dvsn")),
            OrderStatus.valueOf(rs.getString("status")),
            rs.getString("broker_order_id"),
            rs.getString("broker_org_id"),
            rs.getInt("filled_qty"),
            rs.getBigDecimal("avg_fill_price"),
            rs.getString("message"),
            rs.getInt("signal_rank"),
            getInstant(rs, "sent_at"),
            getInstant(rs, "created_at"),
            getInstant(rs, "updated_at")
        );
    }
}
