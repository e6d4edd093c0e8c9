package in.nextopen.domain.repository;

import in.nextopen.domain.broker.BrokerOrderRef;
import in.nextopen.domain.order.Order;
import in.nextopen.domain.order.OrderStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for orders. Every status write is a compare-and-set on the current status.
 */
public interface OrderRepository {

    Optional<Order> findById(long id);

    List<Order> findByExecDate(LocalDate execDate);

    List<Order> findByExecDateAndStatuses(LocalDate execDate, Collection<OrderStatus> statuses);

    /**
     * Replace all PENDING orders for {@code execDate} with {@code pending} in one transaction.
     * Orders whose (exec_date, code, side) already has a row that is neither PENDING nor CANCELLED are skipped.
     */
    MaterializeResult replacePendingOrders(LocalDate execDate, List<Order> pending);

    /**
     * PENDING to SENT with broker ids. Returns false when the row was no longer PENDING.
     */
    boolean markSent(long id, BrokerOrderRef ref, String message);

    /**
     * Move {@code id} from {@code expected} to {@code next}. Returns false on a lost race.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    boolean compareAndSetStatus(long id, OrderStatus expected, OrderStatus next, String message);

    /**
     * Record fill progress together with the status move.
     */
    boolean applyFill(long id, OrderStatus expected, OrderStatus next, int filledQty, BigDecimal avgFillPrice);

    record MaterializeResult(int deleted, int inserted, int skipped) {}
}
