package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.broker.BrokerOrderRef;
import in.nextopen.domain.order.Order;
import in.nextopen.domain.order.OrderCandidate;
import in.nextopen.domain.order.OrderSide;
import in.nextopen.domain.order.OrderStatus;
import in.nextopen.domain.order.OrderType;
import in.nextopen.domain.repository.OrderRepository.MaterializeResult;
import in.nextopen.testsupport.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostgresOrderRepositoryTest {

    private static final LocalDate SIGNAL = LocalDate.of(2026, 3, 2);
    private static final LocalDate EXEC = LocalDate.of(2026, 3, 3);

    private PostgresOrderRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PostgresOrderRepository(TestDatabase.create());
    }

    private static Order pending(String code, OrderSide side, int rank) {
        return Order.pending(new OrderCandidate(SIGNAL, code, side, 10, new BigDecimal("100"),
            OrderType.MARKET, rank, "test"), EXEC);
    }

    @Test
    void replacePendingIsIdempotent() {
        List<Order> batch = List.of(pending("AAA", OrderSide.BUY, 1), pending("BBB", OrderSide.BUY, 2));

        repository.replacePendingOrders(EXEC, batch);
        MaterializeResult second = repository.replacePendingOrders(EXEC, batch);

        assertEquals(2, second.deleted());
        assertEquals(2, second.inserted());
        List<Order> stored = repository.findByExecDate(EXEC);
        assertEquals(2, stored.size());
        assertTrue(stored.stream().allMatch(o -> o.status() == OrderStatus.PENDING));
        assertEquals(SIGNAL, stored.get(0).signalDate());
        assertNotNull(stored.get(0).createdAt());
    }

    @Test
    void activeOrdersAreNeitherReplacedNorDuplicated() {
        repository.replacePendingOrders(EXEC, List.of(pending("AAA", OrderSide.BUY, 1)));
        Order sent = repository.findByExecDate(EXEC).get(0);
        assertTrue(repository.markSent(sent.id(), new BrokerOrderRef("X1", "00950"), null));

        MaterializeResult result = repository.replacePendingOrders(EXEC,
            List.of(pending("AAA", OrderSide.BUY, 1), pending("AAA", OrderSide.SELL, 1)));

        assertEquals(0, result.deleted());
        assertEquals(1, result.inserted());
        assertEquals(1, result.skipped());
        Order stillSent = repository.findById(sent.id()).orElseThrow();
        assertEquals(OrderStatus.SENT, stillSent.status());
        assertEquals("X1", stillSent.brokerOrderId());
        assertNotNull(stillSent.sentAt());
    }

    @Test
    void duplicateCandidatesInOneBatchAreSkipped() {
        MaterializeResult result = repository.replacePendingOrders(EXEC,
            List.of(pending("AAA", OrderSide.BUY, 1), pending("AAA", OrderSide.BUY, 2)));

        assertEquals(1, result.inserted());
        assertEquals(1, result.skipped());
    }

    @Test
    void sellsAreListedBeforeBuys() {
        repository.replacePendingOrders(EXEC, List.of(
            pending("BBB", OrderSide.BUY, 2), pending("AAA", OrderSide.BUY, 1), pending("ZZZ", OrderSide.SELL, 1)));

        List<Order> pending = repository.findByExecDateAndStatuses(EXEC, EnumSet.of(OrderStatus.PENDING));

        assertEquals(List.of("ZZZ", "AAA", "BBB"), pending.stream().map(Order::code).toList());
    }

    @Test
    void markSentOnlyFromPending() {
        repository.replacePendingOrders(EXEC, List.of(pending("AAA", OrderSide.BUY, 1)));
        long id = repository.findByExecDate(EXEC).get(0).id();

        assertTrue(repository.markSent(id, new BrokerOrderRef("X1", "00950"), "accepted"));
        assertFalse(repository.markSent(id, new BrokerOrderRef("X2", "00950"), "again"));

        assertEquals("X1", repository.findById(id).orElseThrow().brokerOrderId());
    }

    @Test
    void compareAndSetRespectsExpectedStatus() {
        repository.replacePendingOrders(EXEC, List.of(pending("AAA", OrderSide.BUY, 1)));
        long id = repository.findByExecDate(EXEC).get(0).id();
        repository.markSent(id, new BrokerOrderRef("X1", "00950"), null);

        assertFalse(repository.compareAndSetStatus(id, OrderStatus.PARTIAL, OrderStatus.CANCELLED, "stale"));
        assertTrue(repository.compareAndSetStatus(id, OrderStatus.SENT, OrderStatus.CANCELLED, "cancelled"));

        Order order = repository.findById(id).orElseThrow();
        assertEquals(OrderStatus.CANCELLED, order.status());
        assertEquals("cancelled", order.message());
    }

    @Test
    void illegalTransitionRejected() {
        repository.replacePendingOrders(EXEC, List.of(pending("AAA", OrderSide.BUY, 1)));
        long id = repository.findByExecDate(EXEC).get(0).id();

        assertThrows(IllegalStateException.class,
            () -> repository.compareAndSetStatus(id, OrderStatus.DONE, OrderStatus.PENDING, null));
        assertThrows(IllegalStateException.class,
            () -> repository.applyFill(id, OrderStatus.PENDING, OrderStatus.DONE, 10, BigDecimal.TEN));
    }

    @Test
    void applyFillRecordsQuantityAndPrice() {
        repository.replacePendingOrders(EXEC, List.of(pending("AAA", OrderSide.BUY, 1)));
        long id = repository.findByExecDate(EXEC).get(0).id();
        repository.markSent(id, new BrokerOrderRef("X1", "00950"), null);

        assertTrue(repository.applyFill(id, OrderStatus.SENT, OrderStatus.PARTIAL, 4, new BigDecimal("101.5")));

        Order order = repository.findById(id).orElseThrow();
        assertEquals(OrderStatus.PARTIAL, order.status());
        assertEquals(4, order.filledQty());
        assertEquals(0, new BigDecimal("101.5").compareTo(order.avgFillPrice()));
        assertEquals(6, order.remainingQty());
    }
}
