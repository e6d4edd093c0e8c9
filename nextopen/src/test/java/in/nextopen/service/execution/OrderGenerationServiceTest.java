package in.nextopen.service.execution;

import in.nextopen.domain.job.JobStatus;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.order.Order;
import in.nextopen.domain.order.OrderStatus;
import in.nextopen.testsupport.TradingFixture;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OrderGenerationServiceTest {

    private static final LocalDate WEDNESDAY = LocalDate.of(2026, 3, 4);
    private static final LocalDate THURSDAY = LocalDate.of(2026, 3, 5);

    private final TradingFixture fixture = new TradingFixture();

    private static List<String> snapshot(List<Order> orders) {
        return orders.stream()
            .map(o -> o.code() + "/" + o.side() + "/" + o.qty() + "/" + o.status() + "/" + o.signalRank())
            .sorted()
            .toList();
    }

    @Test
    void emptyStoreIsSkipped() {
        StepResult result = fixture.close.run(Optional.empty());

        assertEquals(JobStatus.SKIPPED, result.status());
    }

    @Test
    void materializesPendingOrdersForNextSession() {
        fixture.seedDip("AAA", WEDNESDAY, 100);

        StepResult result = fixture.close.run(Optional.empty());

        assertEquals(JobStatus.SUCCESS, result.status());
        List<Order> orders = fixture.orders.findByExecDate(THURSDAY);
        assertEquals(1, orders.size());
        Order order = orders.get(0);
        assertEquals(OrderStatus.PENDING, order.status());
        assertEquals(WEDNESDAY, order.signalDate());
        assertEquals(10, order.qty());
    }

    @Test
    void rerunningCloseProducesTheSamePendingSet() {
        fixture.seedDip("AAA", WEDNESDAY, 100);
        fixture.seedDip("BBB", WEDNESDAY, 50);

        fixture.close.run(Optional.empty());
        List<String> first = snapshot(fixture.orders.findByExecDate(THURSDAY));
        fixture.close.run(Optional.empty());
        List<String> second = snapshot(fixture.orders.findByExecDate(THURSDAY));

        assertEquals(2, first.size());
        assertEquals(first, second);
    }

    @Test
    void dispatchedOrdersAreLeftAloneOnRerun() {
        fixture.seedDip("AAA", WEDNESDAY, 100);
        fixture.close.run(Optional.empty());
        Order sent = fixture.sent(THURSDAY, "AAA", "X1");

        StepResult rerun = fixture.close.run(Optional.empty());

        assertTrue(rerun.message().contains("skipped=1"), rerun.message());
        List<Order> orders = fixture.orders.findByExecDate(THURSDAY);
        assertEquals(1, orders.size(), "No duplicate for an active (exec_date, code, side)");
        assertEquals(OrderStatus.SENT, fixture.reload(sent).status());
    }

    @Test
    void rejectedOrderIsNotRequeuedOnRerun() {
        fixture.seedDip("AAA", WEDNESDAY, 100);
        fixture.close.run(Optional.empty());
        fixture.broker.rejectOrdersFor("AAA");
        fixture.open.run(THURSDAY);

        fixture.close.run(Optional.empty());

        List<Order> orders = fixture.orders.findByExecDate(THURSDAY);
        assertEquals(1, orders.size());
        assertEquals(OrderStatus.ERROR, orders.get(0).status());
        assertEquals(JobStatus.SKIPPED, fixture.open.run(THURSDAY).status());
    }

    @Test
    void filledOrderIsNotRequeuedOnRerun() {
        fixture.seedDip("AAA", WEDNESDAY, 100);
        fixture.close.run(Optional.empty());
        fixture.open.run(THURSDAY);
        fixture.broker.fill("X1", 10, new BigDecimal("100"));
        fixture.sync.run(THURSDAY);

        fixture.close.run(Optional.empty());

        assertEquals(List.of("AAA/BUY/10/DONE/1"), snapshot(fixture.orders.findByExecDate(THURSDAY)));
    }

    @Test
    void fridaySignalExecutesMonday() {
        LocalDate friday = LocalDate.of(2026, 3, 6);
        fixture.seedDip("AAA", friday, 100);

        fixture.close.run(Optional.of(friday));

        assertEquals(1, fixture.orders.findByExecDate(LocalDate.of(2026, 3, 9)).size());
    }
}
