package in.nextopen.service.execution;

import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.order.Order;
import in.nextopen.domain.order.OrderCandidate;
import in.nextopen.domain.position.Position;
import in.nextopen.domain.repository.DailyBarRepository;
import in.nextopen.domain.repository.OrderRepository;
import in.nextopen.domain.repository.OrderRepository.MaterializeResult;
import in.nextopen.domain.repository.PositionRepository;
import in.nextopen.service.calendar.SessionCalendar;
import in.nextopen.service.signal.SignalGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The close step: turns the latest closing data into PENDING orders for the next session.
 *
 * Re-running before the open step produces the same PENDING set; orders already sent are
 * never touched.
 */
public final class OrderGenerationService {
    private static final Logger log = LoggerFactory.getLogger(OrderGenerationService.class);

    private final OrderRepository orderRepository;
    private final PositionRepository positionRepository;
    private final DailyBarRepository dailyBarRepository;
    private final SignalGenerator signalGenerator;

    public OrderGenerationService(OrderRepository orderRepository, PositionRepository positionRepository,
                                  DailyBarRepository dailyBarRepository, SignalGenerator signalGenerator) {
        this.orderRepository = orderRepository;
        this.positionRepository = positionRepository;
        this.dailyBarRepository = dailyBarRepository;
        this.signalGenerator = signalGenerator;
    }

    /**
     * @param signalDateOverride signal date to use instead of the latest stored trade date
     */
    public StepResult run(Optional<LocalDate> signalDateOverride) {
        Optional<LocalDate> signalDate = signalDateOverride.isPresent()
            ? signalDateOverride
            : dailyBarRepository.latestTradeDate();
        if (signalDate.isEmpty()) {
            log.warn("[CLOSE] daily_price is empty, nothing to scan");
            return StepResult.skipped("no daily bars");
        }

        LocalDate execDate = SessionCalendar.nextBusinessDay(signalDate.get());
        List<Position> positions = positionRepository.findAll();
        List<OrderCandidate> candidates = signalGenerator.generate(signalDate.get(), positions);
        List<Order> pending = candidates.stream()
            .map(candidate -> Order.pending(candidate, execDate))
            .toList();

        MaterializeResult result = orderRepository.replacePendingOrders(execDate, pending);
        String summary = String.format("signal_date=%s exec_date=%s pending=%d replaced=%d skipped=%d",
            signalDate.get(), execDate, result.inserted(), result.deleted(), result.skipped());
        log.info("[CLOSE] {}", summary);
        return StepResult.success(summary);
    }
}
