package in.nextopen.service.execution;

import in.nextopen.domain.broker.FillRecord;
import in.nextopen.domain.broker.HoldingRecord;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.order.Order;
import in.nextopen.domain.order.OrderStatus;
import in.nextopen.domain.position.Position;
import in.nextopen.domain.repository.OrderRepository;
import in.nextopen.domain.repository.PositionRepository;
import in.nextopen.infrastructure.broker.BrokerAuthenticationException;
import in.nextopen.infrastructure.broker.BrokerException;
import in.nextopen.infrastructure.broker.BrokerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The sync step: advances today's sent orders from broker fills, then overwrites positions
 * with broker balances.
 *
 * <ul>
 *   <li>filled &gt;= qty: DONE</li>
 *   <li>0 &lt; filled &lt; qty: PARTIAL</li>
 *   <li>no broker record: NOT_FOUND</li>
 *   <li>record with zero fills: unchanged</li>
 * </ul>
 * Safe to run any number of times.
 */
public final class OrderReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(OrderReconciliationService.class);

    private final OrderRepository orderRepository;
    private final PositionRepository positionRepository;
    private final BrokerGateway gateway;

    public OrderReconciliationService(OrderRepository orderRepository, PositionRepository positionRepository,
                                      BrokerGateway gateway) {
        this.orderRepository = orderRepository;
        this.positionRepository = positionRepository;
        this.gateway = gateway;
    }

    public StepResult run(LocalDate today) {
        List<Order> open = orderRepository.findByExecDateAndStatuses(today, OrderStatus.AWAITING_FILL);
        int done = 0;
        int partial = 0;
        int notFound = 0;
        int lost = 0;

        if (!open.isEmpty()) {
            Map<String, FillRecord> fills = new HashMap<>();
            for (FillRecord fill : gateway.getFills(today)) {
                fills.put(normalizeOrderId(fill.orderId()), fill);
            }

            for (Order order : open) {
                FillRecord fill = order.brokerOrderId() != null
                    ? fills.get(normalizeOrderId(order.brokerOrderId()))
                    : null;
                OrderStatus next = nextStatus(order, fill);
                if (next == null) {
                    continue;
                }

                boolean applied = next == OrderStatus.NOT_FOUND
                    ? orderRepository.compareAndSetStatus(order.id(), order.status(), next, "no broker record")
                    : orderRepository.applyFill(order.id(), order.status(), next, fill.filledQty(), fill.avgPrice());
                if (!applied) {
                    log.warn("[SYNC] Order {} changed status concurrently, skipped", order.id());
                    lost++;
                    continue;
                }
                switch (next) {
                    case DONE -> done++;
                    case PARTIAL -> partial++;
                    default -> notFound++;
                }
                log.info("[SYNC] Order {} {} {}: {} -> {} (filled {}/{})", order.id(), order.side(), order.code(),
                    order.status(), next, fill != null ? fill.filledQty() : 0, order.qty());
            }
        }

        List<HoldingRecord> holdings;
        try {
            holdings = gateway.getBalances();
        } catch (BrokerAuthenticationException e) {
            throw e;
        } catch (BrokerException e) {
            log.error("[SYNC] Balance query failed, positions left untouched: {}", e.getMessage());
            return StepResult.failed(String.format("exec_date=%s done=%d partial=%d not_found=%d balances unavailable: %s",
                today, done, partial, notFound, e.getMessage()));
        }
        List<Position> positions = holdings.stream()
            .map(h -> new Position(h.code(), h.name(), h.qty(), h.avgPrice(), today, null))
            .toList();
        positionRepository.replaceAll(positions);

        String summary = String.format("exec_date=%s checked=%d done=%d partial=%d not_found=%d lost=%d positions=%d",
            today, open.size(), done, partial, notFound, lost, positions.size());
        log.info("[SYNC] {}", summary);
        return StepResult.success(summary);
    }

    /**
     * @return the status to move to, or null to leave the order unchanged
     */
    static OrderStatus nextStatus(Order order, FillRecord fill) {
        if (fill == null) {
            return order.status() == OrderStatus.NOT_FOUND ? null : OrderStatus.NOT_FOUND;
        }
        if (fill.filledQty() >= order.qty()) {
            return OrderStatus.DONE;
        }
        if (fill.filledQty() > 0) {
            boolean changed = order.status() != OrderStatus.PARTIAL || fill.filledQty() != order.filledQty();
            return changed ? OrderStatus.PARTIAL : null;
        }
        return null;
    }

    /**
     * KIS pads order numbers with leading zeros inconsistently between endpoints.
     */
    static String normalizeOrderId(String orderId) {
        String trimmed = orderId.trim();
        int i = 0;
        while (i < trimmed.length() - 1 && trimmed.charAt(i) == '0') {
            i++;
        }
        return trimmed.substring(i);
    }
}
