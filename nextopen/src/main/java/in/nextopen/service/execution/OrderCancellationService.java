package in.nextopen.service.execution;

import in.nextopen.domain.broker.CancelAck;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.order.Order;
import in.nextopen.domain.order.OrderStatus;
import in.nextopen.domain.repository.OrderRepository;
import in.nextopen.infrastructure.broker.BrokerGateway;
import in.nextopen.infrastructure.broker.BrokerRejectionException;
import in.nextopen.infrastructure.broker.BrokerTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The cancel step: cancels the unfilled remainder of today's unresolved orders.
 *
 * Each order's status is re-read right before the broker call so an order that was filled
 * or cancelled in the meantime is left alone.
 */
public final class OrderCancellationService {
    private static final Logger log = LoggerFactory.getLogger(OrderCancellationService.class);

    private final OrderRepository orderRepository;
    private final BrokerGateway gateway;

    public OrderCancellationService(OrderRepository orderRepository, BrokerGateway gateway) {
        this.orderRepository = orderRepository;
        this.gateway = gateway;
    }

    public StepResult run(LocalDate today) {
        List<Order> targets = orderRepository.findByExecDateAndStatuses(today, OrderStatus.AWAITING_FILL).stream()
            .filter(order -> order.remainingQty() > 0)
            .toList();
        if (targets.isEmpty()) {
            log.info("[CANCEL] Nothing to cancel for {}", today);
            return StepResult.skipped("no open orders for " + today);
        }

        int cancelled = 0;
        int errors = 0;
        int skipped = 0;
        int failed = 0;
        for (Order target : targets) {
            Optional<Order> current = orderRepository.findById(target.id());
            if (current.isEmpty() || !OrderStatus.AWAITING_FILL.contains(current.get().status())) {
                log.info("[CANCEL] Order {} is {}, nothing to cancel", target.id(),
                    current.map(Order::status).orElse(null));
                skipped++;
                continue;
            }
            Order order = current.get();
            if (!order.hasBrokerRef()) {
                log.warn("[CANCEL] Order {} {} has no broker order id, skipped", order.id(), order.code());
                skipped++;
                continue;
            }

            try {
                CancelAck ack = gateway.cancelOrder(order.brokerRef());
                if (orderRepository.compareAndSetStatus(order.id(), order.status(), OrderStatus.CANCELLED,
                    ack.message())) {
                    cancelled++;
                    log.info("[CANCEL] Order {} {} {} cancelled (remaining {})",
                        order.id(), order.side(), order.code(), order.remainingQty());
                } else {
                    log.warn("[CANCEL] Order {} changed status during cancel, CANCELLED not recorded", order.id());
                }
            } catch (BrokerRejectionException e) {
                log.warn("[CANCEL] Cancel of order {} rejected: {}", order.id(), e.getMessage());
                if (!orderRepository.compareAndSetStatus(order.id(), order.status(), OrderStatus.ERROR,
                    e.getErrorCode() + " " + e.getBrokerMessage())) {
                    log.warn("[CANCEL] Order {} changed status, ERROR not recorded", order.id());
                }
                errors++;
            } catch (BrokerTransientException e) {
                log.error("[CANCEL] Cancel of order {} failed, left {}: {}", order.id(), order.status(), e.getMessage());
                failed++;
            }
        }

        String summary = String.format("exec_date=%s cancelled=%d error=%d failed=%d skipped=%d",
            today, cancelled, errors, failed, skipped);
        log.info("[CANCEL] {}", summary);
        return failed > 0 ? StepResult.failed(summary) : StepResult.success(summary);
    }
}
