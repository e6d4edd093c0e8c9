package in.nextopen.service.execution;

import in.nextopen.domain.broker.BrokerOrderRef;
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
import java.util.EnumSet;
import java.util.List;

/**
 * The open step: sends today's PENDING orders, sells first.
 *
 * A rejected order, or one whose retries ran out, is moved to ERROR and not retried in this run.
 * Authentication failures abort the step and leave the remaining orders PENDING.
 */
public final class OrderDispatchService {
    private static final Logger log = LoggerFactory.getLogger(OrderDispatchService.class);

    private final OrderRepository orderRepository;
    private final BrokerGateway gateway;

    public OrderDispatchService(OrderRepository orderRepository, BrokerGateway gateway) {
        this.orderRepository = orderRepository;
        this.gateway = gateway;
    }

    public StepResult run(LocalDate today) {
        List<Order> pending = orderRepository.findByExecDateAndStatuses(today, EnumSet.of(OrderStatus.PENDING));
        if (pending.isEmpty()) {
            log.info("[OPEN] No PENDING orders for {}", today);
            return StepResult.skipped("no pending orders for " + today);
        }

        int sent = 0;
        int errors = 0;
        for (Order order : pending) {
            try {
                BrokerOrderRef ref = gateway.createOrder(order.code(), order.side(), order.qty(),
                    order.plannedPrice(), order.orderType());
                if (orderRepository.markSent(order.id(), ref, null)) {
                    sent++;
                } else {
                    log.error("[OPEN] Order {} {} {} left PENDING before it was marked sent; broker odno={} needs review",
                        order.id(), order.side(), order.code(), ref.orderId());
                }
            } catch (BrokerRejectionException e) {
                log.warn("[OPEN] Order {} {} {} rejected: {}", order.id(), order.side(), order.code(), e.getMessage());
                markError(order, e.getErrorCode() + " " + e.getBrokerMessage());
                errors++;
            } catch (BrokerTransientException e) {
                log.error("[OPEN] Order {} {} {} failed: {}", order.id(), order.side(), order.code(), e.getMessage());
                markError(order, e.getMessage());
                errors++;
            }
        }

        String summary = String.format("exec_date=%s sent=%d error=%d", today, sent, errors);
        log.info("[OPEN] {}", summary);
        return sent == 0 && errors > 0 ? StepResult.failed(summary) : StepResult.success(summary);
    }

    private void markError(Order order, String message) {
        if (!orderRepository.compareAndSetStatus(order.id(), OrderStatus.PENDING, OrderStatus.ERROR, message)) {
            log.warn("[OPEN] Order {} was no longer PENDING, ERROR not recorded", order.id());
        }
    }
}
