package in.nextopen.domain.order;

import in.nextopen.domain.broker.BrokerOrderRef;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Persisted order row.
 */
public record Order(
    Long id,
    LocalDate execDate,
    LocalDate signalDate,
    String code,
    OrderSide side,
    int qty,
    BigDecimal plannedPrice,
    OrderType orderType,
    OrderStatus status,
    String brokerOrderId,
    String brokerOrgId,
    int filledQty,
    BigDecimal avgFillPrice,
    String message,
    int signalRank,
    Instant sentAt,
    Instant createdAt,
    Instant updatedAt
) {

    public static Order pending(OrderCandidate candidate, LocalDate execDate) {
        return new Order(
            null, execDate, candidate.signalDate(), candidate.code(), candidate.side(), candidate.qty(),
            candidate.plannedPrice(), candidate.orderType(), OrderStatus.PENDING,
            null, null, 0, null, candidate.reason(), candidate.rank(), null, null, null
        );
    }

    public OrderKey key() {
        return new OrderKey(execDate, code, side);
    }

    public int remainingQty() {
        return Math.max(0, qty - filledQty);
    }

    public boolean hasBrokerRef() {
        return brokerOrderId != null && !brokerOrderId.isBlank()
            && brokerOrgId != null && !brokerOrgId.isBlank();
    }

    public BrokerOrderRef brokerRef() {
        return new BrokerOrderRef(brokerOrderId, brokerOrgId);
    }
}
