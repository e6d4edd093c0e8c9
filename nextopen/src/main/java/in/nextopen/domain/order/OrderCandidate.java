package in.nextopen.domain.order;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A trade proposed by the close step, before it is materialized as a PENDING order.
 */
public record OrderCandidate(
    LocalDate signalDate,
    String code,
    OrderSide side,
    int qty,
    BigDecimal plannedPrice,
    OrderType orderType,
    int rank,
    String reason
) {
    public OrderCandidate {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Code cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (qty <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
    }

    public OrderKey key(LocalDate execDate) {
        return new OrderKey(execDate, code, side);
    }
}
