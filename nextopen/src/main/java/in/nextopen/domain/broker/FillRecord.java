package in.nextopen.domain.broker;

import in.nextopen.domain.order.OrderSide;

import java.math.BigDecimal;

/**
 * One order as reported by the brokerage's daily execution inquiry.
 */
public record FillRecord(
    String orderId,
    String orgId,
    String code,
    OrderSide side,
    int orderedQty,
    int filledQty,
    BigDecimal avgPrice,
    boolean cancelled
) {}
