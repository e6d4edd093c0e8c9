package in.nextopen.domain.order;

import java.time.LocalDate;

/**
 * Natural key of an order: at most one non-terminal order exists per key.
 */
public record OrderKey(LocalDate execDate, String code, OrderSide side) {}
