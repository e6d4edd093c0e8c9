package in.nextopen.domain.broker;

import java.math.BigDecimal;

/**
 * One holding as reported by the brokerage balance inquiry.
 */
public record HoldingRecord(String code, String name, int qty, BigDecimal avgPrice) {}
