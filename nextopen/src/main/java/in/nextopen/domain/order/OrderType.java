package in.nextopen.domain.order;

/**
 * Order pricing type (the brokerage's {@code ord_dvsn}).
 */
public enum OrderType {
    MARKET,
    LIMIT;

    /**
     * Parse a configured order type. Accepts the enum names as well as the
     * KIS division codes ("01" market, "00" limit).
     */
    public static OrderType parse(String value) {
        if (value == null || value.isBlank()) {
            return MARKET;
        }
        return switch (value.trim().toUpperCase()) {
            case "MARKET", "01" -> MARKET;
            case "LIMIT", "00" -> LIMIT;
            default -> throw new IllegalArgumentException("Unknown order type: " + value);
        };
    }
}
