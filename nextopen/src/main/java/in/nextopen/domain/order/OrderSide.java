package in.nextopen.domain.order;

/**
 * Order side.
 */
public enum OrderSide {
    BUY,
    SELL
}
