package in.nextopen.domain.broker;

/**
 * Identifiers the brokerage assigns to an accepted order ({@code ODNO} and the
 * forwarding organisation number).
 */
public record BrokerOrderRef(String orderId, String orgId) {
    public BrokerOrderRef {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("Broker order id cannot be null or empty");
        }
    }
}
