package in.nextopen.domain.broker;

/**
 * Acknowledgement of a cancel request.
 */
public record CancelAck(String orderId, String cancelOrderId, String message) {}
