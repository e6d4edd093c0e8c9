package in.nextopen.infrastructure.broker;

import in.nextopen.domain.broker.BrokerOrderRef;
import in.nextopen.domain.broker.CancelAck;
import in.nextopen.domain.broker.FillRecord;
import in.nextopen.domain.broker.HoldingRecord;
import in.nextopen.domain.data.DailyBar;
import in.nextopen.domain.order.OrderSide;
import in.nextopen.domain.order.OrderType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Brokerage operations used by the trading steps and the refill pipeline.
 *
 * All calls are synchronous. Implementations throw {@link BrokerTransientException}
 * (after their own retries are exhausted), {@link BrokerRejectionException} for terminal
 * rejections, and {@link BrokerAuthenticationException} when credentials are refused.
 */
public interface BrokerGateway {

    /**
     * Place a cash order.
     *
     * @param price limit price; ignored for market orders
     */
    BrokerOrderRef createOrder(String code, OrderSide side, int qty, BigDecimal price, OrderType orderType);

    /**
     * Cancel the whole unfilled remainder of an order.
     */
    CancelAck cancelOrder(BrokerOrderRef ref);

    /**
     * All orders placed on {@code date} with their fill progress.
     */
    List<FillRecord> getFills(LocalDate date);

    List<HoldingRecord> getBalances();

    /**
     * Daily bars for {@code code} between {@code from} and {@code to}, inclusive, oldest first.
     */
    List<DailyBar> getHistory(String code, LocalDate from, LocalDate to);
}
