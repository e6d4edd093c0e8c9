package in.nextopen.domain.data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Daily OHLCV bar. {@code amount} is the traded value for the day.
 */
public record DailyBar(
    String code,
    LocalDate tradeDate,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume,
    BigDecimal amount
) {}
