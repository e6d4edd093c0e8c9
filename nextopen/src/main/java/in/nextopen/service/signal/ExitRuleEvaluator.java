package in.nextopen.service.signal;

import in.nextopen.config.NextOpenConfig.StrategyConfig;
import in.nextopen.domain.position.Position;
import in.nextopen.service.calendar.SessionCalendar;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Decides whether a held position should be sold at the next open.
 *
 * Price rules are checked before the holding period; a missing close or average price
 * disables the price rules only. The holding period counts business days from the entry date
 * to the exit session (the business day after the signal date).
 */
public final class ExitRuleEvaluator {

    private final StrategyConfig config;

    public ExitRuleEvaluator(StrategyConfig config) {
        this.config = config;
    }

    public Optional<ExitReason> evaluate(Position position, BigDecimal latestClose, LocalDate signalDate) {
        BigDecimal avg = position.avgPrice();
        if (latestClose != null && avg != null && avg.signum() > 0) {
            BigDecimal change = latestClose.divide(avg, MathContext.DECIMAL64).subtract(BigDecimal.ONE);
            if (config.stopLossPct().signum() > 0 && change.compareTo(config.stopLossPct().negate()) <= 0) {
                return Optional.of(ExitReason.STOP_LOSS);
            }
            if (config.takeProfitPct().signum() > 0 && change.compareTo(config.takeProfitPct()) >= 0) {
                return Optional.of(ExitReason.TAKE_PROFIT);
            }
        }
        if (config.maxHoldDays() > 0 && position.entryDate() != null
            && SessionCalendar.businessDaysBetween(position.entryDate(), SessionCalendar.nextBusinessDay(signalDate))
                >= config.maxHoldDays()) {
            return Optional.of(ExitReason.HOLDING_PERIOD);
        }
        return Optional.empty();
    }
}
