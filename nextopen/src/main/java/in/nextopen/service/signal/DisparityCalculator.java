package in.nextopen.service.signal;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Optional;

/**
 * Disparity of the latest close against its simple moving average: {@code close / SMA - 1}.
 *
 * The average covers the last {@code window} closes including the latest one, and is defined
 * once at least {@code minBars} closes exist.
 */
public final class DisparityCalculator {

    private static final MathContext MC = MathContext.DECIMAL64;

    private DisparityCalculator() {}

    /**
     * @param closes closes ordered oldest first
     */
    public static Optional<BigDecimal> sma(List<BigDecimal> closes, int window, int minBars) {
        int size = closes.size();
        int n = Math.min(window, size);
        if (n < minBars || n == 0) {
            return Optional.empty();
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal close : closes.subList(size - n, size)) {
            sum = sum.add(close);
        }
        return Optional.of(sum.divide(BigDecimal.valueOf(n), MC));
    }

    public static Optional<BigDecimal> disparity(List<BigDecimal> closes, int window, int minBars) {
        return sma(closes, window, minBars)
            .filter(avg -> avg.signum() > 0)
            .map(avg -> closes.get(closes.size() - 1).divide(avg, MC).subtract(BigDecimal.ONE));
    }
}
