package in.nextopen.service.signal;

import in.nextopen.config.NextOpenConfig.StrategyConfig;
import in.nextopen.domain.data.DailyBar;
import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.order.OrderCandidate;
import in.nextopen.domain.order.OrderSide;
import in.nextopen.domain.position.Position;
import in.nextopen.domain.repository.DailyBarRepository;
import in.nextopen.domain.repository.InstrumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes next-open trade candidates from the closing data of {@code signalDate}.
 *
 * SELL candidates come from held positions that hit an exit rule. BUY candidates come from
 * the liquidity-ranked scan: the most traded codes whose close sits far enough below its
 * moving average, excluding codes already held, capped by the free position slots.
 */
public final class SignalGenerator {
    private static final Logger log = LoggerFactory.getLogger(SignalGenerator.class);

    private final DailyBarRepository dailyBarRepository;
    private final InstrumentRepository instrumentRepository;
    private final StrategyConfig config;
    private final ExitRuleEvaluator exitRules;

    public SignalGenerator(DailyBarRepository dailyBarRepository, InstrumentRepository instrumentRepository,
                           StrategyConfig config) {
        this.dailyBarRepository = dailyBarRepository;
        this.instrumentRepository = instrumentRepository;
        this.config = config;
        this.exitRules = new ExitRuleEvaluator(config);
    }

    public List<OrderCandidate> generate(LocalDate signalDate, List<Position> positions) {
        List<DailyBar> bars = dailyBarRepository.findByDate(signalDate);
        Map<String, BigDecimal> closes = new HashMap<>();
        for (DailyBar bar : bars) {
            closes.put(bar.code(), bar.close());
        }

        List<OrderCandidate> candidates = new ArrayList<>(sells(signalDate, positions, closes));
        int selling = candidates.size();
        int slots = config.maxPositions() - (positions.size() - selling);
        candidates.addAll(buys(signalDate, bars, positions, slots));

        log.info("[CLOSE] {} candidates for signal date {}: {} sell, {} buy",
            candidates.size(), signalDate, selling, candidates.size() - selling);
        return candidates;
    }

    private List<OrderCandidate> sells(LocalDate signalDate, List<Position> positions, Map<String, BigDecimal> closes) {
        List<OrderCandidate> sells = new ArrayList<>();
        for (Position position : positions) {
            if (position.qty() <= 0) {
                continue;
            }
            BigDecimal close = closes.get(position.code());
            if (close == null) {
                List<DailyBar> recent = dailyBarRepository.findRecent(position.code(), signalDate, 1);
                close = recent.isEmpty() ? null : recent.get(0).close();
            }
            Optional<ExitReason> reason = exitRules.evaluate(position, close, signalDate);
            if (reason.isPresent()) {
                sells.add(new OrderCandidate(signalDate, position.code(), OrderSide.SELL, position.qty(),
                    close, config.orderType(), sells.size() + 1, reason.get().name()));
                log.info("[CLOSE] SELL {} qty={} ({})", position.code(), position.qty(), reason.get());
            }
        }
        return sells;
    }

    private List<OrderCandidate> buys(LocalDate signalDate, List<DailyBar> bars, List<Position> positions, int slots) {
        if (slots <= 0) {
            log.info("[CLOSE] No free position slots, skipping buy scan");
            return List.of();
        }
        Set<String> held = positions.stream().map(Position::code).collect(Collectors.toSet());
        Map<String, Instrument> instruments = instrumentRepository.findActive().stream()
            .collect(Collectors.toMap(Instrument::code, Function.identity()));

        List<DailyBar> ranked = bars.stream()
            .filter(bar -> bar.amount() != null && bar.amount().compareTo(config.minAmount()) >= 0)
            .sorted(Comparator.comparing(DailyBar::amount).reversed().thenComparing(DailyBar::code))
            .limit(config.liquidityRank())
            .toList();

        List<OrderCandidate> buys = new ArrayList<>();
        for (DailyBar bar : ranked) {
            if (buys.size() >= slots) {
                break;
            }
            if (held.contains(bar.code()) || bar.close().signum() <= 0) {
                continue;
            }
            List<BigDecimal> history = dailyBarRepository.findRecent(bar.code(), signalDate, config.maWindow())
                .stream().map(DailyBar::close).toList();
            Optional<BigDecimal> disparity = DisparityCalculator.disparity(history, config.maWindow(), config.minMaBars());
            if (disparity.isEmpty()) {
                continue;
            }

            Instrument instrument = instruments.get(bar.code());
            boolean kospi = instrument == null || instrument.isKospi();
            BigDecimal threshold = kospi ? config.buyThresholdKospi() : config.buyThresholdKosdaq();
            if (disparity.get().compareTo(threshold) > 0) {
                continue;
            }

            int qty = config.orderValue().divide(bar.close(), 0, RoundingMode.DOWN).intValue();
            if (qty <= 0) {
                log.debug("[CLOSE] {} close {} exceeds order value, skipped", bar.code(), bar.close());
                continue;
            }
            buys.add(new OrderCandidate(signalDate, bar.code(), OrderSide.BUY, qty, bar.close(),
                config.orderType(), buys.size() + 1,
                "disparity=" + disparity.get().setScale(4, RoundingMode.HALF_UP).toPlainString()));
            log.info("[CLOSE] BUY {} qty={} close={} disparity={}", bar.code(), qty, bar.close(),
                disparity.get().setScale(4, RoundingMode.HALF_UP));
        }
        return buys;
    }
}
