package in.nextopen.service.signal;

import in.nextopen.domain.data.DailyBar;
import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.order.OrderCandidate;
import in.nextopen.domain.order.OrderSide;
import in.nextopen.domain.position.Position;
import in.nextopen.domain.repository.DailyBarRepository;
import in.nextopen.domain.repository.InstrumentRepository;
import in.nextopen.testsupport.MarketData;
import in.nextopen.testsupport.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SignalGeneratorTest {

    private static final LocalDate SIGNAL = LocalDate.of(2026, 3, 4);

    @Mock
    private DailyBarRepository dailyBars;
    @Mock
    private InstrumentRepository instruments;

    private final List<DailyBar> todaysBars = new ArrayList<>();
    private final List<Instrument> universe = new ArrayList<>();

    @BeforeEach
    void setUp() {
        when(dailyBars.findByDate(SIGNAL)).thenReturn(todaysBars);
        when(instruments.findActive()).thenReturn(universe);
        when(dailyBars.findRecent(any(), any(), anyInt())).thenReturn(List.of());
    }

    private void stock(String code, String market, int priorClose, int lastClose, long amount) {
        List<DailyBar> history = MarketData.history(code, SIGNAL, 24, priorClose, lastClose, amount);
        todaysBars.add(history.get(history.size() - 1));
        universe.add(new Instrument(code, code + " Co", market, null, true));
        when(dailyBars.findRecent(eq(code), eq(SIGNAL), anyInt())).thenReturn(history);
    }

    private SignalGenerator generator(int maxPositions) {
        return new SignalGenerator(dailyBars, instruments, TestConfigs.strategy(maxPositions, 3));
    }

    @Test
    void buysLiquidDipsBelowMarketThreshold() {
        stock("AAA", "KOSPI", 130, 100, 50_000_000);
        stock("BBB", "KOSPI", 100, 100, 40_000_000);
        stock("CCC", "KOSPI", 130, 100, 500_000);
        stock("DDD", "KOSDAQ", 122, 100, 30_000_000);

        List<OrderCandidate> candidates = generator(10).generate(SIGNAL, List.of());

        assertEquals(1, candidates.size());
        OrderCandidate buy = candidates.get(0);
        assertEquals("AAA", buy.code());
        assertEquals(OrderSide.BUY, buy.side());
        assertEquals(10, buy.qty());
        assertEquals(0, new BigDecimal("100").compareTo(buy.plannedPrice()));
        assertEquals(1, buy.rank());
        assertEquals(SIGNAL, buy.signalDate());
        assertTrue(buy.reason().startsWith("disparity=-0.22"), buy.reason());
    }

    @Test
    void kospiThresholdAppliesToKospiListings() {
        stock("DDD", "KOSPI", 122, 100, 30_000_000);

        assertEquals(List.of("DDD"), generator(10).generate(SIGNAL, List.of()).stream()
            .map(OrderCandidate::code).toList());
    }

    @Test
    void unknownInstrumentUsesKospiThreshold() {
        stock("DDD", "KOSDAQ", 122, 100, 30_000_000);
        universe.clear();

        assertEquals(1, generator(10).generate(SIGNAL, List.of()).size());
    }

    @Test
    void sellsFirstAndBuysCappedByFreeSlots() {
        stock("AAA", "KOSPI", 130, 100, 50_000_000);
        stock("GGG", "KOSPI", 130, 100, 90_000_000);
        stock("EEE", "KOSPI", 100, 100, 10_000_000);
        stock("FFF", "KOSPI", 100, 100, 10_000_000);
        List<Position> positions = List.of(
            new Position("EEE", "E Co", 7, new BigDecimal("100"), SIGNAL.minusDays(10), null),
            new Position("FFF", "F Co", 3, new BigDecimal("100"), SIGNAL, null));

        List<OrderCandidate> candidates = generator(2).generate(SIGNAL, positions);

        assertEquals(2, candidates.size());
        OrderCandidate sell = candidates.get(0);
        assertEquals(OrderSide.SELL, sell.side());
        assertEquals("EEE", sell.code());
        assertEquals(7, sell.qty());
        assertEquals(ExitReason.HOLDING_PERIOD.name(), sell.reason());

        OrderCandidate buy = candidates.get(1);
        assertEquals("GGG", buy.code(), "Highest traded value ranks first");
    }

    @Test
    void heldCodesAreNotBoughtAgain() {
        stock("AAA", "KOSPI", 130, 100, 50_000_000);
        List<Position> positions = List.of(
            new Position("AAA", "A Co", 10, new BigDecimal("100"), SIGNAL, null));

        assertTrue(generator(10).generate(SIGNAL, positions).isEmpty());
    }

    @Test
    void noBuysWhenPortfolioFull() {
        stock("AAA", "KOSPI", 130, 100, 50_000_000);
        stock("FFF", "KOSPI", 100, 100, 10_000_000);
        List<Position> positions = List.of(
            new Position("FFF", "F Co", 3, new BigDecimal("100"), SIGNAL, null));

        assertTrue(generator(1).generate(SIGNAL, positions).isEmpty());
        verify(dailyBars, never()).findRecent(eq("AAA"), any(), anyInt());
    }

    @Test
    void closeAboveOrderValueIsSkipped() {
        stock("AAA", "KOSPI", 2600, 2000, 50_000_000);

        assertTrue(generator(10).generate(SIGNAL, List.of()).isEmpty());
    }

    @Test
    void sellUsesLatestStoredCloseWhenTodayIsMissing() {
        Position held = new Position("HHH", "H Co", 5, new BigDecimal("100"), SIGNAL, null);
        when(dailyBars.findRecent("HHH", SIGNAL, 1)).thenReturn(List.of(
            MarketData.bar("HHH", SIGNAL.minusDays(1), 90, 1_000)));

        List<OrderCandidate> candidates = generator(10).generate(SIGNAL, List.of(held));

        assertEquals(1, candidates.size());
        assertEquals(ExitReason.STOP_LOSS.name(), candidates.get(0).reason());
        assertEquals(0, new BigDecimal("90").compareTo(candidates.get(0).plannedPrice()));
    }
}
