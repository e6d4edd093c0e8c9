package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.data.DailyBar;
import in.nextopen.testsupport.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PostgresDailyBarRepositoryTest {

    private PostgresDailyBarRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PostgresDailyBarRepository(TestDatabase.create());
    }

    private static DailyBar bar(String code, LocalDate date, int close) {
        BigDecimal price = BigDecimal.valueOf(close);
        return new DailyBar(code, date, price, price, price, price, 100, price.multiply(BigDecimal.valueOf(100)));
    }

    @Test
    void upsertReplacesExistingBar() {
        LocalDate day = LocalDate.of(2026, 3, 2);
        repository.upsertAll(List.of(bar("AAA", day, 100)));
        repository.upsertAll(List.of(bar("AAA", day, 105), bar("AAA", day.plusDays(1), 106)));

        List<DailyBar> bars = repository.findRange("AAA", day, day.plusDays(1));
        assertEquals(2, bars.size());
        assertEquals(0, BigDecimal.valueOf(105).compareTo(bars.get(0).close()));
    }

    @Test
    void recentBarsAreOldestFirstAndBoundedByAsOf() {
        LocalDate start = LocalDate.of(2026, 3, 2);
        for (int i = 0; i < 5; i++) {
            repository.upsertAll(List.of(bar("AAA", start.plusDays(i), 100 + i)));
        }

        List<DailyBar> recent = repository.findRecent("AAA", start.plusDays(3), 3);

        assertEquals(List.of(start.plusDays(1), start.plusDays(2), start.plusDays(3)),
            recent.stream().map(DailyBar::tradeDate).toList());
    }

    @Test
    void latestTradeDateAndByDate() {
        assertEquals(Optional.empty(), repository.latestTradeDate());

        LocalDate day = LocalDate.of(2026, 3, 4);
        repository.upsertAll(List.of(bar("AAA", day.minusDays(1), 1), bar("AAA", day, 2), bar("BBB", day, 3)));

        assertEquals(Optional.of(day), repository.latestTradeDate());
        assertEquals(2, repository.findByDate(day).size());
    }

    @Test
    void latestTradeDatePerCode() {
        LocalDate day = LocalDate.of(2026, 3, 4);
        repository.upsertAll(List.of(bar("AAA", day.minusDays(1), 1), bar("BBB", day, 3)));

        assertEquals(Optional.of(day.minusDays(1)), repository.latestTradeDate("AAA"));
        assertEquals(Optional.empty(), repository.latestTradeDate("CCC"));
    }
}
