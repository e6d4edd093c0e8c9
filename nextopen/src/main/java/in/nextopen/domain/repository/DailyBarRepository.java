package in.nextopen.domain.repository;

import in.nextopen.domain.data.DailyBar;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailyBarRepository {

    /**
     * Insert or overwrite bars by (code, trade_date). Returns the number of rows written.
     */
    int upsertAll(List<DailyBar> bars);

    /**
     * Latest {@code limit} bars of {@code code} on or before {@code asOf}, oldest first.
     */
    List<DailyBar> findRecent(String code, LocalDate asOf, int limit);

    List<DailyBar> findByDate(LocalDate tradeDate);

    List<DailyBar> findRange(String code, LocalDate from, LocalDate to);

    Optional<LocalDate> latestTradeDate();

    Optional<LocalDate> latestTradeDate(String code);
}
