package in.nextopen.service.calendar;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Session Calendar - business-day arithmetic for the exchange.
 *
 * Weekends are skipped; exchange holidays are not modelled, so a step invoked on a holiday
 * finds nothing to do and no-ops.
 */
public final class SessionCalendar {

    private SessionCalendar() {}

    public static boolean isBusinessDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    /**
     * First business day strictly after {@code date}.
     */
    public static LocalDate nextBusinessDay(LocalDate date) {
        LocalDate next = date.plusDays(1);
        while (!isBusinessDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /**
     * Business days in the half-open range (from, to]. Zero when {@code to} is not after {@code from}.
     */
    public static int businessDaysBetween(LocalDate from, LocalDate to) {
        int count = 0;
        for (LocalDate d = from.plusDays(1); !d.isAfter(to); d = d.plusDays(1)) {
            if (isBusinessDay(d)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Today's date in the market time zone.
     */
    public static LocalDate today(Clock clock, ZoneId marketZone) {
        return LocalDate.now(clock.withZone(marketZone));
    }
}
