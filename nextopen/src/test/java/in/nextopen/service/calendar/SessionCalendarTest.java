package in.nextopen.service.calendar;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SessionCalendarTest {

    private static final LocalDate FRIDAY = LocalDate.of(2026, 3, 6);

    @Test
    void nextBusinessDaySkipsWeekend() {
        assertEquals(LocalDate.of(2026, 3, 9), SessionCalendar.nextBusinessDay(FRIDAY));
        assertEquals(LocalDate.of(2026, 3, 9), SessionCalendar.nextBusinessDay(FRIDAY.plusDays(1)));
        assertEquals(FRIDAY, SessionCalendar.nextBusinessDay(FRIDAY.minusDays(1)));
    }

    @Test
    void businessDaysBetweenIsHalfOpen() {
        LocalDate monday = LocalDate.of(2026, 3, 2);

        assertEquals(0, SessionCalendar.businessDaysBetween(monday, monday));
        assertEquals(4, SessionCalendar.businessDaysBetween(monday, FRIDAY));
        assertEquals(5, SessionCalendar.businessDaysBetween(monday, LocalDate.of(2026, 3, 9)));
        assertEquals(0, SessionCalendar.businessDaysBetween(FRIDAY, monday));
    }

    @Test
    void todayUsesMarketZone() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T20:00:00Z"), ZoneOffset.UTC);

        assertEquals(LocalDate.of(2026, 3, 3), SessionCalendar.today(clock, ZoneId.of("Asia/Seoul")));
        assertEquals(LocalDate.of(2026, 3, 2), SessionCalendar.today(clock, ZoneOffset.UTC));
    }
}
