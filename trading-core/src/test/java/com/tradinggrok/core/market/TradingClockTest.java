package com.tradinggrok.core.market;

import com.tradinggrok.core.error.ClockMisconfiguration;
import com.tradinggrok.core.market.TradingClock.SessionPhase;
import com.tradinggrok.core.model.MarketSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TradingClock Tests")
class TradingClockTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final LocalDate JULY_4 = LocalDate.of(2024, 7, 4);

    private TradingClock clock;

    @BeforeEach
    void setUp() {
        clock = new TradingClock("America/New_York", LocalTime.of(9, 30), LocalTime.of(16, 0), 10,
            Duration.ofMinutes(10), Set.of(JULY_4));
    }

    private static Instant ny(String localDateTime) {
        return ZonedDateTime.of(LocalDateTime.parse(localDateTime), NEW_YORK).toInstant();
    }

    // ==================== Window Tests ====================

    @Nested
    @DisplayName("Trading Window")
    class Window {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "2024-03-12T09:39:59, PRE_WINDOW",
            "2024-03-12T09:40:00, IN_WINDOW",
            "2024-03-12T12:00:00, IN_WINDOW",
            "2024-03-12T15:50:00, IN_WINDOW",
            "2024-03-12T15:50:01, POST_WINDOW",
            "2024-03-12T20:00:00, POST_WINDOW",
            "2024-03-16T12:00:00, NON_TRADING_DAY",
            "2024-03-17T12:00:00, NON_TRADING_DAY",
            "2024-07-04T12:00:00, NON_TRADING_DAY"
        })
        @DisplayName("Session phase at window edges, weekends and holidays")
        void testSessionPhase(String localDateTime, SessionPhase expected) {
            assertEquals(expected, clock.sessionPhase(ny(localDateTime)));
            assertEquals(expected == SessionPhase.IN_WINDOW, clock.isTradingWindow(ny(localDateTime)));
        }

        @Test
        @DisplayName("Window follows the market zone across daylight saving")
        void testDaylightSaving() {
            // EST in January, EDT in July: same local window, different UTC instants
            assertEquals(Instant.parse("2024-01-09T14:40:00Z"), clock.windowStart(LocalDate.of(2024, 1, 9)));
            assertEquals(Instant.parse("2024-07-09T13:40:00Z"), clock.windowStart(LocalDate.of(2024, 7, 9)));
        }
    }

    // ==================== Wake Time Tests ====================

    @Nested
    @DisplayName("Next Wake Time")
    class WakeTime {

        @Test
        @DisplayName("Inside the window: now + poll interval")
        void testInsideWindow() {
            Instant now = ny("2024-03-12T11:00:00");
            assertEquals(now.plus(Duration.ofMinutes(10)), clock.nextWakeTime(now));
        }

        @Test
        @DisplayName("Before the window: today's window start")
        void testBeforeWindow() {
            assertEquals(ny("2024-03-12T09:40:00"), clock.nextWakeTime(ny("2024-03-12T07:15:00")));
        }

        @Test
        @DisplayName("After Friday's window: Monday's window start")
        void testFridayEvening() {
            assertEquals(ny("2024-03-18T09:40:00"), clock.nextWakeTime(ny("2024-03-15T17:00:00")));
        }

        @Test
        @DisplayName("Saturday: Monday's window start")
        void testWeekend() {
            assertEquals(ny("2024-03-18T09:40:00"), clock.nextWakeTime(ny("2024-03-16T12:00:00")));
        }

        @Test
        @DisplayName("Evening before a holiday skips the holiday")
        void testHoliday() {
            assertEquals(ny("2024-07-05T09:40:00"), clock.nextWakeTime(ny("2024-07-03T18:00:00")));
        }

        @Test
        @DisplayName("Wake time is always after now")
        void testMonotonic() {
            Instant now = ny("2024-03-11T00:00:00");
            for (int i = 0; i < 24 * 14; i++) {
                assertTrue(clock.nextWakeTime(now).isAfter(now), "wake after " + now);
                now = now.plus(Duration.ofMinutes(37));
            }
        }
    }

    // ==================== Broker Calendar Tests ====================

    @Nested
    @DisplayName("Broker Calendar")
    class BrokerCalendar {

        private final LocalDate from = LocalDate.of(2024, 11, 25);
        private final LocalDate until = LocalDate.of(2024, 12, 2);
        private TradingClock calendarClock;

        @BeforeEach
        void setUp() {
            // Thanksgiving week: closed Thursday, early close Friday
            calendarClock = clock.withSessions(from, until, List.of(
                session("2024-11-25", "09:30", "16:00"),
                session("2024-11-26", "09:30", "16:00"),
                session("2024-11-27", "09:30", "16:00"),
                session("2024-11-29", "09:30", "13:00"),
                session("2024-12-02", "09:30", "16:00")));
        }

        private MarketSession session(String date, String open, String close) {
            return new MarketSession(LocalDate.parse(date), LocalTime.parse(open), LocalTime.parse(close));
        }

        @Test
        @DisplayName("Dates missing from the calendar are closed even without a configured holiday")
        void testUnlistedDateClosed() {
            assertEquals(SessionPhase.NON_TRADING_DAY, calendarClock.sessionPhase(ny("2024-11-28T12:00:00")));
            assertEquals(SessionPhase.IN_WINDOW, clock.sessionPhase(ny("2024-11-28T12:00:00")));
        }

        @Test
        @DisplayName("Early close shortens the window")
        void testEarlyClose() {
            assertEquals(SessionPhase.IN_WINDOW, calendarClock.sessionPhase(ny("2024-11-29T12:50:00")));
            assertEquals(SessionPhase.POST_WINDOW, calendarClock.sessionPhase(ny("2024-11-29T12:50:01")));
            assertEquals(ny("2024-11-29T12:50:00"), calendarClock.windowEnd(LocalDate.of(2024, 11, 29)));
        }

        @Test
        @DisplayName("Wake time skips the closed day")
        void testWakeSkipsClosedDay() {
            assertEquals(ny("2024-11-29T09:40:00"), calendarClock.nextWakeTime(ny("2024-11-27T18:00:00")));
        }

        @Test
        @DisplayName("Dates after the calendar range fall back to weekday rules")
        void testFallbackOutsideRange() {
            assertTrue(calendarClock.isTradingDay(LocalDate.of(2024, 12, 3)));
            assertFalse(calendarClock.isTradingDay(LocalDate.of(2024, 12, 7)));
        }

        @Test
        @DisplayName("A session too short for the buffer does not trade")
        void testSessionShorterThanBuffer() {
            TradingClock shortDay = clock.withSessions(from, from,
                List.of(session("2024-11-25", "09:30", "09:45")));

            assertFalse(shortDay.isTradingDay(from));
        }
    }

    // ==================== Misconfiguration Tests ====================

    @Nested
    @DisplayName("Misconfiguration")
    class Misconfiguration {

        @Test
        @DisplayName("Buffer that empties the window is rejected")
        void testEmptyWindow() {
            assertThrows(ClockMisconfiguration.class, () -> new TradingClock("America/New_York",
                LocalTime.of(9, 30), LocalTime.of(16, 0), 200, Duration.ofMinutes(10), Set.of()));
        }

        @Test
        @DisplayName("Start after end is rejected")
        void testInvertedWindow() {
            assertThrows(ClockMisconfiguration.class, () -> new TradingClock("America/New_York",
                LocalTime.of(16, 0), LocalTime.of(9, 30), 0, Duration.ofMinutes(10), Set.of()));
        }

        @Test
        @DisplayName("Unknown zone is rejected")
        void testUnknownZone() {
            assertThrows(ClockMisconfiguration.class, () -> new TradingClock("Mars/Olympus_Mons",
                LocalTime.of(9, 30), LocalTime.of(16, 0), 10, Duration.ofMinutes(10), Set.of()));
        }

        @Test
        @DisplayName("Zero poll interval is rejected")
        void testZeroPoll() {
            assertThrows(ClockMisconfiguration.class, () -> new TradingClock("America/New_York",
                LocalTime.of(9, 30), LocalTime.of(16, 0), 10, Duration.ZERO, Set.of()));
        }
    }
}
