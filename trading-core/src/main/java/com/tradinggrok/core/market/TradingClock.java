package com.tradinggrok.core.market;

import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.error.ClockMisconfiguration;
import com.tradinggrok.core.model.MarketSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Trading window calendar. The window on a trading day (Mon-Fri, not a holiday) is
 * [start + buffer, end - buffer] in the market zone, both ends inclusive.
 *
 * <p>Dates covered by a broker calendar ({@link #withSessions}) follow it instead: only listed
 * dates trade, and their own open and close times (early closes included) bound the window.
 *
 * <p>Every query takes {@code now} explicitly; the clock never reads system time.
 */
public final class TradingClock {
    private static final Logger logger = LoggerFactory.getLogger(TradingClock.class);
    private static final int MAX_DAYS_AHEAD = 366;

    public enum SessionPhase {
        PRE_WINDOW,       // trading day, before start + buffer
        IN_WINDOW,
        POST_WINDOW,      // trading day, after end - buffer
        NON_TRADING_DAY   // weekend or holiday
    }

    private final ZoneId zone;
    private final LocalTime windowOpen;
    private final LocalTime windowClose;
    private final Duration pollInterval;
    private final int bufferMinutes;
    private final Set<LocalDate> holidays;
    private final Map<LocalDate, MarketSession> sessions;
    private final LocalDate sessionsFrom;
    private final LocalDate sessionsUntil;

    public TradingClock(TradingConfig config) {
        this(config.getMarketTimezone(), config.getTradingStart(), config.getTradingEnd(),
            config.getBufferMinutes(), config.getPollInterval(), config.getMarketHolidays());
    }

    /**
     * @throws ClockMisconfiguration for an unknown zone, a non-positive poll interval, a negative
     *                               buffer, or a window that is empty once buffers are applied
     */
    public TradingClock(String zoneId, LocalTime start, LocalTime end, int bufferMinutes,
                        Duration pollInterval, Set<LocalDate> holidays) {
        try {
            this.zone = ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new ClockMisconfiguration("Unknown market timezone: " + zoneId, e);
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new ClockMisconfiguration("Poll interval must be positive: " + pollInterval);
        }
        if (bufferMinutes < 0) {
            throw new ClockMisconfiguration("Buffer minutes must not be negative: " + bufferMinutes);
        }
        // Compare in minutes of day so a large buffer cannot wrap around midnight.
        int openMinute = start.getHour() * 60 + start.getMinute() + bufferMinutes;
        int closeMinute = end.getHour() * 60 + end.getMinute() - bufferMinutes;
        if (openMinute >= closeMinute) {
            throw new ClockMisconfiguration("Trading window is empty: start " + start + " + " + bufferMinutes
                + "m is not before end " + end + " - " + bufferMinutes + "m");
        }
        this.windowOpen = start.plusMinutes(bufferMinutes);
        this.windowClose = end.minusMinutes(bufferMinutes);
        this.pollInterval = pollInterval;
        this.bufferMinutes = bufferMinutes;
        this.holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
        this.sessions = Map.of();
        this.sessionsFrom = null;
        this.sessionsUntil = null;

        logger.info("🕐 Trading window {}-{} {} ({} holidays), poll every {}",
            windowOpen, windowClose, zone, this.holidays.size(), pollInterval);
    }

    private TradingClock(TradingClock base, LocalDate from, LocalDate until, Map<LocalDate, MarketSession> sessions) {
        this.zone = base.zone;
        this.windowOpen = base.windowOpen;
        this.windowClose = base.windowClose;
        this.pollInterval = base.pollInterval;
        this.bufferMinutes = base.bufferMinutes;
        this.holidays = base.holidays;
        this.sessions = Map.copyOf(sessions);
        this.sessionsFrom = from;
        this.sessionsUntil = until;
    }

    /**
     * A copy that trusts the broker calendar for every date in [from, until]. Listed sessions whose
     * window is empty once buffers are applied are dropped with a warning.
     */
    public TradingClock withSessions(LocalDate from, LocalDate until, Collection<MarketSession> calendar) {
        if (until.isBefore(from)) {
            throw new IllegalArgumentException("Calendar range ends before it starts: " + from + " to " + until);
        }
        Map<LocalDate, MarketSession> byDate = new HashMap<>();
        int earlyCloses = 0;
        for (MarketSession session : calendar) {
            if (session.date().isBefore(from) || session.date().isAfter(until)) {
                continue;
            }
            if (!session.open().plusMinutes(bufferMinutes).isBefore(session.close().minusMinutes(bufferMinutes))) {
                logger.warn("Session on {} ({}-{}) leaves no window after the {}m buffer, not trading",
                    session.date(), session.open(), session.close(), bufferMinutes);
                continue;
            }
            if (session.close().isBefore(windowClose.plusMinutes(bufferMinutes))) {
                earlyCloses++;
            }
            byDate.put(session.date(), session);
        }
        logger.info("📅 Market calendar {} to {}: {} sessions, {} early closes", from, until, byDate.size(), earlyCloses);
        return new TradingClock(this, from, until, byDate);
    }

    public boolean isTradingWindow(Instant now) {
        return sessionPhase(now) == SessionPhase.IN_WINDOW;
    }

    public SessionPhase sessionPhase(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate date = local.toLocalDate();
        if (!isTradingDay(date)) {
            return SessionPhase.NON_TRADING_DAY;
        }
        if (now.isBefore(windowStart(date))) {
            return SessionPhase.PRE_WINDOW;
        }
        if (now.isAfter(windowEnd(date))) {
            return SessionPhase.POST_WINDOW;
        }
        return SessionPhase.IN_WINDOW;
    }

    /**
     * Inside the window: now + poll interval. Before today's window: today's window start.
     * Otherwise: the next trading day's window start.
     */
    public Instant nextWakeTime(Instant now) {
        LocalDate today = now.atZone(zone).toLocalDate();
        return switch (sessionPhase(now)) {
            case IN_WINDOW -> now.plus(pollInterval);
            case PRE_WINDOW -> windowStart(today);
            default -> windowStart(nextTradingDay(today));
        };
    }

    public boolean isTradingDay(LocalDate date) {
        if (coversDate(date)) {
            return sessions.containsKey(date);
        }
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    public Instant windowStart(LocalDate date) {
        MarketSession session = sessions.get(date);
        LocalTime open = session != null ? session.open().plusMinutes(bufferMinutes) : windowOpen;
        return date.atTime(open).atZone(zone).toInstant();
    }

    public Instant windowEnd(LocalDate date) {
        MarketSession session = sessions.get(date);
        LocalTime close = session != null ? session.close().minusMinutes(bufferMinutes) : windowClose;
        return date.atTime(close).atZone(zone).toInstant();
    }

    private boolean coversDate(LocalDate date) {
        return sessionsFrom != null && !date.isBefore(sessionsFrom) && !date.isAfter(sessionsUntil);
    }

    private LocalDate nextTradingDay(LocalDate after) {
        LocalDate candidate = after.plusDays(1);
        for (int i = 0; i < MAX_DAYS_AHEAD; i++) {
            if (isTradingDay(candidate)) {
                return candidate;
            }
            candidate = candidate.plusDays(1);
        }
        throw new ClockMisconfiguration("No trading day within a year after " + after);
    }

    public ZoneId getZone() {
        return zone;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
