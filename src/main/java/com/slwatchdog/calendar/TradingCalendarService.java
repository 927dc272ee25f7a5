package com.slwatchdog.calendar;

import com.slwatchdog.domain.enums.MarketPhase;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Service;

/**
 * Market-hours awareness for the watchdog's control loop: phase of the session,
 * exchange holidays, and whether today's session is over.
 */
@Service
public class TradingCalendarService {

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final Clock clock;
    private final ZoneId zone;

    public TradingCalendarService(HolidayCalendarConfig holidayCalendarConfig, Clock clock) {
        this.holidayCalendarConfig = holidayCalendarConfig;
        this.clock = clock;
        this.zone = ZoneId.of(holidayCalendarConfig.getTimezone());
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone);
    }

    public MarketPhase currentPhase() {
        ZonedDateTime now = now();
        return calculatePhase(now.toLocalDate(), now.toLocalTime());
    }

    /**
     * True once the NORMAL session has ended for today, or all day on a non-trading day.
     * The watchdog shuts itself down when this turns true.
     */
    public boolean isSessionOver() {
        ZonedDateTime now = now();
        if (!isTradingDay(now.toLocalDate())) {
            return true;
        }
        return !now.toLocalTime().isBefore(MarketPhase.NORMAL.getEndTime());
    }

    /** Weekends and full holidays. */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.FULL_HOLIDAY);
    }

    public boolean isMuhuratTrading(LocalDate date) {
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.MUHURAT_TRADING);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date) || isMuhuratTrading(date);
    }

    public MarketPhase calculatePhase(LocalDate date, LocalTime time) {
        if (!isTradingDay(date)) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(MarketPhase.PRE_OPEN.getStartTime())) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(MarketPhase.NORMAL.getStartTime())) {
            return MarketPhase.PRE_OPEN;
        }
        if (time.isBefore(MarketPhase.CLOSING.getStartTime())) {
            return MarketPhase.NORMAL;
        }
        if (time.isBefore(MarketPhase.CLOSING.getEndTime())) {
            return MarketPhase.CLOSING;
        }
        return MarketPhase.CLOSED;
    }
}
