package com.slwatchdog.domain.enums;

import java.time.LocalTime;

/**
 * NSE equity session phases by time of day (IST).
 *
 * <pre>
 * 09:00-09:15  PRE_OPEN  call auction, exits may be queued but do not match
 * 09:15-15:30  NORMAL    continuous trading, the watchdog's working window
 * 15:30-16:00  CLOSING   closing session, watchdog shuts down
 * 16:00-09:00  CLOSED
 * </pre>
 */
public enum MarketPhase {
    PRE_OPEN(LocalTime.of(9, 0), LocalTime.of(9, 15)),
    NORMAL(LocalTime.of(9, 15), LocalTime.of(15, 30)),
    CLOSING(LocalTime.of(15, 30), LocalTime.of(16, 0)),
    CLOSED(LocalTime.of(16, 0), LocalTime.of(9, 0));

    private final LocalTime startTime;
    private final LocalTime endTime;

    MarketPhase(LocalTime startTime, LocalTime endTime) {
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }
}
