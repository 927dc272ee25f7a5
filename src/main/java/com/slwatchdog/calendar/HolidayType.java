package com.slwatchdog.calendar;

/**
 * FULL_HOLIDAY means no equity session. MUHURAT_TRADING (Diwali) is a short evening
 * session; the day still counts as a trading day.
 */
public enum HolidayType {
    FULL_HOLIDAY,
    MUHURAT_TRADING
}
